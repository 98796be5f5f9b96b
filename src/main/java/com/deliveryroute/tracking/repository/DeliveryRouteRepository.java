package com.deliveryroute.tracking.repository;

import com.deliveryroute.tracking.entity.DeliveryRoute;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DeliveryRouteRepository extends JpaRepository<DeliveryRoute, String> {

    List<DeliveryRoute> findByActiveTrue();
}
