package com.deliveryroute.tracking.repository;

import com.deliveryroute.tracking.entity.PositionLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for PositionLog, the raw GPS trail.
 */
@Repository
public interface PositionLogRepository extends JpaRepository<PositionLog, Long> {

    List<PositionLog> findTop500ByVehicleIdOrderByTimestampDesc(String vehicleId);

    List<PositionLog> findByVehicleIdAndTimestampBetweenOrderByTimestampAsc(
            String vehicleId, LocalDateTime start, LocalDateTime end);

    List<PositionLog> findByRouteIdAndTimestampBetweenOrderByTimestampAsc(
            String routeId, LocalDateTime start, LocalDateTime end);
}
