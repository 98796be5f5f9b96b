package com.deliveryroute.tracking.repository;

import com.deliveryroute.tracking.entity.TrackingEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for TrackingEvent, the audit trail.
 *
 * Derived queries only; the (route_id), (vehicle_id) and (event_time) indexes back them.
 */
@Repository
public interface TrackingEventRepository extends JpaRepository<TrackingEvent, Long> {

    /** Chronological audit trail of one route. */
    List<TrackingEvent> findByRouteIdOrderByEventTimeAsc(String routeId);

    List<TrackingEvent> findByVehicleIdOrderByEventTimeDesc(String vehicleId);

    List<TrackingEvent> findByEventTimeBetweenOrderByEventTimeAsc(LocalDateTime start, LocalDateTime end);
}
