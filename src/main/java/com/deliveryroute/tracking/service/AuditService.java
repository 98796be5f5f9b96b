package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.entity.PositionLog;
import com.deliveryroute.tracking.entity.TrackingEvent;
import com.deliveryroute.tracking.repository.PositionLogRepository;
import com.deliveryroute.tracking.repository.TrackingEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Audit trail and GPS trail of the tracking subsystem.
 *
 * Writes are best effort: a failed insert is logged and swallowed so that an audit
 * problem never aborts tracking. Reads back the audit REST API.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private final TrackingEventRepository trackingEventRepository;
    private final PositionLogRepository positionLogRepository;

    public void recordEvent(TrackingEvent event) {
        try {
            trackingEventRepository.save(event);
            log.info("AUDIT: {} persisted, route: {}, stop: {}, at {}",
                    event.getEventType(), event.getRouteId(), event.getStopId(), event.getEventTime());
        } catch (Exception e) {
            log.error("AUDIT: Failed to persist {} for route {}: {}",
                    event.getEventType(), event.getRouteId(), e.getMessage());
        }
    }

    public void recordPosition(PositionLog position) {
        try {
            positionLogRepository.save(position);
        } catch (Exception e) {
            log.error("AUDIT: Failed to persist position of vehicle {} at {}: {}",
                    position.getVehicleId(), position.getTimestamp(), e.getMessage());
        }
    }

    /** Chronological audit trail of one route. */
    @Transactional(readOnly = true)
    public List<TrackingEvent> getEventsByRouteId(String routeId) {
        List<TrackingEvent> events = trackingEventRepository.findByRouteIdOrderByEventTimeAsc(routeId);
        log.info("AUDIT: Found {} event(s) for route {}", events.size(), routeId);
        return events;
    }

    /** Newest first. */
    @Transactional(readOnly = true)
    public List<TrackingEvent> getEventsByVehicleId(String vehicleId) {
        List<TrackingEvent> events = trackingEventRepository.findByVehicleIdOrderByEventTimeDesc(vehicleId);
        log.info("AUDIT: Found {} event(s) for vehicle {}", events.size(), vehicleId);
        return events;
    }

    /**
     * @throws IllegalArgumentException if start is after end
     */
    @Transactional(readOnly = true)
    public List<TrackingEvent> getEventsByTimeRange(LocalDateTime start, LocalDateTime end) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException(
                    "start (" + start + ") must not be after end (" + end + ")");
        }
        List<TrackingEvent> events = trackingEventRepository.findByEventTimeBetweenOrderByEventTimeAsc(start, end);
        log.info("AUDIT: Found {} event(s) between {} and {}", events.size(), start, end);
        return events;
    }

    /** GPS trail of a vehicle on one day, oldest first; the latest 500 samples when no date is given. */
    @Transactional(readOnly = true)
    public List<PositionLog> getPositions(String vehicleId, LocalDate date) {
        if (date == null) {
            return positionLogRepository.findTop500ByVehicleIdOrderByTimestampDesc(vehicleId);
        }
        return positionLogRepository.findByVehicleIdAndTimestampBetweenOrderByTimestampAsc(
                vehicleId, date.atStartOfDay(), date.atTime(LocalTime.MAX));
    }

    @Transactional(readOnly = true)
    public List<PositionLog> getRoutePositions(String routeId, LocalDate date) {
        return positionLogRepository.findByRouteIdAndTimestampBetweenOrderByTimestampAsc(
                routeId, date.atStartOfDay(), date.atTime(LocalTime.MAX));
    }
}
