package com.deliveryroute.tracking.event;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * An actual arrival or departure became known, by geofence or by manual trigger.
 * Drives the cascading schedule recalculation.
 */
public record StopEventFixed(
        String routeId,
        String driverId,
        String vehicleId,
        LocalDate date,
        int stopIndex,
        String stopId,
        StopEventType type,
        LocalDateTime time,
        boolean manual,
        boolean routeCompleted) {
}
