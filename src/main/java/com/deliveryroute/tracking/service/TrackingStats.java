package com.deliveryroute.tracking.service;

import java.time.LocalDateTime;

public record TrackingStats(
        long activeRoutes,
        int trackedVehicles,
        boolean pollingEnabled,
        boolean withinTrackingWindow,
        int windowStartHour,
        int windowEndHour,
        int vehiclesPolling,
        int routesRecalculating,
        LocalDateTime lastPollAt) {
}
