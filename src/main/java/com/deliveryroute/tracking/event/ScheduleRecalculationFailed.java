package com.deliveryroute.tracking.event;

public record ScheduleRecalculationFailed(
        String routeId,
        StopEventType trigger,
        int fromStopIndex,
        String reason) {
}
