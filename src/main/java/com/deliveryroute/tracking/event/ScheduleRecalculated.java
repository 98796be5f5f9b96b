package com.deliveryroute.tracking.event;

import com.deliveryroute.tracking.model.ScheduledStop;

import java.util.List;

/**
 * @param fallbackCount legs estimated with the fixed fallback duration
 */
public record ScheduleRecalculated(
        String routeId,
        StopEventType trigger,
        int fromStopIndex,
        List<ScheduledStop> stops,
        int fallbackCount) {
}
