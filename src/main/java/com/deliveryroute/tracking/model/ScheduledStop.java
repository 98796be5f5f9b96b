package com.deliveryroute.tracking.model;

import lombok.*;

import java.time.LocalTime;

/**
 * One stop of a route's current schedule.
 *
 * Starts as a copy of the registry definition; once tracking begins the
 * cascading recalculation is the only writer of the planned times.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledStop {

    private String stopId;

    private String warehouseId;

    private int order;

    private LocalTime plannedArrival;

    private LocalTime plannedDeparture;

    private boolean hasLunchBreak;

    private Integer lunchDurationMinutes;

    public ScheduledStop copy() {
        return new ScheduledStop(stopId, warehouseId, order, plannedArrival, plannedDeparture,
                hasLunchBreak, lunchDurationMinutes);
    }
}
