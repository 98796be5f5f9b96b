package com.deliveryroute.tracking.model;

import lombok.*;

import java.time.LocalDateTime;

/**
 * Live tracking state of one planned stop.
 *
 * Each timestamp is written at most once; setters are only called by the
 * tracking engine and the manual trigger while they hold the route lock.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StopProgress {

    private String stopId;

    private String warehouseId;

    private int order;

    @Builder.Default
    private StopStatus status = StopStatus.PENDING;

    /** First sample outside the geofence while heading here; separate from the departure fields. */
    private LocalDateTime legStartedAt;

    private LocalDateTime enteredGeofenceAt;

    private LocalDateTime exitedGeofenceAt;

    private LocalDateTime actualArrival;

    private LocalDateTime actualDeparture;

    public StopProgress copy() {
        return new StopProgress(stopId, warehouseId, order, status, legStartedAt,
                enteredGeofenceAt, exitedGeofenceAt, actualArrival, actualDeparture);
    }
}
