package com.deliveryroute.tracking.model;

/**
 * Lifecycle of a single stop inside a {@link RouteProgress}.
 *
 * GPS tracking walks PENDING -> EN_ROUTE -> ARRIVED -> DEPARTED.
 * COMPLETED is the terminal marker set by a manual departure trigger.
 */
public enum StopStatus {

    PENDING,

    EN_ROUTE,

    ARRIVED,

    DEPARTED,

    COMPLETED;

    /** True once the vehicle has left this stop, by geofence exit or by manual trigger. */
    public boolean isFinished() {
        return this == DEPARTED || this == COMPLETED;
    }
}
