package com.deliveryroute.tracking.entity;

/**
 * Audit event types written to {@link TrackingEvent}.
 * Stored as a String via {@code @Enumerated(EnumType.STRING)}.
 */
public enum TrackingEventType {

    /** First stop left its pending state: the driver is on the road */
    ROUTE_STARTED,

    /** Vehicle entered the geofence of the stop it was heading to */
    STOP_ARRIVED,

    /** Vehicle left the geofence of the stop it stood at */
    STOP_DEPARTED,

    /** Last stop departed or manually completed */
    ROUTE_COMPLETED,

    INTERMEDIATE_STOP_OPENED,

    INTERMEDIATE_STOP_CLOSED,

    /** Operator fixed an arrival without waiting for the geofence */
    MANUAL_ARRIVAL,

    /** Operator fixed a departure without waiting for the geofence */
    MANUAL_DEPARTURE,

    /** Downstream planned times recomputed */
    SCHEDULE_RECALCULATED,

    /** Recalculation aborted, e.g. a warehouse referenced by the route is missing */
    SCHEDULE_RECALCULATION_FAILED
}
