package com.deliveryroute.tracking.entity;

public enum TrackingRecordType {

    /** Serialized RouteProgress, keyed "{routeId}:{driverId}:{date}" */
    ROUTE_PROGRESS,

    /** Serialized current stop schedule of one route */
    ROUTE_SCHEDULE
}
