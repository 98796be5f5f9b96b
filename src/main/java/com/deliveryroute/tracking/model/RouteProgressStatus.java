package com.deliveryroute.tracking.model;

public enum RouteProgressStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED
}
