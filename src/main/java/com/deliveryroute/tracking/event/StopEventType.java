package com.deliveryroute.tracking.event;

public enum StopEventType {
    ARRIVAL,
    DEPARTURE
}
