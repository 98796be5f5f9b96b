package com.deliveryroute.tracking.model;

/** The next event a manual trigger will fix for a route. */
public enum TriggerAction {
    DEPARTURE,
    ARRIVAL
}
