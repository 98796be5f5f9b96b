package com.deliveryroute.tracking.exception;

/**
 * No route progress exists for the requested (route, driver, date).
 */
public class TrackingNotFoundException extends RuntimeException {

    public TrackingNotFoundException(String message) {
        super(message);
    }
}
