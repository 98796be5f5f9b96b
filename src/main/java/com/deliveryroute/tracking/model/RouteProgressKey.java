package com.deliveryroute.tracking.model;

import java.time.LocalDate;

/**
 * Identity of a {@link RouteProgress}: one driver executing one route on one calendar day.
 * The record key doubles as the key-value store key, {@code "{routeId}:{driverId}:{date}"}.
 */
public record RouteProgressKey(String routeId, String driverId, LocalDate date) {

    public String recordKey() {
        return routeId + ":" + driverId + ":" + date;
    }

    @Override
    public String toString() {
        return recordKey();
    }
}
