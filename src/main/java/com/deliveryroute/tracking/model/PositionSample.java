package com.deliveryroute.tracking.model;

import lombok.*;

import java.time.LocalDateTime;

/**
 * One GPS fix for a vehicle, as polled from the device-tracking provider
 * or pushed through the REST API.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionSample {

    private String vehicleId;

    private double latitude;

    private double longitude;

    /** km/h; null when the device did not report one. */
    private Double speed;

    private LocalDateTime timestamp;

    public GeoPoint toPoint() {
        return new GeoPoint(latitude, longitude);
    }

    public double speedOrZero() {
        return speed != null ? speed : 0.0;
    }
}
