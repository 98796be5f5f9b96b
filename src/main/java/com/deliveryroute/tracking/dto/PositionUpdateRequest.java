package com.deliveryroute.tracking.dto;

import com.deliveryroute.tracking.model.PositionSample;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A GPS fix pushed by a device or an integration:
 * {@code {vehicleId, position: {latitude, longitude, speed?}, timestamp}}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionUpdateRequest {

    @NotBlank(message = "Vehicle ID is required")
    private String vehicleId;

    @NotNull(message = "Position is required")
    @Valid
    private Position position;

    @NotNull(message = "Timestamp is required")
    private LocalDateTime timestamp;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Position {

        @NotNull(message = "Latitude is required")
        @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
        @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
        private Double latitude;

        @NotNull(message = "Longitude is required")
        @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
        @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
        private Double longitude;

        @PositiveOrZero(message = "Speed must not be negative")
        private Double speed; // km/h, missing means stationary
    }

    public PositionSample toSample() {
        return PositionSample.builder()
                .vehicleId(vehicleId)
                .latitude(position.getLatitude())
                .longitude(position.getLongitude())
                .speed(position.getSpeed())
                .timestamp(timestamp)
                .build();
    }
}
