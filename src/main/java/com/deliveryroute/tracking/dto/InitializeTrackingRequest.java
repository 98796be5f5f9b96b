package com.deliveryroute.tracking.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * Start tracking a route for today. Driver and vehicle default to the route's assignment.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InitializeTrackingRequest {

    @NotBlank(message = "Route ID is required")
    private String routeId;

    private String driverId;

    private String vehicleId;
}
