package com.deliveryroute.tracking.client;

import com.deliveryroute.tracking.model.TrafficScenario;

import java.time.LocalDateTime;

/**
 * Body of a travel-time estimation call.
 *
 * @param speedLimit vehicle speed limit in mph
 */
public record TravelTimeRequest(
        String originAddress,
        String destinationAddress,
        TrafficScenario trafficScenario,
        LocalDateTime departureTime,
        int speedLimit) {
}
