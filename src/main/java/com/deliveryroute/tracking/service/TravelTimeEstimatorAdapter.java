package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.client.TravelTimeClient;
import com.deliveryroute.tracking.client.TravelTimeRequest;
import com.deliveryroute.tracking.client.TravelTimeResponse;
import com.deliveryroute.tracking.config.TrackingProperties;
import com.deliveryroute.tracking.entity.Warehouse;
import com.deliveryroute.tracking.model.TrafficScenario;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Leg travel time between two warehouses. Never fails: any routing-service problem
 * yields the configured fallback duration so the cascade keeps going.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TravelTimeEstimatorAdapter {

    private final TravelTimeClient travelTimeClient;
    private final TrackingProperties properties;

    public TravelEstimate estimate(Warehouse origin, Warehouse destination,
                                   LocalDateTime departureTime, Integer speedLimitMph) {
        TrafficScenario scenario = destination.getTrafficScenario() != null
                ? destination.getTrafficScenario() : TrafficScenario.BEST_GUESS;
        int speedLimit = speedLimitMph != null && speedLimitMph > 0
                ? speedLimitMph : properties.getRecalculation().getDefaultSpeedLimit();

        TravelTimeRequest request = new TravelTimeRequest(
                origin.routingAddress(), destination.routingAddress(), scenario, departureTime, speedLimit);

        try {
            TravelTimeResponse response = travelTimeClient.estimate(request);
            Integer minutes = response != null ? response.effectiveMinutes() : null;
            if (minutes != null) {
                log.debug("ESTIMATE: {} -> {} at {} ({}): {} min",
                        origin.getId(), destination.getId(), departureTime, scenario.getWireName(), minutes);
                return new TravelEstimate(minutes, false);
            }
            log.warn("ESTIMATE: no result for {} -> {}, using fallback", origin.getId(), destination.getId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("ESTIMATE: interrupted for {} -> {}, using fallback", origin.getId(), destination.getId());
        } catch (Exception e) {
            log.warn("ESTIMATE: call failed for {} -> {}: {}, using fallback",
                    origin.getId(), destination.getId(), e.getMessage());
        }
        return new TravelEstimate(properties.getRecalculation().getFallbackTravelMinutes(), true);
    }
}
