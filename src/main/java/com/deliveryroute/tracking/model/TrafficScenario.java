package com.deliveryroute.tracking.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Traffic model the routing service applies when estimating travel time.
 * Serialized with the routing API's lower-case wire names.
 */
public enum TrafficScenario {

    OPTIMISTIC("optimistic"),
    BEST_GUESS("best_guess"),
    PESSIMISTIC("pessimistic");

    private final String wireName;

    TrafficScenario(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static TrafficScenario fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return BEST_GUESS;
        }
        for (TrafficScenario scenario : values()) {
            if (scenario.wireName.equalsIgnoreCase(value) || scenario.name().equalsIgnoreCase(value)) {
                return scenario;
            }
        }
        return BEST_GUESS;
    }
}
