package com.deliveryroute.tracking.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * Routing service answer. {@code travelTimeInTrafficMinutes} is only present when the
 * provider had live traffic for the departure time, and then takes precedence.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class TravelTimeResponse {

    private Boolean success;

    private Integer travelTimeMinutes;

    private Integer travelTimeInTrafficMinutes;

    /** Usable duration in minutes, null when the call did not produce one. */
    public Integer effectiveMinutes() {
        if (!Boolean.TRUE.equals(success)) {
            return null;
        }
        Integer minutes = travelTimeInTrafficMinutes != null ? travelTimeInTrafficMinutes : travelTimeMinutes;
        return minutes != null && minutes >= 0 ? minutes : null;
    }
}
