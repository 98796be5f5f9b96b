package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.model.TriggerAction;
import com.deliveryroute.tracking.model.TriggerState;

import java.time.LocalDateTime;

/**
 * Outcome of a manual trigger. A rejected trigger changed nothing and says why in {@code message}.
 *
 * @param nextState trigger cursor after the call, null once the route is finished
 */
public record TriggerResult(
        boolean success,
        TriggerAction action,
        Integer stopIndex,
        String stopId,
        LocalDateTime triggeredAt,
        String message,
        TriggerState nextState) {

    public static TriggerResult rejected(String reason) {
        return new TriggerResult(false, null, null, null, null, reason, null);
    }
}
