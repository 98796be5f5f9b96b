package com.deliveryroute.tracking.model;

import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Manual trigger cursor for a route on one service day. Transient: lost on restart.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TriggerState {

    private String routeId;

    private LocalDate date;

    private int currentStopIndex;

    @Builder.Default
    private TriggerAction nextAction = TriggerAction.DEPARTURE;

    private LocalDateTime lastTriggeredAt;

    public TriggerState copy() {
        return new TriggerState(routeId, date, currentStopIndex, nextAction, lastTriggeredAt);
    }
}
