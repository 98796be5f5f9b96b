package com.deliveryroute.tracking.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * An unplanned stationary period detected between two planned stops
 * (traffic, rest break). Open while {@code endTime} is null.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IntermediateStop {

    private String id;

    private GeoPoint position;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private Long durationMinutes;

    /** Stop the vehicle last left; null before the first departure. */
    private String fromStopId;

    /** Stop the vehicle is heading to. */
    private String toStopId;

    @JsonIgnore
    public boolean isOpen() {
        return endTime == null;
    }

    /** Ends the stop at {@code end}; the duration is rounded to whole minutes. */
    public void close(LocalDateTime end) {
        this.endTime = end;
        this.durationMinutes = Math.round(Duration.between(startTime, end).toSeconds() / 60.0);
    }

    public IntermediateStop copy() {
        return new IntermediateStop(id, position, startTime, endTime, durationMinutes, fromStopId, toStopId);
    }
}
