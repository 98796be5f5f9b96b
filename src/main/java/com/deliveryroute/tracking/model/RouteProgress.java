package com.deliveryroute.tracking.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Live tracking record for one driver executing one route on one calendar day.
 *
 * Owned by the tracking subsystem: only {@code TrackingEngine} and
 * {@code ManualTriggerService} mutate it, always under the per-key lock held by
 * {@code RouteProgressRegistry}. Callers outside that lock only ever see
 * {@link #copy()} snapshots.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RouteProgress {

    private String routeId;

    private String driverId;

    private String vehicleId;

    private LocalDate date;

    @Builder.Default
    private RouteProgressStatus status = RouteProgressStatus.NOT_STARTED;

    private int currentStopIndex;

    @Builder.Default
    private List<StopProgress> stops = new ArrayList<>();

    @Builder.Default
    private List<IntermediateStop> intermediateStops = new ArrayList<>();

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private LocalDateTime lastPositionUpdateAt;

    @JsonIgnore
    public RouteProgressKey getKey() {
        return new RouteProgressKey(routeId, driverId, date);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == RouteProgressStatus.COMPLETED;
    }

    /** The stop the vehicle is currently heading to or standing at, empty once every stop is done. */
    @JsonIgnore
    public Optional<StopProgress> getCurrentStop() {
        if (currentStopIndex < 0 || currentStopIndex >= stops.size()) {
            return Optional.empty();
        }
        return Optional.of(stops.get(currentStopIndex));
    }

    @JsonIgnore
    public Optional<IntermediateStop> getOpenIntermediateStop() {
        return intermediateStops.stream().filter(IntermediateStop::isOpen).findFirst();
    }

    public RouteProgress copy() {
        return RouteProgress.builder()
                .routeId(routeId)
                .driverId(driverId)
                .vehicleId(vehicleId)
                .date(date)
                .status(status)
                .currentStopIndex(currentStopIndex)
                .stops(new ArrayList<>(stops.stream().map(StopProgress::copy).toList()))
                .intermediateStops(new ArrayList<>(intermediateStops.stream().map(IntermediateStop::copy).toList()))
                .startTime(startTime)
                .endTime(endTime)
                .lastPositionUpdateAt(lastPositionUpdateAt)
                .build();
    }
}
