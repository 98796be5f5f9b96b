package com.deliveryroute.tracking.store;

import com.deliveryroute.tracking.model.RouteProgress;
import com.deliveryroute.tracking.model.RouteProgressKey;
import com.deliveryroute.tracking.model.ScheduledStop;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local TrackingStore for the {@code in-memory} profile and tests.
 * Stores copies so callers can't mutate what was saved.
 */
@Component
@Profile("in-memory")
@Slf4j
public class InMemoryTrackingStore implements TrackingStore {

    private final Map<String, RouteProgress> progress = new ConcurrentHashMap<>();
    private final Map<String, List<ScheduledStop>> schedules = new ConcurrentHashMap<>();

    @Override
    public Optional<RouteProgress> loadProgress(RouteProgressKey key) {
        return Optional.ofNullable(progress.get(key.recordKey())).map(RouteProgress::copy);
    }

    @Override
    public boolean saveProgress(RouteProgress value) {
        progress.put(value.getKey().recordKey(), value.copy());
        return true;
    }

    @Override
    public Optional<List<ScheduledStop>> loadSchedule(String routeId) {
        return Optional.ofNullable(schedules.get(TrackingStore.scheduleKey(routeId)))
                .map(InMemoryTrackingStore::copyOf);
    }

    @Override
    public boolean saveSchedule(String routeId, List<ScheduledStop> stops) {
        schedules.put(TrackingStore.scheduleKey(routeId), copyOf(stops));
        return true;
    }

    private static List<ScheduledStop> copyOf(List<ScheduledStop> stops) {
        return new ArrayList<>(stops.stream().map(ScheduledStop::copy).toList());
    }
}
