package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.model.RouteProgress;
import com.deliveryroute.tracking.model.RouteProgressKey;
import com.deliveryroute.tracking.store.TrackingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory home of every live RouteProgress, one instance per key.
 *
 * Live instances are only touched inside {@link #withLock}; everything handed out
 * of the registry is a copy. Writes go through to the {@link TrackingStore}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RouteProgressRegistry {

    private final TrackingStore trackingStore;

    private final Map<String, RouteProgress> progressByKey = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /** vehicleId -> key of the progress its GPS samples are applied to */
    private final Map<String, RouteProgressKey> activeKeyByVehicle = new ConcurrentHashMap<>();

    /** Runs {@code work} holding the lock of {@code key}. */
    public <T> T withLock(RouteProgressKey key, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(key.recordKey(), k -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Live instance for {@code key}, loaded from the store on first access.
     * Callers must hold the key's lock.
     */
    public RouteProgress live(RouteProgressKey key) {
        RouteProgress progress = progressByKey.get(key.recordKey());
        if (progress != null) {
            return progress;
        }
        Optional<RouteProgress> stored = trackingStore.loadProgress(key);
        stored.ifPresent(p -> {
            progressByKey.put(key.recordKey(), p);
            log.info("REGISTRY: progress {} restored from store", key);
        });
        return stored.orElse(null);
    }

    /** Registers a new live instance and routes its vehicle's samples to it. Callers must hold the key's lock. */
    public void register(RouteProgress progress) {
        progressByKey.put(progress.getKey().recordKey(), progress);
        indexVehicle(progress);
        persist(progress);
    }

    /** Routes the vehicle's samples to {@code progress} unless it is already completed. */
    public void indexVehicle(RouteProgress progress) {
        if (progress.getVehicleId() != null && !progress.isCompleted()) {
            activeKeyByVehicle.put(progress.getVehicleId(), progress.getKey());
        }
    }

    /** Writes the live instance through to the store and drops finished routes from the vehicle index. */
    public boolean persist(RouteProgress progress) {
        if (progress.isCompleted() && progress.getVehicleId() != null) {
            activeKeyByVehicle.remove(progress.getVehicleId(), progress.getKey());
        }
        boolean saved = trackingStore.saveProgress(progress);
        if (!saved) {
            log.warn("REGISTRY: progress {} not persisted, in-memory state stays authoritative", progress.getKey());
        }
        return saved;
    }

    public Optional<RouteProgressKey> activeKeyForVehicle(String vehicleId) {
        return Optional.ofNullable(activeKeyByVehicle.get(vehicleId));
    }

    /** Vehicles with a route in progress or about to start. */
    public List<String> trackedVehicleIds() {
        return new ArrayList<>(activeKeyByVehicle.keySet());
    }

    /** Snapshot of a progress, from memory or the store. */
    public Optional<RouteProgress> snapshot(RouteProgressKey key) {
        return withLock(key, () -> Optional.ofNullable(live(key)).map(RouteProgress::copy));
    }

    public List<RouteProgress> snapshots() {
        List<RouteProgress> result = new ArrayList<>();
        for (RouteProgress progress : new ArrayList<>(progressByKey.values())) {
            withLock(progress.getKey(), () -> result.add(progress.copy()));
        }
        return result;
    }

    public long countActive() {
        return progressByKey.values().stream().filter(p -> !p.isCompleted()).count();
    }

    /**
     * Drops live instances of days before {@code date} once they are safely in the store,
     * together with their locks and vehicle index entries. A record whose write fails stays
     * in memory and is retried on the next call. Returns the number of evicted records.
     */
    public int evictBefore(LocalDate date) {
        int evicted = 0;
        for (RouteProgress progress : new ArrayList<>(progressByKey.values())) {
            if (!progress.getDate().isBefore(date)) {
                continue;
            }
            RouteProgressKey key = progress.getKey();
            ReentrantLock lock = locks.computeIfAbsent(key.recordKey(), k -> new ReentrantLock());
            lock.lock();
            try {
                if (!trackingStore.saveProgress(progress)) {
                    log.warn("REGISTRY: {} not persisted, kept in memory", key);
                    continue;
                }
                progressByKey.remove(key.recordKey(), progress);
                if (progress.getVehicleId() != null) {
                    activeKeyByVehicle.remove(progress.getVehicleId(), key);
                }
                locks.remove(key.recordKey(), lock);
                evicted++;
            } finally {
                lock.unlock();
            }
        }
        if (evicted > 0) {
            log.info("REGISTRY: evicted {} progress record(s) dated before {}", evicted, date);
        }
        return evicted;
    }

    /** Writes every live instance to the store. Returns the number of failed writes. */
    public int flushAll() {
        int failed = 0;
        for (RouteProgress progress : new ArrayList<>(progressByKey.values())) {
            boolean saved = withLock(progress.getKey(), () -> trackingStore.saveProgress(progress));
            if (!saved) {
                failed++;
            }
        }
        log.info("REGISTRY: flushed {} progress record(s), {} failed", progressByKey.size(), failed);
        return failed;
    }
}
