package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.client.GpsPositionProvider;
import com.deliveryroute.tracking.entity.DeliveryRoute;
import com.deliveryroute.tracking.entity.Vehicle;
import com.deliveryroute.tracking.lookup.RouteLookup;
import com.deliveryroute.tracking.lookup.VehicleLookup;
import com.deliveryroute.tracking.model.PositionSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * GPS polling loop.
 *
 * Every cycle inside the tracking window: make sure today's routes are tracked, then poll
 * each tracked vehicle on the ingest pool. A vehicle whose previous poll is still running
 * is skipped for the cycle.
 */
@Service
@Slf4j
public class TrackingScheduler {

    private final TrackingEngine trackingEngine;
    private final RouteProgressRegistry registry;
    private final RouteLookup routeLookup;
    private final VehicleLookup vehicleLookup;
    private final GpsPositionProvider gpsPositionProvider;
    private final TrackingSettings settings;
    private final KeyedSerialExecutor routeRecalculationQueue;
    private final Executor positionIngestExecutor;
    private final Clock clock;

    @Value("${tracking.polling.auto-start:true}")
    private boolean autoStartRoutes;

    private final Set<String> pollsInFlight = ConcurrentHashMap.newKeySet();

    private volatile LocalDateTime lastPollAt;

    public TrackingScheduler(TrackingEngine trackingEngine,
                             RouteProgressRegistry registry,
                             RouteLookup routeLookup,
                             VehicleLookup vehicleLookup,
                             GpsPositionProvider gpsPositionProvider,
                             TrackingSettings settings,
                             KeyedSerialExecutor routeRecalculationQueue,
                             @Qualifier("positionIngestExecutor") Executor positionIngestExecutor,
                             Clock clock) {
        this.trackingEngine = trackingEngine;
        this.registry = registry;
        this.routeLookup = routeLookup;
        this.vehicleLookup = vehicleLookup;
        this.gpsPositionProvider = gpsPositionProvider;
        this.settings = settings;
        this.routeRecalculationQueue = routeRecalculationQueue;
        this.positionIngestExecutor = positionIngestExecutor;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${tracking.polling.interval-ms:30000}",
               initialDelayString = "${tracking.polling.initial-delay-ms:10000}")
    public void pollCycle() {
        if (!settings.isPollingEnabled()) {
            return;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (!settings.isWithinWindow(now.toLocalTime())) {
            log.debug("POLL: {} outside tracking window {}-{}, skipped",
                    now.toLocalTime(), settings.getStartHour(), settings.getEndHour());
            return;
        }
        lastPollAt = now;
        registry.evictBefore(now.toLocalDate());

        if (autoStartRoutes) {
            startTrackingAllRoutes(now.toLocalDate());
        }
        for (String vehicleId : registry.trackedVehicleIds()) {
            pollVehicle(vehicleId);
        }
    }

    /**
     * Initializes tracking for every active route scheduled on {@code date} that has a driver,
     * a vehicle and stops. Already tracked routes are left alone.
     *
     * @return number of routes tracked for the date
     */
    public int startTrackingAllRoutes(LocalDate date) {
        int tracked = 0;
        for (DeliveryRoute route : routeLookup.findActiveRoutes()) {
            if (!route.isScheduledFor(date) || route.getDriverId() == null || route.getVehicleId() == null
                    || route.getStops() == null || route.getStops().isEmpty()) {
                continue;
            }
            try {
                trackingEngine.initializeTracking(route, route.getDriverId(), route.getVehicleId(), date);
                tracked++;
            } catch (Exception e) {
                log.error("POLL: could not start tracking route {}: {}", route.getId(), e.getMessage());
            }
        }
        log.debug("POLL: {} route(s) tracked for {}", tracked, date);
        return tracked;
    }

    void pollVehicle(String vehicleId) {
        if (!pollsInFlight.add(vehicleId)) {
            log.debug("POLL: vehicle {} still busy with previous poll, skipped", vehicleId);
            return;
        }
        try {
            positionIngestExecutor.execute(() -> {
                try {
                    pollOnce(vehicleId);
                } finally {
                    pollsInFlight.remove(vehicleId);
                }
            });
        } catch (RuntimeException e) {
            pollsInFlight.remove(vehicleId);
            log.error("POLL: could not schedule poll of vehicle {}: {}", vehicleId, e.getMessage());
        }
    }

    private void pollOnce(String vehicleId) {
        try {
            Optional<Vehicle> vehicle = vehicleLookup.findVehicle(vehicleId);
            if (vehicle.isEmpty()) {
                log.warn("POLL: vehicle {} not in registry", vehicleId);
                return;
            }
            Optional<PositionSample> sample = gpsPositionProvider.fetchLatestPosition(vehicle.get());
            sample.ifPresent(trackingEngine::ingestPosition);
        } catch (Exception e) {
            log.error("POLL: vehicle {} failed: {}", vehicleId, e.getMessage());
        }
    }

    public TrackingStats getStats() {
        LocalDateTime now = LocalDateTime.now(clock);
        return new TrackingStats(
                registry.countActive(),
                registry.trackedVehicleIds().size(),
                settings.isPollingEnabled(),
                settings.isWithinWindow(now.toLocalTime()),
                settings.getStartHour(),
                settings.getEndHour(),
                pollsInFlight.size(),
                routeRecalculationQueue.activeKeys(),
                lastPollAt);
    }
}
