package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.config.TrackingProperties;
import com.deliveryroute.tracking.entity.DeliveryRoute;
import com.deliveryroute.tracking.entity.PositionLog;
import com.deliveryroute.tracking.entity.RouteStop;
import com.deliveryroute.tracking.entity.TrackingEvent;
import com.deliveryroute.tracking.entity.TrackingEventType;
import com.deliveryroute.tracking.entity.Warehouse;
import com.deliveryroute.tracking.event.RouteProgressChanged;
import com.deliveryroute.tracking.event.StopEventFixed;
import com.deliveryroute.tracking.event.StopEventType;
import com.deliveryroute.tracking.exception.MissingReferenceDataException;
import com.deliveryroute.tracking.lookup.RouteLookup;
import com.deliveryroute.tracking.lookup.WarehouseLookup;
import com.deliveryroute.tracking.model.*;
import com.deliveryroute.tracking.util.GeofenceUtil;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns GPS samples into route progress.
 *
 * Per stop:  PENDING -> EN_ROUTE -> ARRIVED -> DEPARTED, at most one transition per sample.
 *  - PENDING  -> EN_ROUTE : outside the stop's geofence, previous stop finished (or first stop)
 *  - EN_ROUTE -> ARRIVED  : inside the geofence, fixes the actual arrival
 *  - ARRIVED  -> DEPARTED : outside again, fixes the actual departure and moves to the next stop
 * While EN_ROUTE and outside, stationary periods are recorded as intermediate stops.
 *
 * Every mutation happens under the route's lock in {@link RouteProgressRegistry}. Audit rows,
 * the GPS trail and application events are written after the lock is released.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingEngine {

    private final RouteProgressRegistry registry;
    private final RouteLookup routeLookup;
    private final WarehouseLookup warehouseLookup;
    private final TrackingProperties properties;
    private final TrackingSettings settings;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // ────────────────────────────────────────────────────────────────────────
    // Initialization
    // ────────────────────────────────────────────────────────────────────────

    /**
     * Starts tracking {@code routeId} for today.
     *
     * @throws MissingReferenceDataException when the route is unknown
     */
    public RouteProgress initializeTracking(String routeId, String driverId, String vehicleId) {
        DeliveryRoute route = routeLookup.findRoute(routeId)
                .orElseThrow(() -> MissingReferenceDataException.route(routeId));
        return initializeTracking(route, driverId, vehicleId, LocalDate.now(clock));
    }

    /**
     * Creates the progress record of (route, driver, date) with every stop PENDING.
     * An existing record is returned as is.
     */
    public RouteProgress initializeTracking(DeliveryRoute route, String driverId, String vehicleId, LocalDate date) {
        if (driverId == null || driverId.isBlank()) {
            throw new IllegalArgumentException("Route " + route.getId() + " has no driver to track");
        }
        if (route.getStops() == null || route.getStops().isEmpty()) {
            throw new IllegalArgumentException("Route " + route.getId() + " has no stops");
        }

        registry.evictBefore(LocalDate.now(clock));

        RouteProgressKey key = new RouteProgressKey(route.getId(), driverId, date);
        Outcome outcome = new Outcome();
        RouteProgress result = registry.withLock(key, () -> {
            RouteProgress existing = registry.live(key);
            if (existing != null) {
                registry.indexVehicle(existing);
                return existing.copy();
            }

            List<StopProgress> stops = new ArrayList<>();
            route.getStops().stream()
                    .sorted(Comparator.comparingInt(RouteStop::getStopOrder))
                    .forEach(stop -> stops.add(StopProgress.builder()
                            .stopId(stop.getId())
                            .warehouseId(stop.getWarehouseId())
                            .order(stop.getStopOrder())
                            .build()));

            RouteProgress progress = RouteProgress.builder()
                    .routeId(route.getId())
                    .driverId(driverId)
                    .vehicleId(vehicleId)
                    .date(date)
                    .stops(stops)
                    .build();
            registry.register(progress);
            log.info("TRACKING: initialized {} with {} stop(s), vehicle {}", key, stops.size(), vehicleId);

            RouteProgress snapshot = progress.copy();
            outcome.events.add(new RouteProgressChanged(snapshot, "INITIALIZED"));
            return snapshot;
        });
        outcome.flush();
        return result;
    }

    // ────────────────────────────────────────────────────────────────────────
    // Position ingestion
    // ────────────────────────────────────────────────────────────────────────

    /**
     * Applies one GPS sample to the route the vehicle is currently running.
     *
     * @return snapshot after the sample, or null when the vehicle has no active route
     */
    public RouteProgress ingestPosition(PositionSample sample) {
        if (sample == null || sample.getVehicleId() == null || sample.getTimestamp() == null) {
            throw new IllegalArgumentException("Position sample needs a vehicle id and a timestamp");
        }

        Optional<RouteProgressKey> key = registry.activeKeyForVehicle(sample.getVehicleId());
        if (key.isEmpty()) {
            log.debug("TRACKING: no active route for vehicle {}, sample ignored", sample.getVehicleId());
            return null;
        }

        Outcome outcome = new Outcome();
        RouteProgress result = registry.withLock(key.get(), () -> applySample(key.get(), sample, outcome));
        outcome.flush();
        return result;
    }

    public RouteProgress ingestPosition(String vehicleId, GeoPoint position, Double speed, LocalDateTime timestamp) {
        return ingestPosition(PositionSample.builder()
                .vehicleId(vehicleId)
                .latitude(position.latitude())
                .longitude(position.longitude())
                .speed(speed)
                .timestamp(timestamp)
                .build());
    }

    private RouteProgress applySample(RouteProgressKey key, PositionSample sample, Outcome outcome) {
        RouteProgress progress = registry.live(key);
        if (progress == null || progress.isCompleted()) {
            return null;
        }

        LocalDateTime time = sample.getTimestamp();
        if (progress.getLastPositionUpdateAt() != null && time.isBefore(progress.getLastPositionUpdateAt())) {
            log.debug("TRACKING: stale sample for {} at {} (last {}), dropped",
                    key, time, progress.getLastPositionUpdateAt());
            return progress.copy();
        }

        Optional<StopProgress> currentStop = progress.getCurrentStop();
        if (currentStop.isEmpty()) {
            return progress.copy();
        }
        StopProgress stop = currentStop.get();

        Optional<Warehouse> warehouse = warehouseLookup.findWarehouse(stop.getWarehouseId());
        if (warehouse.isEmpty()) {
            log.warn("TRACKING: warehouse {} of stop {} on {} not found, sample dropped",
                    stop.getWarehouseId(), stop.getStopId(), key);
            return progress.copy();
        }

        boolean inside = GeofenceUtil.isWithinGeofence(
                sample.toPoint(), warehouse.get().location(), properties.getGeofenceRadiusMeters());
        progress.setLastPositionUpdateAt(time);

        outcome.position = PositionLog.builder()
                .vehicleId(sample.getVehicleId())
                .routeId(progress.getRouteId())
                .driverId(progress.getDriverId())
                .latitude(sample.getLatitude())
                .longitude(sample.getLongitude())
                .speed(sample.getSpeed())
                .currentStopId(stop.getStopId())
                .withinGeofence(inside)
                .timestamp(time)
                .build();

        switch (stop.getStatus()) {
            case PENDING -> {
                if (!inside) {
                    startLeg(progress, stop, sample, outcome);
                }
            }
            case EN_ROUTE -> {
                if (inside) {
                    arrive(progress, stop, sample, outcome);
                } else {
                    detectIntermediateStop(progress, stop, sample, outcome);
                }
            }
            case ARRIVED -> {
                if (!inside) {
                    depart(progress, stop, sample, outcome);
                }
            }
            default -> log.debug("TRACKING: stop {} already {}, nothing to do", stop.getStopId(), stop.getStatus());
        }

        registry.persist(progress);
        return progress.copy();
    }

    private void startLeg(RouteProgress progress, StopProgress stop, PositionSample sample, Outcome outcome) {
        int index = progress.getCurrentStopIndex();
        if (index > 0 && !progress.getStops().get(index - 1).getStatus().isFinished()) {
            return;
        }
        stop.setStatus(StopStatus.EN_ROUTE);
        stop.setLegStartedAt(sample.getTimestamp());

        if (index == 0 && progress.getStatus() == RouteProgressStatus.NOT_STARTED) {
            progress.setStatus(RouteProgressStatus.IN_PROGRESS);
            progress.setStartTime(sample.getTimestamp());
            log.info("==> ROUTE_STARTED {} at {}", progress.getKey(), sample.getTimestamp());
            outcome.audit.add(event(progress, TrackingEventType.ROUTE_STARTED, stop, sample, null));
            outcome.events.add(new RouteProgressChanged(progress.copy(), "ROUTE_STARTED"));
        } else {
            log.info("TRACKING: {} heading to stop #{} ({})", progress.getKey(), index, stop.getStopId());
            outcome.events.add(new RouteProgressChanged(progress.copy(), "EN_ROUTE"));
        }
    }

    private void arrive(RouteProgress progress, StopProgress stop, PositionSample sample, Outcome outcome) {
        LocalDateTime time = sample.getTimestamp();
        closeOpenIntermediateStop(progress, time, sample, outcome);

        stop.setStatus(StopStatus.ARRIVED);
        stop.setEnteredGeofenceAt(time);
        stop.setActualArrival(time);

        log.info("==> STOP_ARRIVED {} stop #{} ({}) at {}",
                progress.getKey(), progress.getCurrentStopIndex(), stop.getStopId(), time);
        outcome.audit.add(event(progress, TrackingEventType.STOP_ARRIVED, stop, sample, null));
        outcome.events.add(fixed(progress, progress.getCurrentStopIndex(), stop, StopEventType.ARRIVAL, time));
        outcome.events.add(new RouteProgressChanged(progress.copy(), "STOP_ARRIVED"));
    }

    private void depart(RouteProgress progress, StopProgress stop, PositionSample sample, Outcome outcome) {
        LocalDateTime time = sample.getTimestamp();
        int index = progress.getCurrentStopIndex();

        stop.setStatus(StopStatus.DEPARTED);
        stop.setExitedGeofenceAt(time);
        stop.setActualDeparture(time);
        progress.setCurrentStopIndex(index + 1);

        log.info("==> STOP_DEPARTED {} stop #{} ({}) at {}", progress.getKey(), index, stop.getStopId(), time);
        outcome.audit.add(event(progress, TrackingEventType.STOP_DEPARTED, stop, sample, null));

        if (progress.getCurrentStopIndex() >= progress.getStops().size()) {
            progress.setStatus(RouteProgressStatus.COMPLETED);
            progress.setEndTime(time);
            log.info("==> ROUTE_COMPLETED {} at {}", progress.getKey(), time);
            outcome.audit.add(event(progress, TrackingEventType.ROUTE_COMPLETED, stop, sample, null));
        }
        outcome.events.add(fixed(progress, index, stop, StopEventType.DEPARTURE, time));
        outcome.events.add(new RouteProgressChanged(progress.copy(),
                progress.isCompleted() ? "ROUTE_COMPLETED" : "STOP_DEPARTED"));
    }

    /**
     * Stationary below the speed threshold opens an intermediate stop; moving on closes it;
     * drifting further than the move threshold while stationary closes it and opens a new one.
     */
    private void detectIntermediateStop(RouteProgress progress, StopProgress destination,
                                        PositionSample sample, Outcome outcome) {
        boolean stationary = sample.speedOrZero() < properties.getStationarySpeedThreshold();
        Optional<IntermediateStop> open = progress.getOpenIntermediateStop();

        if (!stationary) {
            open.ifPresent(stop -> close(progress, stop, sample.getTimestamp(), sample, outcome));
            return;
        }
        if (open.isEmpty()) {
            openIntermediateStop(progress, destination, sample, outcome);
            return;
        }
        double moved = GeofenceUtil.distanceMeters(sample.toPoint(), open.get().getPosition());
        if (moved > properties.getIntermediateStopMoveThresholdMeters()) {
            close(progress, open.get(), sample.getTimestamp(), sample, outcome);
            openIntermediateStop(progress, destination, sample, outcome);
        }
    }

    private void openIntermediateStop(RouteProgress progress, StopProgress destination,
                                      PositionSample sample, Outcome outcome) {
        int index = progress.getCurrentStopIndex();
        IntermediateStop stop = IntermediateStop.builder()
                .id("intermediate-" + UUID.randomUUID())
                .position(sample.toPoint())
                .startTime(sample.getTimestamp())
                .fromStopId(index > 0 ? progress.getStops().get(index - 1).getStopId() : null)
                .toStopId(destination.getStopId())
                .build();
        progress.getIntermediateStops().add(stop);
        log.info("TRACKING: intermediate stop opened for {} at ({}, {})",
                progress.getKey(), sample.getLatitude(), sample.getLongitude());
        outcome.audit.add(event(progress, TrackingEventType.INTERMEDIATE_STOP_OPENED, destination, sample, stop.getId()));
    }

    private void closeOpenIntermediateStop(RouteProgress progress, LocalDateTime time,
                                           PositionSample sample, Outcome outcome) {
        progress.getOpenIntermediateStop().ifPresent(stop -> close(progress, stop, time, sample, outcome));
    }

    private void close(RouteProgress progress, IntermediateStop stop, LocalDateTime time,
                       PositionSample sample, Outcome outcome) {
        stop.close(time);
        log.info("TRACKING: intermediate stop closed for {}, {} min", progress.getKey(), stop.getDurationMinutes());
        outcome.audit.add(TrackingEvent.builder()
                .routeId(progress.getRouteId())
                .driverId(progress.getDriverId())
                .vehicleId(progress.getVehicleId())
                .eventType(TrackingEventType.INTERMEDIATE_STOP_CLOSED)
                .stopId(stop.getToStopId())
                .latitude(sample != null ? sample.getLatitude() : null)
                .longitude(sample != null ? sample.getLongitude() : null)
                .details(stop.getId() + ", " + stop.getDurationMinutes() + " min")
                .eventTime(time)
                .build());
    }

    // ────────────────────────────────────────────────────────────────────────
    // Queries and lifecycle
    // ────────────────────────────────────────────────────────────────────────

    public Optional<RouteProgress> getProgress(String routeId, String driverId, LocalDate date) {
        return registry.snapshot(new RouteProgressKey(routeId, driverId, date));
    }

    public List<RouteProgress> getAllProgress() {
        return registry.snapshots();
    }

    /** Pauses automatic polling and writes every live progress to the store. */
    public int stopAllTracking() {
        settings.setPollingEnabled(false);
        int failed = registry.flushAll();
        log.info("TRACKING: all tracking stopped, {} failed write(s)", failed);
        return failed;
    }

    public void startTracking() {
        settings.setPollingEnabled(true);
        log.info("TRACKING: automatic polling resumed");
    }

    @PreDestroy
    public void shutdown() {
        log.info("TRACKING: shutting down, flushing progress records");
        registry.flushAll();
    }

    // ────────────────────────────────────────────────────────────────────────
    // Helpers
    // ────────────────────────────────────────────────────────────────────────

    private static TrackingEvent event(RouteProgress progress, TrackingEventType type, StopProgress stop,
                                       PositionSample sample, String details) {
        return TrackingEvent.builder()
                .routeId(progress.getRouteId())
                .driverId(progress.getDriverId())
                .vehicleId(progress.getVehicleId())
                .eventType(type)
                .stopId(stop.getStopId())
                .latitude(sample.getLatitude())
                .longitude(sample.getLongitude())
                .details(details)
                .eventTime(sample.getTimestamp())
                .build();
    }

    private static StopEventFixed fixed(RouteProgress progress, int index, StopProgress stop,
                                        StopEventType type, LocalDateTime time) {
        return new StopEventFixed(progress.getRouteId(), progress.getDriverId(), progress.getVehicleId(),
                progress.getDate(), index, stop.getStopId(), type, time, false, progress.isCompleted());
    }

    /** Side effects collected under the lock, emitted after it is released. */
    private final class Outcome {
        private PositionLog position;
        private final List<TrackingEvent> audit = new ArrayList<>();
        private final List<Object> events = new ArrayList<>();

        void flush() {
            if (position != null) {
                auditService.recordPosition(position);
            }
            audit.forEach(auditService::recordEvent);
            events.forEach(eventPublisher::publishEvent);
        }
    }
}
