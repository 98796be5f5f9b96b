package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.config.TrackingProperties;
import com.deliveryroute.tracking.entity.DeliveryRoute;
import com.deliveryroute.tracking.entity.TrackingEvent;
import com.deliveryroute.tracking.entity.TrackingEventType;
import com.deliveryroute.tracking.entity.Vehicle;
import com.deliveryroute.tracking.entity.Warehouse;
import com.deliveryroute.tracking.event.ScheduleRecalculated;
import com.deliveryroute.tracking.event.ScheduleRecalculationFailed;
import com.deliveryroute.tracking.event.StopEventFixed;
import com.deliveryroute.tracking.event.StopEventType;
import com.deliveryroute.tracking.exception.MissingReferenceDataException;
import com.deliveryroute.tracking.lookup.RouteLookup;
import com.deliveryroute.tracking.lookup.VehicleLookup;
import com.deliveryroute.tracking.lookup.WarehouseLookup;
import com.deliveryroute.tracking.model.ScheduledStop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Re-derives planned stop times whenever an actual arrival or departure is fixed.
 *
 * Departure at stop i: stop i departs at the actual time, then every later stop is
 * re-planned leg by leg from the travel-time estimate, clamped into the operating day,
 * plus dwell. Arrival at stop i: only stop i is re-planned.
 *
 * Always starts from the stored schedule and overwrites absolute times, so replaying
 * the same event gives the same schedule. Requests run on the recalculation pool,
 * one at a time per route.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CascadingRecalculationService {

    private final ScheduleService scheduleService;
    private final RouteLookup routeLookup;
    private final VehicleLookup vehicleLookup;
    private final WarehouseLookup warehouseLookup;
    private final TravelTimeEstimatorAdapter estimator;
    private final TrackingProperties properties;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final KeyedSerialExecutor routeRecalculationQueue;

    @EventListener
    public void onStopEventFixed(StopEventFixed event) {
        submit(event);
    }

    /** Queues the recalculation behind any other pending one of the same route. */
    public CompletableFuture<Void> submit(StopEventFixed event) {
        log.debug("RECALC: queued {} of route {} stop #{}", event.type(), event.routeId(), event.stopIndex());
        return routeRecalculationQueue.submit(event.routeId(), () -> runQueued(event));
    }

    private void runQueued(StopEventFixed event) {
        try {
            if (event.type() == StopEventType.DEPARTURE) {
                recalculateFromDeparture(event.routeId(), event.stopIndex(), event.time());
            } else {
                recalculateFromArrival(event.routeId(), event.stopIndex(), event.time());
            }
        } catch (RuntimeException e) {
            log.error("RECALC: route {} {} at stop #{} failed: {}",
                    event.routeId(), event.type(), event.stopIndex(), e.getMessage());
            auditService.recordEvent(TrackingEvent.builder()
                    .routeId(event.routeId())
                    .driverId(event.driverId())
                    .vehicleId(event.vehicleId())
                    .eventType(TrackingEventType.SCHEDULE_RECALCULATION_FAILED)
                    .stopId(event.stopId())
                    .details(truncate(e.getMessage()))
                    .eventTime(event.time())
                    .build());
            eventPublisher.publishEvent(new ScheduleRecalculationFailed(
                    event.routeId(), event.type(), event.stopIndex(), e.getMessage()));
        }
    }

    /**
     * Cascade after an actual departure from stop {@code stopIndex} at {@code departure}.
     * Each recomputed stop is persisted as soon as it is known.
     *
     * @return the resulting schedule
     * @throws MissingReferenceDataException when a warehouse on the remaining legs is unknown;
     *                                       stops recomputed before it stay persisted
     */
    public List<ScheduledStop> recalculateFromDeparture(String routeId, int stopIndex, LocalDateTime departure) {
        List<ScheduledStop> stops = scheduleService.currentSchedule(routeId);
        checkIndex(routeId, stopIndex, stops);
        Integer speedLimit = resolveSpeedLimit(routeId);

        stops.get(stopIndex).setPlannedDeparture(departure.toLocalTime());
        scheduleService.saveSchedule(routeId, stops);

        LocalDateTime running = departure;
        int fallbacks = 0;
        for (int k = stopIndex + 1; k < stops.size(); k++) {
            ScheduledStop previous = stops.get(k - 1);
            ScheduledStop stop = stops.get(k);
            Warehouse origin = requireWarehouse(previous.getWarehouseId());
            Warehouse destination = requireWarehouse(stop.getWarehouseId());

            TravelEstimate estimate = estimator.estimate(origin, destination, running, speedLimit);
            if (estimate.fallback()) {
                fallbacks++;
            }
            LocalDateTime arrival = clampToOperatingDay(running.plusMinutes(estimate.minutes()));
            LocalDateTime leaving = arrival.plusMinutes(scheduleService.dwellMinutes(stop));

            stop.setPlannedArrival(arrival.toLocalTime());
            stop.setPlannedDeparture(leaving.toLocalTime());
            scheduleService.saveSchedule(routeId, stops);

            log.debug("RECALC: route {} stop #{} -> arrive {}, depart {} ({} min{})", routeId, k,
                    arrival.toLocalTime(), leaving.toLocalTime(), estimate.minutes(),
                    estimate.fallback() ? ", fallback" : "");
            running = leaving;
        }

        log.info("RECALC: route {} re-planned from departure at stop #{} ({}), {} stop(s), {} fallback(s)",
                routeId, stopIndex, departure, stops.size() - stopIndex - 1, fallbacks);
        completed(routeId, StopEventType.DEPARTURE, stopIndex, stops, fallbacks, departure);
        return stops;
    }

    /**
     * Narrow recompute after an actual arrival: stop {@code stopIndex} arrives at {@code arrival}
     * and leaves after its dwell; later stops are untouched.
     */
    public List<ScheduledStop> recalculateFromArrival(String routeId, int stopIndex, LocalDateTime arrival) {
        List<ScheduledStop> stops = scheduleService.currentSchedule(routeId);
        checkIndex(routeId, stopIndex, stops);

        ScheduledStop stop = stops.get(stopIndex);
        stop.setPlannedArrival(arrival.toLocalTime());
        stop.setPlannedDeparture(arrival.plusMinutes(scheduleService.dwellMinutes(stop)).toLocalTime());
        scheduleService.saveSchedule(routeId, stops);

        log.info("RECALC: route {} stop #{} arrival fixed at {}", routeId, stopIndex, arrival);
        completed(routeId, StopEventType.ARRIVAL, stopIndex, stops, 0, arrival);
        return stops;
    }

    /**
     * Keeps a planned arrival inside [day start, day end): earlier arrivals move to the
     * day start, later ones to one minute before the day end, on the same date.
     */
    public LocalDateTime clampToOperatingDay(LocalDateTime arrival) {
        TrackingProperties.Recalculation day = properties.getRecalculation();
        if (arrival.getHour() < day.getDayStartHour()) {
            return arrival.toLocalDate().atTime(LocalTime.of(day.getDayStartHour(), 0));
        }
        if (arrival.getHour() >= day.getDayEndHour()) {
            return arrival.toLocalDate().atTime(LocalTime.of(day.getDayEndHour() - 1, 59));
        }
        return arrival;
    }

    private void completed(String routeId, StopEventType trigger, int stopIndex,
                           List<ScheduledStop> stops, int fallbacks, LocalDateTime eventTime) {
        auditService.recordEvent(TrackingEvent.builder()
                .routeId(routeId)
                .eventType(TrackingEventType.SCHEDULE_RECALCULATED)
                .stopId(stops.get(stopIndex).getStopId())
                .details(trigger + " at stop #" + stopIndex + ", " + fallbacks + " fallback estimate(s)")
                .eventTime(eventTime)
                .build());
        eventPublisher.publishEvent(new ScheduleRecalculated(
                routeId, trigger, stopIndex, stops.stream().map(ScheduledStop::copy).toList(), fallbacks));
    }

    private Warehouse requireWarehouse(String warehouseId) {
        return warehouseLookup.findWarehouse(warehouseId)
                .orElseThrow(() -> MissingReferenceDataException.warehouse(warehouseId));
    }

    private Integer resolveSpeedLimit(String routeId) {
        DeliveryRoute route = routeLookup.findRoute(routeId).orElse(null);
        if (route == null) {
            return null;
        }
        if (route.getVehicleSpeedLimit() != null) {
            return route.getVehicleSpeedLimit();
        }
        if (route.getVehicleId() == null) {
            return null;
        }
        return vehicleLookup.findVehicle(route.getVehicleId()).map(Vehicle::getSpeedLimitMph).orElse(null);
    }

    private static void checkIndex(String routeId, int stopIndex, List<ScheduledStop> stops) {
        if (stopIndex < 0 || stopIndex >= stops.size()) {
            throw new IllegalArgumentException(
                    "Stop index " + stopIndex + " out of range for route " + routeId + " (" + stops.size() + " stops)");
        }
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > 500 ? message.substring(0, 500) : message;
    }
}
