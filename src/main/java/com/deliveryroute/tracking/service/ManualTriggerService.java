package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.entity.DeliveryRoute;
import com.deliveryroute.tracking.entity.TrackingEvent;
import com.deliveryroute.tracking.entity.TrackingEventType;
import com.deliveryroute.tracking.event.RouteProgressChanged;
import com.deliveryroute.tracking.event.StopEventFixed;
import com.deliveryroute.tracking.event.StopEventType;
import com.deliveryroute.tracking.lookup.RouteLookup;
import com.deliveryroute.tracking.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator fallback when GPS is unavailable: each trigger fixes the next event of the route
 * "now", alternating departure and arrival.
 *
 *   stop 0: DEPARTURE -> stop 1: ARRIVAL -> stop 1: DEPARTURE -> stop 2: ARRIVAL -> ...
 *
 * The stop index only advances on a departure. A departure from the last stop completes the
 * route and discards the trigger state. The state belongs to one service day; a trigger on a
 * later day starts again from a departure at stop 0. Fixed events go through the same recalculation path
 * as GPS-detected ones.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManualTriggerService {

    private final RouteLookup routeLookup;
    private final TrackingEngine trackingEngine;
    private final RouteProgressRegistry registry;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<String, TriggerState> triggerStates = new ConcurrentHashMap<>();

    public TriggerResult trigger(String routeId) {
        Optional<DeliveryRoute> found = routeLookup.findRoute(routeId);
        if (found.isEmpty()) {
            return TriggerResult.rejected("Route not found: " + routeId);
        }
        DeliveryRoute route = found.get();
        LocalDate today = LocalDate.now(clock);
        if (!route.isScheduledFor(today)) {
            log.warn("TRIGGER: route {} is not scheduled for {}, rejected", routeId, today);
            return TriggerResult.rejected("Route " + routeId + " is not scheduled for today (" + today + ")");
        }
        if (route.getStops() == null || route.getStops().isEmpty()) {
            return TriggerResult.rejected("Route " + routeId + " has no stops");
        }
        if (route.getDriverId() == null) {
            return TriggerResult.rejected("Route " + routeId + " has no assigned driver");
        }

        RouteProgressKey key = new RouteProgressKey(routeId, route.getDriverId(), today);
        if (registry.snapshot(key).isEmpty()) {
            trackingEngine.initializeTracking(route, route.getDriverId(), route.getVehicleId(), today);
        }

        List<Object> events = new ArrayList<>();
        List<TrackingEvent> audit = new ArrayList<>();
        TriggerResult result = registry.withLock(key, () -> apply(key, events, audit));
        audit.forEach(auditService::recordEvent);
        events.forEach(eventPublisher::publishEvent);
        return result;
    }

    private TriggerResult apply(RouteProgressKey key, List<Object> events, List<TrackingEvent> audit) {
        RouteProgress progress = registry.live(key);
        if (progress == null) {
            return TriggerResult.rejected("No tracking record for " + key);
        }
        if (progress.isCompleted()) {
            return TriggerResult.rejected("Route " + key.routeId() + " is already completed");
        }

        TriggerState state = triggerStates.compute(key.routeId(), (id, existing) -> {
            if (existing != null && key.date().equals(existing.getDate())) {
                return existing;
            }
            if (existing != null) {
                log.info("TRIGGER: route {} state from {} discarded, new service day {}",
                        id, existing.getDate(), key.date());
            }
            return TriggerState.builder().routeId(id).date(key.date()).build();
        });
        syncWithProgress(state, progress);

        int index = state.getCurrentStopIndex();
        if (index >= progress.getStops().size()) {
            return TriggerResult.rejected("No stops left on route " + key.routeId());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        StopProgress stop = progress.getStops().get(index);
        progress.getOpenIntermediateStop().ifPresent(open -> open.close(now));
        TriggerAction action = state.getNextAction();

        if (action == TriggerAction.DEPARTURE) {
            stop.setActualDeparture(now);
            stop.setStatus(StopStatus.COMPLETED);
            if (progress.getStatus() == RouteProgressStatus.NOT_STARTED) {
                progress.setStatus(RouteProgressStatus.IN_PROGRESS);
                progress.setStartTime(now);
            }
            progress.setCurrentStopIndex(index + 1);
            boolean last = index + 1 >= progress.getStops().size();
            if (last) {
                progress.setStatus(RouteProgressStatus.COMPLETED);
                progress.setEndTime(now);
            }
            state.setCurrentStopIndex(index + 1);
            state.setNextAction(TriggerAction.ARRIVAL);
            audit.add(event(progress, TrackingEventType.MANUAL_DEPARTURE, stop, now));
            if (last) {
                audit.add(event(progress, TrackingEventType.ROUTE_COMPLETED, stop, now));
            }
        } else {
            stop.setActualArrival(now);
            stop.setStatus(StopStatus.ARRIVED);
            progress.setCurrentStopIndex(index);
            state.setNextAction(TriggerAction.DEPARTURE);
            audit.add(event(progress, TrackingEventType.MANUAL_ARRIVAL, stop, now));
        }
        state.setLastTriggeredAt(now);
        registry.persist(progress);

        StopEventType type = action == TriggerAction.DEPARTURE ? StopEventType.DEPARTURE : StopEventType.ARRIVAL;
        events.add(new StopEventFixed(progress.getRouteId(), progress.getDriverId(), progress.getVehicleId(),
                progress.getDate(), index, stop.getStopId(), type, now, true, progress.isCompleted()));
        events.add(new RouteProgressChanged(progress.copy(), "MANUAL_" + action));

        TriggerState nextState = state.copy();
        if (progress.isCompleted()) {
            triggerStates.remove(key.routeId());
            nextState = null;
            log.info("TRIGGER: route {} completed, trigger state discarded", key.routeId());
        }
        log.info("==> MANUAL_{} route {} stop #{} ({}) at {}", action, key.routeId(), index, stop.getStopId(), now);
        return new TriggerResult(true, action, index, stop.getStopId(), now,
                describe(action, index) + " fixed at " + now.toLocalTime(), nextState);
    }

    /**
     * GPS may have moved the route on since the last trigger: never re-fix an event
     * that is already known.
     */
    private void syncWithProgress(TriggerState state, RouteProgress progress) {
        if (progress.getCurrentStopIndex() > state.getCurrentStopIndex()) {
            log.info("TRIGGER: route {} advanced by GPS to stop #{}", state.getRouteId(), progress.getCurrentStopIndex());
            state.setCurrentStopIndex(progress.getCurrentStopIndex());
            state.setNextAction(TriggerAction.ARRIVAL);
        }
        int index = state.getCurrentStopIndex();
        if (index < progress.getStops().size()
                && state.getNextAction() == TriggerAction.ARRIVAL
                && progress.getStops().get(index).getActualArrival() != null) {
            state.setNextAction(TriggerAction.DEPARTURE);
        }
    }

    public Optional<TriggerState> getTriggerState(String routeId) {
        return todaysState(routeId).map(TriggerState::copy);
    }

    /** A state left over from an earlier day does not apply to today's progress. */
    private Optional<TriggerState> todaysState(String routeId) {
        LocalDate today = LocalDate.now(clock);
        return Optional.ofNullable(triggerStates.get(routeId))
                .filter(state -> today.equals(state.getDate()));
    }

    public void resetTrigger(String routeId) {
        triggerStates.remove(routeId);
        log.info("TRIGGER: state of route {} reset", routeId);
    }

    /** Human-readable next action, e.g. "Fix departure from stop 1". */
    public String describeNextAction(String routeId) {
        return todaysState(routeId)
                .map(state -> describe(state.getNextAction(), state.getCurrentStopIndex()))
                .orElseGet(() -> describe(TriggerAction.DEPARTURE, 0));
    }

    private static String describe(TriggerAction action, int index) {
        return action == TriggerAction.DEPARTURE
                ? "Fix departure from stop " + (index + 1)
                : "Fix arrival at stop " + (index + 1);
    }

    private static TrackingEvent event(RouteProgress progress, TrackingEventType type, StopProgress stop,
                                       LocalDateTime time) {
        return TrackingEvent.builder()
                .routeId(progress.getRouteId())
                .driverId(progress.getDriverId())
                .vehicleId(progress.getVehicleId())
                .eventType(type)
                .stopId(stop.getStopId())
                .details("manual trigger")
                .eventTime(time)
                .build();
    }
}
