package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.config.TrackingProperties;
import com.deliveryroute.tracking.entity.DeliveryRoute;
import com.deliveryroute.tracking.entity.RouteStop;
import com.deliveryroute.tracking.exception.MissingReferenceDataException;
import com.deliveryroute.tracking.lookup.RouteLookup;
import com.deliveryroute.tracking.model.ScheduledStop;
import com.deliveryroute.tracking.store.TrackingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The current stop schedule of a route.
 *
 * The stored schedule record wins; a route that was never recalculated falls back
 * to its registry definition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleService {

    private final TrackingStore trackingStore;
    private final RouteLookup routeLookup;
    private final TrackingProperties properties;

    /**
     * Mutable copy of the route's current schedule, ordered by stop order.
     *
     * @throws MissingReferenceDataException when the route is unknown and has no stored schedule
     */
    public List<ScheduledStop> currentSchedule(String routeId) {
        List<ScheduledStop> stops = trackingStore.loadSchedule(routeId)
                .map(stored -> new ArrayList<>(stored.stream().map(ScheduledStop::copy).toList()))
                .orElseGet(() -> fromDefinition(routeLookup.findRoute(routeId)
                        .orElseThrow(() -> MissingReferenceDataException.route(routeId))));
        stops.sort(Comparator.comparingInt(ScheduledStop::getOrder));
        return stops;
    }

    public boolean saveSchedule(String routeId, List<ScheduledStop> stops) {
        boolean saved = trackingStore.saveSchedule(routeId, stops);
        if (!saved) {
            log.warn("SCHEDULE: route {} schedule not persisted", routeId);
        }
        return saved;
    }

    /** Minutes spent at a stop: the base dwell plus the lunch break when one is planned there. */
    public int dwellMinutes(ScheduledStop stop) {
        int dwell = properties.getRecalculation().getBaseDwellMinutes();
        if (stop.isHasLunchBreak() && stop.getLunchDurationMinutes() != null) {
            dwell += stop.getLunchDurationMinutes();
        }
        return dwell;
    }

    static ArrayList<ScheduledStop> fromDefinition(DeliveryRoute route) {
        ArrayList<ScheduledStop> stops = new ArrayList<>();
        for (RouteStop stop : route.getStops()) {
            stops.add(ScheduledStop.builder()
                    .stopId(stop.getId())
                    .warehouseId(stop.getWarehouseId())
                    .order(stop.getStopOrder())
                    .plannedArrival(stop.getArrivalTime())
                    .plannedDeparture(stop.getDepartureTime())
                    .hasLunchBreak(stop.isHasLunchBreak())
                    .lunchDurationMinutes(stop.getLunchDurationMinutes())
                    .build());
        }
        return stops;
    }
}
