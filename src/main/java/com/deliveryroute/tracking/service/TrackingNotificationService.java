package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.config.WebSocketConfig;
import com.deliveryroute.tracking.event.RouteProgressChanged;
import com.deliveryroute.tracking.event.ScheduleRecalculated;
import com.deliveryroute.tracking.event.ScheduleRecalculationFailed;
import com.deliveryroute.tracking.event.StopEventFixed;
import com.deliveryroute.tracking.model.RouteProgress;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes tracking events to dashboards over STOMP.
 *
 *   /topic/route-progress    progress snapshots and fixed arrivals/departures
 *   /topic/schedule-updates  recalculated schedules and recalculation failures
 *
 * A failed push is logged; tracking never depends on a dashboard being connected.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingNotificationService {

    private final SimpMessagingTemplate messagingTemplate;

    @EventListener
    public void onRouteProgressChanged(RouteProgressChanged event) {
        RouteProgress progress = event.progress();
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", "ROUTE_PROGRESS");
        msg.put("change", event.change());
        msg.put("routeId", progress.getRouteId());
        msg.put("driverId", progress.getDriverId());
        msg.put("vehicleId", progress.getVehicleId());
        msg.put("date", progress.getDate().toString());
        msg.put("status", progress.getStatus().name());
        msg.put("currentStopIndex", progress.getCurrentStopIndex());
        msg.put("progress", progress);
        send(WebSocketConfig.TOPIC_ROUTE_PROGRESS, msg);
    }

    @EventListener
    public void onStopEventFixed(StopEventFixed event) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", "STOP_" + event.type().name());
        msg.put("routeId", event.routeId());
        msg.put("driverId", event.driverId());
        msg.put("vehicleId", event.vehicleId());
        msg.put("stopIndex", event.stopIndex());
        msg.put("stopId", event.stopId());
        msg.put("time", event.time().toString());
        msg.put("manual", event.manual());
        msg.put("routeCompleted", event.routeCompleted());
        send(WebSocketConfig.TOPIC_ROUTE_PROGRESS, msg);
    }

    @EventListener
    public void onScheduleRecalculated(ScheduleRecalculated event) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", "SCHEDULE_UPDATED");
        msg.put("routeId", event.routeId());
        msg.put("trigger", event.trigger().name());
        msg.put("fromStopIndex", event.fromStopIndex());
        msg.put("fallbackCount", event.fallbackCount());
        msg.put("stops", event.stops());
        send(WebSocketConfig.TOPIC_SCHEDULE_UPDATES, msg);
    }

    @EventListener
    public void onScheduleRecalculationFailed(ScheduleRecalculationFailed event) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", "SCHEDULE_RECALCULATION_FAILED");
        msg.put("routeId", event.routeId());
        msg.put("trigger", event.trigger().name());
        msg.put("fromStopIndex", event.fromStopIndex());
        msg.put("reason", event.reason());
        send(WebSocketConfig.TOPIC_SCHEDULE_UPDATES, msg);
    }

    private void send(String topic, Map<String, Object> msg) {
        try {
            messagingTemplate.convertAndSend(topic, msg);
            log.debug("WS {}: {} route {}", topic, msg.get("type"), msg.get("routeId"));
        } catch (Exception e) {
            log.warn("WS push to {} failed for route {}: {}", topic, msg.get("routeId"), e.getMessage());
        }
    }
}
