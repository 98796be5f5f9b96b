package com.deliveryroute.tracking.controller;

import com.deliveryroute.tracking.dto.ApiResponse;
import com.deliveryroute.tracking.dto.InitializeTrackingRequest;
import com.deliveryroute.tracking.dto.PositionUpdateRequest;
import com.deliveryroute.tracking.dto.TrackingHoursRequest;
import com.deliveryroute.tracking.entity.DeliveryRoute;
import com.deliveryroute.tracking.exception.MissingReferenceDataException;
import com.deliveryroute.tracking.exception.TrackingNotFoundException;
import com.deliveryroute.tracking.lookup.RouteLookup;
import com.deliveryroute.tracking.model.PositionSample;
import com.deliveryroute.tracking.model.RouteProgress;
import com.deliveryroute.tracking.model.ScheduledStop;
import com.deliveryroute.tracking.service.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracking control surface for dashboards and integrations.
 *
 *  POST   /api/tracking/initialize                       start tracking a route for today
 *  POST   /api/tracking/positions[/batch|/async]         push GPS samples
 *  POST   /api/tracking/routes/{routeId}/trigger         manual departure/arrival
 *  GET    /api/tracking/routes/{routeId}/trigger         trigger state and next action
 *  DELETE /api/tracking/routes/{routeId}/trigger         reset trigger state
 *  GET    /api/tracking/routes/{routeId}/schedule        current planned times
 *  GET    /api/tracking/progress[/{routeId}/{driverId}/{date}]
 *  POST   /api/tracking/stop-all, /start, /start-all
 *  GET|PUT /api/tracking/settings/hours
 *  GET    /api/tracking/stats
 */
@RestController
@RequestMapping("/api/tracking")
@RequiredArgsConstructor
@Slf4j
public class TrackingController {

    private final TrackingEngine trackingEngine;
    private final ManualTriggerService manualTriggerService;
    private final PositionIngestService positionIngestService;
    private final ScheduleService scheduleService;
    private final TrackingScheduler trackingScheduler;
    private final TrackingSettings trackingSettings;
    private final ReferenceDataService referenceDataService;
    private final RouteLookup routeLookup;
    private final Clock clock;

    @Value("${tracking.positions.batch-max-size:100}")
    private int maxBatchSize;

    @PostMapping("/initialize")
    public ResponseEntity<ApiResponse<RouteProgress>> initialize(@Valid @RequestBody InitializeTrackingRequest request) {
        DeliveryRoute route = routeLookup.findRoute(request.getRouteId())
                .orElseThrow(() -> MissingReferenceDataException.route(request.getRouteId()));
        String driverId = request.getDriverId() != null ? request.getDriverId() : route.getDriverId();
        String vehicleId = request.getVehicleId() != null ? request.getVehicleId() : route.getVehicleId();

        RouteProgress progress = trackingEngine.initializeTracking(route, driverId, vehicleId, LocalDate.now(clock));
        return ResponseEntity.ok(ApiResponse.success(progress, "Tracking initialized for route " + route.getId()));
    }

    @PostMapping("/positions")
    public ResponseEntity<ApiResponse<RouteProgress>> ingestPosition(@Valid @RequestBody PositionUpdateRequest request) {
        RouteProgress progress = trackingEngine.ingestPosition(request.toSample());
        if (progress == null) {
            return ResponseEntity.ok(ApiResponse.error(
                    "No active route for vehicle " + request.getVehicleId() + ", position ignored"));
        }
        return ResponseEntity.ok(ApiResponse.success(progress, "Position processed"));
    }

    /** Buffered samples from a device that was offline, applied oldest first. */
    @PostMapping("/positions/batch")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> ingestBatch(
            @RequestBody List<@Valid PositionUpdateRequest> requests) {
        if (requests.isEmpty()) {
            return ResponseEntity.badRequest().body(ApiResponse.error("Batch is empty, nothing to process"));
        }
        if (requests.size() > maxBatchSize) {
            log.warn("Batch rejected, size {} exceeds max {}", requests.size(), maxBatchSize);
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(ApiResponse.error(
                    "Batch size " + requests.size() + " exceeds maximum allowed " + maxBatchSize));
        }
        List<PositionSample> samples = requests.stream().map(PositionUpdateRequest::toSample).toList();
        Map<String, Integer> result = positionIngestService.processBatch(samples);
        return ResponseEntity.ok(ApiResponse.success(result,
                "Batch processed: " + result.get("processed") + "/" + result.get("total")));
    }

    @PostMapping("/positions/async")
    public ResponseEntity<ApiResponse<Void>> ingestPositionAsync(@Valid @RequestBody PositionUpdateRequest request) {
        positionIngestService.processAsync(request.toSample());
        return ResponseEntity.accepted().body(ApiResponse.success("Position accepted for processing"));
    }

    // ── Manual trigger ──────────────────────────────────────────────────────

    @PostMapping("/routes/{routeId}/trigger")
    public ResponseEntity<ApiResponse<TriggerResult>> trigger(@PathVariable String routeId) {
        log.info("Manual trigger requested for route {}", routeId);
        TriggerResult result = manualTriggerService.trigger(routeId);
        if (!result.success()) {
            return ResponseEntity.badRequest().body(ApiResponse.error(result.message(), result));
        }
        return ResponseEntity.ok(ApiResponse.success(result, result.message()));
    }

    @GetMapping("/routes/{routeId}/trigger")
    public ResponseEntity<ApiResponse<Map<String, Object>>> triggerState(@PathVariable String routeId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("state", manualTriggerService.getTriggerState(routeId).orElse(null));
        data.put("nextAction", manualTriggerService.describeNextAction(routeId));
        return ResponseEntity.ok(ApiResponse.success(data, "Trigger state of route " + routeId));
    }

    @DeleteMapping("/routes/{routeId}/trigger")
    public ResponseEntity<ApiResponse<Void>> resetTrigger(@PathVariable String routeId) {
        manualTriggerService.resetTrigger(routeId);
        return ResponseEntity.ok(ApiResponse.success("Trigger state of route " + routeId + " reset"));
    }

    @GetMapping("/routes/{routeId}/schedule")
    public ResponseEntity<ApiResponse<List<ScheduledStop>>> schedule(@PathVariable String routeId) {
        List<ScheduledStop> stops = scheduleService.currentSchedule(routeId);
        return ResponseEntity.ok(ApiResponse.success(stops, stops.size() + " stop(s)"));
    }

    // ── Progress ────────────────────────────────────────────────────────────

    @GetMapping("/progress/{routeId}/{driverId}/{date}")
    public ResponseEntity<ApiResponse<RouteProgress>> progress(
            @PathVariable String routeId,
            @PathVariable String driverId,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        RouteProgress progress = trackingEngine.getProgress(routeId, driverId, date)
                .orElseThrow(() -> new TrackingNotFoundException(
                        "No tracking record for route " + routeId + ", driver " + driverId + " on " + date));
        return ResponseEntity.ok(ApiResponse.success(progress, "Progress of route " + routeId));
    }

    @GetMapping("/progress")
    public ResponseEntity<ApiResponse<List<RouteProgress>>> allProgress() {
        List<RouteProgress> all = trackingEngine.getAllProgress();
        return ResponseEntity.ok(ApiResponse.success(all, all.size() + " tracked route(s)"));
    }

    // ── Lifecycle and settings ──────────────────────────────────────────────

    @PostMapping("/stop-all")
    public ResponseEntity<ApiResponse<Void>> stopAll() {
        int failed = trackingEngine.stopAllTracking();
        return ResponseEntity.ok(ApiResponse.success(failed == 0
                ? "Tracking stopped, all progress saved"
                : "Tracking stopped, " + failed + " progress record(s) could not be saved"));
    }

    @PostMapping("/start")
    public ResponseEntity<ApiResponse<Void>> start() {
        trackingEngine.startTracking();
        return ResponseEntity.ok(ApiResponse.success("Automatic tracking resumed"));
    }

    @PostMapping("/start-all")
    public ResponseEntity<ApiResponse<Integer>> startAll() {
        int tracked = trackingScheduler.startTrackingAllRoutes(LocalDate.now(clock));
        return ResponseEntity.ok(ApiResponse.success(tracked, tracked + " route(s) tracked for today"));
    }

    @GetMapping("/settings/hours")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> trackingHours() {
        return ResponseEntity.ok(ApiResponse.success(hours(), "Tracking window"));
    }

    @PutMapping("/settings/hours")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> updateTrackingHours(
            @Valid @RequestBody TrackingHoursRequest request) {
        trackingSettings.updateHours(request.getStartHour(), request.getEndHour());
        return ResponseEntity.ok(ApiResponse.success(hours(), "Tracking window updated"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<TrackingStats>> stats() {
        return ResponseEntity.ok(ApiResponse.success(trackingScheduler.getStats(), "Tracking statistics"));
    }

    /** Drops cached registry data after warehouses, vehicles or routes were edited. */
    @PostMapping("/registry/refresh")
    public ResponseEntity<ApiResponse<Void>> refreshRegistry() {
        referenceDataService.evictAll();
        return ResponseEntity.ok(ApiResponse.success("Registry caches cleared"));
    }

    private Map<String, Integer> hours() {
        Map<String, Integer> hours = new LinkedHashMap<>();
        hours.put("startHour", trackingSettings.getStartHour());
        hours.put("endHour", trackingSettings.getEndHour());
        return hours;
    }
}
