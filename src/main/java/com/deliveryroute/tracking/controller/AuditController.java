package com.deliveryroute.tracking.controller;

import com.deliveryroute.tracking.dto.ApiResponse;
import com.deliveryroute.tracking.entity.PositionLog;
import com.deliveryroute.tracking.entity.TrackingEvent;
import com.deliveryroute.tracking.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Audit trail and GPS trail queries.
 *
 *  GET /api/audit/route/{routeId}                     events of a route, oldest first
 *  GET /api/audit/vehicle/{vehicleId}                 events of a vehicle, newest first
 *  GET /api/audit/events?from=...&to=...              events in a time range
 *  GET /api/audit/positions/{vehicleId}?date=...      GPS trail of a vehicle
 *  GET /api/audit/route/{routeId}/positions?date=...  GPS trail of a route
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
@Slf4j
public class AuditController {

    private final AuditService auditService;

    @GetMapping("/route/{routeId}")
    public ResponseEntity<ApiResponse<List<TrackingEvent>>> eventsByRoute(@PathVariable String routeId) {
        List<TrackingEvent> events = auditService.getEventsByRouteId(routeId);
        return ResponseEntity.ok(ApiResponse.success(events,
                "Found " + events.size() + " audit event(s) for route " + routeId));
    }

    @GetMapping("/vehicle/{vehicleId}")
    public ResponseEntity<ApiResponse<List<TrackingEvent>>> eventsByVehicle(@PathVariable String vehicleId) {
        List<TrackingEvent> events = auditService.getEventsByVehicleId(vehicleId);
        return ResponseEntity.ok(ApiResponse.success(events,
                "Found " + events.size() + " audit event(s) for vehicle " + vehicleId));
    }

    @GetMapping("/events")
    public ResponseEntity<ApiResponse<List<TrackingEvent>>> eventsByTimeRange(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        if (from.isAfter(to)) {
            return ResponseEntity.badRequest().body(ApiResponse.error(
                    "'from' must not be after 'to'. Received: from=" + from + ", to=" + to));
        }
        List<TrackingEvent> events = auditService.getEventsByTimeRange(from, to);
        return ResponseEntity.ok(ApiResponse.success(events,
                "Found " + events.size() + " audit event(s) between " + from + " and " + to));
    }

    @GetMapping("/positions/{vehicleId}")
    public ResponseEntity<ApiResponse<List<PositionLog>>> vehiclePositions(
            @PathVariable String vehicleId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        List<PositionLog> positions = auditService.getPositions(vehicleId, date);
        return ResponseEntity.ok(ApiResponse.success(positions,
                "Found " + positions.size() + " position(s) for vehicle " + vehicleId));
    }

    @GetMapping("/route/{routeId}/positions")
    public ResponseEntity<ApiResponse<List<PositionLog>>> routePositions(
            @PathVariable String routeId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        List<PositionLog> positions = auditService.getRoutePositions(routeId, date);
        return ResponseEntity.ok(ApiResponse.success(positions,
                "Found " + positions.size() + " position(s) for route " + routeId + " on " + date));
    }
}
