package com.deliveryroute.tracking.controller;

import com.deliveryroute.tracking.config.TrackingProperties;
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
import com.deliveryroute.tracking.model.TriggerAction;
import com.deliveryroute.tracking.service.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TrackingController: request mapping onto the services and the
 * status codes of the non-happy paths.
 */
@ExtendWith(MockitoExtension.class)
class TrackingControllerTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private TrackingEngine        trackingEngine;
    @Mock private ManualTriggerService  manualTriggerService;
    @Mock private PositionIngestService positionIngestService;
    @Mock private ScheduleService       scheduleService;
    @Mock private TrackingScheduler     trackingScheduler;
    @Mock private ReferenceDataService  referenceDataService;
    @Mock private RouteLookup           routeLookup;

    private TrackingSettings trackingSettings;
    private TrackingController trackingController;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 2);

    @BeforeEach
    void setUp() {
        trackingSettings = new TrackingSettings(new TrackingProperties(), true);
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);
        trackingController = new TrackingController(trackingEngine, manualTriggerService, positionIngestService,
                scheduleService, trackingScheduler, trackingSettings, referenceDataService, routeLookup, clock);
        ReflectionTestUtils.setField(trackingController, "maxBatchSize", 3);
    }

    private static PositionUpdateRequest positionRequest(String vehicleId) {
        return PositionUpdateRequest.builder()
                .vehicleId(vehicleId)
                .position(new PositionUpdateRequest.Position(39.96, -82.99, 25.0))
                .timestamp(LocalDateTime.of(2026, 3, 2, 8, 30))
                .build();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Initialization
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Initialize without driver/vehicle uses the route's assignment for today")
    void initialize_defaultsToRouteAssignment() {
        DeliveryRoute route = DeliveryRoute.builder().id("RT-1").name("R").driverId("DRV-1").vehicleId("VAN-1").build();
        when(routeLookup.findRoute("RT-1")).thenReturn(Optional.of(route));
        RouteProgress progress = RouteProgress.builder().routeId("RT-1").build();
        when(trackingEngine.initializeTracking(route, "DRV-1", "VAN-1", TODAY)).thenReturn(progress);

        ResponseEntity<ApiResponse<RouteProgress>> response = trackingController.initialize(
                InitializeTrackingRequest.builder().routeId("RT-1").build());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getData()).isSameAs(progress);
    }

    @Test
    @DisplayName("Initialize with an unknown route → MissingReferenceDataException (404 via handler)")
    void initialize_unknownRoute_throws() {
        when(routeLookup.findRoute("NOPE")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> trackingController.initialize(
                InitializeTrackingRequest.builder().routeId("NOPE").build()))
                .isInstanceOf(MissingReferenceDataException.class);
        verifyNoInteractions(trackingEngine);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Positions
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Position for a vehicle without an active route → success=false, 200")
    void position_noActiveRoute_reportedNotFailed() {
        when(trackingEngine.ingestPosition(any(PositionSample.class))).thenReturn(null);

        ResponseEntity<ApiResponse<RouteProgress>> response = trackingController.ingestPosition(positionRequest("VAN-9"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().isSuccess()).isFalse();
        assertThat(response.getBody().getMessage()).contains("No active route");
    }

    @Test
    @DisplayName("Position request is mapped onto a sample with the nested fix")
    void position_mappedToSample() {
        when(trackingEngine.ingestPosition(any(PositionSample.class))).thenReturn(new RouteProgress());

        trackingController.ingestPosition(positionRequest("VAN-1"));

        ArgumentCaptor<PositionSample> captor = ArgumentCaptor.forClass(PositionSample.class);
        verify(trackingEngine).ingestPosition(captor.capture());
        assertThat(captor.getValue().getVehicleId()).isEqualTo("VAN-1");
        assertThat(captor.getValue().getLatitude()).isEqualTo(39.96);
        assertThat(captor.getValue().getSpeed()).isEqualTo(25.0);
    }

    @Test
    @DisplayName("Empty batch → 400, oversized batch → 413, neither reaches the engine")
    void batch_guards() {
        assertThat(trackingController.ingestBatch(List.of()).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);

        List<PositionUpdateRequest> tooMany = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            tooMany.add(positionRequest("VAN-1"));
        }
        assertThat(trackingController.ingestBatch(tooMany).getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
        verifyNoInteractions(positionIngestService);
    }

    @Test
    @DisplayName("Async position is accepted with 202")
    void asyncPosition_accepted() {
        ResponseEntity<ApiResponse<Void>> response = trackingController.ingestPositionAsync(positionRequest("VAN-1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        verify(positionIngestService).processAsync(any(PositionSample.class));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Manual trigger, progress, settings
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Rejected trigger → 400 with the reason")
    void trigger_rejected_badRequest() {
        when(manualTriggerService.trigger("RT-1"))
                .thenReturn(TriggerResult.rejected("Route RT-1 is already completed"));

        ResponseEntity<ApiResponse<TriggerResult>> response = trackingController.trigger("RT-1");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getMessage()).isEqualTo("Route RT-1 is already completed");
    }

    @Test
    @DisplayName("Successful trigger → 200 with the fixed action")
    void trigger_success_ok() {
        TriggerResult result = new TriggerResult(true, TriggerAction.DEPARTURE, 0, "S0",
                LocalDateTime.of(2026, 3, 2, 9, 0), "Fix departure from stop 1 fixed at 09:00", null);
        when(manualTriggerService.trigger("RT-1")).thenReturn(result);

        ResponseEntity<ApiResponse<TriggerResult>> response = trackingController.trigger("RT-1");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getData().action()).isEqualTo(TriggerAction.DEPARTURE);
    }

    @Test
    @DisplayName("Unknown progress record → TrackingNotFoundException (404 via handler)")
    void progress_unknown_throws() {
        when(trackingEngine.getProgress("RT-1", "DRV-1", TODAY)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> trackingController.progress("RT-1", "DRV-1", TODAY))
                .isInstanceOf(TrackingNotFoundException.class);
    }

    @Test
    @DisplayName("Tracking hours update is applied and echoed back")
    void updateHours_appliedAndEchoed() {
        ResponseEntity<ApiResponse<Map<String, Integer>>> response =
                trackingController.updateTrackingHours(new TrackingHoursRequest(6, 21));

        assertThat(response.getBody().getData()).containsEntry("startHour", 6).containsEntry("endHour", 21);
        assertThat(trackingSettings.getStartHour()).isEqualTo(6);
    }

    @Test
    @DisplayName("Stop-all pauses polling and reports failed writes")
    void stopAll_reportsFailedWrites() {
        when(trackingEngine.stopAllTracking()).thenReturn(2);

        ResponseEntity<ApiResponse<Void>> response = trackingController.stopAll();

        assertThat(response.getBody().getMessage()).contains("2 progress record(s) could not be saved");
    }

    @Test
    @DisplayName("Registry refresh clears the reference-data caches")
    void registryRefresh_evictsCaches() {
        trackingController.refreshRegistry();

        verify(referenceDataService).evictAll();
    }
}
