package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.client.GpsPositionProvider;
import com.deliveryroute.tracking.config.TrackingProperties;
import com.deliveryroute.tracking.entity.DeliveryRoute;
import com.deliveryroute.tracking.entity.RouteStop;
import com.deliveryroute.tracking.entity.Vehicle;
import com.deliveryroute.tracking.lookup.RouteLookup;
import com.deliveryroute.tracking.lookup.VehicleLookup;
import com.deliveryroute.tracking.model.PositionSample;
import com.deliveryroute.tracking.model.RouteProgress;
import com.deliveryroute.tracking.store.InMemoryTrackingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TrackingScheduler: window gating, route auto-start and vehicle polling.
 * Polls run on the calling thread.
 */
@ExtendWith(MockitoExtension.class)
class TrackingSchedulerTest {

    @Mock private TrackingEngine      trackingEngine;
    @Mock private RouteLookup         routeLookup;
    @Mock private VehicleLookup       vehicleLookup;
    @Mock private GpsPositionProvider gpsPositionProvider;

    private RouteProgressRegistry registry;
    private TrackingSettings settings;

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 2);

    @BeforeEach
    void setUp() {
        registry = new RouteProgressRegistry(new InMemoryTrackingStore());
        settings = new TrackingSettings(new TrackingProperties(), true);
    }

    // ── Helper builders ───────────────────────────────────────────────────────

    private TrackingScheduler schedulerAt(String instant) {
        Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
        TrackingScheduler scheduler = new TrackingScheduler(trackingEngine, registry, routeLookup, vehicleLookup,
                gpsPositionProvider, settings, new KeyedSerialExecutor(Runnable::run), Runnable::run, clock);
        ReflectionTestUtils.setField(scheduler, "autoStartRoutes", true);
        return scheduler;
    }

    private static DeliveryRoute route(String id, DayOfWeek weekday, String vehicleId) {
        DeliveryRoute route = DeliveryRoute.builder()
                .id(id).name(id).driverId("DRV-" + id).vehicleId(vehicleId).weekday(weekday)
                .build();
        route.getStops().add(RouteStop.builder().id(id + "-0").route(route).warehouseId("WH-A").stopOrder(0).build());
        return route;
    }

    private void trackVehicle(String vehicleId) {
        RouteProgress progress = RouteProgress.builder()
                .routeId("RT-" + vehicleId).driverId("DRV-1").vehicleId(vehicleId).date(TODAY)
                .build();
        registry.withLock(progress.getKey(), () -> {
            registry.register(progress);
            return null;
        });
    }

    // ════════════════════════════════════════════════════════════════════════
    // Tests
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Only active routes scheduled today with a driver, vehicle and stops are started")
    void startTrackingAllRoutes_filtersRoutes() {
        DeliveryRoute monday = route("RT-MON", DayOfWeek.MONDAY, "VAN-1");
        DeliveryRoute tuesday = route("RT-TUE", DayOfWeek.TUESDAY, "VAN-2");
        DeliveryRoute noVehicle = route("RT-NOVAN", null, null);
        when(routeLookup.findActiveRoutes()).thenReturn(List.of(monday, tuesday, noVehicle));

        int tracked = schedulerAt("2026-03-02T08:00:00Z").startTrackingAllRoutes(TODAY);

        assertThat(tracked).isEqualTo(1);
        verify(trackingEngine).initializeTracking(monday, "DRV-RT-MON", "VAN-1", TODAY);
        verifyNoMoreInteractions(trackingEngine);
    }

    @Test
    @DisplayName("A route that fails to start does not stop the others")
    void startTrackingAllRoutes_continuesAfterFailure() {
        DeliveryRoute broken = route("RT-1", null, "VAN-1");
        DeliveryRoute fine = route("RT-2", null, "VAN-2");
        when(routeLookup.findActiveRoutes()).thenReturn(List.of(broken, fine));
        lenient().when(trackingEngine.initializeTracking(eq(broken), any(), any(), any()))
                .thenThrow(new IllegalStateException("store down"));

        int tracked = schedulerAt("2026-03-02T08:00:00Z").startTrackingAllRoutes(TODAY);

        assertThat(tracked).isEqualTo(1);
        verify(trackingEngine).initializeTracking(fine, "DRV-RT-2", "VAN-2", TODAY);
    }

    @Test
    @DisplayName("Poll cycle inside the window feeds each tracked vehicle's latest fix to the engine")
    void pollCycle_insideWindow_ingestsPositions() {
        when(routeLookup.findActiveRoutes()).thenReturn(List.of());
        trackVehicle("VAN-1");
        Vehicle vehicle = Vehicle.builder().id("VAN-1").name("Van").gpsDeviceId("DEV-1").build();
        PositionSample sample = PositionSample.builder()
                .vehicleId("VAN-1").latitude(40.0).longitude(-83.0).speed(20.0)
                .timestamp(LocalDateTime.of(2026, 3, 2, 8, 0))
                .build();
        when(vehicleLookup.findVehicle("VAN-1")).thenReturn(Optional.of(vehicle));
        when(gpsPositionProvider.fetchLatestPosition(vehicle)).thenReturn(Optional.of(sample));

        TrackingScheduler scheduler = schedulerAt("2026-03-02T08:00:00Z");
        scheduler.pollCycle();

        verify(trackingEngine).ingestPosition(sample);
        assertThat(scheduler.getStats().lastPollAt()).isEqualTo(LocalDateTime.of(2026, 3, 2, 8, 0));
        assertThat(scheduler.getStats().vehiclesPolling()).isZero();
    }

    @Test
    @DisplayName("Poll cycle outside the window or with polling disabled does nothing")
    void pollCycle_outsideWindowOrDisabled_noop() {
        trackVehicle("VAN-1");

        schedulerAt("2026-03-02T04:30:00Z").pollCycle();
        settings.setPollingEnabled(false);
        schedulerAt("2026-03-02T08:00:00Z").pollCycle();

        verifyNoInteractions(routeLookup, vehicleLookup, gpsPositionProvider, trackingEngine);
    }

    @Test
    @DisplayName("GPS provider failure is contained to that vehicle")
    void pollVehicle_providerFailure_contained() {
        Vehicle vehicle = Vehicle.builder().id("VAN-1").name("Van").gpsDeviceId("DEV-1").build();
        when(vehicleLookup.findVehicle("VAN-1")).thenReturn(Optional.of(vehicle));
        when(gpsPositionProvider.fetchLatestPosition(vehicle)).thenThrow(new IllegalStateException("boom"));

        TrackingScheduler scheduler = schedulerAt("2026-03-02T08:00:00Z");
        assertThatCode(() -> scheduler.pollVehicle("VAN-1")).doesNotThrowAnyException();

        verify(trackingEngine, never()).ingestPosition(any(PositionSample.class));
        assertThat(scheduler.getStats().vehiclesPolling()).isZero();
    }

    @Test
    @DisplayName("Stats report the window, the polling flag and tracked vehicles")
    void stats_reportSettings() {
        trackVehicle("VAN-1");
        trackVehicle("VAN-2");

        TrackingStats stats = schedulerAt("2026-03-02T23:30:00Z").getStats();

        assertThat(stats.trackedVehicles()).isEqualTo(2);
        assertThat(stats.activeRoutes()).isEqualTo(2);
        assertThat(stats.withinTrackingWindow()).isTrue();
        assertThat(stats.windowStartHour()).isEqualTo(5);
        assertThat(stats.windowEndHour()).isEqualTo(23);
        assertThat(stats.pollingEnabled()).isTrue();
        assertThat(stats.lastPollAt()).isNull();
    }
}
