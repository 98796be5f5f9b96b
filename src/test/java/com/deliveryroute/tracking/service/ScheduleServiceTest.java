package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.config.TrackingProperties;
import com.deliveryroute.tracking.entity.DeliveryRoute;
import com.deliveryroute.tracking.entity.RouteStop;
import com.deliveryroute.tracking.exception.MissingReferenceDataException;
import com.deliveryroute.tracking.lookup.RouteLookup;
import com.deliveryroute.tracking.model.ScheduledStop;
import com.deliveryroute.tracking.store.InMemoryTrackingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScheduleServiceTest {

    @Mock private RouteLookup routeLookup;

    private InMemoryTrackingStore store;
    private ScheduleService scheduleService;

    @BeforeEach
    void setUp() {
        store = new InMemoryTrackingStore();
        scheduleService = new ScheduleService(store, routeLookup, new TrackingProperties());
    }

    private static DeliveryRoute route() {
        DeliveryRoute route = DeliveryRoute.builder().id("RT-1").name("R").build();
        route.getStops().add(RouteStop.builder().id("S1").route(route).warehouseId("WH-B").stopOrder(1)
                .arrivalTime(LocalTime.of(8, 40)).hasLunchBreak(true).lunchDurationMinutes(45).build());
        route.getStops().add(RouteStop.builder().id("S0").route(route).warehouseId("WH-A").stopOrder(0)
                .departureTime(LocalTime.of(8, 0)).build());
        return route;
    }

    @Test
    @DisplayName("Never recalculated → schedule comes from the route definition, ordered by stop order")
    void noStoredSchedule_usesDefinition() {
        when(routeLookup.findRoute("RT-1")).thenReturn(Optional.of(route()));

        List<ScheduledStop> stops = scheduleService.currentSchedule("RT-1");

        assertThat(stops).extracting(ScheduledStop::getStopId).containsExactly("S0", "S1");
        assertThat(stops.get(1).getPlannedArrival()).isEqualTo(LocalTime.of(8, 40));
    }

    @Test
    @DisplayName("Stored schedule wins over the definition")
    void storedSchedule_wins() {
        store.saveSchedule("RT-1", List.of(ScheduledStop.builder().stopId("S0").order(0)
                .plannedDeparture(LocalTime.of(8, 20)).build()));

        List<ScheduledStop> stops = scheduleService.currentSchedule("RT-1");

        assertThat(stops).hasSize(1);
        assertThat(stops.get(0).getPlannedDeparture()).isEqualTo(LocalTime.of(8, 20));
        verifyNoInteractions(routeLookup);
    }

    @Test
    @DisplayName("Unknown route without stored schedule → MissingReferenceDataException")
    void unknownRoute_throws() {
        when(routeLookup.findRoute("NOPE")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> scheduleService.currentSchedule("NOPE"))
                .isInstanceOf(MissingReferenceDataException.class);
    }

    @Test
    @DisplayName("Dwell is 30 min, plus the lunch break where one is planned")
    void dwellMinutes_includesLunch() {
        ScheduledStop plain = ScheduledStop.builder().stopId("S0").build();
        ScheduledStop lunch = ScheduledStop.builder().stopId("S1").hasLunchBreak(true).lunchDurationMinutes(45).build();
        ScheduledStop flagOnly = ScheduledStop.builder().stopId("S2").hasLunchBreak(true).build();

        assertThat(scheduleService.dwellMinutes(plain)).isEqualTo(30);
        assertThat(scheduleService.dwellMinutes(lunch)).isEqualTo(75);
        assertThat(scheduleService.dwellMinutes(flagOnly)).isEqualTo(30);
    }
}
