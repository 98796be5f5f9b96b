package com.deliveryroute.tracking.config;

import com.deliveryroute.tracking.entity.DeliveryRoute;
import com.deliveryroute.tracking.entity.RouteStop;
import com.deliveryroute.tracking.entity.Vehicle;
import com.deliveryroute.tracking.entity.Warehouse;
import com.deliveryroute.tracking.model.TrafficScenario;
import com.deliveryroute.tracking.repository.DeliveryRouteRepository;
import com.deliveryroute.tracking.repository.VehicleRepository;
import com.deliveryroute.tracking.repository.WarehouseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * Seeds a small registry on startup so the tracking endpoints can be tried
 * against an empty database. Disabled with {@code tracking.seed-data=false}.
 */
@Component
@ConditionalOnProperty(name = "tracking.seed-data", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DataLoader implements CommandLineRunner {

    private final WarehouseRepository warehouseRepository;
    private final VehicleRepository vehicleRepository;
    private final DeliveryRouteRepository routeRepository;

    @Override
    public void run(String... args) {
        if (routeRepository.count() > 0) {
            log.info("Registry already populated, skipping seed data");
            return;
        }

        warehouseRepository.save(warehouse("WH-DEPOT", "Central Depot",
                "1200 Industrial Pkwy, Columbus, OH", 39.9612, -82.9988, TrafficScenario.BEST_GUESS));
        warehouseRepository.save(warehouse("WH-NORTH", "North Distribution",
                "455 Polaris Pkwy, Westerville, OH", 40.1451, -82.9816, TrafficScenario.PESSIMISTIC));
        warehouseRepository.save(warehouse("WH-EAST", "East Cross-Dock",
                "8800 E Broad St, Reynoldsburg, OH", 39.9701, -82.8121, TrafficScenario.OPTIMISTIC));
        log.info("Seeded {} warehouses", warehouseRepository.count());

        vehicleRepository.save(Vehicle.builder()
                .id("VAN-101").name("Box truck 101")
                .gpsDeviceId("DEV-7781").speedLimitMph(55).assignedDriverId("DRV-ALVAREZ")
                .build());
        vehicleRepository.save(Vehicle.builder()
                .id("VAN-202").name("Sprinter 202")
                .gpsDeviceId("DEV-7790").speedLimitMph(65).assignedDriverId("DRV-OKAFOR")
                .build());
        log.info("Seeded {} vehicles", vehicleRepository.count());

        DeliveryRoute daily = DeliveryRoute.builder()
                .id("RT-NORTH-LOOP").name("North loop")
                .driverId("DRV-ALVAREZ").vehicleId("VAN-101")
                .build();
        addStop(daily, "WH-DEPOT", 0, null, LocalTime.of(8, 0), false, null);
        addStop(daily, "WH-NORTH", 1, LocalTime.of(8, 40), LocalTime.of(10, 10), true, 60);
        addStop(daily, "WH-DEPOT", 2, LocalTime.of(10, 50), null, false, null);
        routeRepository.save(daily);

        DeliveryRoute weekly = DeliveryRoute.builder()
                .id("RT-EAST-MON").name("East Monday run")
                .weekday(DayOfWeek.MONDAY)
                .driverId("DRV-OKAFOR").vehicleId("VAN-202")
                .vehicleSpeedLimit(60)
                .build();
        addStop(weekly, "WH-DEPOT", 0, null, LocalTime.of(9, 0), false, null);
        addStop(weekly, "WH-EAST", 1, LocalTime.of(9, 30), LocalTime.of(10, 0), false, null);
        addStop(weekly, "WH-NORTH", 2, LocalTime.of(10, 45), LocalTime.of(11, 15), false, null);
        routeRepository.save(weekly);
        log.info("Seeded {} routes", routeRepository.count());
    }

    private static Warehouse warehouse(String id, String name, String address,
                                       double lat, double lng, TrafficScenario scenario) {
        return Warehouse.builder()
                .id(id).name(name).fullAddress(address)
                .latitude(lat).longitude(lng)
                .trafficScenario(scenario)
                .build();
    }

    private static void addStop(DeliveryRoute route, String warehouseId, int order,
                                LocalTime arrival, LocalTime departure,
                                boolean lunch, Integer lunchMinutes) {
        route.getStops().add(RouteStop.builder()
                .id(route.getId() + "-" + order)
                .route(route)
                .warehouseId(warehouseId)
                .stopOrder(order)
                .arrivalTime(arrival)
                .departureTime(departure)
                .hasLunchBreak(lunch)
                .lunchDurationMinutes(lunchMinutes)
                .build());
    }
}
