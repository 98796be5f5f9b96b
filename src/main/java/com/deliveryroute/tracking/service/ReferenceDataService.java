package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.config.CacheConfig;
import com.deliveryroute.tracking.entity.DeliveryRoute;
import com.deliveryroute.tracking.entity.Vehicle;
import com.deliveryroute.tracking.entity.Warehouse;
import com.deliveryroute.tracking.lookup.RouteLookup;
import com.deliveryroute.tracking.lookup.VehicleLookup;
import com.deliveryroute.tracking.lookup.WarehouseLookup;
import com.deliveryroute.tracking.repository.DeliveryRouteRepository;
import com.deliveryroute.tracking.repository.VehicleRepository;
import com.deliveryroute.tracking.repository.WarehouseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.cache.annotation.Caching;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Registry lookups backed by JPA, fronted by the Caffeine caches.
 *
 * Kept in its own bean so every call goes through the cache proxy
 * (self-invocation would skip {@code @Cacheable}).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferenceDataService implements WarehouseLookup, VehicleLookup, RouteLookup {

    private final WarehouseRepository warehouseRepository;
    private final VehicleRepository vehicleRepository;
    private final DeliveryRouteRepository routeRepository;

    @Override
    @Cacheable(value = CacheConfig.CACHE_WAREHOUSES, unless = "#result == null")
    @Transactional(readOnly = true)
    public Optional<Warehouse> findWarehouse(String warehouseId) {
        log.debug("[CACHE MISS] warehouse {}, loading from DB", warehouseId);
        return warehouseRepository.findById(warehouseId);
    }

    @Override
    @Cacheable(value = CacheConfig.CACHE_VEHICLES, unless = "#result == null")
    @Transactional(readOnly = true)
    public Optional<Vehicle> findVehicle(String vehicleId) {
        log.debug("[CACHE MISS] vehicle {}, loading from DB", vehicleId);
        return vehicleRepository.findById(vehicleId);
    }

    @Override
    @Cacheable(value = CacheConfig.CACHE_ROUTES, unless = "#result == null")
    @Transactional(readOnly = true)
    public Optional<DeliveryRoute> findRoute(String routeId) {
        log.debug("[CACHE MISS] route {}, loading from DB", routeId);
        return routeRepository.findById(routeId);
    }

    @Override
    @Cacheable(value = CacheConfig.CACHE_ROUTES, key = "'active-routes'")
    @Transactional(readOnly = true)
    public List<DeliveryRoute> findActiveRoutes() {
        log.debug("[CACHE MISS] active routes, loading from DB");
        return routeRepository.findByActiveTrue();
    }

    @Caching(evict = {
            @CacheEvict(value = CacheConfig.CACHE_WAREHOUSES, allEntries = true),
            @CacheEvict(value = CacheConfig.CACHE_VEHICLES,   allEntries = true),
            @CacheEvict(value = CacheConfig.CACHE_ROUTES,     allEntries = true)
    })
    public void evictAll() {
        log.info("[CACHE EVICT] Registry caches cleared, next lookup reloads from DB");
    }
}
