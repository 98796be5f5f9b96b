package com.deliveryroute.tracking.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine caches for registry data.
 *
 *   warehouses  looked up on every GPS sample (geofence centre) and every cascade leg
 *   vehicles    looked up on every polling cycle (GPS device credentials)
 *   routes      looked up on initialization, manual trigger and cascade
 *
 * Entries expire 30 minutes after write; ReferenceDataService.evictAll() clears them
 * when the registry changes.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String CACHE_WAREHOUSES = "warehouses";

    public static final String CACHE_VEHICLES = "vehicles";

    public static final String CACHE_ROUTES = "routes";

    @Bean
    public CacheManager cacheManager() {
        log.info("[CACHE] Initialising Caffeine CacheManager, caches: '{}', '{}', '{}'",
                CACHE_WAREHOUSES, CACHE_VEHICLES, CACHE_ROUTES);

        SimpleCacheManager manager = new SimpleCacheManager();
        manager.setCaches(List.of(
                buildCache(CACHE_WAREHOUSES, 30, 500),
                buildCache(CACHE_VEHICLES,   30, 200),
                buildCache(CACHE_ROUTES,     30, 500)
        ));
        return manager;
    }

    private CaffeineCache buildCache(String name, int ttlMinutes, int maxSize) {
        return new CaffeineCache(name,
                Caffeine.newBuilder()
                        .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                        .maximumSize(maxSize)
                        .recordStats()
                        .build());
    }
}
