package com.deliveryroute.tracking.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single source of "now" for the tracking subsystem, so tests can pin the clock.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock trackingClock(TrackingProperties properties) {
        return Clock.system(ZoneId.of(properties.getZoneId()));
    }
}
