package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.config.TrackingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalTime;

/**
 * Runtime switches of automatic tracking: the daily polling window and the polling flag.
 * Starts from configuration, adjustable through the settings API.
 */
@Component
@Slf4j
public class TrackingSettings {

    private volatile int startHour;
    private volatile int endHour;
    private volatile boolean pollingEnabled;

    public TrackingSettings(TrackingProperties properties,
                            @Value("${tracking.polling.enabled:true}") boolean pollingEnabled) {
        validateHours(properties.getWindow().getStartHour(), properties.getWindow().getEndHour());
        this.startHour = properties.getWindow().getStartHour();
        this.endHour = properties.getWindow().getEndHour();
        this.pollingEnabled = pollingEnabled;
    }

    public int getStartHour() {
        return startHour;
    }

    public int getEndHour() {
        return endHour;
    }

    public boolean isPollingEnabled() {
        return pollingEnabled;
    }

    public void setPollingEnabled(boolean pollingEnabled) {
        this.pollingEnabled = pollingEnabled;
        log.info("SETTINGS: automatic polling {}", pollingEnabled ? "enabled" : "disabled");
    }

    /**
     * @throws IllegalArgumentException when an hour is outside 0-23 or start is not before end
     */
    public synchronized void updateHours(int newStartHour, int newEndHour) {
        validateHours(newStartHour, newEndHour);
        this.startHour = newStartHour;
        this.endHour = newEndHour;
        log.info("SETTINGS: tracking window set to {}:00-{}:59", newStartHour, newEndHour);
    }

    /** True when {@code time} falls inside the window; the end hour is inclusive. */
    public boolean isWithinWindow(LocalTime time) {
        int hour = time.getHour();
        return hour >= startHour && hour <= endHour;
    }

    private static void validateHours(int start, int end) {
        if (start < 0 || start > 23 || end < 0 || end > 23) {
            throw new IllegalArgumentException("Tracking hours must be between 0 and 23");
        }
        if (start >= end) {
            throw new IllegalArgumentException("Tracking start hour must be before end hour");
        }
    }
}
