package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.config.TrackingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.*;

class TrackingSettingsTest {

    private TrackingSettings settings;

    @BeforeEach
    void setUp() {
        settings = new TrackingSettings(new TrackingProperties(), true);
    }

    @Test
    @DisplayName("Default window 05-23, both hours inclusive")
    void defaultWindow_inclusiveOfEndHour() {
        assertThat(settings.isWithinWindow(LocalTime.of(4, 59))).isFalse();
        assertThat(settings.isWithinWindow(LocalTime.of(5, 0))).isTrue();
        assertThat(settings.isWithinWindow(LocalTime.of(23, 45))).isTrue();
    }

    @Test
    @DisplayName("Updated hours take effect immediately")
    void updateHours_appliesNewWindow() {
        settings.updateHours(8, 18);

        assertThat(settings.getStartHour()).isEqualTo(8);
        assertThat(settings.getEndHour()).isEqualTo(18);
        assertThat(settings.isWithinWindow(LocalTime.of(7, 30))).isFalse();
        assertThat(settings.isWithinWindow(LocalTime.of(18, 30))).isTrue();
        assertThat(settings.isWithinWindow(LocalTime.of(19, 0))).isFalse();
    }

    @Test
    @DisplayName("Start not before end, or hours out of range, are rejected and keep the old window")
    void invalidHours_rejected() {
        assertThatThrownBy(() -> settings.updateHours(18, 8))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settings.updateHours(10, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settings.updateHours(-1, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settings.updateHours(5, 24))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(settings.getStartHour()).isEqualTo(5);
        assertThat(settings.getEndHour()).isEqualTo(23);
    }

    @Test
    @DisplayName("Polling flag can be switched at runtime")
    void pollingFlag_toggles() {
        settings.setPollingEnabled(false);
        assertThat(settings.isPollingEnabled()).isFalse();
        settings.setPollingEnabled(true);
        assertThat(settings.isPollingEnabled()).isTrue();
    }
}
