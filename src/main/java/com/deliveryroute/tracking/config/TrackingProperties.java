package com.deliveryroute.tracking.config;

import com.deliveryroute.tracking.util.GeofenceUtil;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the tracking subsystem, bound from {@code tracking.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "tracking")
public class TrackingProperties {

    /** Time zone the operating day (tracking window, "today", clamp) is evaluated in. */
    private String zoneId = "UTC";

    private double geofenceRadiusMeters = GeofenceUtil.WAREHOUSE_GEOFENCE_RADIUS_METERS;

    /** km/h; below this a vehicle counts as stationary. */
    private double stationarySpeedThreshold = 5.0;

    private double intermediateStopMoveThresholdMeters = 50.0;

    private Window window = new Window();

    private Recalculation recalculation = new Recalculation();

    private Endpoint estimator = new Endpoint();

    private Endpoint gps = new Endpoint();

    @Getter
    @Setter
    public static class Window {
        private int startHour = 5;
        private int endHour = 23;
    }

    @Getter
    @Setter
    public static class Recalculation {
        private int baseDwellMinutes = 30;
        private int fallbackTravelMinutes = 15;
        private int defaultSpeedLimit = 55;
        private int dayStartHour = 7;
        private int dayEndHour = 20;
    }

    @Getter
    @Setter
    public static class Endpoint {
        private String baseUrl;
        private String apiKey;
        private int timeoutSeconds = 10;
    }
}
