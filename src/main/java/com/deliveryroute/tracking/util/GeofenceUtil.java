package com.deliveryroute.tracking.util;

import com.deliveryroute.tracking.model.GeoPoint;

/**
 * Utility class for geofence calculations.
 *
 * Warehouse geofences are circles: a Haversine distance check against the
 * warehouse coordinates and a fixed radius.
 */
public final class GeofenceUtil {

    // Earth's radius in meters
    private static final double EARTH_RADIUS_METERS = 6371000;

    /** 0.1 mile */
    public static final double WAREHOUSE_GEOFENCE_RADIUS_METERS = 160.934;

    private GeofenceUtil() {
    }

    /**
     * Great-circle distance between two GPS coordinates using the Haversine formula.
     *
     * @return distance in meters
     */
    public static double distanceMeters(GeoPoint from, GeoPoint to) {
        double lat1Rad = Math.toRadians(from.latitude());
        double lat2Rad = Math.toRadians(to.latitude());
        double deltaLat = lat2Rad - lat1Rad;
        double deltaLon = Math.toRadians(to.longitude() - from.longitude());

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2) +
                   Math.cos(lat1Rad) * Math.cos(lat2Rad) *
                   Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Check if a point is within a circular geofence. The boundary counts as inside.
     *
     * @param point        position to check
     * @param center       geofence centre
     * @param radiusMeters geofence radius in meters
     */
    public static boolean isWithinGeofence(GeoPoint point, GeoPoint center, double radiusMeters) {
        return distanceMeters(point, center) <= radiusMeters;
    }
}
