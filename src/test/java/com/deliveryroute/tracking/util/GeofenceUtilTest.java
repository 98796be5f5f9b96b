package com.deliveryroute.tracking.util;

import com.deliveryroute.tracking.model.GeoPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GeofenceUtilTest {

    private static final GeoPoint DEPOT = new GeoPoint(39.9612, -82.9988);

    @Test
    @DisplayName("Distance of a point to itself is zero")
    void samePoint_zeroDistance() {
        assertThat(GeofenceUtil.distanceMeters(DEPOT, DEPOT)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("One degree of latitude is about 111.2 km")
    void oneDegreeLatitude() {
        GeoPoint north = new GeoPoint(DEPOT.latitude() + 1.0, DEPOT.longitude());

        assertThat(GeofenceUtil.distanceMeters(DEPOT, north)).isCloseTo(111_195.0, within(1.0));
    }

    @Test
    @DisplayName("Point ~150 m from the warehouse is inside the 0.1 mile geofence, ~172 m is outside")
    void geofenceBoundary() {
        GeoPoint near = new GeoPoint(DEPOT.latitude() + 0.00135, DEPOT.longitude());
        GeoPoint far = new GeoPoint(DEPOT.latitude() + 0.00155, DEPOT.longitude());

        assertThat(GeofenceUtil.isWithinGeofence(near, DEPOT, GeofenceUtil.WAREHOUSE_GEOFENCE_RADIUS_METERS)).isTrue();
        assertThat(GeofenceUtil.isWithinGeofence(far, DEPOT, GeofenceUtil.WAREHOUSE_GEOFENCE_RADIUS_METERS)).isFalse();
    }
}
