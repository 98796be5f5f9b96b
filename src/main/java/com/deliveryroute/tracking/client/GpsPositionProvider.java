package com.deliveryroute.tracking.client;

import com.deliveryroute.tracking.entity.Vehicle;
import com.deliveryroute.tracking.model.PositionSample;

import java.util.Optional;

/**
 * Device-tracking API: latest fix of a vehicle's GPS unit.
 */
public interface GpsPositionProvider {

    /** Empty when the device has no fix or the provider could not be reached. */
    Optional<PositionSample> fetchLatestPosition(Vehicle vehicle);
}
