package com.deliveryroute.tracking.lookup;

import com.deliveryroute.tracking.entity.Vehicle;

import java.util.Optional;

/** Read-only access to the vehicle registry. */
public interface VehicleLookup {

    Optional<Vehicle> findVehicle(String vehicleId);
}
