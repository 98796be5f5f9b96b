package com.deliveryroute.tracking.lookup;

import com.deliveryroute.tracking.entity.Warehouse;

import java.util.Optional;

/** Read-only access to the warehouse registry. */
public interface WarehouseLookup {

    Optional<Warehouse> findWarehouse(String warehouseId);
}
