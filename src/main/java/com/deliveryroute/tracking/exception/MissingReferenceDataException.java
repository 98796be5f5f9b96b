package com.deliveryroute.tracking.exception;

import lombok.Getter;

/**
 * A route, warehouse or vehicle referenced by tracking data is not in the registry.
 * Mapped to 404 at the REST boundary.
 */
@Getter
public class MissingReferenceDataException extends RuntimeException {

    private final String referenceType;

    private final String referenceId;

    public MissingReferenceDataException(String referenceType, String referenceId) {
        super(referenceType + " not found: " + referenceId);
        this.referenceType = referenceType;
        this.referenceId = referenceId;
    }

    public static MissingReferenceDataException route(String routeId) {
        return new MissingReferenceDataException("Route", routeId);
    }

    public static MissingReferenceDataException warehouse(String warehouseId) {
        return new MissingReferenceDataException("Warehouse", warehouseId);
    }

    public static MissingReferenceDataException vehicle(String vehicleId) {
        return new MissingReferenceDataException("Vehicle", vehicleId);
    }
}
