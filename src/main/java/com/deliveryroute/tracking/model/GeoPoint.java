package com.deliveryroute.tracking.model;

/**
 * A WGS84 coordinate in decimal degrees.
 */
public record GeoPoint(double latitude, double longitude) {
}
