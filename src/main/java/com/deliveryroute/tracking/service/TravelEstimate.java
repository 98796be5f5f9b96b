package com.deliveryroute.tracking.service;

/**
 * Travel time of one leg in whole minutes.
 *
 * @param fallback true when the routing service gave no usable answer and the fixed
 *                 fallback duration was substituted
 */
public record TravelEstimate(int minutes, boolean fallback) {
}
