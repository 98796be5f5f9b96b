package com.deliveryroute.tracking.client;

import java.io.IOException;

/**
 * Traffic-aware routing service.
 */
public interface TravelTimeClient {

    /**
     * @throws IOException on transport failure, timeout or a non-2xx answer
     */
    TravelTimeResponse estimate(TravelTimeRequest request) throws IOException, InterruptedException;
}
