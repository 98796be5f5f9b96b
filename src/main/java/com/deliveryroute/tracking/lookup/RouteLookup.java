package com.deliveryroute.tracking.lookup;

import com.deliveryroute.tracking.entity.DeliveryRoute;

import java.util.List;
import java.util.Optional;

/** Read-only access to the route registry. */
public interface RouteLookup {

    Optional<DeliveryRoute> findRoute(String routeId);

    List<DeliveryRoute> findActiveRoutes();
}
