package com.deliveryroute.tracking.event;

import com.deliveryroute.tracking.model.RouteProgress;

/**
 * A tracked route changed state. Carries a detached snapshot.
 */
public record RouteProgressChanged(RouteProgress progress, String change) {
}
