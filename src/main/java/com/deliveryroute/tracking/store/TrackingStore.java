package com.deliveryroute.tracking.store;

import com.deliveryroute.tracking.model.RouteProgress;
import com.deliveryroute.tracking.model.RouteProgressKey;
import com.deliveryroute.tracking.model.ScheduledStop;

import java.util.List;
import java.util.Optional;

/**
 * Key-value persistence of tracking state.
 *
 * Last write wins. Implementations never throw: a failed write returns {@code false}
 * and a failed read returns empty, the in-memory state stays authoritative.
 */
public interface TrackingStore {

    Optional<RouteProgress> loadProgress(RouteProgressKey key);

    boolean saveProgress(RouteProgress progress);

    /** Current schedule of a route, ordered by stop order. Empty when never recalculated. */
    Optional<List<ScheduledStop>> loadSchedule(String routeId);

    boolean saveSchedule(String routeId, List<ScheduledStop> stops);

    static String scheduleKey(String routeId) {
        return "route-schedule:" + routeId;
    }
}
