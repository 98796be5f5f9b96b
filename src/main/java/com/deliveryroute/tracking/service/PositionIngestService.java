package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.model.PositionSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Pushed positions: single samples in the background, and buffered batches from
 * devices that were offline.
 *
 * Separate bean from TrackingEngine so {@code @Async} goes through the Spring proxy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PositionIngestService {

    private final TrackingEngine trackingEngine;

    @Async("positionIngestExecutor")
    public CompletableFuture<Void> processAsync(PositionSample sample) {
        try {
            trackingEngine.ingestPosition(sample);
        } catch (Exception e) {
            log.error("Async position processing failed, vehicle: {}, ts: {}: {}",
                    sample.getVehicleId(), sample.getTimestamp(), e.getMessage());
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Applies buffered samples oldest first. A failing sample is logged and skipped,
     * the rest of the batch still goes through.
     *
     * @return counts: total, processed, ignored (no active route), failed
     */
    public Map<String, Integer> processBatch(List<PositionSample> samples) {
        log.info("Batch of {} buffered position(s) received", samples.size());

        List<PositionSample> sorted = samples.stream()
                .sorted(Comparator.comparing(PositionSample::getTimestamp,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();

        int processed = 0;
        int ignored = 0;
        int failed = 0;
        for (PositionSample sample : sorted) {
            try {
                if (trackingEngine.ingestPosition(sample) != null) {
                    processed++;
                } else {
                    ignored++;
                }
            } catch (Exception e) {
                log.error("Batch position failed, vehicle: {}, ts: {}: {}",
                        sample.getVehicleId(), sample.getTimestamp(), e.getMessage());
                failed++;
            }
        }

        log.info("Batch complete, total: {}, processed: {}, ignored: {}, failed: {}",
                samples.size(), processed, ignored, failed);
        Map<String, Integer> result = new LinkedHashMap<>();
        result.put("total", samples.size());
        result.put("processed", processed);
        result.put("ignored", ignored);
        result.put("failed", failed);
        return result;
    }
}
