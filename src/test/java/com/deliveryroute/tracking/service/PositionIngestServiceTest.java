package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.model.PositionSample;
import com.deliveryroute.tracking.model.RouteProgress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PositionIngestServiceTest {

    @Mock private TrackingEngine trackingEngine;

    @InjectMocks
    private PositionIngestService positionIngestService;

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 3, 2, 8, 0);

    private static PositionSample sample(String vehicleId, LocalDateTime at) {
        return PositionSample.builder()
                .vehicleId(vehicleId).latitude(40.0).longitude(-83.0).speed(30.0).timestamp(at)
                .build();
    }

    @Test
    @DisplayName("Buffered batch is applied oldest first and counted")
    void batch_appliedInTimestampOrder() {
        PositionSample late = sample("VAN-1", T0.plusMinutes(2));
        PositionSample early = sample("VAN-1", T0);
        PositionSample unknown = sample("VAN-9", T0.plusMinutes(1));
        when(trackingEngine.ingestPosition(late)).thenReturn(new RouteProgress());
        when(trackingEngine.ingestPosition(early)).thenReturn(new RouteProgress());
        when(trackingEngine.ingestPosition(unknown)).thenReturn(null);

        Map<String, Integer> result = positionIngestService.processBatch(List.of(late, early, unknown));

        InOrder order = inOrder(trackingEngine);
        order.verify(trackingEngine).ingestPosition(early);
        order.verify(trackingEngine).ingestPosition(unknown);
        order.verify(trackingEngine).ingestPosition(late);
        assertThat(result).containsEntry("total", 3)
                .containsEntry("processed", 2)
                .containsEntry("ignored", 1)
                .containsEntry("failed", 0);
    }

    @Test
    @DisplayName("A failing sample is counted and the rest of the batch still goes through")
    void batch_failureDoesNotAbort() {
        PositionSample bad = sample("VAN-1", T0);
        PositionSample good = sample("VAN-1", T0.plusMinutes(1));
        when(trackingEngine.ingestPosition(bad)).thenThrow(new IllegalArgumentException("bad sample"));
        when(trackingEngine.ingestPosition(good)).thenReturn(new RouteProgress());

        Map<String, Integer> result = positionIngestService.processBatch(List.of(bad, good));

        assertThat(result).containsEntry("processed", 1).containsEntry("failed", 1);
    }

    @Test
    @DisplayName("Async processing swallows engine errors into the log")
    void async_engineErrorDoesNotFailFuture() {
        PositionSample bad = sample("VAN-1", T0);
        when(trackingEngine.ingestPosition(bad)).thenThrow(new IllegalStateException("boom"));

        assertThat(positionIngestService.processAsync(bad)).isCompleted();
    }
}
