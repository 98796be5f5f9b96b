package com.deliveryroute.tracking.service;

import com.deliveryroute.tracking.entity.PositionLog;
import com.deliveryroute.tracking.entity.TrackingEvent;
import com.deliveryroute.tracking.entity.TrackingEventType;
import com.deliveryroute.tracking.repository.PositionLogRepository;
import com.deliveryroute.tracking.repository.TrackingEventRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    @Mock private TrackingEventRepository trackingEventRepository;
    @Mock private PositionLogRepository   positionLogRepository;

    @InjectMocks
    private AuditService auditService;

    private static final LocalDate DATE = LocalDate.of(2026, 3, 2);

    @Test
    @DisplayName("Audit write failure is logged, never propagated to tracking")
    void recordEvent_failureSwallowed() {
        when(trackingEventRepository.save(any())).thenThrow(new IllegalStateException("db down"));
        TrackingEvent event = TrackingEvent.builder()
                .routeId("RT-1").eventType(TrackingEventType.STOP_ARRIVED).eventTime(DATE.atTime(8, 0))
                .build();

        assertThatCode(() -> auditService.recordEvent(event)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Inverted time range is rejected before querying")
    void timeRange_inverted_rejected() {
        LocalDateTime from = DATE.atTime(10, 0);
        LocalDateTime to = DATE.atTime(9, 0);

        assertThatThrownBy(() -> auditService.getEventsByTimeRange(from, to))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(trackingEventRepository);
    }

    @Test
    @DisplayName("Positions of a day span midnight to end of day; without a date the latest 500")
    void positions_dayRangeOrLatest() {
        PositionLog log = PositionLog.builder().vehicleId("VAN-1").timestamp(DATE.atTime(8, 0)).build();
        when(positionLogRepository.findByVehicleIdAndTimestampBetweenOrderByTimestampAsc(
                "VAN-1", DATE.atStartOfDay(), DATE.atTime(LocalTime.MAX))).thenReturn(List.of(log));

        assertThat(auditService.getPositions("VAN-1", DATE)).containsExactly(log);

        auditService.getPositions("VAN-1", null);
        verify(positionLogRepository).findTop500ByVehicleIdOrderByTimestampDesc("VAN-1");
    }
}
