package com.deliveryroute.tracking.controller;

import com.deliveryroute.tracking.dto.ApiResponse;
import com.deliveryroute.tracking.entity.TrackingEvent;
import com.deliveryroute.tracking.entity.TrackingEventType;
import com.deliveryroute.tracking.service.AuditService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditControllerTest {

    @Mock private AuditService auditService;

    @InjectMocks
    private AuditController auditController;

    @Test
    @DisplayName("Route audit trail is returned with its count")
    void routeTrail_returned() {
        TrackingEvent arrived = TrackingEvent.builder()
                .routeId("RT-1").eventType(TrackingEventType.STOP_ARRIVED)
                .eventTime(LocalDateTime.of(2026, 3, 2, 8, 40))
                .build();
        when(auditService.getEventsByRouteId("RT-1")).thenReturn(List.of(arrived));

        ResponseEntity<ApiResponse<List<TrackingEvent>>> response = auditController.eventsByRoute("RT-1");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getData()).containsExactly(arrived);
        assertThat(response.getBody().getMessage()).contains("1 audit event(s)");
    }

    @Test
    @DisplayName("'from' after 'to' → 400 without querying")
    void invertedRange_badRequest() {
        ResponseEntity<ApiResponse<List<TrackingEvent>>> response = auditController.eventsByTimeRange(
                LocalDateTime.of(2026, 3, 2, 10, 0), LocalDateTime.of(2026, 3, 2, 9, 0));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verifyNoInteractions(auditService);
    }
}
