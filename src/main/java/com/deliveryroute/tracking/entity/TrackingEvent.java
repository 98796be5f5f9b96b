package com.deliveryroute.tracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Audit trail of the tracking subsystem.
 *
 *  - eventTime : the time the event refers to (sample time for GPS events,
 *                trigger time for manual ones)
 *  - createdAt : server time the row was written
 */
@Entity
@Table(
    name = "tracking_events",
    indexes = {
        @Index(name = "idx_tracking_event_route", columnList = "route_id"),
        @Index(name = "idx_tracking_event_vehicle", columnList = "vehicle_id"),
        @Index(name = "idx_tracking_event_time", columnList = "event_time")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackingEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "route_id", nullable = false)
    private String routeId;

    private String driverId;

    @Column(name = "vehicle_id")
    private String vehicleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private TrackingEventType eventType;

    private String stopId;

    private Double latitude;

    private Double longitude;

    @Column(length = 500)
    private String details;

    @Column(name = "event_time", nullable = false)
    private LocalDateTime eventTime;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
