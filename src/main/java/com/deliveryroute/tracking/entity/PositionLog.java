package com.deliveryroute.tracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Every GPS sample accepted by the tracking engine, with the stop it was
 * evaluated against.
 */
@Entity
@Table(
    name = "position_logs",
    indexes = {
        @Index(name = "idx_position_log_vehicle", columnList = "vehicle_id"),
        @Index(name = "idx_position_log_route", columnList = "route_id, sample_timestamp")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false)
    private String vehicleId;

    @Column(name = "route_id")
    private String routeId;

    private String driverId;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    private Double speed; // km/h

    private String currentStopId;

    private Boolean withinGeofence;

    @Column(name = "sample_timestamp", nullable = false)
    private LocalDateTime timestamp;
}
