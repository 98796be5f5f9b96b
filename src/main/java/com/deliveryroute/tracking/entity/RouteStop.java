package com.deliveryroute.tracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalTime;

/**
 * One planned warehouse visit of a {@link DeliveryRoute}.
 */
@Entity
@Table(name = "route_stops")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RouteStop {

    @Id
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "route_id", nullable = false)
    private DeliveryRoute route;

    @Column(nullable = false)
    private String warehouseId;

    @Column(nullable = false)
    private int stopOrder;

    private LocalTime arrivalTime;

    private LocalTime departureTime;

    private boolean hasLunchBreak;

    private Integer lunchDurationMinutes;
}
