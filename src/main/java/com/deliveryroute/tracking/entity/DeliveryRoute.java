package com.deliveryroute.tracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Route registry entry: the planned stop sequence a driver runs with a vehicle.
 *
 * A route is scheduled either on a fixed {@code serviceDate}, or weekly on
 * {@code weekday}; with neither set it runs every day.
 */
@Entity
@Table(name = "routes")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeliveryRoute {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    private LocalDate serviceDate;

    @Enumerated(EnumType.STRING)
    private DayOfWeek weekday;

    private String driverId;

    private String vehicleId;

    // mph, falls back to tracking.recalculation.default-speed-limit when null
    private Integer vehicleSpeedLimit;

    @Builder.Default
    private boolean active = true;

    @OneToMany(mappedBy = "route", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("stopOrder ASC")
    @Builder.Default
    private List<RouteStop> stops = new ArrayList<>();

    public boolean isScheduledFor(LocalDate date) {
        if (serviceDate != null) {
            return serviceDate.equals(date);
        }
        if (weekday != null) {
            return weekday == date.getDayOfWeek();
        }
        return true;
    }
}
