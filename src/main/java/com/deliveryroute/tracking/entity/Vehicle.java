package com.deliveryroute.tracking.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Vehicle registry entry with the GPS device it carries.
 */
@Entity
@Table(name = "vehicles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Vehicle {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    private String gpsDeviceId;

    private String gpsApiKey;

    private Integer speedLimitMph;

    private String assignedDriverId;
}
