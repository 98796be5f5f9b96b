package com.deliveryroute.tracking.entity;

import com.deliveryroute.tracking.model.GeoPoint;
import com.deliveryroute.tracking.model.TrafficScenario;
import jakarta.persistence.*;
import lombok.*;

/**
 * Warehouse registry entry. Its coordinates are the centre of the stop geofence,
 * its address is what the routing service is queried with.
 */
@Entity
@Table(name = "warehouses")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Warehouse {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    private String fullAddress;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    // Scenario used when this warehouse is the destination of a leg
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private TrafficScenario trafficScenario = TrafficScenario.BEST_GUESS;

    public GeoPoint location() {
        return new GeoPoint(latitude, longitude);
    }

    /** Address sent to the routing service, the name when no address was registered. */
    public String routingAddress() {
        return fullAddress != null && !fullAddress.isBlank() ? fullAddress : name;
    }
}
