package com.deliveryroute.tracking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main Spring Boot Application Class
 * Route progress tracking and cascading schedule recalculation
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RouteTrackingApplication {

    public static void main(String[] args) {
        SpringApplication.run(RouteTrackingApplication.class, args);
    }

}
