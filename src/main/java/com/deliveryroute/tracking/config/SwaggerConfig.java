package com.deliveryroute.tracking.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI description, split into the live tracking surface and the audit queries.
 */
@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI routeTrackingOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Route Tracking API")
                        .description("Live route progress from GPS, manual stop triggers, "
                                + "cascading schedule recalculation and the audit trail")
                        .version("1.0.0"));
    }

    @Bean
    public GroupedOpenApi trackingApi() {
        return GroupedOpenApi.builder()
                .group("tracking")
                .pathsToMatch("/api/tracking/**")
                .build();
    }

    @Bean
    public GroupedOpenApi auditApi() {
        return GroupedOpenApi.builder()
                .group("audit")
                .pathsToMatch("/api/audit/**")
                .build();
    }
}
