package com.deliveryroute.tracking.client;

import com.deliveryroute.tracking.config.TrackingProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * POSTs {@link TravelTimeRequest} as JSON to {@code tracking.estimator.base-url}.
 */
@Component
@Slf4j
public class HttpTravelTimeClient implements TravelTimeClient {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TrackingProperties.Endpoint endpoint;

    public HttpTravelTimeClient(TrackingProperties properties, ObjectMapper objectMapper) {
        this.endpoint = properties.getEstimator();
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(endpoint.getTimeoutSeconds()))
                .build();
    }

    @Override
    public TravelTimeResponse estimate(TravelTimeRequest request) throws IOException, InterruptedException {
        if (endpoint.getBaseUrl() == null || endpoint.getBaseUrl().isBlank()) {
            throw new IOException("Travel-time estimator not configured (tracking.estimator.base-url)");
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(endpoint.getBaseUrl()))
                .timeout(Duration.ofSeconds(endpoint.getTimeoutSeconds()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(request)));
        if (endpoint.getApiKey() != null && !endpoint.getApiKey().isBlank()) {
            builder.header("X-Api-Key", endpoint.getApiKey());
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("Estimator answered HTTP " + response.statusCode());
        }
        log.debug("Estimator {} -> {}: {}", request.originAddress(), request.destinationAddress(), response.body());
        return objectMapper.readValue(response.body(), TravelTimeResponse.class);
    }
}
