package com.deliveryroute.tracking.client;

import com.deliveryroute.tracking.config.TrackingProperties;
import com.deliveryroute.tracking.entity.Vehicle;
import com.deliveryroute.tracking.model.PositionSample;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Polls {@code GET {tracking.gps.base-url}/devices/{deviceId}/position}.
 *
 * Expected body: {@code {vehicleId, position: {latitude, longitude, speed?}, timestamp}}.
 * Timestamps with an offset are converted into the tracking zone.
 */
@Component
@Slf4j
public class HttpGpsPositionProvider implements GpsPositionProvider {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TrackingProperties.Endpoint endpoint;
    private final Clock clock;

    public HttpGpsPositionProvider(TrackingProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.endpoint = properties.getGps();
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(endpoint.getTimeoutSeconds()))
                .build();
    }

    @Override
    public Optional<PositionSample> fetchLatestPosition(Vehicle vehicle) {
        if (endpoint.getBaseUrl() == null || endpoint.getBaseUrl().isBlank()) {
            log.debug("GPS: provider not configured, skipping vehicle {}", vehicle.getId());
            return Optional.empty();
        }
        if (vehicle.getGpsDeviceId() == null) {
            log.debug("GPS: vehicle {} has no device", vehicle.getId());
            return Optional.empty();
        }

        try {
            String url = endpoint.getBaseUrl() + "/devices/"
                    + URLEncoder.encode(vehicle.getGpsDeviceId(), StandardCharsets.UTF_8) + "/position";
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(endpoint.getTimeoutSeconds()))
                    .GET();
            String apiKey = vehicle.getGpsApiKey() != null ? vehicle.getGpsApiKey() : endpoint.getApiKey();
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("X-Api-Key", apiKey);
            }

            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                log.warn("GPS: provider answered HTTP {} for vehicle {}", response.statusCode(), vehicle.getId());
                return Optional.empty();
            }
            return parse(vehicle.getId(), objectMapper.readTree(response.body()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("GPS: poll interrupted for vehicle {}", vehicle.getId());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("GPS: poll failed for vehicle {}: {}", vehicle.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    Optional<PositionSample> parse(String vehicleId, JsonNode root) {
        JsonNode position = root.path("position");
        if (!position.hasNonNull("latitude") || !position.hasNonNull("longitude")) {
            log.debug("GPS: no fix in response for vehicle {}", vehicleId);
            return Optional.empty();
        }
        LocalDateTime timestamp = parseTimestamp(root.path("timestamp").asText(null));
        if (timestamp == null) {
            log.warn("GPS: unparseable timestamp for vehicle {}: {}", vehicleId, root.path("timestamp"));
            return Optional.empty();
        }
        return Optional.of(PositionSample.builder()
                .vehicleId(vehicleId)
                .latitude(position.get("latitude").asDouble())
                .longitude(position.get("longitude").asDouble())
                .speed(position.hasNonNull("speed") ? position.get("speed").asDouble() : null)
                .timestamp(timestamp)
                .build());
    }

    private LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.atZoneSameInstant(clock.getZone()).toLocalDateTime();
            }
            return (LocalDateTime) parsed;
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
