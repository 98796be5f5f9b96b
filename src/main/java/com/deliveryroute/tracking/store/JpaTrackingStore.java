package com.deliveryroute.tracking.store;

import com.deliveryroute.tracking.entity.TrackingRecord;
import com.deliveryroute.tracking.entity.TrackingRecordType;
import com.deliveryroute.tracking.model.RouteProgress;
import com.deliveryroute.tracking.model.RouteProgressKey;
import com.deliveryroute.tracking.model.ScheduledStop;
import com.deliveryroute.tracking.repository.TrackingRecordRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * TrackingStore on the {@code tracking_records} table, JSON payload per key.
 */
@Component
@Profile("!in-memory")
@RequiredArgsConstructor
@Slf4j
public class JpaTrackingStore implements TrackingStore {

    private static final TypeReference<List<ScheduledStop>> SCHEDULE_TYPE = new TypeReference<>() {
    };

    private final TrackingRecordRepository recordRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Optional<RouteProgress> loadProgress(RouteProgressKey key) {
        try {
            return recordRepository.findById(key.recordKey())
                    .map(record -> readValue(record.getPayload(), RouteProgress.class));
        } catch (Exception e) {
            log.error("STORE: Failed to load progress {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean saveProgress(RouteProgress progress) {
        return write(progress.getKey().recordKey(), TrackingRecordType.ROUTE_PROGRESS, progress);
    }

    @Override
    public Optional<List<ScheduledStop>> loadSchedule(String routeId) {
        try {
            return recordRepository.findById(TrackingStore.scheduleKey(routeId))
                    .map(record -> readValue(record.getPayload(), SCHEDULE_TYPE));
        } catch (Exception e) {
            log.error("STORE: Failed to load schedule of route {}: {}", routeId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean saveSchedule(String routeId, List<ScheduledStop> stops) {
        return write(TrackingStore.scheduleKey(routeId), TrackingRecordType.ROUTE_SCHEDULE, stops);
    }

    private boolean write(String key, TrackingRecordType type, Object value) {
        try {
            recordRepository.save(TrackingRecord.builder()
                    .recordKey(key)
                    .recordType(type)
                    .payload(objectMapper.writeValueAsString(value))
                    .updatedAt(LocalDateTime.now(clock))
                    .build());
            log.debug("STORE: {} {} written", type, key);
            return true;
        } catch (Exception e) {
            log.error("STORE: Failed to write {} {}: {}", type, key, e.getMessage());
            return false;
        }
    }

    private <T> T readValue(String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (Exception e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " record", e);
        }
    }

    private <T> T readValue(String payload, TypeReference<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (Exception e) {
            throw new IllegalStateException("Corrupt schedule record", e);
        }
    }
}
