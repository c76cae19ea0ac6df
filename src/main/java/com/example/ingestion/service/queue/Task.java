package com.example.ingestion.service.queue;

import com.example.ingestion.domain.enums.TaskType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A unit of work read from the task stream.
 * <p>
 * {@code id} is the application level identifier that survives retries;
 * {@code deliveryToken} is the stream entry id needed to acknowledge this
 * particular delivery.
 */
@Value
@Builder(toBuilder = true)
public class Task {

    String id;

    /**
     * Wire tag as read from the stream; may not match any known {@link TaskType}
     */
    String type;

    @Builder.Default
    Map<String, Object> payload = Map.of();

    /**
     * Payload exactly as read from the stream, kept for dead-lettering
     */
    String rawPayload;

    String deliveryToken;

    int retryCount;

    /**
     * Earliest time a retried task may run; null for first attempts
     */
    Instant availableAt;

    public Optional<TaskType> getTaskType() {
        return TaskType.findByCode(type);
    }

    public boolean isDelayed(Instant now) {
        return availableAt != null && availableAt.isAfter(now);
    }

    public Optional<Long> getPayloadLong(String key) {
        var value = payload.get(key);
        if (value instanceof Number number) {
            return Optional.of(number.longValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Optional.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Map<String, Object> immutablePayload(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
