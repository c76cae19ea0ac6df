package com.example.ingestion.service.queue;

import com.example.ingestion.config.QueueProperties;
import com.example.ingestion.domain.enums.TaskType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.DataType;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.connection.RedisStreamCommands.XClaimOptions;
import org.springframework.data.redis.connection.stream.*;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Task queue on a Redis stream with a consumer group.
 * <p>
 * Delivery rules:
 * - dequeue re-reads this consumer's own pending entries before asking for new ones,
 *   so a restarted consumer gets its unfinished work back first
 * - ack removes an entry from the pending set and is idempotent
 * - fail copies the entry to the dead-letter stream, then acknowledges it
 * - retry acknowledges the entry and appends a new attempt with the same id,
 *   or dead-letters it once the attempt limit is reached
 * <p>
 * Entries left pending by a crashed consumer stay with that consumer until
 * {@link #claimOrphaned(Duration, int)} moves them.
 */
@Slf4j
@Component
public class TaskQueue {

    static final String FIELD_ID = "id";
    static final String FIELD_TYPE = "type";
    static final String FIELD_PAYLOAD = "payload";
    static final String FIELD_RETRY_COUNT = "retry_count";
    static final String FIELD_AVAILABLE_AT = "available_at";

    static final String DLQ_ORIGINAL_ID = "original_id";
    static final String DLQ_ERROR = "error";
    static final String DLQ_FAILED_AT = "failed_at";

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final QueueProperties properties;
    private final String consumerName;

    @Autowired
    public TaskQueue(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, QueueProperties properties) {
        this(redisTemplate, objectMapper, properties, newConsumerName());
    }

    public TaskQueue(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, QueueProperties properties, String consumerName) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.consumerName = consumerName;
    }

    public static String newConsumerName() {
        return "worker-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    public String getConsumerName() {
        return consumerName;
    }

    /**
     * Ensure the consumer group exists, reading from the start of the stream.
     * Safe to call repeatedly.
     */
    public void setup() {
        var streamKey = properties.getStreamKey();
        var groupName = properties.getGroupName();

        var keyType = redisTemplate.type(streamKey);
        if (keyType != null && keyType != DataType.NONE && keyType != DataType.STREAM) {
            log.warn("Key {} holds a {} instead of a stream, deleting it", streamKey, keyType.code());
            redisTemplate.delete(streamKey);
        }

        try {
            streamOps().createGroup(streamKey, ReadOffset.from("0"), groupName);
            log.info("Created consumer group {} on stream {}", groupName, streamKey);
        } catch (DataAccessException e) {
            if (!RedisErrors.isBusyGroup(e)) {
                throw e;
            }
            log.debug("Consumer group {} already exists on stream {}", groupName, streamKey);
        }
    }

    /**
     * Append a new task.
     *
     * @return the application level id of the task
     */
    public String enqueue(TaskType type, Map<String, Object> payload) {
        var id = UUID.randomUUID().toString();
        append(id, type.getCode(), serializePayload(payload), 0, null);
        log.info("Enqueued task {} of type {}", id, type.getCode());
        return id;
    }

    /**
     * Next task for this consumer: its own pending entries first, then new
     * entries, blocking up to {@code block}.
     */
    public Optional<Task> dequeue(Duration block) {
        try {
            return read(block);
        } catch (DataAccessException e) {
            if (!RedisErrors.isNoGroup(e)) {
                throw e;
            }
            log.warn("Consumer group {} disappeared, recreating", properties.getGroupName());
            setup();
            return read(block);
        }
    }

    /**
     * Remove the task from the pending set. Acknowledging twice is harmless.
     */
    public void ack(Task task) {
        var acknowledged = streamOps().acknowledge(properties.getStreamKey(), properties.getGroupName(),
                RecordId.of(task.getDeliveryToken()));
        log.debug("Acknowledged task {} (entry {}, removed {})", task.getId(), task.getDeliveryToken(), acknowledged);
    }

    /**
     * Dead-letter the task with the given error and acknowledge it.
     * A task that is no longer pending has already been resolved and is left alone.
     *
     * @return true if a dead-letter entry was written
     */
    public boolean fail(Task task, String error) {
        if (!isPending(task)) {
            log.debug("Task {} (entry {}) is no longer pending, not dead-lettering", task.getId(), task.getDeliveryToken());
            return false;
        }

        var fields = new HashMap<String, String>();
        fields.put(DLQ_ORIGINAL_ID, nullToEmpty(task.getId()));
        fields.put(FIELD_TYPE, nullToEmpty(task.getType()));
        fields.put(FIELD_PAYLOAD, payloadForWire(task));
        fields.put(DLQ_ERROR, nullToEmpty(error));
        fields.put(DLQ_FAILED_AT, Instant.now().toString());

        streamOps().add(StreamRecords.newRecord().in(properties.getDlqKey()).ofMap(fields));
        ack(task);
        log.error("Task {} of type {} moved to dead-letter stream: {}", task.getId(), task.getType(), error);
        return true;
    }

    /**
     * Schedule another attempt of a task that failed with a retryable error.
     * Once the attempt limit is reached the task is dead-lettered instead.
     */
    public RetryOutcome retry(Task task, String error) {
        var maxRetries = properties.getMaxRetries();
        var nextAttempt = task.getRetryCount() + 1;

        if (nextAttempt >= maxRetries) {
            var failed = fail(task, String.format("Max retries (%d) exceeded: %s", maxRetries, error));
            return failed ? RetryOutcome.DEAD_LETTERED : RetryOutcome.ALREADY_RESOLVED;
        }
        if (!isPending(task)) {
            log.debug("Task {} (entry {}) is no longer pending, not retrying", task.getId(), task.getDeliveryToken());
            return RetryOutcome.ALREADY_RESOLVED;
        }

        var delay = Duration.ofSeconds(properties.retryDelaySecondsFor(task.getRetryCount()));
        var availableAt = Instant.now().plus(delay);

        append(task.getId(), task.getType(), payloadForWire(task), nextAttempt, availableAt);
        ack(task);
        log.warn("Task {} scheduled for retry {}/{} in {}s: {}", task.getId(), nextAttempt, maxRetries - 1,
                delay.toSeconds(), error);
        return RetryOutcome.SCHEDULED;
    }

    /**
     * Move entries idle for at least {@code minIdle} in other consumers' pending
     * sets to this consumer. The next {@link #dequeue(Duration)} returns them.
     *
     * @return number of entries claimed
     */
    public int claimOrphaned(Duration minIdle, int count) {
        PendingMessages pending;
        try {
            pending = streamOps().pending(properties.getStreamKey(), properties.getGroupName(), Range.unbounded(), count);
        } catch (DataAccessException e) {
            if (!RedisErrors.isNoGroup(e)) {
                throw e;
            }
            setup();
            return 0;
        }

        var orphaned = pending.stream()
                .filter(message -> !consumerName.equals(message.getConsumerName()))
                .filter(message -> message.getElapsedTimeSinceLastDelivery().compareTo(minIdle) >= 0)
                .map(PendingMessage::getId)
                .toArray(RecordId[]::new);

        if (orphaned.length == 0) {
            return 0;
        }

        var claimed = streamOps().claim(properties.getStreamKey(), properties.getGroupName(), consumerName,
                XClaimOptions.minIdle(minIdle).ids(orphaned));
        var claimedCount = claimed == null ? 0 : claimed.size();
        if (claimedCount > 0) {
            log.info("Consumer {} claimed {} orphaned entries", consumerName, claimedCount);
        }
        return claimedCount;
    }

    /**
     * Newest dead-letter entries first.
     */
    public List<DeadLetterEntry> deadLetters(int limit) {
        var records = streamOps().reverseRange(properties.getDlqKey(), Range.unbounded(), Limit.limit().count(limit));
        if (records == null) {
            return List.of();
        }
        return records.stream().map(this::toDeadLetterEntry).toList();
    }

    public QueueStats stats() {
        var streamLength = sizeOf(properties.getStreamKey());
        var dlqLength = sizeOf(properties.getDlqKey());

        long pendingCount = 0;
        if (streamLength > 0) {
            try {
                var summary = streamOps().pending(properties.getStreamKey(), properties.getGroupName());
                pendingCount = summary == null ? 0 : summary.getTotalPendingMessages();
            } catch (DataAccessException e) {
                if (!RedisErrors.isNoGroup(e)) {
                    throw e;
                }
            }
        }

        return QueueStats.builder()
                .consumerName(consumerName)
                .streamLength(streamLength)
                .pendingCount(pendingCount)
                .deadLetterCount(dlqLength)
                .build();
    }

    private Optional<Task> read(Duration block) {
        var consumer = Consumer.from(properties.getGroupName(), consumerName);

        var own = streamOps().read(consumer, StreamReadOptions.empty().count(1),
                StreamOffset.create(properties.getStreamKey(), ReadOffset.from("0")));
        if (own != null && !own.isEmpty() && isEmptyRecord(own.get(0))) {
            // trimmed or deleted from the stream while still pending
            var stale = own.get(0).getId();
            log.warn("Pending entry {} no longer exists in stream {}, acknowledging it", stale, properties.getStreamKey());
            streamOps().acknowledge(properties.getStreamKey(), properties.getGroupName(), stale);
        }
        var ownTask = firstTask(own);
        if (ownTask.isPresent()) {
            log.info("Redelivering pending task {} to {}", ownTask.get().getId(), consumerName);
            return ownTask;
        }

        var fresh = streamOps().read(consumer, StreamReadOptions.empty().count(1).block(block),
                StreamOffset.create(properties.getStreamKey(), ReadOffset.lastConsumed()));
        return firstTask(fresh);
    }

    private Optional<Task> firstTask(List<MapRecord<String, Object, Object>> records) {
        if (records == null || records.isEmpty()) {
            return Optional.empty();
        }
        var record = records.get(0);
        if (isEmptyRecord(record)) {
            return Optional.empty();
        }
        return Optional.of(toTask(record));
    }

    private static boolean isEmptyRecord(MapRecord<String, Object, Object> record) {
        return record.getValue() == null || record.getValue().isEmpty();
    }

    Task toTask(MapRecord<String, Object, Object> record) {
        var fields = record.getValue();
        var entryId = record.getId().getValue();

        var id = stringField(fields, FIELD_ID);
        var rawPayload = stringField(fields, FIELD_PAYLOAD);

        return Task.builder()
                .id(id != null ? id : entryId)
                .type(stringField(fields, FIELD_TYPE))
                .payload(parsePayload(rawPayload, entryId))
                .rawPayload(rawPayload)
                .deliveryToken(entryId)
                .retryCount(parseRetryCount(stringField(fields, FIELD_RETRY_COUNT), entryId))
                .availableAt(parseAvailableAt(stringField(fields, FIELD_AVAILABLE_AT), entryId))
                .build();
    }

    private DeadLetterEntry toDeadLetterEntry(MapRecord<String, Object, Object> record) {
        var fields = record.getValue();
        var failedAt = stringField(fields, DLQ_FAILED_AT);
        Instant failedAtInstant = null;
        if (failedAt != null) {
            try {
                failedAtInstant = Instant.parse(failedAt);
            } catch (DateTimeParseException e) {
                log.debug("Unreadable failed_at '{}' on dead-letter entry {}", failedAt, record.getId());
            }
        }
        return DeadLetterEntry.builder()
                .entryId(record.getId().getValue())
                .originalId(stringField(fields, DLQ_ORIGINAL_ID))
                .type(stringField(fields, FIELD_TYPE))
                .payload(stringField(fields, FIELD_PAYLOAD))
                .error(stringField(fields, DLQ_ERROR))
                .failedAt(failedAtInstant)
                .build();
    }

    private void append(String id, String type, String payloadJson, int retryCount, Instant availableAt) {
        var fields = new HashMap<String, String>();
        fields.put(FIELD_ID, id);
        fields.put(FIELD_TYPE, type);
        fields.put(FIELD_PAYLOAD, payloadJson);
        fields.put(FIELD_RETRY_COUNT, String.valueOf(retryCount));
        if (availableAt != null) {
            fields.put(FIELD_AVAILABLE_AT, String.valueOf(availableAt.toEpochMilli()));
        }
        streamOps().add(StreamRecords.newRecord().in(properties.getStreamKey()).ofMap(fields));
    }

    private boolean isPending(Task task) {
        var token = task.getDeliveryToken();
        var pending = streamOps().pending(properties.getStreamKey(), properties.getGroupName(), Range.closed(token, token), 1);
        return pending != null && !pending.isEmpty();
    }

    private long sizeOf(String key) {
        var size = streamOps().size(key);
        return size == null ? 0 : size;
    }

    private String serializePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload == null ? Map.of() : payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Task payload is not serialisable: " + e.getOriginalMessage(), e);
        }
    }

    private String payloadForWire(Task task) {
        return task.getRawPayload() != null ? task.getRawPayload() : serializePayload(task.getPayload());
    }

    private Map<String, Object> parsePayload(String rawPayload, String entryId) {
        if (rawPayload == null || rawPayload.isBlank()) {
            return Map.of();
        }
        try {
            return Task.immutablePayload(objectMapper.readValue(rawPayload, PAYLOAD_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("Entry {} has an unreadable payload, delivering it empty: {}", entryId, e.getOriginalMessage());
            return Map.of();
        }
    }

    private int parseRetryCount(String value, String entryId) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Entry {} has an unreadable retry_count '{}', treating as 0", entryId, value);
            return 0;
        }
    }

    private Instant parseAvailableAt(String value, String entryId) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Entry {} has an unreadable available_at '{}', ignoring it", entryId, value);
            return null;
        }
    }

    private static String stringField(Map<Object, Object> fields, String name) {
        var value = fields.get(name);
        return value == null ? null : value.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private StreamOperations<String, Object, Object> streamOps() {
        return redisTemplate.opsForStream();
    }
}
