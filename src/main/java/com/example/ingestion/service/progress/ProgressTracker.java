package com.example.ingestion.service.progress;

import com.example.ingestion.config.ProgressProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Progress snapshots in Redis.
 * <p>
 * Each update overwrites the snapshot (with a TTL) and is published on the
 * item's channel. Subscribers only see updates published after they joined;
 * the current state is always available through {@link #get(long)}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressTracker {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final ProgressProperties properties;
    private final RedisMessageListenerContainer listenerContainer;

    public void update(Progress progress) {
        var json = toJson(progress);

        redisTemplate.opsForValue().set(keyFor(progress.getSubjectId()), json, Duration.ofSeconds(properties.getTtlSeconds()));
        redisTemplate.convertAndSend(channelFor(progress.getSubjectId()), json);

        log.debug("Progress updated for {}: {}/{} {}", progress.getSubjectId(), progress.getPage(),
                progress.getTotal(), progress.getStatus());
    }

    public Optional<Progress> get(long subjectId) {
        var json = redisTemplate.opsForValue().get(keyFor(subjectId));
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Progress.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable progress snapshot for {}: {}", subjectId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Live updates for one item. The stream never completes on its own;
     * cancelling the subscription removes the Redis listener.
     */
    public Flux<Progress> subscribe(long subjectId) {
        var topic = new ChannelTopic(channelFor(subjectId));

        return Flux.create(sink -> {
            MessageListener listener = (message, pattern) -> {
                var body = new String(message.getBody(), StandardCharsets.UTF_8);
                try {
                    sink.next(objectMapper.readValue(body, Progress.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping unreadable progress message on {}: {}", topic.getTopic(), e.getOriginalMessage());
                }
            };

            listenerContainer.addMessageListener(listener, topic);
            log.debug("Subscribed to {}", topic.getTopic());

            sink.onDispose(() -> {
                listenerContainer.removeMessageListener(listener, topic);
                log.debug("Unsubscribed from {}", topic.getTopic());
            });
        });
    }

    /**
     * Best-effort removal of the stored snapshot
     */
    public void clear(long subjectId) {
        try {
            redisTemplate.delete(keyFor(subjectId));
            log.debug("Progress cleared for {}", subjectId);
        } catch (DataAccessException e) {
            log.warn("Failed to clear progress for {}: {}", subjectId, e.getMessage());
        }
    }

    private String toJson(Progress progress) {
        try {
            return objectMapper.writeValueAsString(progress);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Progress is not serialisable: " + e.getOriginalMessage(), e);
        }
    }

    private String keyFor(long subjectId) {
        return properties.getKeyPrefix() + subjectId;
    }

    private String channelFor(long subjectId) {
        return properties.getChannelPrefix() + subjectId;
    }
}
