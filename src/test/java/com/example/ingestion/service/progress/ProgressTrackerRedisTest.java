package com.example.ingestion.service.progress;

import com.example.ingestion.config.ProgressProperties;
import com.example.ingestion.domain.enums.ProgressStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
@DisplayName("ProgressTracker Redis Tests")
class ProgressTrackerRedisTest {

    @Container
    private static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static RedisMessageListenerContainer listenerContainer;
    private static StringRedisTemplate redisTemplate;

    private ProgressTracker tracker;
    private long documentId;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        redisTemplate = new StringRedisTemplate(connectionFactory);

        listenerContainer = new RedisMessageListenerContainer();
        listenerContainer.setConnectionFactory(connectionFactory);
        listenerContainer.afterPropertiesSet();
        listenerContainer.start();
    }

    @AfterAll
    static void disconnect() throws Exception {
        listenerContainer.destroy();
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        var properties = new ProgressProperties();
        properties.setTtlSeconds(60);
        tracker = new ProgressTracker(redisTemplate, new ObjectMapper(), properties, listenerContainer);
        documentId = ThreadLocalRandom.current().nextLong(1, Long.MAX_VALUE);
    }

    @Test
    @DisplayName("Should store the latest snapshot with a TTL")
    void shouldStoreLatestSnapshot() {
        // When
        tracker.update(Progress.processing(documentId, 1, 3, "Stored page 1 of 3"));
        tracker.update(Progress.processing(documentId, 2, 3, "Stored page 2 of 3"));

        // Then
        var progress = tracker.get(documentId);
        assertThat(progress).isPresent();
        assertThat(progress.get().getPage()).isEqualTo(2);
        assertThat(progress.get().getMessage()).isEqualTo("Stored page 2 of 3");
        assertThat(redisTemplate.getExpire("ingestion:progress:" + documentId)).isBetween(1L, 60L);
    }

    @Test
    @DisplayName("Should clear the snapshot")
    void shouldClearSnapshot() {
        tracker.update(Progress.ready(documentId, 3));

        tracker.clear(documentId);

        assertThat(tracker.get(documentId)).isEmpty();
    }

    @Test
    @DisplayName("Should deliver updates published after subscribing")
    void shouldDeliverPublishedUpdates() {
        StepVerifier.create(tracker.subscribe(documentId))
                .then(() -> {
                    waitForSubscription();
                    tracker.update(Progress.processing(documentId, 1, 2, "Stored page 1 of 2"));
                    tracker.update(Progress.ready(documentId, 2));
                })
                .assertNext(progress -> assertThat(progress.getPage()).isEqualTo(1))
                .assertNext(progress -> assertThat(progress.getStatus()).isEqualTo(ProgressStatus.READY))
                .thenCancel()
                .verify(Duration.ofSeconds(10));
    }

    private static void waitForSubscription() {
        try {
            Thread.sleep(500);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
