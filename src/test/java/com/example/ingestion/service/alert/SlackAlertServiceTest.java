package com.example.ingestion.service.alert;

import com.example.ingestion.config.SlackProperties;
import com.example.ingestion.domain.enums.TaskType;
import com.example.ingestion.service.queue.Task;
import com.slack.api.Slack;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import com.slack.api.webhook.WebhookResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlackAlertService Tests")
class SlackAlertServiceTest {

    private static final String WEBHOOK = "https://hooks.slack.test/services/T/B/X";

    @Mock
    private Slack slack;

    private SlackProperties properties;
    private SlackAlertService alertService;
    private Task task;

    @BeforeEach
    void setUp() {
        properties = new SlackProperties();
        properties.setWebhookUrl(WEBHOOK);
        alertService = new SlackAlertService(properties, slack);
        task = Task.builder()
                .id("task-1")
                .type(TaskType.DOCUMENT_PROCESS.getCode())
                .payload(Map.of("document_id", 42))
                .deliveryToken("1-0")
                .retryCount(2)
                .build();
    }

    @Nested
    @DisplayName("sendDeadLetterAlert")
    class SendTests {

        @Test
        @DisplayName("Should post the alert to the webhook")
        void shouldSendAlert() throws IOException {
            // Given
            when(slack.send(eq(WEBHOOK), any(Payload.class)))
                    .thenReturn(WebhookResponse.builder().code(200).body("ok").build());

            // When
            alertService.sendDeadLetterAlert(task, "Max retries (3) exceeded: S3 download timeout");

            // Then
            var payload = ArgumentCaptor.forClass(Payload.class);
            verify(slack).send(eq(WEBHOOK), payload.capture());
            assertThat(payload.getValue().getChannel()).isEqualTo("#ingestion-alerts");
        }

        @Test
        @DisplayName("Should skip sending when disabled")
        void shouldSkipWhenDisabled() {
            properties.setEnabled(false);

            alertService.sendDeadLetterAlert(task, "boom");

            verifyNoInteractions(slack);
        }

        @Test
        @DisplayName("Should skip sending without a webhook")
        void shouldSkipWithoutWebhook() {
            properties.setWebhookUrl("");

            alertService.sendDeadLetterAlert(task, "boom");

            verifyNoInteractions(slack);
        }

        @Test
        @DisplayName("Should not propagate delivery errors")
        void shouldSwallowDeliveryErrors() throws IOException {
            when(slack.send(anyString(), any(Payload.class))).thenThrow(new IOException("connection refused"));

            assertThatCode(() -> alertService.sendDeadLetterAlert(task, "boom")).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("buildDeadLetterPayload")
    class PayloadTests {

        @Test
        @DisplayName("Should describe the dead-lettered task")
        void shouldDescribeTask() {
            // When
            var payload = alertService.buildDeadLetterPayload(task, "Document 42 not found");

            // Then
            var attachment = payload.getAttachments().get(0);
            assertThat(attachment.getTitle()).isEqualTo("Document Processing - task-1");
            assertThat(attachment.getFields())
                    .extracting(Field::getTitle, Field::getValue)
                    .contains(
                            tuple("Task ID", "task-1"),
                            tuple("Document ID", "42"),
                            tuple("Attempts", "3"),
                            tuple("Error", "```Document 42 not found```"));
        }

        @Test
        @DisplayName("Should keep unknown type tags and truncate long errors")
        void shouldHandleUnknownTypeAndLongError() {
            var unknown = task.toBuilder().type("image:resize").payload(Map.of()).build();

            var payload = alertService.buildDeadLetterPayload(unknown, "e".repeat(1000));

            var fields = payload.getAttachments().get(0).getFields();
            assertThat(fields).filteredOn(field -> field.getTitle().equals("Task Type"))
                    .extracting(Field::getValue).containsExactly("image:resize");
            assertThat(fields).filteredOn(field -> field.getTitle().equals("Document ID"))
                    .extracting(Field::getValue).containsExactly("-");
            assertThat(fields).filteredOn(field -> field.getTitle().equals("Error"))
                    .extracting(Field::getValue)
                    .allSatisfy(value -> assertThat(value).hasSize(406).endsWith("...```"));
        }
    }
}
