package com.example.ingestion.service.alert;

import com.example.ingestion.config.SlackProperties;
import com.example.ingestion.domain.enums.TaskType;
import com.example.ingestion.service.queue.Task;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Sends an alert to Slack when a task is moved to the dead-letter stream.
 * <p>
 * Dead-lettered tasks are never replayed automatically, so every one of them
 * needs someone to look at it.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:ingestion-worker}")
    private String applicationName;

    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Runs asynchronously to not block the worker loop.
     */
    @Async
    public void sendDeadLetterAlert(Task task, String error) {
        if (!isEnabled()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Task {} was dead-lettered but no alert was sent.", task.getId());
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildDeadLetterPayload(task, error));

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for dead-lettered task {}", task.getId());
            }
        } catch (IOException e) {
            log.error("Error sending Slack alert for task {}: {}", task.getId(), e.getMessage(), e);
        }
    }

    private boolean isEnabled() {
        return slackProperties.isEnabled()
                && slackProperties.getWebhookUrl() != null
                && !slackProperties.getWebhookUrl().isBlank();
    }

    Payload buildDeadLetterPayload(Task task, String error) {
        var taskType = task.getTaskType().map(TaskType::getDisplayName).orElse(task.getType());
        var documentId = task.getPayloadLong("document_id").map(String::valueOf).orElse("-");

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Task Dead-Lettered - Manual Intervention Required*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(taskType + " - " + task.getId())
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/api/v1/worker/dead-letters")
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Task ID")
                                                .value(task.getId())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Task Type")
                                                .value(taskType)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Document ID")
                                                .value(documentId)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Attempts")
                                                .value(String.valueOf(task.getRetryCount() + 1))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Error")
                                                .value("```" + truncate(error != null ? error : "Unknown error", 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | Inspect the dead-letter stream and re-enqueue if needed")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
