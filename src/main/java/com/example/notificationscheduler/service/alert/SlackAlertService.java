package com.example.notificationscheduler.service.alert;

import com.example.notificationscheduler.config.SlackProperties;
import com.example.notificationscheduler.domain.entity.RetryableNotification;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Sends on-call alerts to Slack for exhausted notifications and failed jobs.
 * <p>
 * Both alerts are opt-in ({@code slack.alert-on-exhaustion},
 * {@code slack.alert-on-job-failure}) on top of {@code slack.enabled}.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.of("UTC"));

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:notification-scheduler}")
    private String applicationName = "notification-scheduler";

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Alert that a notification exhausted its retries and will not be sent
     */
    @Async
    public void sendNotificationExhaustedAlert(RetryableNotification notification) {
        if (!slackProperties.isAlertOnExhaustion()) {
            return;
        }
        if (!slackProperties.isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Notification {} exhausted but no alert was sent.",
                    notification.getId());
            return;
        }

        var notificationId = String.valueOf(notification.getId());
        var lastError = notification.getLastError() != null ? notification.getLastError() : "Unknown error";

        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Notification Retries Exhausted - Not Delivered*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(notification.getNotificationType().getDisplayName() + " via " + notification.getChannel())
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/notifications/" + notificationId)
                                .fields(List.of(
                                        shortField("Notification ID", notificationId),
                                        shortField("Recipient", notification.getRecipient()),
                                        shortField("Attempts", String.valueOf(notification.getAttemptCount())),
                                        shortField("Created At", notification.getCreatedAt() != null
                                                ? DATE_FORMATTER.format(notification.getCreatedAt()) : "-"),
                                        longField("Last Error", "```" + truncate(lastError, 400) + "```")
                                ))
                                .footer(applicationName + " | Resend manually if still relevant")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();

        send(payload, "notification " + notificationId);
    }

    /**
     * Alert that a scheduled job run failed
     */
    @Async
    public void sendJobFailureAlert(String jobName, String schedule, String errorMessage) {
        if (!slackProperties.isAlertOnJobFailure() || !slackProperties.isConfigured()) {
            return;
        }

        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":warning:")
                .text(":warning: *Scheduled Job Failed*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("warning")
                                .title("Job: " + jobName)
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/jobs/" + jobName)
                                .fields(List.of(
                                        shortField("Schedule", schedule),
                                        longField("Error", truncate(errorMessage, 300))
                                ))
                                .footer(applicationName)
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();

        send(payload, "job " + jobName);
    }

    private void send(Payload payload, String subject) {
        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert for {}. Response code: {}, body: {}",
                        subject, response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for {}", subject);
            }
        } catch (IOException e) {
            log.error("Error sending Slack alert for {}: {}", subject, e.getMessage(), e);
        }
    }

    private static Field shortField(String title, String value) {
        return Field.builder().title(title).value(value).valueShortEnough(true).build();
    }

    private static Field longField(String title, String value) {
        return Field.builder().title(title).value(value).valueShortEnough(false).build();
    }

    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
