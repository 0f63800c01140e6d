package com.example.notificationscheduler.domain.entity;

import com.example.notificationscheduler.domain.enums.NotificationChannel;
import com.example.notificationscheduler.domain.enums.NotificationStatus;
import com.example.notificationscheduler.domain.enums.NotificationType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A notification whose initial delivery failed and which is now owned by the
 * retry queue.
 * <p>
 * Rows are inserted by the notification send path. The retry coordinator only
 * touches the status fields (status, attempt count, next attempt, last error)
 * and never deletes rows.
 */
@Entity
@Table(name = "notification_retries", indexes = {
        @Index(name = "idx_retry_status_next_attempt", columnList = "status, next_attempt_at"),
        @Index(name = "idx_retry_recipient", columnList = "recipient")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetryableNotification {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "notification_type", nullable = false, length = 40)
    private NotificationType notificationType;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, length = 10)
    private NotificationChannel channel;

    /**
     * Phone number, email address or device token, depending on channel
     */
    @Column(name = "recipient", nullable = false, length = 255)
    private String recipient;

    @Column(name = "subject", length = 255)
    private String subject;

    @Column(name = "body", columnDefinition = "TEXT")
    private String body;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private NotificationStatus status = NotificationStatus.PENDING;

    /**
     * Failed retry attempts so far. Never exceeds the configured max retries.
     */
    @Column(name = "attempt_count", nullable = false)
    @Builder.Default
    private Integer attemptCount = 0;

    /**
     * Earliest time the next attempt may run. Null once terminal.
     */
    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "exhausted_at")
    private Instant exhaustedAt;

    @Version
    @Column(name = "version")
    private Long version;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.status == null) {
            this.status = NotificationStatus.PENDING;
        }
        if (this.attemptCount == null) {
            this.attemptCount = 0;
        }
        if (this.nextAttemptAt == null && !this.status.isTerminal()) {
            this.nextAttemptAt = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === State transitions ===

    /**
     * Record a successful delivery
     */
    public void markDelivered(Instant now) {
        this.status = NotificationStatus.DELIVERED;
        this.deliveredAt = now;
        this.nextAttemptAt = null;
        this.lastError = null;
    }

    /**
     * Record a failed attempt that will be retried at {@code nextAttemptAt}
     */
    public void markRetrying(int attemptCount, Instant nextAttemptAt, String error) {
        this.status = NotificationStatus.RETRYING;
        this.attemptCount = attemptCount;
        this.nextAttemptAt = nextAttemptAt;
        this.lastError = error;
    }

    /**
     * Record the final failed attempt
     */
    public void markExhausted(int attemptCount, Instant now, String error) {
        this.status = NotificationStatus.EXHAUSTED;
        this.attemptCount = attemptCount;
        this.nextAttemptAt = null;
        this.exhaustedAt = now;
        this.lastError = error;
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
