package com.example.notificationscheduler.service.retry;

import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.domain.entity.RetryableNotification;
import com.example.notificationscheduler.domain.enums.NotificationChannel;
import com.example.notificationscheduler.domain.enums.NotificationStatus;
import com.example.notificationscheduler.domain.enums.NotificationType;
import com.example.notificationscheduler.domain.repository.RetryableNotificationRepository;
import com.example.notificationscheduler.exception.NotificationDeliveryException;
import com.example.notificationscheduler.service.alert.SlackAlertService;
import com.example.notificationscheduler.service.clock.ManualSchedulerClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationRetryCoordinator Tests")
class NotificationRetryCoordinatorTest {

    private static final Instant T0 = Instant.parse("2024-03-10T08:00:00Z");

    @Mock
    private RetryableNotificationRepository notificationRepository;

    @Mock
    private NotificationTransport transport;

    @Mock
    private SlackAlertService slackAlertService;

    private ManualSchedulerClock clock;
    private SimpleMeterRegistry meterRegistry;
    private NotificationRetryCoordinator coordinator;
    private final List<RetryableNotification> store = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new ManualSchedulerClock(T0);
        meterRegistry = new SimpleMeterRegistry();
        var metricsConfig = new MetricsConfig(meterRegistry, notificationRepository);
        coordinator = new NotificationRetryCoordinator(notificationRepository, transport,
                new BackoffPolicy(RetryConfig.defaults()), clock, metricsConfig, slackAlertService, 100);

        lenient().when(notificationRepository.findDueForRetry(any(), any(), any())).thenAnswer(inv -> {
            Collection<NotificationStatus> statuses = inv.getArgument(0);
            Instant now = inv.getArgument(1);
            Pageable page = inv.getArgument(2);
            return store.stream()
                    .filter(n -> statuses.contains(n.getStatus()))
                    .filter(n -> n.getNextAttemptAt() == null || !n.getNextAttemptAt().isAfter(now))
                    .sorted(Comparator.comparing(RetryableNotification::getNextAttemptAt,
                            Comparator.nullsFirst(Comparator.naturalOrder())))
                    .limit(page.getPageSize())
                    .toList();
        });
        lenient().when(notificationRepository.save(any(RetryableNotification.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private RetryableNotification pending(String recipient, Instant due) {
        var notification = RetryableNotification.builder()
                .id(UUID.randomUUID())
                .notificationType(NotificationType.VACCINATION_REMINDER)
                .channel(NotificationChannel.SMS)
                .recipient(recipient)
                .subject("Vaccination due")
                .body("Herd B is due for FMD vaccination tomorrow")
                .nextAttemptAt(due)
                .createdAt(T0)
                .build();
        store.add(notification);
        return notification;
    }

    private void failDelivery() throws NotificationDeliveryException {
        doAnswer(inv -> {
            RetryableNotification n = inv.getArgument(0);
            throw new NotificationDeliveryException(n.getId(), "SMS provider timeout");
        }).when(transport).deliver(any());
    }

    @Nested
    @DisplayName("processFailedNotifications Tests")
    class ProcessTests {

        @Test
        @DisplayName("Should reschedule with growing backoff and exhaust after max retries")
        void shouldFollowBackoffUntilExhausted() throws Exception {
            // Given
            var notification = pending("+84901234567", T0);
            failDelivery();

            // When: first failure
            var first = coordinator.processFailedNotifications();

            // Then
            assertThat(first.getScheduled()).isEqualTo(1);
            assertThat(notification.getStatus()).isEqualTo(NotificationStatus.RETRYING);
            assertThat(notification.getAttemptCount()).isEqualTo(1);
            assertThat(notification.getNextAttemptAt()).isEqualTo(T0.plusMillis(300_000));

            // When: second failure
            clock.setNow(T0.plusMillis(300_000));
            coordinator.processFailedNotifications();

            // Then
            assertThat(notification.getAttemptCount()).isEqualTo(2);
            assertThat(notification.getNextAttemptAt()).isEqualTo(T0.plusMillis(300_000 + 600_000));

            // When: third failure
            clock.setNow(T0.plusMillis(900_000));
            var third = coordinator.processFailedNotifications();

            // Then
            assertThat(third.getExhausted()).isEqualTo(1);
            assertThat(notification.getStatus()).isEqualTo(NotificationStatus.EXHAUSTED);
            assertThat(notification.getAttemptCount()).isEqualTo(3);
            assertThat(notification.getNextAttemptAt()).isNull();
            assertThat(notification.getExhaustedAt()).isEqualTo(T0.plusMillis(900_000));
            assertThat(notification.getLastError()).contains("SMS provider timeout");
            verify(slackAlertService).sendNotificationExhaustedAlert(notification);
            assertThat(meterRegistry.counter("notification_retry_exhausted").count()).isEqualTo(1.0);

            // Exhausted rows are never picked up again
            clock.setNow(T0.plusMillis(100_000_000));
            assertThat(coordinator.processFailedNotifications().getProcessed()).isZero();
            verify(transport, times(3)).deliver(notification);
        }

        @Test
        @DisplayName("Should mark delivered and clear the error on success")
        void shouldMarkDelivered() throws Exception {
            // Given
            var notification = pending("farmer@example.com", T0.minusSeconds(60));
            notification.markRetrying(1, T0.minusSeconds(60), "SmtpException: mailbox full");

            // When
            var result = coordinator.processFailedNotifications();

            // Then
            assertThat(result.getProcessed()).isEqualTo(1);
            assertThat(result.getSuccessful()).isEqualTo(1);
            assertThat(notification.getStatus()).isEqualTo(NotificationStatus.DELIVERED);
            assertThat(notification.getDeliveredAt()).isEqualTo(T0);
            assertThat(notification.getLastError()).isNull();
            assertThat(notification.getNextAttemptAt()).isNull();
            assertThat(notification.getAttemptCount()).isEqualTo(1);
            verify(transport).deliver(notification);
        }

        @Test
        @DisplayName("Should do nothing on a second sweep in the same instant")
        void shouldBeIdempotentWithinInstant() throws Exception {
            // Given
            pending("+84900000001", T0);
            pending("+84900000002", T0.minusSeconds(30));
            failDelivery();
            coordinator.processFailedNotifications();

            // When
            var second = coordinator.processFailedNotifications();

            // Then
            assertThat(second.getProcessed()).isZero();
            assertThat(second.getSuccessful()).isZero();
            assertThat(second.getScheduled()).isZero();
            assertThat(second.getExhausted()).isZero();
            verify(transport, times(2)).deliver(any());
        }

        @Test
        @DisplayName("Should pick up pending rows inserted without a next attempt time")
        void shouldPickUpPendingRowWithoutNextAttempt() throws Exception {
            // Given
            var notification = pending("+84900000008", null);

            // When
            var result = coordinator.processFailedNotifications();

            // Then
            assertThat(result.getSuccessful()).isEqualTo(1);
            assertThat(notification.getStatus()).isEqualTo(NotificationStatus.DELIVERED);
            verify(transport).deliver(notification);
        }

        @Test
        @DisplayName("Should skip rows that are not yet due")
        void shouldSkipRowsNotDue() throws Exception {
            pending("+84900000003", T0.plusSeconds(1));

            var result = coordinator.processFailedNotifications();

            assertThat(result.getProcessed()).isZero();
            verify(transport, never()).deliver(any());
        }

        @Test
        @DisplayName("Should treat unexpected transport exceptions as failed attempts")
        void shouldContainRuntimeExceptions() throws Exception {
            // Given
            var notification = pending("device-token-1", T0);
            doThrow(new IllegalStateException("circuit open")).when(transport).deliver(any());

            // When
            var result = coordinator.processFailedNotifications();

            // Then
            assertThat(result.getScheduled()).isEqualTo(1);
            assertThat(notification.getLastError()).isEqualTo("IllegalStateException: circuit open");
        }

        @Test
        @DisplayName("Should continue the sweep when one row fails to persist")
        void shouldContinueWhenSaveFails() throws Exception {
            // Given
            var broken = pending("+84900000004", T0.minusSeconds(10));
            var healthy = pending("+84900000005", T0);
            when(notificationRepository.save(broken)).thenThrow(new OptimisticLockingFailureException("stale row"));

            // When
            var result = coordinator.processFailedNotifications();

            // Then
            assertThat(result.getProcessed()).isEqualTo(2);
            assertThat(result.getSuccessful()).isEqualTo(1);
            verify(notificationRepository).save(healthy);
            verify(transport).deliver(broken);
            verify(transport).deliver(healthy);
        }
    }

    @Nested
    @DisplayName("Overlapping sweep Tests")
    class OverlapTests {

        @Test
        @DisplayName("Should skip a sweep requested while another is delivering")
        void shouldSkipConcurrentSweep() throws Exception {
            // Given: the first sweep blocks inside delivery
            var notification = pending("+84900000006", T0);
            var deliveries = new AtomicInteger();
            var delivering = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            doAnswer(inv -> {
                deliveries.incrementAndGet();
                delivering.countDown();
                release.await(5, TimeUnit.SECONDS);
                return null;
            }).when(transport).deliver(any());

            var first = CompletableFuture.supplyAsync(coordinator::processFailedNotifications);
            assertThat(delivering.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            var second = coordinator.processFailedNotifications();
            release.countDown();
            var firstResult = first.get(5, TimeUnit.SECONDS);

            // Then
            assertThat(second.isSkipped()).isTrue();
            assertThat(second.getProcessed()).isZero();
            assertThat(firstResult.isSkipped()).isFalse();
            assertThat(firstResult.getSuccessful()).isEqualTo(1);
            assertThat(deliveries).hasValue(1);
            assertThat(notification.getStatus()).isEqualTo(NotificationStatus.DELIVERED);
        }

        @Test
        @DisplayName("Should allow a new sweep once the previous one finished")
        void shouldReleaseGuardAfterSweep() throws Exception {
            // Given
            pending("+84900000007", T0);
            doThrow(new IllegalStateException("gateway down")).when(transport).deliver(any());
            coordinator.processFailedNotifications();

            // When
            clock.setNow(T0.plusMillis(300_000));
            var next = coordinator.processFailedNotifications();

            // Then
            assertThat(next.isSkipped()).isFalse();
            assertThat(next.getProcessed()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should expose the effective retry config")
    void shouldExposeRetryConfig() {
        assertThat(coordinator.getRetryConfig()).isEqualTo(RetryConfig.defaults());
    }
}
