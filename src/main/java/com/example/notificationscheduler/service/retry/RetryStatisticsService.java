package com.example.notificationscheduler.service.retry;

import com.example.notificationscheduler.domain.enums.NotificationStatus;
import com.example.notificationscheduler.domain.repository.RetryableNotificationRepository;
import com.example.notificationscheduler.dto.RetryStatistics;
import com.example.notificationscheduler.service.clock.SchedulerClock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Read-only summary of the retry queue
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetryStatisticsService {

    private static final List<NotificationStatus> FAILED_STATUSES = List.of(
            NotificationStatus.RETRYING, NotificationStatus.DELIVERED, NotificationStatus.EXHAUSTED);

    private final RetryableNotificationRepository notificationRepository;
    private final SchedulerClock clock;

    @Transactional(readOnly = true)
    public RetryStatistics getRetryStatistics() {
        var pending = notificationRepository.countByStatus(NotificationStatus.PENDING);
        var retrying = notificationRepository.countByStatus(NotificationStatus.RETRYING);
        var delivered = notificationRepository.countByStatus(NotificationStatus.DELIVERED);
        var exhausted = notificationRepository.countByStatus(NotificationStatus.EXHAUSTED);

        var totalFailed = retrying + delivered + exhausted;
        var totalRetried = totalFailed > 0 ? notificationRepository.sumAttemptCountByStatusIn(FAILED_STATUSES) : 0L;

        var averageRetries = totalFailed > 0
                ? BigDecimal.valueOf(totalRetried).divide(BigDecimal.valueOf(totalFailed), 2, RoundingMode.HALF_UP).doubleValue()
                : 0.0;
        var finished = delivered + exhausted;
        var successRate = finished > 0 ? (double) delivered / finished : 0.0;

        return RetryStatistics.builder()
                .totalFailed(totalFailed)
                .totalRetried(totalRetried)
                .averageRetries(averageRetries)
                .successRate(successRate)
                .pendingCount(pending)
                .retryingCount(retrying)
                .deliveredCount(delivered)
                .exhaustedCount(exhausted)
                .generatedAt(clock.now())
                .build();
    }
}
