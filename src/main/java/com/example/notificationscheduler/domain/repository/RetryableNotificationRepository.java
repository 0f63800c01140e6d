package com.example.notificationscheduler.domain.repository;

import com.example.notificationscheduler.domain.entity.RetryableNotification;
import com.example.notificationscheduler.domain.enums.NotificationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for the notification retry queue.
 */
@Repository
public interface RetryableNotificationRepository extends JpaRepository<RetryableNotification, UUID> {

    /**
     * Find notifications due for a retry attempt, oldest due first.
     * <p>
     * Criteria:
     * - Status is one of {@code statuses} (PENDING, RETRYING)
     * - Next attempt time has passed, or was never set (rows written by the
     *   send path without one are due immediately)
     */
    @Query("""
            SELECT n FROM RetryableNotification n
            WHERE n.status IN :statuses
              AND (n.nextAttemptAt IS NULL OR n.nextAttemptAt <= :now)
            ORDER BY n.nextAttemptAt ASC NULLS FIRST, n.createdAt ASC
            """)
    List<RetryableNotification> findDueForRetry(@Param("statuses") Collection<NotificationStatus> statuses,
                                                @Param("now") Instant now,
                                                Pageable pageable);

    /**
     * Count notifications by status
     */
    long countByStatus(NotificationStatus status);

    /**
     * Sum of attempt counts across the given statuses
     */
    @Query("""
            SELECT COALESCE(SUM(n.attemptCount), 0) FROM RetryableNotification n
            WHERE n.status IN :statuses
            """)
    long sumAttemptCountByStatusIn(@Param("statuses") Collection<NotificationStatus> statuses);
}
