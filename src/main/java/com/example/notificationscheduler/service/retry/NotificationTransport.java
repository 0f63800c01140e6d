package com.example.notificationscheduler.service.retry;

import com.example.notificationscheduler.domain.entity.RetryableNotification;
import com.example.notificationscheduler.exception.NotificationDeliveryException;

/**
 * Delivers one notification over its channel.
 */
public interface NotificationTransport {

    /**
     * Returns normally on delivery.
     *
     * @throws NotificationDeliveryException if the notification was not delivered
     */
    void deliver(RetryableNotification notification) throws NotificationDeliveryException;
}
