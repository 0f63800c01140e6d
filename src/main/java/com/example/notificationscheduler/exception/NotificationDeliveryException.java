package com.example.notificationscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Raised by a notification transport when a delivery attempt fails
 */
@Getter
public class NotificationDeliveryException extends Exception {

    private final UUID notificationId;

    public NotificationDeliveryException(UUID notificationId, String message) {
        super(String.format("Delivery of notification %s failed: %s", notificationId, message));
        this.notificationId = notificationId;
    }

    public NotificationDeliveryException(UUID notificationId, Exception cause) {
        super(String.format("Delivery of notification %s failed: %s", notificationId, cause.getMessage()), cause);
        this.notificationId = notificationId;
    }
}
