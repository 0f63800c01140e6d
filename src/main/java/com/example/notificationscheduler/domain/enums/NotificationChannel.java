package com.example.notificationscheduler.domain.enums;

/**
 * Transport channel a notification is delivered over.
 */
public enum NotificationChannel {
    PUSH,
    EMAIL,
    SMS
}
