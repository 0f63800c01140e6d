package com.example.notificationscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kinds of farm notifications that can end up in the retry queue.
 */
@Getter
@RequiredArgsConstructor
public enum NotificationType {

    BREEDING_REMINDER("breeding_reminder", "Breeding Reminder"),

    VACCINATION_REMINDER("vaccination_reminder", "Vaccination Reminder"),

    HARVEST_REMINDER("harvest_reminder", "Harvest Reminder"),

    STOCK_ALERT("stock_alert", "Stock Alert"),

    WEATHER_ALERT("weather_alert", "Weather Alert"),

    /**
     * Marketplace order status change
     */
    ORDER_UPDATE("order_update", "Order Update");

    private final String code;
    private final String displayName;
}
