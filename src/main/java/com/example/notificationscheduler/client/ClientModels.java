package com.example.notificationscheduler.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Request/Response DTOs for the notification gateway
 */
public class ClientModels {
    private ClientModels() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NotificationDeliveryRequest {
        private UUID notificationId;
        private String notificationType;
        private String channel;
        private String recipient;
        private String subject;
        private String body;

        /**
         * Attempt number of this delivery, starting at 1 for the first retry
         */
        private int attempt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NotificationDeliveryResponse {
        private boolean delivered;
        private String providerMessageId;
        private String error;
    }
}
