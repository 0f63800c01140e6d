package com.example.notificationscheduler.client;

import com.example.notificationscheduler.client.ClientModels.NotificationDeliveryRequest;
import com.example.notificationscheduler.client.ClientModels.NotificationDeliveryResponse;
import com.example.notificationscheduler.domain.entity.RetryableNotification;
import com.example.notificationscheduler.exception.ExternalServiceException;
import com.example.notificationscheduler.exception.NotificationDeliveryException;
import com.example.notificationscheduler.service.retry.NotificationTransport;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Notification transport backed by the platform's notification gateway,
 * which fans out to the SMS, email and push providers.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker so a dead gateway fails fast
 * - WebClient for the HTTP call
 */
@Slf4j
@Component
public class NotificationGatewayClient implements NotificationTransport {

    private static final String SERVICE_NAME = "Notification Gateway";

    private final WebClient webClient;

    public NotificationGatewayClient(@Qualifier("notificationGatewayWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    @CircuitBreaker(name = "notificationGateway", fallbackMethod = "deliverFallback")
    public void deliver(RetryableNotification notification) throws NotificationDeliveryException {
        var request = toRequest(notification);
        log.debug("Delivering notification {} via {}", notification.getId(), request.getChannel());

        NotificationDeliveryResponse response;
        try {
            response = webClient.post()
                    .uri("/api/v1/notifications/deliver")
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, clientResponse.statusCode().value(), body))))
                    .bodyToMono(NotificationDeliveryResponse.class)
                    .timeout(Duration.ofSeconds(30))
                    .block();
        } catch (ExternalServiceException e) {
            throw new NotificationDeliveryException(notification.getId(), e);
        } catch (Exception e) {
            throw new NotificationDeliveryException(notification.getId(), new ExternalServiceException(SERVICE_NAME, e));
        }

        if (response == null || !response.isDelivered()) {
            var reason = response != null && response.getError() != null ? response.getError() : "gateway did not confirm delivery";
            throw new NotificationDeliveryException(notification.getId(), reason);
        }
        log.debug("Notification {} accepted by gateway as {}", notification.getId(), response.getProviderMessageId());
    }

    /**
     * Fallback when the circuit breaker is open
     */
    @SuppressWarnings("unused")
    private void deliverFallback(RetryableNotification notification, Exception e) throws NotificationDeliveryException {
        if (e instanceof NotificationDeliveryException deliveryException) {
            throw deliveryException;
        }
        log.warn("Circuit breaker open for {}, notification: {}, error: {}", SERVICE_NAME, notification.getId(), e.getMessage());
        throw new NotificationDeliveryException(notification.getId(),
                new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e));
    }

    private NotificationDeliveryRequest toRequest(RetryableNotification notification) {
        return NotificationDeliveryRequest.builder()
                .notificationId(notification.getId())
                .notificationType(notification.getNotificationType().getCode())
                .channel(notification.getChannel().name())
                .recipient(notification.getRecipient())
                .subject(notification.getSubject())
                .body(notification.getBody())
                .attempt(notification.getAttemptCount() + 1)
                .build();
    }
}
