package com.example.notificationscheduler.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for the notification gateway
 */
@Configuration
@Slf4j
public class WebClientConfig {

    private static final String SERVICE_NAME = "NotificationGateway";

    @Bean(name = "notificationGatewayWebClient")
    public WebClient notificationGatewayWebClient(WebClient.Builder builder, NotificationGatewayProperties properties) {
        var timeoutSeconds = properties.getTimeoutSeconds();
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        return builder.clone()
                .baseUrl(properties.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("X-Service-Name", "notification-scheduler")
                .filter(logExchange())
                .build();
    }

    private ExchangeFilterFunction logExchange() {
        return (request, next) -> {
            log.debug("[{}] Request: {} {}", SERVICE_NAME, request.method(), request.url());
            return next.exchange(request).flatMap(response -> {
                if (response.statusCode().isError()) {
                    log.warn("[{}] Error response: {}", SERVICE_NAME, response.statusCode());
                } else {
                    log.debug("[{}] Response status: {}", SERVICE_NAME, response.statusCode());
                }
                return Mono.just(response);
            });
        };
    }
}
