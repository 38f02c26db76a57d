package com.example.tuckshop.infrastructure.adapter.out.notification;

import com.example.tuckshop.infrastructure.adapter.out.notification.dto.NotificationRequest;
import com.example.tuckshop.infrastructure.exception.NonRetryableServiceException;
import com.example.tuckshop.infrastructure.exception.RetryableServiceException;
import com.example.tuckshop.infrastructure.exception.ServiceUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Delivers user notifications to the notification service over HTTP.
 * Decorator order: Retry → CircuitBreaker → HTTP call.
 */
@Component
public class NotificationServiceAdapter {

    private static final Logger log = LoggerFactory.getLogger(NotificationServiceAdapter.class);
    private static final String SERVICE_NAME = "notification";

    private final WebClient webClient;

    public NotificationServiceAdapter(@Qualifier("notificationWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @CircuitBreaker(name = "notificationCircuitBreaker", fallbackMethod = "deliverCircuitOpenFallback")
    @Retry(name = "notificationRetry", fallbackMethod = "deliverRetryFallback")
    public CompletableFuture<Void> deliver(NotificationRequest request) {
        log.debug("Delivering {} notification to user {}", request.type(), request.userId());

        return webClient.post()
                .uri("/api/notifications")
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new NonRetryableServiceException(
                                        SERVICE_NAME, response.statusCode().value(),
                                        "Notification rejected: " + body))))
                .onStatus(HttpStatusCode::is5xxServerError, response ->
                        Mono.error(new RetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(),
                                "Notification service temporarily unavailable")))
                .toBodilessEntity()
                .then()
                .toFuture();
    }

    @SuppressWarnings("unused")
    private CompletableFuture<Void> deliverCircuitOpenFallback(NotificationRequest request,
                                                               CallNotPermittedException ex) {
        log.warn("Circuit breaker is OPEN for notification service, {} for user {} stays queued",
                request.type(), request.userId());
        return CompletableFuture.failedFuture(
                new ServiceUnavailableException(SERVICE_NAME, "Notification service is unavailable", ex));
    }

    @SuppressWarnings("unused")
    private CompletableFuture<Void> deliverRetryFallback(NotificationRequest request, Throwable throwable) {
        log.error("Notification delivery failed for user {}, cause: {}", request.userId(), throwable.getMessage());

        if (throwable instanceof NonRetryableServiceException) {
            log.warn("Notification service answered {} for user {}, not retrying",
                    ((NonRetryableServiceException) throwable).getStatusCode(), request.userId());
            return CompletableFuture.failedFuture(throwable);
        }
        if (throwable instanceof ServiceUnavailableException) {
            return CompletableFuture.failedFuture(throwable);
        }
        return CompletableFuture.failedFuture(
                new ServiceUnavailableException(SERVICE_NAME, "Notification service is unavailable", throwable));
    }
}
