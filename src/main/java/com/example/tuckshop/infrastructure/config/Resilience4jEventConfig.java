package com.example.tuckshop.infrastructure.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Logs circuit breaker and retry events with greppable tags.
 * Stock ledger retries show up as {@code [RETRY] name=stockLedgerRetry} when a
 * concurrent update loses the optimistic version check.
 */
@Configuration
public class Resilience4jEventConfig {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jEventConfig.class);

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;

    public Resilience4jEventConfig(CircuitBreakerRegistry circuitBreakerRegistry, RetryRegistry retryRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.retryRegistry = retryRegistry;
    }

    @PostConstruct
    public void registerEventListeners() {
        circuitBreakerRegistry.getAllCircuitBreakers().forEach(this::onCircuitBreaker);
        circuitBreakerRegistry.getEventPublisher()
                .onEntryAdded(event -> onCircuitBreaker(event.getAddedEntry()));

        retryRegistry.getAllRetries().forEach(this::onRetry);
        retryRegistry.getEventPublisher()
                .onEntryAdded(event -> onRetry(event.getAddedEntry()));
    }

    private void onCircuitBreaker(CircuitBreaker circuitBreaker) {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.info("[CB_STATE] name={}, from={}, to={}",
                        event.getCircuitBreakerName(),
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState()))
                .onError(event -> log.warn("[CB_ERROR] name={}, duration={}ms, error={}",
                        event.getCircuitBreakerName(),
                        event.getElapsedDuration().toMillis(),
                        event.getThrowable().getMessage()))
                .onFailureRateExceeded(event -> log.warn("[CB_FAIL_RATE] name={}, failureRate={}%",
                        event.getCircuitBreakerName(),
                        event.getFailureRate()))
                .onCallNotPermitted(event -> log.warn("[CB_REJECTED] name={}, circuit is OPEN",
                        event.getCircuitBreakerName()));
    }

    private void onRetry(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> log.info("[RETRY] name={}, attempt={}, waitDuration={}ms, cause={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "N/A"))
                .onError(event -> log.error("[RETRY_EXHAUSTED] name={}, attempts={}, error={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "N/A"))
                .onSuccess(event -> log.debug("[RETRY_SUCCESS] name={}, attempts={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts()));
    }
}
