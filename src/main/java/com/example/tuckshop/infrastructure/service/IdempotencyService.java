package com.example.tuckshop.infrastructure.service;

import com.example.tuckshop.application.dto.OrderResult;
import com.example.tuckshop.infrastructure.persistence.entity.IdempotencyRecord;
import com.example.tuckshop.infrastructure.persistence.entity.IdempotencyStatus;
import com.example.tuckshop.infrastructure.persistence.repository.IdempotencyRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Remembers order-creation results per {@code X-Idempotency-Key} so a client can retry
 * a create without placing the order twice.
 */
@Service
public class IdempotencyService {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyService.class);

    private final IdempotencyRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int expiryHours;

    public IdempotencyService(
            IdempotencyRepository repository,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${idempotency.expiry-hours:24}") int expiryHours) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.expiryHours = expiryHours;
    }

    /**
     * Looks up the stored result of a completed request made by the same user.
     *
     * @return the previous result, or empty if the key is unknown, expired, still running
     *         or belongs to another user
     */
    @Transactional(readOnly = true)
    public Optional<OrderResult> getExistingResult(String idempotencyKey, String userId) {
        return repository.findValidByIdempotencyKey(idempotencyKey, clock.instant())
                .filter(record -> record.getStatus() == IdempotencyStatus.COMPLETED)
                .filter(record -> record.getUserId().equals(userId))
                .flatMap(record -> {
                    try {
                        return Optional.of(objectMapper.readValue(record.getResponse(), OrderResult.class));
                    } catch (JsonProcessingException e) {
                        log.error("Failed to deserialize idempotency response for key: {}", idempotencyKey, e);
                        return Optional.empty();
                    }
                });
    }

    @Transactional(readOnly = true)
    public boolean isInProgress(String idempotencyKey) {
        return repository.findValidByIdempotencyKey(idempotencyKey, clock.instant())
                .map(record -> record.getStatus() == IdempotencyStatus.IN_PROGRESS)
                .orElse(false);
    }

    /**
     * Claims the key for a new request.
     *
     * @return {@code false} if another request already holds the key
     */
    public boolean markInProgress(String idempotencyKey, String userId) {
        Instant now = clock.instant();
        Optional<IdempotencyRecord> existing = repository.findById(idempotencyKey);
        if (existing.isPresent()) {
            if (existing.get().getExpiresAt().isAfter(now)) {
                log.debug("Idempotency key already exists: {}", idempotencyKey);
                return false;
            }
            repository.delete(existing.get());
        }
        Instant expiresAt = now.plus(expiryHours, ChronoUnit.HOURS);
        try {
            repository.saveAndFlush(new IdempotencyRecord(idempotencyKey, userId, expiresAt));
        } catch (DataIntegrityViolationException e) {
            log.debug("Idempotency key claimed concurrently: {}", idempotencyKey);
            return false;
        }
        log.debug("Marked idempotency key as in progress: {}", idempotencyKey);
        return true;
    }

    @Transactional
    public void saveResult(String idempotencyKey, OrderResult result) {
        repository.findById(idempotencyKey).ifPresentOrElse(
                record -> {
                    try {
                        record.complete(result.orderId(), objectMapper.writeValueAsString(result));
                        repository.save(record);
                        log.debug("Saved result for idempotency key: {}", idempotencyKey);
                    } catch (JsonProcessingException e) {
                        log.error("Failed to serialize result for idempotency key: {}", idempotencyKey, e);
                    }
                },
                () -> log.warn("No idempotency record found for key: {}", idempotencyKey));
    }

    /**
     * Frees the key after a failure so the client can retry with it.
     */
    @Transactional
    public void release(String idempotencyKey) {
        repository.findById(idempotencyKey).ifPresent(record -> {
            repository.delete(record);
            log.debug("Released idempotency key: {}", idempotencyKey);
        });
    }

    @Scheduled(fixedRate = 3600000)
    @Transactional
    public void cleanupExpiredRecords() {
        int deleted = repository.deleteExpiredRecords(clock.instant());
        if (deleted > 0) {
            log.info("Cleaned up {} expired idempotency records", deleted);
        }
    }
}
