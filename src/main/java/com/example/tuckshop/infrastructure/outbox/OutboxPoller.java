package com.example.tuckshop.infrastructure.outbox;

import com.example.tuckshop.infrastructure.adapter.out.notification.NotificationServiceAdapter;
import com.example.tuckshop.infrastructure.adapter.out.notification.dto.NotificationRequest;
import com.example.tuckshop.infrastructure.persistence.entity.OutboxEvent;
import com.example.tuckshop.infrastructure.persistence.entity.OutboxEventStatus;
import com.example.tuckshop.infrastructure.persistence.repository.OutboxRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Delivers queued notifications and retries the ones that failed.
 */
@Component
@ConditionalOnProperty(value = "outbox.poller.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPoller {

    private static final Logger log = LoggerFactory.getLogger(OutboxPoller.class);

    private final OutboxRepository outboxRepository;
    private final NotificationServiceAdapter notificationService;
    private final ObjectMapper objectMapper;
    private final int batchSize;
    private final int maxRetries;
    private final int retentionHours;

    public OutboxPoller(
            OutboxRepository outboxRepository,
            NotificationServiceAdapter notificationService,
            ObjectMapper objectMapper,
            @Value("${outbox.poller.batch-size:100}") int batchSize,
            @Value("${outbox.poller.max-retries:3}") int maxRetries,
            @Value("${outbox.poller.retention-hours:24}") int retentionHours) {
        this.outboxRepository = outboxRepository;
        this.notificationService = notificationService;
        this.objectMapper = objectMapper;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
        this.retentionHours = retentionHours;
    }

    @Scheduled(fixedDelayString = "${outbox.poller.interval-ms:1000}")
    public void pollAndProcess() {
        List<OutboxEvent> events = outboxRepository.findByStatusOrderByCreatedAtAsc(
                OutboxEventStatus.PENDING, PageRequest.of(0, batchSize));

        if (!events.isEmpty()) {
            log.debug("Processing {} pending outbox events", events.size());
        }
        events.forEach(this::processEvent);
    }

    /**
     * Puts failed events that still have retries left back through delivery.
     */
    @Scheduled(fixedDelayString = "${outbox.poller.retry-interval-ms:30000}")
    public void retryFailedEvents() {
        List<OutboxEvent> failedEvents = outboxRepository.findByStatusAndFailedAttemptsLessThanOrderByCreatedAtAsc(
                OutboxEventStatus.FAILED, maxRetries, PageRequest.of(0, batchSize));

        if (!failedEvents.isEmpty()) {
            log.info("Retrying {} failed outbox events", failedEvents.size());
        }
        failedEvents.forEach(this::processEvent);
    }

    @Scheduled(fixedRate = 3600000)
    @Transactional
    public void cleanupProcessedEvents() {
        Instant cutoff = Instant.now().minus(retentionHours, ChronoUnit.HOURS);
        int deleted = outboxRepository.deleteByStatusAndDeliveredAtBefore(OutboxEventStatus.PROCESSED, cutoff);
        if (deleted > 0) {
            log.info("Cleaned up {} processed outbox events older than {} hours", deleted, retentionHours);
        }
    }

    private void processEvent(OutboxEvent event) {
        log.debug("Processing outbox event: {} (type: {}, order: {})",
                event.getId(), event.getNotificationType(), event.getOrderReference());

        event.startDelivery();
        event = outboxRepository.save(event);

        try {
            NotificationRequest request = objectMapper.readValue(event.getPayload(), NotificationRequest.class);
            notificationService.deliver(request).join();
            event.delivered();
            log.info("Delivered {} notification for order {} to user {}",
                    event.getNotificationType(), event.getOrderReference(), event.getRecipient());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            event.deliveryFailed(cause.getMessage());
            log.warn("Notification delivery failed for outbox event {} (attempt {}): {}",
                    event.getId(), event.getFailedAttempts(), cause.getMessage());
        } catch (Exception e) {
            event.deliveryFailed(e.getMessage());
            log.error("Failed to process outbox event: {}", event.getId(), e);
        }
        outboxRepository.save(event);
    }
}
