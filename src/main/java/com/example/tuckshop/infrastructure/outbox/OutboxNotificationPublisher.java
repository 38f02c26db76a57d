package com.example.tuckshop.infrastructure.outbox;

import com.example.tuckshop.application.port.out.NotificationPort;
import com.example.tuckshop.infrastructure.adapter.out.notification.dto.NotificationRequest;
import com.example.tuckshop.infrastructure.persistence.entity.OutboxEvent;
import com.example.tuckshop.infrastructure.persistence.repository.OutboxRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Queues notifications in the outbox table; {@link OutboxPoller} delivers them later.
 * A notification that cannot be queued is logged and dropped so the order operation
 * that triggered it still succeeds.
 */
@Component
public class OutboxNotificationPublisher implements NotificationPort {

    private static final Logger log = LoggerFactory.getLogger(OutboxNotificationPublisher.class);

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public OutboxNotificationPublisher(OutboxRepository outboxRepository, ObjectMapper objectMapper,
                                       PlatformTransactionManager transactionManager) {
        this.outboxRepository = outboxRepository;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public void publish(Notification notification) {
        try {
            String payload = objectMapper.writeValueAsString(NotificationRequest.from(notification));
            OutboxEvent event = OutboxEvent.forOrder(
                    notification.orderReference(), notification.type(), notification.userId(), payload);
            transactionTemplate.executeWithoutResult(status -> outboxRepository.save(event));
            log.debug("Queued {} notification {} for user {}", notification.type(), event.getId(),
                    notification.userId());
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to queue {} notification for user {} (order {})",
                    notification.type(), notification.userId(), notification.orderReference(), e);
        }
    }
}
