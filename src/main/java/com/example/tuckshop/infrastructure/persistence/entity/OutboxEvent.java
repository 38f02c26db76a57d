package com.example.tuckshop.infrastructure.persistence.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A notification waiting to be handed to the notification service.
 * Written in its own transaction so that a failed write never undoes the order change
 * that produced it.
 */
@Entity
@Table(name = "outbox_events", indexes = {
    @Index(name = "idx_outbox_status", columnList = "status"),
    @Index(name = "idx_outbox_order_reference", columnList = "order_reference")
})
public class OutboxEvent {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "order_reference", length = 64, nullable = false)
    private String orderReference;

    @Column(name = "notification_type", length = 64, nullable = false)
    private String notificationType;

    @Column(name = "recipient", length = 128, nullable = false)
    private String recipient;

    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "failed_attempts", nullable = false)
    private int failedAttempts;

    @Column(name = "status", length = 32)
    @Enumerated(EnumType.STRING)
    private OutboxEventStatus status = OutboxEventStatus.PENDING;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    protected OutboxEvent() {
    }

    /**
     * @param orderReference   the customer-facing order number
     * @param notificationType e.g. {@code order-cancelled}
     * @param recipient        uid the notification is addressed to
     * @param payload          serialized notification body
     */
    public static OutboxEvent forOrder(String orderReference, String notificationType, String recipient,
                                       String payload) {
        OutboxEvent event = new OutboxEvent();
        event.id = UUID.randomUUID().toString();
        event.orderReference = orderReference;
        event.notificationType = notificationType;
        event.recipient = recipient;
        event.payload = payload;
        event.createdAt = Instant.now();
        return event;
    }

    public String getId() {
        return id;
    }

    public String getOrderReference() {
        return orderReference;
    }

    public String getNotificationType() {
        return notificationType;
    }

    public String getRecipient() {
        return recipient;
    }

    public String getPayload() {
        return payload;
    }

    public Instant getDeliveredAt() {
        return deliveredAt;
    }

    public int getFailedAttempts() {
        return failedAttempts;
    }

    public OutboxEventStatus getStatus() {
        return status;
    }

    public String getLastError() {
        return lastError;
    }

    /**
     * Moves the event to PROCESSING. Failed events go back through here on retry.
     */
    public void startDelivery() {
        this.status = OutboxEventStatus.PROCESSING;
    }

    public void delivered() {
        this.status = OutboxEventStatus.PROCESSED;
        this.deliveredAt = Instant.now();
        this.lastError = null;
    }

    public void deliveryFailed(String error) {
        this.status = OutboxEventStatus.FAILED;
        this.lastError = error;
        this.failedAttempts++;
    }
}
