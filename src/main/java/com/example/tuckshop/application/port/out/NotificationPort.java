package com.example.tuckshop.application.port.out;

import com.example.tuckshop.domain.model.OrderNumber;

import java.util.Objects;

/**
 * Outbound port for user notifications.
 * Publishing never fails the caller; delivery happens later and may be retried.
 */
public interface NotificationPort {

    String ORDER_CREATED = "order-created";
    String ORDER_CANCELLED = "order-cancelled";

    void publish(Notification notification);

    record Notification(
            String userId,
            String type,
            String message,
            String orderReference
    ) {
        public Notification {
            Objects.requireNonNull(userId, "UserId cannot be null");
            Objects.requireNonNull(type, "Type cannot be null");
            Objects.requireNonNull(message, "Message cannot be null");
        }

        public static Notification orderCreated(String userId, OrderNumber orderNumber) {
            return new Notification(userId, ORDER_CREATED,
                    "Your order #" + orderNumber.getValue() + " has been placed.",
                    String.valueOf(orderNumber.getValue()));
        }

        public static Notification orderCancelledByStaff(String userId, OrderNumber orderNumber) {
            return new Notification(userId, ORDER_CANCELLED,
                    "Your order #" + orderNumber.getValue() + " has been cancelled by the staff.",
                    String.valueOf(orderNumber.getValue()));
        }
    }
}
