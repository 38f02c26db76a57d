package com.example.tuckshop.application.dto;

import com.example.tuckshop.domain.model.OrderNumber;
import com.example.tuckshop.domain.model.OrderStatus;

/**
 * Result of a status update request.
 *
 * @param inventoryRestored {@code null} when the transition does not touch inventory,
 *                          otherwise whether restoring the order's stock succeeded
 */
public record StatusUpdateResult(
        boolean success,
        long orderId,
        OrderStatus status,
        Rejection rejection,
        Boolean inventoryRestored,
        String message
) {
    public enum Rejection {
        FORBIDDEN("forbidden"),
        NOT_FOUND("not-found"),
        INVALID_TRANSITION("invalid-transition"),
        /** Store failure or too much contention; nothing was changed and the request may be retried. */
        PROCESSING_ERROR("processing_error");

        private final String value;

        Rejection(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    public static StatusUpdateResult applied(OrderNumber orderNumber, OrderStatus status, Boolean inventoryRestored) {
        String message = Boolean.FALSE.equals(inventoryRestored)
                ? "Order status updated, but inventory could not be restored"
                : "Order status updated";
        return new StatusUpdateResult(true, orderNumber.getValue(), status, null, inventoryRestored, message);
    }

    public static StatusUpdateResult unchanged(OrderNumber orderNumber, OrderStatus status) {
        return new StatusUpdateResult(true, orderNumber.getValue(), status, null, null, "Order is already cancelled");
    }

    public static StatusUpdateResult rejected(Rejection rejection, OrderNumber orderNumber, String message) {
        return new StatusUpdateResult(false, orderNumber.getValue(), null, rejection, null, message);
    }
}
