package com.example.tuckshop.domain.model;

import java.util.Arrays;

/**
 * Enum representing the possible states of an Order.
 */
public enum OrderStatus {

    /**
     * Initial state. Stock has already been deducted.
     */
    PENDING("pending"),

    /**
     * Staff has started preparing the order.
     */
    IN_PROGRESS("in-progress"),

    /**
     * Order has been handed over. Terminal.
     */
    COMPLETED("completed"),

    /**
     * Order was cancelled and its stock returned to inventory.
     */
    CANCELLED("cancelled"),

    /**
     * Staff has seen the cancellation. Terminal.
     */
    CANCELLED_ACKNOWLEDGED("cancelled-acknowledged");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isCancelled() {
        return this == CANCELLED || this == CANCELLED_ACKNOWLEDGED;
    }

    /**
     * Resolves a status from its wire value, e.g. {@code in-progress}.
     *
     * @throws IllegalArgumentException if the value names no status
     */
    public static OrderStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown order status: " + value));
    }
}
