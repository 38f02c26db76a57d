package com.example.tuckshop.application.dto;

import com.example.tuckshop.domain.model.OrderStatus;

/**
 * Filters for listing orders. Both fields are optional.
 */
public record OrderQuery(
        String userId,
        OrderStatus status
) {
    public static OrderQuery all() {
        return new OrderQuery(null, null);
    }

    public boolean hasUserId() {
        return userId != null && !userId.isBlank();
    }
}
