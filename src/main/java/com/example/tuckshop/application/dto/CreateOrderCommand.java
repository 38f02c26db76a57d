package com.example.tuckshop.application.dto;

import java.util.List;
import java.util.Objects;

/**
 * Command for placing a new order. Client-side prices and totals are never part of it.
 */
public record CreateOrderCommand(
        String userId,
        String displayName,
        List<OrderItemDto> items
) {
    public CreateOrderCommand {
        Objects.requireNonNull(items, "Items cannot be null");
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("UserId cannot be blank");
        }
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Order must contain at least one item");
        }
        items = List.copyOf(items);
    }

    /**
     * DTO for one requested line.
     */
    public record OrderItemDto(
            String itemId,
            String name,
            int quantity
    ) {
        public OrderItemDto {
            if (itemId == null || itemId.isBlank()) {
                throw new IllegalArgumentException("ItemId cannot be blank");
            }
            if (quantity <= 0) {
                throw new IllegalArgumentException("Quantity must be positive");
            }
        }
    }
}
