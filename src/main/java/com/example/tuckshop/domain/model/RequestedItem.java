package com.example.tuckshop.domain.model;

import java.util.Objects;

/**
 * An item and quantity a caller asks the stock ledger to deduct or restore.
 * The name is only used for messages; prices always come from the inventory record.
 */
public record RequestedItem(
        ItemId itemId,
        String name,
        int quantity
) {
    public RequestedItem {
        Objects.requireNonNull(itemId, "ItemId cannot be null");
        if (name == null || name.isBlank()) {
            name = itemId.getValue();
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
    }

    public static RequestedItem of(String itemId, String name, int quantity) {
        return new RequestedItem(ItemId.of(itemId), name, quantity);
    }
}
