package com.example.tuckshop.application.dto;

import com.example.tuckshop.domain.model.ItemCategory;

import java.math.BigDecimal;

/**
 * Partial edit of a stock-keeping record; {@code null} leaves a field as it is.
 */
public record UpdateInventoryItemCommand(
        String name,
        String description,
        ItemCategory category,
        BigDecimal price,
        BigDecimal costPrice,
        Integer quantity,
        Integer minStockThreshold
) {
    public UpdateInventoryItemCommand {
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("Name field cannot be empty");
        }
        if (quantity != null && quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative");
        }
        if (price != null && price.signum() < 0) {
            throw new IllegalArgumentException("Price cannot be negative");
        }
        if (costPrice != null && costPrice.signum() < 0) {
            throw new IllegalArgumentException("Cost cannot be negative");
        }
        if (minStockThreshold != null && minStockThreshold < 0) {
            throw new IllegalArgumentException("Minimum stock cannot be negative");
        }
    }
}
