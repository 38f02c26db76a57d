package com.example.tuckshop.application.dto;

import com.example.tuckshop.domain.model.ItemCategory;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Command for adding a stock-keeping record. Optional fields may be {@code null}.
 */
public record CreateInventoryItemCommand(
        String name,
        String description,
        ItemCategory category,
        BigDecimal price,
        BigDecimal costPrice,
        int quantity,
        Integer minStockThreshold
) {
    public CreateInventoryItemCommand {
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(price, "Price cannot be null");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Missing required fields: name, category, price, quantity");
        }
        if (quantity < 0 || price.signum() < 0) {
            throw new IllegalArgumentException("Quantity and price must be non-negative");
        }
        if (costPrice != null && costPrice.signum() < 0) {
            throw new IllegalArgumentException("Cost cannot be negative");
        }
        if (minStockThreshold != null && minStockThreshold < 0) {
            throw new IllegalArgumentException("Minimum stock cannot be negative");
        }
    }
}
