package com.example.tuckshop.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * Request body for adding an inventory item. Range checks happen in the command.
 */
public record InventoryItemRequest(
        @NotBlank(message = "Missing required fields: name, category, price, quantity")
        String name,
        String description,
        @NotBlank(message = "Missing required fields: name, category, price, quantity")
        String category,
        @NotNull(message = "Missing required fields: name, category, price, quantity")
        BigDecimal price,
        BigDecimal costPrice,
        @NotNull(message = "Missing required fields: name, category, price, quantity")
        Integer quantity,
        Integer minStockThreshold
) {}
