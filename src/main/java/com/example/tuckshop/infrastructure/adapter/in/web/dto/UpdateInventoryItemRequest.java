package com.example.tuckshop.infrastructure.adapter.in.web.dto;

import java.math.BigDecimal;

/**
 * Partial update; omitted fields are left unchanged.
 */
public record UpdateInventoryItemRequest(
        String name,
        String description,
        String category,
        BigDecimal price,
        BigDecimal costPrice,
        Integer quantity,
        Integer minStockThreshold
) {}
