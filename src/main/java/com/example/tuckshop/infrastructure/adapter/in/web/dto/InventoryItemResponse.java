package com.example.tuckshop.infrastructure.adapter.in.web.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record InventoryItemResponse(
        String id,
        String name,
        String description,
        String category,
        BigDecimal price,
        BigDecimal costPrice,
        int quantity,
        int minStockThreshold,
        String status,
        Instant lastUpdated,
        String updatedBy
) {}
