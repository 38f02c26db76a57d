package com.example.tuckshop.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A stored order as shown to clients.
 */
public record OrderResponse(
        @JsonProperty("OrderID") long orderId,
        @JsonProperty("OrderTime") Instant orderTime,
        String userId,
        String displayName,
        @JsonProperty("OrderContents") List<OrderLineResponse> orderContents,
        @JsonProperty("TotalPrice") BigDecimal totalPrice,
        String status,
        String documentId
) {
    public record OrderLineResponse(
            String itemId,
            String name,
            int quantity,
            BigDecimal priceAtPurchase
    ) {}
}
