package com.example.tuckshop.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request body for placing an order. Any price or total the client sends is ignored.
 */
public record CreateOrderRequest(
        @NotBlank(message = "userId is required")
        String userId,

        String displayName,

        @JsonProperty("OrderContents")
        @NotEmpty(message = "OrderContents cannot be empty")
        @Valid
        List<OrderItemRequest> orderContents
) {
    public record OrderItemRequest(
            @NotBlank(message = "itemId is required")
            @Size(max = 64, message = "itemId is too long")
            String itemId,

            String name,

            @Positive(message = "Quantity must be positive")
            int quantity
    ) {}
}
