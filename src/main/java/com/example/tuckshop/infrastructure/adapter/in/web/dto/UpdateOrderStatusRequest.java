package com.example.tuckshop.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record UpdateOrderStatusRequest(
        @JsonProperty("OrderID")
        @NotNull(message = "OrderID is required")
        @Positive(message = "OrderID must be positive")
        Long orderId,

        @NotBlank(message = "status is required")
        String status
) {}
