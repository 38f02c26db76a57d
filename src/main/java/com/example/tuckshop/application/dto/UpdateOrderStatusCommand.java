package com.example.tuckshop.application.dto;

import com.example.tuckshop.domain.model.OrderNumber;
import com.example.tuckshop.domain.model.OrderStatus;

import java.util.Objects;

public record UpdateOrderStatusCommand(
        OrderNumber orderNumber,
        OrderStatus status
) {
    public UpdateOrderStatusCommand {
        Objects.requireNonNull(orderNumber, "OrderNumber cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
    }
}
