package com.example.tuckshop.domain.exception;

import com.example.tuckshop.domain.model.OrderNumber;

public class OrderNotFoundException extends DomainException {

    private final OrderNumber orderNumber;

    public OrderNotFoundException(OrderNumber orderNumber) {
        super("Order not found: " + orderNumber);
        this.orderNumber = orderNumber;
    }

    public OrderNumber getOrderNumber() {
        return orderNumber;
    }
}
