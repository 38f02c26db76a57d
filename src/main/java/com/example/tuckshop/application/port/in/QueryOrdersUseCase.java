package com.example.tuckshop.application.port.in;

import com.example.tuckshop.application.dto.OrderQuery;
import com.example.tuckshop.domain.model.Caller;
import com.example.tuckshop.domain.model.Order;
import com.example.tuckshop.domain.model.OrderNumber;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface QueryOrdersUseCase {

    CompletableFuture<Order> getOrder(Caller caller, OrderNumber orderNumber);

    /**
     * Lists orders newest first. Customers only ever see their own.
     */
    CompletableFuture<List<Order>> listOrders(Caller caller, OrderQuery query);
}
