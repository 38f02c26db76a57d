package com.example.tuckshop.application.service;

import com.example.tuckshop.application.dto.OrderQuery;
import com.example.tuckshop.application.port.in.QueryOrdersUseCase;
import com.example.tuckshop.application.port.out.OrderStorePort;
import com.example.tuckshop.domain.exception.OrderAccessDeniedException;
import com.example.tuckshop.domain.exception.OrderNotFoundException;
import com.example.tuckshop.domain.model.Caller;
import com.example.tuckshop.domain.model.Order;
import com.example.tuckshop.domain.model.OrderNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@Service
public class OrderQueryService implements QueryOrdersUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderQueryService.class);

    private final OrderStorePort orderStorePort;

    public OrderQueryService(OrderStorePort orderStorePort) {
        this.orderStorePort = orderStorePort;
    }

    @Override
    public CompletableFuture<Order> getOrder(Caller caller, OrderNumber orderNumber) {
        return orderStorePort.findByNumber(orderNumber).thenApply(found -> {
            Order order = found.orElseThrow(() -> new OrderNotFoundException(orderNumber));
            if (!caller.isStaff() && !order.isOwnedBy(caller.uid())) {
                log.warn("Customer {} tried to read order {} of another user", caller.uid(), orderNumber);
                throw new OrderAccessDeniedException("Forbidden: Cannot view other users' orders");
            }
            return order;
        });
    }

    @Override
    public CompletableFuture<List<Order>> listOrders(Caller caller, OrderQuery query) {
        if (caller.isStaff()) {
            return orderStorePort.findOrders(query.hasUserId() ? query.userId() : null, query.status());
        }
        if (query.hasUserId() && !query.userId().equals(caller.uid())) {
            log.warn("Customer {} tried to list orders of user {}", caller.uid(), query.userId());
            return CompletableFuture.failedFuture(
                    new OrderAccessDeniedException("Forbidden: Cannot view other users' orders"));
        }
        return orderStorePort.findOrders(caller.uid(), query.status());
    }
}
