package com.example.tuckshop.application.port.out;

import com.example.tuckshop.domain.model.Order;
import com.example.tuckshop.domain.model.OrderLine;
import com.example.tuckshop.domain.model.OrderNumber;
import com.example.tuckshop.domain.model.OrderStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for order persistence.
 */
public interface OrderStorePort {

    /**
     * Mints the next order number and stores the order in one transaction.
     *
     * @return future containing the stored pending order
     */
    CompletableFuture<Order> insert(NewOrder newOrder);

    CompletableFuture<Optional<Order>> findByNumber(OrderNumber orderNumber);

    /**
     * Sets the status only if it still equals {@code expected}.
     *
     * @return future containing {@code true} if this call made the change
     */
    CompletableFuture<Boolean> compareAndSetStatus(OrderNumber orderNumber, OrderStatus expected, OrderStatus next);

    /**
     * @param userId owner filter, or {@code null} for every user
     * @param status status filter, or {@code null} for every status
     * @return future containing matching orders, newest first
     */
    CompletableFuture<List<Order>> findOrders(String userId, OrderStatus status);

    /**
     * @return future containing {@code true} if an order was deleted
     */
    CompletableFuture<Boolean> delete(OrderNumber orderNumber);

    /**
     * Everything an order needs before it has a number.
     */
    record NewOrder(
            String userId,
            String displayName,
            List<OrderLine> lines,
            Instant orderTime
    ) {
    }
}
