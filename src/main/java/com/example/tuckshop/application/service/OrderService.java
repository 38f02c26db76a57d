package com.example.tuckshop.application.service;

import com.example.tuckshop.application.dto.CreateOrderCommand;
import com.example.tuckshop.application.dto.CreateOrderCommand.OrderItemDto;
import com.example.tuckshop.application.dto.OrderResult;
import com.example.tuckshop.application.port.in.CreateOrderUseCase;
import com.example.tuckshop.application.port.out.NotificationPort;
import com.example.tuckshop.application.port.out.NotificationPort.Notification;
import com.example.tuckshop.application.port.out.OrderStorePort;
import com.example.tuckshop.application.port.out.OrderStorePort.NewOrder;
import com.example.tuckshop.application.port.out.StockLedgerPort;
import com.example.tuckshop.application.port.out.StockLedgerPort.DeductionResult;
import com.example.tuckshop.domain.exception.OrderAccessDeniedException;
import com.example.tuckshop.domain.model.Caller;
import com.example.tuckshop.domain.model.ItemId;
import com.example.tuckshop.domain.model.Order;
import com.example.tuckshop.domain.model.OrderLine;
import com.example.tuckshop.domain.model.RequestedItem;
import com.example.tuckshop.domain.model.StockError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Application service that orchestrates order creation:
 * authorize, deduct stock, mint the order number, store the pending order.
 */
@Service
public class OrderService implements CreateOrderUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final StockLedgerPort stockLedgerPort;
    private final OrderStorePort orderStorePort;
    private final NotificationPort notificationPort;
    private final Clock clock;

    public OrderService(
            StockLedgerPort stockLedgerPort,
            OrderStorePort orderStorePort,
            NotificationPort notificationPort,
            Clock clock) {
        this.stockLedgerPort = stockLedgerPort;
        this.orderStorePort = orderStorePort;
        this.notificationPort = notificationPort;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<OrderResult> createOrder(Caller caller, CreateOrderCommand command) {
        if (!caller.uid().equals(command.userId())) {
            log.warn("Caller {} tried to place an order for user {}", caller.uid(), command.userId());
            return CompletableFuture.failedFuture(
                    new OrderAccessDeniedException("Forbidden: Cannot place orders for another user"));
        }

        log.info("Creating order for user {} with {} items", command.userId(), command.items().size());

        List<RequestedItem> requested = command.items().stream()
                .map(this::toRequestedItem)
                .toList();

        return stockLedgerPort.deduct(requested, caller.uid())
                .thenCompose(deduction -> {
                    if (!deduction.success()) {
                        log.warn("Stock deduction rejected for user {}: {}",
                                command.userId(), StockError.summarize(deduction.errors()));
                        return CompletableFuture.completedFuture(OrderResult.rejected(deduction.errors()));
                    }
                    return storeOrder(caller, command, deduction);
                });
    }

    private CompletableFuture<OrderResult> storeOrder(Caller caller, CreateOrderCommand command,
                                                      DeductionResult deduction) {
        NewOrder newOrder = new NewOrder(
                command.userId(),
                command.displayName(),
                deduction.pricedLines(),
                Instant.now(clock)
        );

        // Only a failed insert is compensated; once the order is stored nothing may give its stock back.
        return orderStorePort.insert(newOrder)
                .handle((order, failure) -> failure == null
                        ? CompletableFuture.completedFuture(announce(order))
                        : compensate(caller, deduction.pricedLines(), failure))
                .thenCompose(Function.identity());
    }

    private OrderResult announce(Order order) {
        log.info("Order {} created for user {}, total {}",
                order.getOrderNumber(), order.getUserId(), order.getTotalPrice());
        try {
            notificationPort.publish(Notification.orderCreated(order.getUserId(), order.getOrderNumber()));
        } catch (RuntimeException e) {
            log.error("Could not queue order-created notice for order {} (user {})",
                    order.getOrderNumber(), order.getUserId(), e);
        }
        return OrderResult.created(order);
    }

    /**
     * Gives the deducted stock back when the order record could not be written.
     */
    private CompletableFuture<OrderResult> compensate(Caller caller, List<OrderLine> deducted, Throwable cause) {
        log.error("Failed to store order after stock deduction, restoring {} lines", deducted.size(), cause);

        List<RequestedItem> restore = deducted.stream()
                .map(line -> new RequestedItem(line.getItemId(), line.getName(), line.getQuantity()))
                .toList();

        return stockLedgerPort.restore(restore, caller.uid())
                .thenApply(restoration -> {
                    if (!restoration.success()) {
                        log.error("[RECONCILE] Compensating restore failed for items {}: {}",
                                restore.stream().map(item -> item.itemId().getValue()).toList(),
                                restoration.error());
                    }
                    return OrderResult.rejected(List.of(StockError.orderNotSaved()));
                });
    }

    private RequestedItem toRequestedItem(OrderItemDto dto) {
        return new RequestedItem(ItemId.of(dto.itemId()), dto.name(), dto.quantity());
    }
}
