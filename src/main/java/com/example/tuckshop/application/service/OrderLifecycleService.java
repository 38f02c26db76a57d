package com.example.tuckshop.application.service;

import com.example.tuckshop.application.dto.StatusUpdateResult;
import com.example.tuckshop.application.dto.StatusUpdateResult.Rejection;
import com.example.tuckshop.application.dto.UpdateOrderStatusCommand;
import com.example.tuckshop.application.port.in.DeleteOrderUseCase;
import com.example.tuckshop.application.port.in.UpdateOrderStatusUseCase;
import com.example.tuckshop.application.port.out.NotificationPort;
import com.example.tuckshop.application.port.out.NotificationPort.Notification;
import com.example.tuckshop.application.port.out.OrderStorePort;
import com.example.tuckshop.application.port.out.StockLedgerPort;
import com.example.tuckshop.application.port.out.StockLedgerPort.RestorationResult;
import com.example.tuckshop.domain.exception.OrderNotFoundException;
import com.example.tuckshop.domain.exception.StaffOnlyException;
import com.example.tuckshop.domain.model.Caller;
import com.example.tuckshop.domain.model.Order;
import com.example.tuckshop.domain.model.OrderNumber;
import com.example.tuckshop.domain.model.OrderStatus;
import com.example.tuckshop.domain.model.RequestedItem;
import com.example.tuckshop.domain.service.OrderTransitionPolicy;
import com.example.tuckshop.domain.service.OrderTransitionPolicy.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Moves orders through their lifecycle and restores stock on cancellation.
 * <p>
 * A transition is claimed with a conditional status write before any side effect runs.
 * Only the request that wins the claim restores inventory; a request that loses it
 * re-reads the order and is judged again against the new status.
 */
@Service
public class OrderLifecycleService implements UpdateOrderStatusUseCase, DeleteOrderUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleService.class);

    // Every lost claim means another transition happened; the longest path has three.
    private static final int MAX_CLAIM_ATTEMPTS = 4;

    private final OrderStorePort orderStorePort;
    private final StockLedgerPort stockLedgerPort;
    private final NotificationPort notificationPort;
    private final OrderTransitionPolicy transitionPolicy;

    public OrderLifecycleService(
            OrderStorePort orderStorePort,
            StockLedgerPort stockLedgerPort,
            NotificationPort notificationPort,
            OrderTransitionPolicy transitionPolicy) {
        this.orderStorePort = orderStorePort;
        this.stockLedgerPort = stockLedgerPort;
        this.notificationPort = notificationPort;
        this.transitionPolicy = transitionPolicy;
    }

    @Override
    public CompletableFuture<StatusUpdateResult> updateStatus(Caller caller, UpdateOrderStatusCommand command) {
        log.info("Status change requested by {} ({}): order {} -> {}",
                caller.uid(), caller.role().getValue(), command.orderNumber(), command.status().getValue());
        return attempt(caller, command, 1)
                .exceptionally(failure -> {
                    Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                            ? failure.getCause() : failure;
                    log.error("Status change of order {} to {} failed", command.orderNumber(),
                            command.status().getValue(), cause);
                    return StatusUpdateResult.rejected(Rejection.PROCESSING_ERROR, command.orderNumber(),
                            "Unable to update the order right now. Please try again.");
                });
    }

    private CompletableFuture<StatusUpdateResult> attempt(Caller caller, UpdateOrderStatusCommand command,
                                                          int attemptNumber) {
        OrderNumber orderNumber = command.orderNumber();

        return orderStorePort.findByNumber(orderNumber).thenCompose(found -> {
            if (found.isEmpty()) {
                return CompletableFuture.completedFuture(
                        StatusUpdateResult.rejected(Rejection.NOT_FOUND, orderNumber, "Order not found"));
            }

            Order order = found.get();
            Decision decision = transitionPolicy.evaluate(caller, order, command.status());

            return switch (decision) {
                case FORBIDDEN -> {
                    log.warn("Forbidden status change on order {} by {} ({}): {} -> {}",
                            orderNumber, caller.uid(), caller.role().getValue(),
                            order.getStatus().getValue(), command.status().getValue());
                    yield CompletableFuture.completedFuture(StatusUpdateResult.rejected(
                            Rejection.FORBIDDEN, orderNumber, forbiddenMessage(caller, order)));
                }
                case INVALID_TRANSITION -> {
                    log.warn("Invalid transition on order {}: {} -> {}",
                            orderNumber, order.getStatus().getValue(), command.status().getValue());
                    yield CompletableFuture.completedFuture(StatusUpdateResult.rejected(
                            Rejection.INVALID_TRANSITION, orderNumber,
                            "Cannot change order status from " + order.getStatus().getValue()
                                    + " to " + command.status().getValue()));
                }
                case NO_OP -> {
                    log.info("Order {} is already {}, nothing to cancel", orderNumber, order.getStatus().getValue());
                    yield CompletableFuture.completedFuture(
                            StatusUpdateResult.unchanged(orderNumber, order.getStatus()));
                }
                case ALLOWED -> claim(caller, command, order, attemptNumber);
            };
        });
    }

    private CompletableFuture<StatusUpdateResult> claim(Caller caller, UpdateOrderStatusCommand command,
                                                        Order order, int attemptNumber) {
        OrderStatus from = order.getStatus();
        OrderStatus to = command.status();

        return orderStorePort.compareAndSetStatus(order.getOrderNumber(), from, to).thenCompose(claimed -> {
            if (!claimed) {
                if (attemptNumber >= MAX_CLAIM_ATTEMPTS) {
                    log.error("Order {} kept changing while moving to {}, giving up after {} claims",
                            order.getOrderNumber(), to.getValue(), attemptNumber);
                    return CompletableFuture.completedFuture(StatusUpdateResult.rejected(
                            Rejection.PROCESSING_ERROR, order.getOrderNumber(),
                            "Order is being changed by another request. Please try again."));
                }
                log.debug("Order {} left status {} concurrently, re-evaluating", order.getOrderNumber(), from);
                return attempt(caller, command, attemptNumber + 1);
            }

            order.changeStatus(to);
            log.info("Order {} moved {} -> {} by {}",
                    order.getOrderNumber(), from.getValue(), to.getValue(), caller.uid());

            if (!transitionPolicy.restoresStock(from, to)) {
                return CompletableFuture.completedFuture(
                        StatusUpdateResult.applied(order.getOrderNumber(), to, null));
            }
            return restoreStock(caller, order);
        });
    }

    private CompletableFuture<StatusUpdateResult> restoreStock(Caller caller, Order order) {
        return stockLedgerPort.restore(order.toRequestedItems(), caller.uid())
                .exceptionally(failure -> RestorationResult.failure(String.valueOf(failure.getMessage())))
                .thenApply(restoration -> {
                    if (restoration.success()) {
                        log.info("Inventory restored for cancelled order {}", order.getOrderNumber());
                        for (RequestedItem skipped : restoration.skippedItems()) {
                            log.warn("[RECONCILE] Order {}: {} x \"{}\" ({}) not restored, item no longer exists",
                                    order.getOrderNumber(), skipped.quantity(), skipped.name(),
                                    skipped.itemId().getValue());
                        }
                    } else {
                        log.error("[RECONCILE] Order {} cancelled but inventory restore failed for items {}: {}",
                                order.getOrderNumber(),
                                order.getLines().stream().map(line -> line.getItemId().getValue()).toList(),
                                restoration.error());
                    }

                    if (caller.isStaff()) {
                        notifyCustomer(order);
                    }
                    return StatusUpdateResult.applied(order.getOrderNumber(), OrderStatus.CANCELLED,
                            restoration.success());
                });
    }

    // The cancellation is already committed; a notification that cannot be queued must not undo it.
    private void notifyCustomer(Order order) {
        try {
            notificationPort.publish(Notification.orderCancelledByStaff(order.getUserId(), order.getOrderNumber()));
        } catch (RuntimeException e) {
            log.error("Could not queue cancellation notice for order {} (user {})",
                    order.getOrderNumber(), order.getUserId(), e);
        }
    }

    private static String forbiddenMessage(Caller caller, Order order) {
        if (!order.isOwnedBy(caller.uid())) {
            return "Forbidden: Cannot modify other users' orders";
        }
        if (order.getStatus() != OrderStatus.PENDING) {
            return "Forbidden: Only pending orders can be cancelled";
        }
        return "Forbidden: Customers can only cancel orders";
    }

    @Override
    public CompletableFuture<Void> deleteOrder(Caller caller, OrderNumber orderNumber) {
        if (!caller.isStaff()) {
            log.warn("Customer {} tried to delete order {}", caller.uid(), orderNumber);
            return CompletableFuture.failedFuture(new StaffOnlyException("delete orders"));
        }

        return orderStorePort.delete(orderNumber).thenAccept(deleted -> {
            if (!deleted) {
                throw new OrderNotFoundException(orderNumber);
            }
            log.info("Order {} deleted by {}", orderNumber, caller.uid());
        });
    }
}
