package com.example.tuckshop.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Aggregate Root representing a customer order.
 * Everything except the status is fixed when the order is placed.
 */
public final class Order {

    private final String documentId;
    private final OrderNumber orderNumber;
    private final Instant orderTime;
    private final String userId;
    private final String displayName;
    private final List<OrderLine> lines;
    private final Money totalPrice;
    private OrderStatus status;

    private Order(String documentId, OrderNumber orderNumber, Instant orderTime, String userId,
                  String displayName, List<OrderLine> lines, Money totalPrice, OrderStatus status) {
        this.documentId = Objects.requireNonNull(documentId, "DocumentId cannot be null");
        this.orderNumber = Objects.requireNonNull(orderNumber, "OrderNumber cannot be null");
        this.orderTime = Objects.requireNonNull(orderTime, "OrderTime cannot be null");
        this.userId = Objects.requireNonNull(userId, "UserId cannot be null");
        this.displayName = displayName == null ? "" : displayName;
        this.lines = new ArrayList<>(Objects.requireNonNull(lines, "Lines cannot be null"));
        this.totalPrice = Objects.requireNonNull(totalPrice, "TotalPrice cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");

        if (lines.isEmpty()) {
            throw new IllegalArgumentException("Order must have at least one item");
        }
    }

    /**
     * Places a new pending order. The total is computed from the priced lines.
     *
     * @param orderNumber the freshly minted order number
     * @param userId      owner of the order
     * @param displayName customer name at the time of purchase
     * @param lines       priced snapshot lines (must not be empty)
     * @param orderTime   server time of placement
     * @return new Order in PENDING status
     */
    public static Order place(OrderNumber orderNumber, String userId, String displayName,
                              List<OrderLine> lines, Instant orderTime) {
        return new Order(
                UUID.randomUUID().toString(),
                orderNumber,
                orderTime,
                userId,
                displayName,
                lines,
                totalOf(lines),
                OrderStatus.PENDING
        );
    }

    /**
     * Reconstitutes an Order from persistence.
     */
    public static Order reconstitute(String documentId, OrderNumber orderNumber, Instant orderTime,
                                     String userId, String displayName, List<OrderLine> lines,
                                     Money totalPrice, OrderStatus status) {
        return new Order(documentId, orderNumber, orderTime, userId, displayName, lines, totalPrice, status);
    }

    private static Money totalOf(List<OrderLine> lines) {
        return lines.stream()
                .map(OrderLine::getSubtotal)
                .reduce(Money.zero(), Money::add);
    }

    /**
     * Moves the order to a new status. Who may request which move is decided by
     * {@code OrderTransitionPolicy}; this only guards against leaving a terminal state.
     *
     * @throws IllegalStateException if the order is completed or cancellation was acknowledged
     */
    public void changeStatus(OrderStatus newStatus) {
        Objects.requireNonNull(newStatus, "Status cannot be null");
        if (status == OrderStatus.COMPLETED || status == OrderStatus.CANCELLED_ACKNOWLEDGED) {
            throw new IllegalStateException("Cannot transition from terminal status " + status + " to " + newStatus);
        }
        this.status = newStatus;
    }

    public boolean isOwnedBy(String uid) {
        return userId.equals(uid);
    }

    /**
     * The contents expressed as stock movements, for restoring inventory on cancellation.
     */
    public List<RequestedItem> toRequestedItems() {
        return lines.stream()
                .map(line -> new RequestedItem(line.getItemId(), line.getName(), line.getQuantity()))
                .toList();
    }

    public String getDocumentId() {
        return documentId;
    }

    public OrderNumber getOrderNumber() {
        return orderNumber;
    }

    public Instant getOrderTime() {
        return orderTime;
    }

    public String getUserId() {
        return userId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<OrderLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public Money getTotalPrice() {
        return totalPrice;
    }

    public OrderStatus getStatus() {
        return status;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Order order = (Order) o;
        return Objects.equals(documentId, order.documentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId);
    }

    @Override
    public String toString() {
        return "Order{" +
                "orderNumber=" + orderNumber +
                ", userId='" + userId + '\'' +
                ", status=" + status +
                ", itemCount=" + lines.size() +
                ", totalPrice=" + totalPrice +
                '}';
    }
}
