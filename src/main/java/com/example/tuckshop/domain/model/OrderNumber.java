package com.example.tuckshop.domain.model;

/**
 * Value Object for the customer-facing order number (the {@code OrderID}).
 * Numbers are minted by the sequencer, start at 1 and only ever grow.
 * This is not the storage key of the order.
 */
public final class OrderNumber implements Comparable<OrderNumber> {

    private final long value;

    private OrderNumber(long value) {
        this.value = value;
    }

    /**
     * Creates an OrderNumber.
     *
     * @param value the numeric order number
     * @return new OrderNumber instance
     * @throws IllegalArgumentException if value is not positive
     */
    public static OrderNumber of(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Order number must be positive: " + value);
        }
        return new OrderNumber(value);
    }

    public static OrderNumber first() {
        return new OrderNumber(1);
    }

    public OrderNumber next() {
        return new OrderNumber(value + 1);
    }

    public long getValue() {
        return value;
    }

    @Override
    public int compareTo(OrderNumber other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((OrderNumber) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
