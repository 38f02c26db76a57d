package com.example.tuckshop.domain.model;

import java.util.Objects;

/**
 * One line of an order's contents.
 * Name and price are copies taken from the inventory record when the order was placed,
 * so later edits to the inventory never change a historical order.
 */
public final class OrderLine {

    private final ItemId itemId;
    private final String name;
    private final int quantity;
    private final Money priceAtPurchase;

    private OrderLine(ItemId itemId, String name, int quantity, Money priceAtPurchase) {
        this.itemId = Objects.requireNonNull(itemId, "ItemId cannot be null");
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.priceAtPurchase = Objects.requireNonNull(priceAtPurchase, "PriceAtPurchase cannot be null");
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        this.quantity = quantity;
    }

    /**
     * Creates a priced order line.
     *
     * @param itemId          the inventory item
     * @param name            item name at purchase time
     * @param quantity        the quantity (must be positive)
     * @param priceAtPurchase unit price at purchase time
     * @return new OrderLine instance
     */
    public static OrderLine of(ItemId itemId, String name, int quantity, Money priceAtPurchase) {
        return new OrderLine(itemId, name, quantity, priceAtPurchase);
    }

    /**
     * Calculates the subtotal for this line (quantity * priceAtPurchase).
     *
     * @return the subtotal as Money
     */
    public Money getSubtotal() {
        return priceAtPurchase.multiply(quantity);
    }

    public ItemId getItemId() {
        return itemId;
    }

    public String getName() {
        return name;
    }

    public int getQuantity() {
        return quantity;
    }

    public Money getPriceAtPurchase() {
        return priceAtPurchase;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderLine line = (OrderLine) o;
        return quantity == line.quantity &&
                Objects.equals(itemId, line.itemId) &&
                Objects.equals(name, line.name) &&
                Objects.equals(priceAtPurchase, line.priceAtPurchase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(itemId, name, quantity, priceAtPurchase);
    }

    @Override
    public String toString() {
        return "OrderLine{" +
                "itemId=" + itemId +
                ", name='" + name + '\'' +
                ", quantity=" + quantity +
                ", priceAtPurchase=" + priceAtPurchase +
                '}';
    }
}
