package com.example.tuckshop.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.math.BigDecimal;

/**
 * Snapshot of one order line, owned by its order row.
 */
@Embeddable
public class OrderLineEmbeddable {

    @Column(name = "item_id", length = 64, nullable = false)
    private String itemId;

    @Column(name = "name", length = 200, nullable = false)
    private String name;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Column(name = "price_at_purchase", precision = 19, scale = 2, nullable = false)
    private BigDecimal priceAtPurchase;

    protected OrderLineEmbeddable() {
    }

    public OrderLineEmbeddable(String itemId, String name, int quantity, BigDecimal priceAtPurchase) {
        this.itemId = itemId;
        this.name = name;
        this.quantity = quantity;
        this.priceAtPurchase = priceAtPurchase;
    }

    public String getItemId() {
        return itemId;
    }

    public String getName() {
        return name;
    }

    public int getQuantity() {
        return quantity;
    }

    public BigDecimal getPriceAtPurchase() {
        return priceAtPurchase;
    }
}
