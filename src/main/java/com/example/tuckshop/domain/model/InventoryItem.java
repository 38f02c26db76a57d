package com.example.tuckshop.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Stock-keeping record for one item the shop sells.
 * The status is recomputed through {@link StockStatus#derive} whenever quantity or threshold changes.
 */
public final class InventoryItem {

    public static final int DEFAULT_MIN_STOCK_THRESHOLD = 10;

    private final ItemId id;
    private final String name;
    private final String description;
    private final ItemCategory category;
    private final Money price;
    private final Money costPrice;
    private final int quantity;
    private final int minStockThreshold;
    private final StockStatus status;
    private final Instant lastUpdated;
    private final String updatedBy;

    private InventoryItem(ItemId id, String name, String description, ItemCategory category,
                          Money price, Money costPrice, int quantity, int minStockThreshold,
                          Instant lastUpdated, String updatedBy) {
        this.id = Objects.requireNonNull(id, "ItemId cannot be null");
        this.category = Objects.requireNonNull(category, "Category cannot be null");
        this.price = Objects.requireNonNull(price, "Price cannot be null");
        this.costPrice = Objects.requireNonNull(costPrice, "CostPrice cannot be null");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Item name cannot be blank");
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + quantity);
        }
        if (minStockThreshold < 0) {
            throw new IllegalArgumentException("Minimum stock threshold cannot be negative: " + minStockThreshold);
        }
        this.name = name.trim();
        this.description = description == null ? "" : description.trim();
        this.quantity = quantity;
        this.minStockThreshold = minStockThreshold;
        this.status = StockStatus.derive(quantity, minStockThreshold);
        this.lastUpdated = lastUpdated;
        this.updatedBy = updatedBy;
    }

    /**
     * Creates a new inventory record stamped with the creator.
     *
     * @param minStockThreshold threshold, or {@code null} for the default of 10
     * @param costPrice         cost price, or {@code null} for zero
     */
    public static InventoryItem create(ItemId id, String name, String description, ItemCategory category,
                                       Money price, Money costPrice, int quantity, Integer minStockThreshold,
                                       String createdBy, Instant createdAt) {
        return new InventoryItem(
                id, name, description, category, price,
                costPrice == null ? Money.zero() : costPrice,
                quantity,
                minStockThreshold == null ? DEFAULT_MIN_STOCK_THRESHOLD : minStockThreshold,
                Objects.requireNonNull(createdAt, "CreatedAt cannot be null"),
                createdBy
        );
    }

    public static InventoryItem reconstitute(ItemId id, String name, String description, ItemCategory category,
                                             Money price, Money costPrice, int quantity, int minStockThreshold,
                                             Instant lastUpdated, String updatedBy) {
        return new InventoryItem(id, name, description, category, price, costPrice,
                quantity, minStockThreshold, lastUpdated, updatedBy);
    }

    /**
     * Returns a copy holding the given quantity. Used by the stock ledger.
     */
    public InventoryItem withQuantity(int newQuantity, String updatedBy, Instant at) {
        return new InventoryItem(id, name, description, category, price, costPrice,
                newQuantity, minStockThreshold, at, updatedBy);
    }

    /**
     * Applies a partial manual edit. {@code null} arguments leave the field unchanged.
     */
    public InventoryItem revise(String newName, String newDescription, ItemCategory newCategory,
                                Money newPrice, Money newCostPrice, Integer newQuantity,
                                Integer newMinStockThreshold, String editedBy, Instant at) {
        return new InventoryItem(
                id,
                newName != null ? newName : name,
                newDescription != null ? newDescription : description,
                newCategory != null ? newCategory : category,
                newPrice != null ? newPrice : price,
                newCostPrice != null ? newCostPrice : costPrice,
                newQuantity != null ? newQuantity : quantity,
                newMinStockThreshold != null ? newMinStockThreshold : minStockThreshold,
                Objects.requireNonNull(at, "Edit time cannot be null"),
                editedBy
        );
    }

    public ItemId getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public ItemCategory getCategory() {
        return category;
    }

    public Money getPrice() {
        return price;
    }

    public Money getCostPrice() {
        return costPrice;
    }

    public int getQuantity() {
        return quantity;
    }

    public int getMinStockThreshold() {
        return minStockThreshold;
    }

    public StockStatus getStatus() {
        return status;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public String getUpdatedBy() {
        return updatedBy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((InventoryItem) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "InventoryItem{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", quantity=" + quantity +
                ", status=" + status +
                '}';
    }
}
