package com.example.tuckshop.domain.service;

import com.example.tuckshop.domain.model.InventoryItem;
import com.example.tuckshop.domain.model.ItemId;
import com.example.tuckshop.domain.model.Money;
import com.example.tuckshop.domain.model.OrderLine;
import com.example.tuckshop.domain.model.RequestedItem;
import com.example.tuckshop.domain.model.StockError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes stock movements against one consistent snapshot of inventory records.
 * <p>
 * The ledger never touches storage. Callers read every referenced record in one batch,
 * ask for a plan, and write {@code updatedItems} back as one atomic batch only when the
 * plan carries no errors. Lines naming the same item draw down a shared running quantity.
 */
public final class StockLedger {

    /**
     * Plans the deduction of an order's contents.
     *
     * @param requested the order contents, in order
     * @param snapshot  current records keyed by id; ids missing from the map are treated as deleted
     * @param actor     uid stamped into {@code updatedBy}
     * @param at        time stamped into {@code lastUpdated}
     * @return the plan; rejected when any line is missing or over-drawn
     */
    public DeductionPlan planDeduction(List<RequestedItem> requested, Map<ItemId, InventoryItem> snapshot,
                                       String actor, Instant at) {
        requireLines(requested);
        Map<ItemId, InventoryItem> staged = new LinkedHashMap<>();
        List<StockError> errors = new ArrayList<>();
        List<OrderLine> pricedLines = new ArrayList<>();
        Money calculatedPrice = Money.zero();

        for (RequestedItem line : requested) {
            InventoryItem current = staged.getOrDefault(line.itemId(), snapshot.get(line.itemId()));
            if (current == null) {
                errors.add(StockError.itemNotFound(line.name()));
                continue;
            }
            if (line.quantity() > current.getQuantity()) {
                errors.add(StockError.insufficientStock(line.name(), line.quantity(), current.getQuantity()));
                continue;
            }
            staged.put(line.itemId(), current.withQuantity(current.getQuantity() - line.quantity(), actor, at));
            pricedLines.add(OrderLine.of(current.getId(), current.getName(), line.quantity(), current.getPrice()));
            calculatedPrice = calculatedPrice.add(current.getPrice().multiply(line.quantity()));
        }

        if (!errors.isEmpty()) {
            return DeductionPlan.rejected(errors);
        }
        return new DeductionPlan(List.of(), List.copyOf(staged.values()), List.copyOf(pricedLines), calculatedPrice);
    }

    /**
     * Plans the restoration of a cancelled order's contents. Ids missing from the snapshot
     * are reported in {@code skipped} and do not stop the other lines.
     */
    public RestorationPlan planRestoration(List<RequestedItem> requested, Map<ItemId, InventoryItem> snapshot,
                                           String actor, Instant at) {
        requireLines(requested);
        Map<ItemId, InventoryItem> staged = new LinkedHashMap<>();
        List<RequestedItem> skipped = new ArrayList<>();

        for (RequestedItem line : requested) {
            InventoryItem current = staged.getOrDefault(line.itemId(), snapshot.get(line.itemId()));
            if (current == null) {
                skipped.add(line);
                continue;
            }
            staged.put(line.itemId(), current.withQuantity(current.getQuantity() + line.quantity(), actor, at));
        }

        return new RestorationPlan(List.copyOf(staged.values()), List.copyOf(skipped));
    }

    private static void requireLines(List<RequestedItem> requested) {
        Objects.requireNonNull(requested, "Requested items cannot be null");
        if (requested.isEmpty()) {
            throw new IllegalArgumentException("Requested items cannot be empty");
        }
    }

    /**
     * Outcome of {@link #planDeduction}.
     */
    public record DeductionPlan(
            List<StockError> errors,
            List<InventoryItem> updatedItems,
            List<OrderLine> pricedLines,
            Money calculatedPrice
    ) {
        static DeductionPlan rejected(List<StockError> errors) {
            return new DeductionPlan(List.copyOf(errors), List.of(), List.of(), Money.zero());
        }

        public boolean isRejected() {
            return !errors.isEmpty();
        }
    }

    /**
     * Outcome of {@link #planRestoration}.
     */
    public record RestorationPlan(
            List<InventoryItem> updatedItems,
            List<RequestedItem> skipped
    ) {
    }
}
