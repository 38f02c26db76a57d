package com.example.tuckshop.infrastructure.persistence;

import com.example.tuckshop.application.port.out.StockLedgerPort;
import com.example.tuckshop.domain.model.InventoryItem;
import com.example.tuckshop.domain.model.ItemId;
import com.example.tuckshop.domain.model.RequestedItem;
import com.example.tuckshop.domain.model.StockError;
import com.example.tuckshop.domain.service.StockLedger;
import com.example.tuckshop.domain.service.StockLedger.DeductionPlan;
import com.example.tuckshop.domain.service.StockLedger.RestorationPlan;
import com.example.tuckshop.infrastructure.exception.InventoryReadException;
import com.example.tuckshop.infrastructure.persistence.entity.InventoryItemEntity;
import com.example.tuckshop.infrastructure.persistence.mapper.InventoryPersistenceMapper;
import com.example.tuckshop.infrastructure.persistence.repository.InventoryItemJpaRepository;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Stock ledger backed by the inventory table.
 * <p>
 * Each call reads every referenced record in one query, plans the movement with
 * {@link StockLedger} and writes all changed rows in one flush, all inside one transaction.
 * Version checks make the flush fail if another transaction changed any of the rows since
 * the read; the whole read-plan-write is then retried.
 */
@Component
public class JpaStockLedgerAdapter implements StockLedgerPort {

    private static final Logger log = LoggerFactory.getLogger(JpaStockLedgerAdapter.class);

    private final InventoryItemJpaRepository repository;
    private final InventoryPersistenceMapper mapper;
    private final StockLedger stockLedger;
    private final TransactionTemplate transactionTemplate;
    private final Executor storeExecutor;
    private final Clock clock;

    public JpaStockLedgerAdapter(
            InventoryItemJpaRepository repository,
            InventoryPersistenceMapper mapper,
            StockLedger stockLedger,
            PlatformTransactionManager transactionManager,
            @Qualifier("storeExecutor") Executor storeExecutor,
            Clock clock) {
        this.repository = repository;
        this.mapper = mapper;
        this.stockLedger = stockLedger;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.storeExecutor = storeExecutor;
        this.clock = clock;
    }

    @Override
    @Retry(name = "stockLedgerRetry", fallbackMethod = "deductFallback")
    public CompletableFuture<DeductionResult> deduct(List<RequestedItem> items, String actor) {
        return CompletableFuture.supplyAsync(
                () -> transactionTemplate.execute(status -> deductInTransaction(items, actor)),
                storeExecutor);
    }

    private DeductionResult deductInTransaction(List<RequestedItem> items, String actor) {
        Map<ItemId, InventoryItemEntity> entities = readBatch(items);
        DeductionPlan plan = stockLedger.planDeduction(items, toSnapshot(entities), actor, Instant.now(clock));

        if (plan.isRejected()) {
            log.debug("Deduction rejected with {} errors, nothing written", plan.errors().size());
            return DeductionResult.failure(plan.errors());
        }

        List<InventoryItemEntity> changed = new ArrayList<>();
        for (InventoryItem item : plan.updatedItems()) {
            InventoryItemEntity entity = entities.get(item.getId());
            log.debug("Deducting {}: {} -> {} ({})",
                    item.getId(), entity.getQuantity(), item.getQuantity(), item.getStatus().getValue());
            mapper.copyStock(item, entity);
            changed.add(entity);
        }
        repository.saveAllAndFlush(changed);

        return DeductionResult.success(plan.calculatedPrice(), plan.pricedLines());
    }

    /**
     * Fallback for deductions that still fail after retrying.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<DeductionResult> deductFallback(List<RequestedItem> items, String actor,
                                                             Throwable throwable) {
        Throwable cause = unwrap(throwable);
        log.error("Stock deduction failed for items {}, cause: {}", itemIds(items), cause.getMessage());

        StockError error = cause instanceof InventoryReadException
                ? StockError.readFailed()
                : StockError.commitFailed();
        return CompletableFuture.completedFuture(DeductionResult.failure(List.of(error)));
    }

    @Override
    @Retry(name = "stockLedgerRetry", fallbackMethod = "restoreFallback")
    public CompletableFuture<RestorationResult> restore(List<RequestedItem> items, String actor) {
        return CompletableFuture.supplyAsync(
                () -> transactionTemplate.execute(status -> restoreInTransaction(items, actor)),
                storeExecutor);
    }

    private RestorationResult restoreInTransaction(List<RequestedItem> items, String actor) {
        Map<ItemId, InventoryItemEntity> entities = readBatch(items);
        RestorationPlan plan = stockLedger.planRestoration(items, toSnapshot(entities), actor, Instant.now(clock));

        for (RequestedItem skipped : plan.skipped()) {
            log.warn("Cannot restore stock for \"{}\" ({}) - item not found in inventory",
                    skipped.name(), skipped.itemId().getValue());
        }

        List<InventoryItemEntity> changed = new ArrayList<>();
        for (InventoryItem item : plan.updatedItems()) {
            InventoryItemEntity entity = entities.get(item.getId());
            // Not clamped: stock edited down while the order was open still gets the full amount back.
            log.info("Restoring {}: {} -> {} ({})",
                    item.getId(), entity.getQuantity(), item.getQuantity(), item.getStatus().getValue());
            mapper.copyStock(item, entity);
            changed.add(entity);
        }
        repository.saveAllAndFlush(changed);

        return RestorationResult.success(plan.skipped());
    }

    /**
     * Fallback for restorations that still fail after retrying.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<RestorationResult> restoreFallback(List<RequestedItem> items, String actor,
                                                                Throwable throwable) {
        Throwable cause = unwrap(throwable);
        log.error("Stock restoration failed for items {}, cause: {}", itemIds(items), cause.getMessage());

        String error = cause instanceof InventoryReadException
                ? "Failed to read inventory for restoration."
                : "Failed to restore inventory stock.";
        return CompletableFuture.completedFuture(RestorationResult.failure(error));
    }

    private Map<ItemId, InventoryItemEntity> readBatch(List<RequestedItem> items) {
        List<String> ids = items.stream()
                .map(item -> item.itemId().getValue())
                .distinct()
                .toList();
        try {
            return repository.findAllById(ids).stream()
                    .collect(Collectors.toMap(entity -> ItemId.of(entity.getId()), Function.identity()));
        } catch (DataAccessException e) {
            throw new InventoryReadException("Failed to read inventory records " + ids, e);
        }
    }

    private Map<ItemId, InventoryItem> toSnapshot(Map<ItemId, InventoryItemEntity> entities) {
        return entities.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> mapper.toDomain(entry.getValue())));
    }

    private static List<String> itemIds(List<RequestedItem> items) {
        return items.stream().map(item -> item.itemId().getValue()).toList();
    }

    private static Throwable unwrap(Throwable throwable) {
        return throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause()
                : throwable;
    }
}
