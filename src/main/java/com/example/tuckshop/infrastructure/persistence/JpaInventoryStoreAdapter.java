package com.example.tuckshop.infrastructure.persistence;

import com.example.tuckshop.application.port.out.InventoryStorePort;
import com.example.tuckshop.domain.model.InventoryItem;
import com.example.tuckshop.domain.model.ItemId;
import com.example.tuckshop.infrastructure.persistence.entity.InventoryItemEntity;
import com.example.tuckshop.infrastructure.persistence.mapper.InventoryPersistenceMapper;
import com.example.tuckshop.infrastructure.persistence.repository.InventoryItemJpaRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;

@Component
public class JpaInventoryStoreAdapter implements InventoryStorePort {

    private final InventoryItemJpaRepository repository;
    private final InventoryPersistenceMapper mapper;
    private final TransactionTemplate transactionTemplate;
    private final Executor storeExecutor;

    public JpaInventoryStoreAdapter(
            InventoryItemJpaRepository repository,
            InventoryPersistenceMapper mapper,
            PlatformTransactionManager transactionManager,
            @Qualifier("storeExecutor") Executor storeExecutor) {
        this.repository = repository;
        this.mapper = mapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.storeExecutor = storeExecutor;
    }

    @Override
    public CompletableFuture<InventoryItem> insert(InventoryItem item) {
        return CompletableFuture.supplyAsync(() -> transactionTemplate.execute(status ->
                mapper.toDomain(repository.saveAndFlush(mapper.toEntity(item)))), storeExecutor);
    }

    @Override
    public CompletableFuture<Optional<InventoryItem>> findById(ItemId itemId) {
        return CompletableFuture.supplyAsync(() ->
                repository.findById(itemId.getValue()).map(mapper::toDomain), storeExecutor);
    }

    @Override
    public CompletableFuture<List<InventoryItem>> findAll() {
        return CompletableFuture.supplyAsync(() -> repository.findAllByOrderByNameAsc().stream()
                .map(mapper::toDomain)
                .toList(), storeExecutor);
    }

    @Override
    public CompletableFuture<Optional<InventoryItem>> update(ItemId itemId, UnaryOperator<InventoryItem> change) {
        return CompletableFuture.supplyAsync(() -> transactionTemplate.execute(status -> {
            Optional<InventoryItemEntity> found = repository.findById(itemId.getValue());
            if (found.isEmpty()) {
                return Optional.<InventoryItem>empty();
            }
            InventoryItemEntity entity = found.get();
            InventoryItem updated = change.apply(mapper.toDomain(entity));
            mapper.copyInto(updated, entity);
            return Optional.of(mapper.toDomain(repository.saveAndFlush(entity)));
        }), storeExecutor);
    }

    @Override
    public CompletableFuture<Boolean> delete(ItemId itemId) {
        return CompletableFuture.supplyAsync(() -> transactionTemplate.execute(status -> {
            if (!repository.existsById(itemId.getValue())) {
                return false;
            }
            repository.deleteById(itemId.getValue());
            return true;
        }), storeExecutor);
    }
}
