package com.example.tuckshop.infrastructure.persistence;

import com.example.tuckshop.application.port.out.OrderStorePort;
import com.example.tuckshop.domain.model.Order;
import com.example.tuckshop.domain.model.OrderNumber;
import com.example.tuckshop.domain.model.OrderStatus;
import com.example.tuckshop.infrastructure.persistence.entity.OrderEntity;
import com.example.tuckshop.infrastructure.persistence.entity.OrderStatusEnum;
import com.example.tuckshop.infrastructure.persistence.mapper.OrderPersistenceMapper;
import com.example.tuckshop.infrastructure.persistence.repository.OrderJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Order store backed by JPA. Blocking work runs on the store executor.
 */
@Component
public class JpaOrderStoreAdapter implements OrderStorePort {

    private static final Logger log = LoggerFactory.getLogger(JpaOrderStoreAdapter.class);

    private final OrderJpaRepository repository;
    private final OrderPersistenceMapper mapper;
    private final OrderNumberSequencer sequencer;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final Executor storeExecutor;

    public JpaOrderStoreAdapter(
            OrderJpaRepository repository,
            OrderPersistenceMapper mapper,
            OrderNumberSequencer sequencer,
            PlatformTransactionManager transactionManager,
            @Qualifier("storeExecutor") Executor storeExecutor) {
        this.repository = repository;
        this.mapper = mapper;
        this.sequencer = sequencer;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
        this.storeExecutor = storeExecutor;
    }

    @Override
    public CompletableFuture<Order> insert(NewOrder newOrder) {
        return CompletableFuture.supplyAsync(() -> transactionTemplate.execute(status -> {
            OrderNumber orderNumber = sequencer.next();
            Order order = Order.place(orderNumber, newOrder.userId(), newOrder.displayName(),
                    newOrder.lines(), newOrder.orderTime());
            repository.saveAndFlush(mapper.toEntity(order));
            log.debug("Saved order entity {} as {}", order.getDocumentId(), orderNumber);
            return order;
        }), storeExecutor);
    }

    @Override
    public CompletableFuture<Optional<Order>> findByNumber(OrderNumber orderNumber) {
        return CompletableFuture.supplyAsync(() -> readOnlyTemplate.execute(status ->
                repository.findByOrderNumber(orderNumber.getValue()).map(mapper::toDomain)), storeExecutor);
    }

    @Override
    public CompletableFuture<Boolean> compareAndSetStatus(OrderNumber orderNumber, OrderStatus expected,
                                                         OrderStatus next) {
        return CompletableFuture.supplyAsync(() -> transactionTemplate.execute(status -> {
            int updated = repository.updateStatusIfCurrent(
                    orderNumber.getValue(),
                    mapper.toStatusEnum(expected),
                    mapper.toStatusEnum(next),
                    Instant.now());
            return updated == 1;
        }), storeExecutor);
    }

    @Override
    public CompletableFuture<List<Order>> findOrders(String userId, OrderStatus status) {
        return CompletableFuture.supplyAsync(() -> readOnlyTemplate.execute(tx -> {
            OrderStatusEnum statusEnum = status == null ? null : mapper.toStatusEnum(status);
            List<OrderEntity> entities;
            if (userId != null && statusEnum != null) {
                entities = repository.findByUserIdAndStatusOrderByOrderTimeDescOrderNumberDesc(userId, statusEnum);
            } else if (userId != null) {
                entities = repository.findByUserIdOrderByOrderTimeDescOrderNumberDesc(userId);
            } else if (statusEnum != null) {
                entities = repository.findByStatusOrderByOrderTimeDescOrderNumberDesc(statusEnum);
            } else {
                entities = repository.findAllByOrderByOrderTimeDescOrderNumberDesc();
            }
            return entities.stream().map(mapper::toDomain).toList();
        }), storeExecutor);
    }

    @Override
    public CompletableFuture<Boolean> delete(OrderNumber orderNumber) {
        return CompletableFuture.supplyAsync(() -> transactionTemplate.execute(status ->
                repository.deleteByOrderNumber(orderNumber.getValue()) > 0), storeExecutor);
    }
}
