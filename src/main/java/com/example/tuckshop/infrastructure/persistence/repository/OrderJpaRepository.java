package com.example.tuckshop.infrastructure.persistence.repository;

import com.example.tuckshop.infrastructure.persistence.entity.OrderEntity;
import com.example.tuckshop.infrastructure.persistence.entity.OrderStatusEnum;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JPA Repository for Order entities.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    Optional<OrderEntity> findByOrderNumber(long orderNumber);

    List<OrderEntity> findAllByOrderByOrderTimeDescOrderNumberDesc();

    List<OrderEntity> findByUserIdOrderByOrderTimeDescOrderNumberDesc(String userId);

    List<OrderEntity> findByStatusOrderByOrderTimeDescOrderNumberDesc(OrderStatusEnum status);

    List<OrderEntity> findByUserIdAndStatusOrderByOrderTimeDescOrderNumberDesc(String userId, OrderStatusEnum status);

    @Query("SELECT COALESCE(MAX(o.orderNumber), 0) FROM OrderEntity o")
    long findMaxOrderNumber();

    /**
     * Moves the order to {@code next} only if it is still in {@code expected}.
     *
     * @return number of rows changed, 0 or 1
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = :next, o.updatedAt = :now " +
            "WHERE o.orderNumber = :orderNumber AND o.status = :expected")
    int updateStatusIfCurrent(@Param("orderNumber") long orderNumber,
                              @Param("expected") OrderStatusEnum expected,
                              @Param("next") OrderStatusEnum next,
                              @Param("now") Instant now);

    long deleteByOrderNumber(long orderNumber);
}
