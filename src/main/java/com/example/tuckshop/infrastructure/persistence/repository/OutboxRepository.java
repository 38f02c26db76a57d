package com.example.tuckshop.infrastructure.persistence.repository;

import com.example.tuckshop.infrastructure.persistence.entity.OutboxEvent;
import com.example.tuckshop.infrastructure.persistence.entity.OutboxEventStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * JPA Repository for OutboxEvent entities.
 */
@Repository
public interface OutboxRepository extends JpaRepository<OutboxEvent, String> {

    List<OutboxEvent> findByStatusOrderByCreatedAtAsc(OutboxEventStatus status, Pageable pageable);

    List<OutboxEvent> findByStatusAndFailedAttemptsLessThanOrderByCreatedAtAsc(
            OutboxEventStatus status, int maxAttempts, Pageable pageable);

    List<OutboxEvent> findByOrderReference(String orderReference);

    @Modifying
    @Query("DELETE FROM OutboxEvent o WHERE o.status = :status AND o.deliveredAt < :before")
    int deleteByStatusAndDeliveredAtBefore(@Param("status") OutboxEventStatus status,
                                           @Param("before") Instant before);
}
