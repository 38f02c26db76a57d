package com.example.tuckshop.infrastructure.persistence.repository;

import com.example.tuckshop.infrastructure.persistence.entity.OrderSequenceEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface OrderSequenceRepository extends JpaRepository<OrderSequenceEntity, String> {

    /**
     * Reads the counter row with a write lock held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM OrderSequenceEntity s WHERE s.name = :name")
    Optional<OrderSequenceEntity> findForUpdate(@Param("name") String name);
}
