package com.example.tuckshop.infrastructure.persistence.repository;

import com.example.tuckshop.infrastructure.persistence.entity.InventoryItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA Repository for stock-keeping records. {@code findAllById} is the batch read used by the stock ledger.
 */
@Repository
public interface InventoryItemJpaRepository extends JpaRepository<InventoryItemEntity, String> {

    List<InventoryItemEntity> findAllByOrderByNameAsc();
}
