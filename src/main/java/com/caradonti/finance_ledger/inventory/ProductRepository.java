package com.caradonti.finance_ledger.inventory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProductRepository extends JpaRepository<ProductEntity, String> {

    @Query("SELECT p FROM ProductEntity p WHERE p.currentStock <= p.minStockThreshold ORDER BY p.currentStock ASC, p.sku ASC")
    List<ProductEntity> findLowStock();
}
