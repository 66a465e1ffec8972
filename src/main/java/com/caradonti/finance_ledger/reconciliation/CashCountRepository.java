package com.caradonti.finance_ledger.reconciliation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CashCountRepository extends JpaRepository<CashCountEntity, UUID> {

    List<CashCountEntity> findByScopeTypeAndScopeIdOrderByCountDateDescCreatedAtDesc(ScopeType scopeType, UUID scopeId);

    List<CashCountEntity> findByAlertTrueOrderByCreatedAtDesc();
}
