package com.caradonti.finance_ledger.register;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CashRegisterRepository extends JpaRepository<CashRegisterEntity, UUID> {

    List<CashRegisterEntity> findByTypeOrderByCreatedAtAsc(RegisterType type);
}
