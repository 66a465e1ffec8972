package com.caradonti.finance_ledger.provider;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProviderRepository extends JpaRepository<ProviderEntity, UUID> {

    List<ProviderEntity> findAllByOrderByUsageCountDescNameAsc();
}
