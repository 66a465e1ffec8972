package com.caradonti.finance_ledger.eventcash;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EventCashRepository extends JpaRepository<EventCashEntity, UUID> {

    List<EventCashEntity> findAllByOrderByEventDateDescCreatedAtDesc();
}
