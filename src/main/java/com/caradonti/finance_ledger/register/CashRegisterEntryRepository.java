package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.ledger.DateWindow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CashRegisterEntryRepository extends JpaRepository<CashRegisterEntryEntity, UUID> {

    List<CashRegisterEntryEntity> findByRegisterIdOrderBySequenceNumberAsc(UUID registerId);

    List<CashRegisterEntryEntity> findByRegisterIdAndApprovalStatusOrderBySequenceNumberAsc(
        UUID registerId, ApprovalStatus approvalStatus);

    List<CashRegisterEntryEntity> findByRegisterIdAndApprovalStatusNotAndEntryDateBetweenOrderBySequenceNumberAsc(
        UUID registerId, ApprovalStatus excluded, LocalDate from, LocalDate to);

    /**
     * Entries that count toward the register's cash within {@code window}.
     * Rejected entries never moved money and are left out.
     */
    default List<CashRegisterEntryEntity> findEffectiveEntries(UUID registerId, DateWindow window) {
        return findByRegisterIdAndApprovalStatusNotAndEntryDateBetweenOrderBySequenceNumberAsc(
            registerId, ApprovalStatus.REJECTED, window.lowerBound(), window.upperBound());
    }

    Optional<CashRegisterEntryEntity> findByIdAndRegisterId(UUID id, UUID registerId);

    @Query("SELECT e.id FROM CashRegisterEntryEntity e WHERE e.idempotencyKey = :key")
    Optional<UUID> findIdByIdempotencyKey(@Param("key") String idempotencyKey);

    long countByApprovalStatus(ApprovalStatus approvalStatus);
}
