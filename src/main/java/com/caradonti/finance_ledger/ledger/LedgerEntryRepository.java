package com.caradonti.finance_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntryEntity, UUID> {

    List<LedgerEntryEntity> findByEventIdOrderBySequenceNumberAsc(UUID eventId);

    Optional<LedgerEntryEntity> findByIdAndEventId(UUID id, UUID eventId);

    boolean existsByReversesEntryId(UUID reversesEntryId);

    List<LedgerEntryEntity> findByEventIdAndEntryDateBetweenOrderBySequenceNumberAsc(
        UUID eventId, LocalDate from, LocalDate to);

    default List<LedgerEntryEntity> findForWindow(UUID eventId, DateWindow window) {
        return findByEventIdAndEntryDateBetweenOrderBySequenceNumberAsc(
            eventId, window.lowerBound(), window.upperBound());
    }

    @Query("SELECT e.id FROM LedgerEntryEntity e WHERE e.idempotencyKey = :key")
    Optional<UUID> findIdByIdempotencyKey(@Param("key") String idempotencyKey);
}
