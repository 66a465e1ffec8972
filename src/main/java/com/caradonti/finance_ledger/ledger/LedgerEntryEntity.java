package com.caradonti.finance_ledger.ledger;

import com.caradonti.finance_ledger.money.MoneyPair;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Row of the ledger_entries table.
 *
 * No setters: amounts, detail and dates are {@code updatable = false}. The only
 * update path is {@link #updateReferences}.
 */
@Entity
@Table(
    name = "ledger_entries",
    indexes = {
        @Index(name = "idx_ledger_entries_event", columnList = "event_id, sequence_number")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "entry_date", nullable = false, updatable = false)
    private LocalDate entryDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, updatable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Column(nullable = false, updatable = false, length = LedgerEntry.MAX_DETAIL_LENGTH)
    private String detail;

    @Column(name = "income_ars", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal incomeArs;

    @Column(name = "income_usd", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal incomeUsd;

    @Column(name = "expense_ars", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal expenseArs;

    @Column(name = "expense_usd", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal expenseUsd;

    @Column(name = "provider_ref")
    private UUID providerRef;

    @Column(name = "category_ref")
    private UUID categoryRef;

    @Column(name = "client_payment", nullable = false, updatable = false)
    private boolean clientPayment;

    @Column(name = "reverses_entry_id", updatable = false, unique = true)
    private UUID reversesEntryId;

    @Column(name = "idempotency_key", updatable = false, unique = true)
    private String idempotencyKey;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Insertion order within the event. Assigned by the database.
     */
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    public static LedgerEntryEntity fromDomain(LedgerEntry entry, String idempotencyKey) {
        return new LedgerEntryEntity(
            entry.getId(),
            entry.getEventId(),
            entry.getDate(),
            entry.getPaymentMethod(),
            entry.getDetail(),
            entry.getIncome().getArs(),
            entry.getIncome().getUsd(),
            entry.getExpense().getArs(),
            entry.getExpense().getUsd(),
            entry.getProviderRef(),
            entry.getCategoryRef(),
            entry.isClientPayment(),
            entry.getReversesEntryId(),
            idempotencyKey,
            entry.getCreatedBy(),
            entry.getCreatedAt(),
            null
        );
    }

    public LedgerEntry toDomain() {
        return new LedgerEntry(
            id,
            eventId,
            entryDate,
            paymentMethod,
            detail,
            MoneyPair.of(incomeArs, incomeUsd),
            MoneyPair.of(expenseArs, expenseUsd),
            providerRef,
            categoryRef,
            clientPayment,
            reversesEntryId,
            createdBy,
            createdAt
        );
    }

    public void updateReferences(LedgerEntry entry) {
        this.providerRef = entry.getProviderRef();
        this.categoryRef = entry.getCategoryRef();
    }
}
