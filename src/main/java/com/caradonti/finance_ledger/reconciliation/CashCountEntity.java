package com.caradonti.finance_ledger.reconciliation;

import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.money.SignedMoneyPair;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Row of the cash_counts table. Every column is write-once.
 */
@Entity
@Table(
    name = "cash_counts",
    indexes = {
        @Index(name = "idx_cash_counts_scope", columnList = "scope_type, scope_id, count_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CashCountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope_type", nullable = false, updatable = false, length = 10)
    private ScopeType scopeType;

    @Column(name = "scope_id", nullable = false, updatable = false)
    private UUID scopeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "count_type", nullable = false, updatable = false, length = 10)
    private CashCountType countType;

    @Column(name = "count_date", nullable = false, updatable = false)
    private LocalDate countDate;

    @Column(name = "counted_ars", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal countedArs;

    @Column(name = "counted_usd", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal countedUsd;

    @Column(name = "expected_ars", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal expectedArs;

    @Column(name = "expected_usd", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal expectedUsd;

    @Column(name = "discrepancy_ars", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal discrepancyArs;

    @Column(name = "discrepancy_usd", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal discrepancyUsd;

    @Column(name = "discrepancy_pct_ars", updatable = false, precision = 12, scale = 2)
    private BigDecimal discrepancyPctArs;

    @Column(name = "discrepancy_pct_usd", updatable = false, precision = 12, scale = 2)
    private BigDecimal discrepancyPctUsd;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private CashCountStatus status;

    @Column(nullable = false, updatable = false)
    private boolean alert;

    @Column(name = "expected_derived", nullable = false, updatable = false)
    private boolean expectedDerived;

    @Column(name = "window_from", updatable = false)
    private LocalDate windowFrom;

    @Column(name = "window_to", updatable = false)
    private LocalDate windowTo;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String notes;

    @Column(name = "counted_by", nullable = false, updatable = false)
    private String countedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static CashCountEntity fromDomain(CashCount count) {
        CashCountEntity entity = new CashCountEntity();
        entity.id = count.getId();
        entity.scopeType = count.getScopeType();
        entity.scopeId = count.getScopeId();
        entity.countType = count.getCountType();
        entity.countDate = count.getCountDate();
        entity.countedArs = count.getCounted().getArs();
        entity.countedUsd = count.getCounted().getUsd();
        entity.expectedArs = count.getExpected().getArs();
        entity.expectedUsd = count.getExpected().getUsd();
        entity.discrepancyArs = count.getDiscrepancy().getArs();
        entity.discrepancyUsd = count.getDiscrepancy().getUsd();
        entity.discrepancyPctArs = count.getArsDiscrepancyPct();
        entity.discrepancyPctUsd = count.getUsdDiscrepancyPct();
        entity.status = count.getStatus();
        entity.alert = count.isAlert();
        entity.expectedDerived = count.isExpectedDerived();
        entity.windowFrom = count.getWindowFrom();
        entity.windowTo = count.getWindowTo();
        entity.notes = count.getNotes();
        entity.countedBy = count.getCountedBy();
        entity.createdAt = count.getCreatedAt();
        return entity;
    }

    public CashCount toDomain() {
        return new CashCount(id, scopeType, scopeId, countType, countDate,
            MoneyPair.of(countedArs, countedUsd),
            MoneyPair.of(expectedArs, expectedUsd),
            new SignedMoneyPair(discrepancyArs, discrepancyUsd),
            discrepancyPctArs, discrepancyPctUsd, status, alert, expectedDerived,
            windowFrom, windowTo, notes, countedBy, createdAt);
    }
}
