package com.caradonti.finance_ledger.reconciliation;

import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.money.SignedMoneyPair;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A physical cash count and its reconciliation. Immutable once recorded;
 * a recount is a new record.
 */
@Value
public class CashCount {
    UUID id;
    ScopeType scopeType;
    UUID scopeId;
    CashCountType countType;
    LocalDate countDate;
    MoneyPair counted;
    MoneyPair expected;
    SignedMoneyPair discrepancy;
    BigDecimal arsDiscrepancyPct;
    BigDecimal usdDiscrepancyPct;
    CashCountStatus status;
    boolean alert;
    boolean expectedDerived;
    LocalDate windowFrom;
    LocalDate windowTo;
    String notes;
    String countedBy;
    Instant createdAt;

    public static CashCount record(ScopeType scopeType, UUID scopeId, CashCountType countType,
                                   LocalDate countDate, ReconciliationResult result, boolean expectedDerived,
                                   LocalDate windowFrom, LocalDate windowTo, String notes, String countedBy) {
        if (scopeType == null || scopeId == null) {
            throw new IllegalArgumentException("Count scope is required");
        }
        if (countType == null) {
            throw new IllegalArgumentException("Count type is required");
        }
        if (countDate == null) {
            throw new IllegalArgumentException("Count date is required");
        }
        return new CashCount(
            UUID.randomUUID(),
            scopeType,
            scopeId,
            countType,
            countDate,
            result.getCounted(),
            result.getExpected(),
            result.getDiscrepancy(),
            result.getArsDiscrepancyPct(),
            result.getUsdDiscrepancyPct(),
            result.getStatus(),
            result.isAlert(),
            expectedDerived,
            windowFrom,
            windowTo,
            notes,
            countedBy,
            Instant.now()
        );
    }
}
