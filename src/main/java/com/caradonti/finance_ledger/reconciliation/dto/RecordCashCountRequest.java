package com.caradonti.finance_ledger.reconciliation.dto;

import com.caradonti.finance_ledger.ledger.DateWindow;
import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.reconciliation.CashCountType;
import com.caradonti.finance_ledger.reconciliation.NewCashCount;
import com.caradonti.finance_ledger.reconciliation.ScopeType;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Body of a cash count. Leave both expected amounts out to have the expected
 * total derived from the ledger over the optional window.
 */
@Value
public class RecordCashCountRequest {

    @NotNull(message = "Scope type is required")
    @JsonProperty("scope_type")
    ScopeType scopeType;

    @NotNull(message = "Scope ID is required")
    @JsonProperty("scope_id")
    UUID scopeId;

    @NotNull(message = "Count type is required")
    @JsonProperty("count_type")
    CashCountType countType;

    @NotNull(message = "Count date is required")
    @JsonProperty("count_date")
    LocalDate countDate;

    @DecimalMin(value = "0.00", message = "Amounts must not be negative")
    @JsonProperty("counted_ars")
    BigDecimal countedArs;

    @DecimalMin(value = "0.00", message = "Amounts must not be negative")
    @JsonProperty("counted_usd")
    BigDecimal countedUsd;

    @DecimalMin(value = "0.00", message = "Amounts must not be negative")
    @JsonProperty("expected_ars")
    BigDecimal expectedArs;

    @DecimalMin(value = "0.00", message = "Amounts must not be negative")
    @JsonProperty("expected_usd")
    BigDecimal expectedUsd;

    @JsonProperty("window_from")
    LocalDate windowFrom;

    @JsonProperty("window_to")
    LocalDate windowTo;

    @JsonProperty("notes")
    String notes;

    public NewCashCount toInput() {
        MoneyPair expected = expectedArs == null && expectedUsd == null
            ? null
            : MoneyPair.of(expectedArs, expectedUsd);
        return new NewCashCount(scopeType, scopeId, countType, countDate,
            MoneyPair.of(countedArs, countedUsd), expected, DateWindow.of(windowFrom, windowTo), notes);
    }
}
