package com.caradonti.finance_ledger.reconciliation.dto;

import com.caradonti.finance_ledger.ledger.dto.AmountsResponse;
import com.caradonti.finance_ledger.reconciliation.CashCount;
import com.caradonti.finance_ledger.reconciliation.CashCountStatus;
import com.caradonti.finance_ledger.reconciliation.CashCountType;
import com.caradonti.finance_ledger.reconciliation.ScopeType;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class CashCountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("scope_type")
    ScopeType scopeType;

    @JsonProperty("scope_id")
    UUID scopeId;

    @JsonProperty("count_type")
    CashCountType countType;

    @JsonProperty("count_date")
    LocalDate countDate;

    @JsonProperty("counted")
    AmountsResponse counted;

    @JsonProperty("expected")
    AmountsResponse expected;

    @JsonProperty("discrepancy")
    AmountsResponse discrepancy;

    @JsonProperty("discrepancy_pct_ars")
    BigDecimal discrepancyPctArs;

    @JsonProperty("discrepancy_pct_usd")
    BigDecimal discrepancyPctUsd;

    @JsonProperty("status")
    CashCountStatus status;

    @JsonProperty("alert")
    boolean alert;

    @JsonProperty("expected_derived")
    boolean expectedDerived;

    @JsonProperty("window_from")
    LocalDate windowFrom;

    @JsonProperty("window_to")
    LocalDate windowTo;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("counted_by")
    String countedBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static CashCountResponse from(CashCount count) {
        return CashCountResponse.builder()
            .id(count.getId())
            .scopeType(count.getScopeType())
            .scopeId(count.getScopeId())
            .countType(count.getCountType())
            .countDate(count.getCountDate())
            .counted(AmountsResponse.from(count.getCounted()))
            .expected(AmountsResponse.from(count.getExpected()))
            .discrepancy(AmountsResponse.from(count.getDiscrepancy()))
            .discrepancyPctArs(count.getArsDiscrepancyPct())
            .discrepancyPctUsd(count.getUsdDiscrepancyPct())
            .status(count.getStatus())
            .alert(count.isAlert())
            .expectedDerived(count.isExpectedDerived())
            .windowFrom(count.getWindowFrom())
            .windowTo(count.getWindowTo())
            .notes(count.getNotes())
            .countedBy(count.getCountedBy())
            .createdAt(count.getCreatedAt())
            .build();
    }
}
