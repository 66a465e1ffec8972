package com.caradonti.finance_ledger.eventcash.dto;

import com.caradonti.finance_ledger.ledger.LedgerEntry;
import com.caradonti.finance_ledger.ledger.PaymentMethod;
import com.caradonti.finance_ledger.ledger.dto.AmountsResponse;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("detail")
    String detail;

    @JsonProperty("income")
    AmountsResponse income;

    @JsonProperty("expense")
    AmountsResponse expense;

    @JsonProperty("provider_id")
    UUID providerId;

    @JsonProperty("category_id")
    UUID categoryId;

    @JsonProperty("is_client_payment")
    boolean clientPayment;

    @JsonProperty("reverses_entry_id")
    UUID reversesEntryId;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .eventId(entry.getEventId())
            .date(entry.getDate())
            .paymentMethod(entry.getPaymentMethod())
            .detail(entry.getDetail())
            .income(AmountsResponse.from(entry.getIncome()))
            .expense(AmountsResponse.from(entry.getExpense()))
            .providerId(entry.getProviderRef())
            .categoryId(entry.getCategoryRef())
            .clientPayment(entry.isClientPayment())
            .reversesEntryId(entry.getReversesEntryId())
            .createdBy(entry.getCreatedBy())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
