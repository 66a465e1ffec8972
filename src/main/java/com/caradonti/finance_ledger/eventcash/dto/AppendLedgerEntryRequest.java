package com.caradonti.finance_ledger.eventcash.dto;

import com.caradonti.finance_ledger.eventcash.NewLedgerEntry;
import com.caradonti.finance_ledger.ledger.LedgerEntry;
import com.caradonti.finance_ledger.ledger.PaymentMethod;
import com.caradonti.finance_ledger.money.MoneyPair;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class AppendLedgerEntryRequest {

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @NotNull(message = "Payment method is required")
    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @NotBlank(message = "Detail is required")
    @Size(max = LedgerEntry.MAX_DETAIL_LENGTH, message = "Detail is too long")
    @JsonProperty("detail")
    String detail;

    @DecimalMin(value = "0.00", message = "Amounts must not be negative")
    @JsonProperty("income_ars")
    BigDecimal incomeArs;

    @DecimalMin(value = "0.00", message = "Amounts must not be negative")
    @JsonProperty("income_usd")
    BigDecimal incomeUsd;

    @DecimalMin(value = "0.00", message = "Amounts must not be negative")
    @JsonProperty("expense_ars")
    BigDecimal expenseArs;

    @DecimalMin(value = "0.00", message = "Amounts must not be negative")
    @JsonProperty("expense_usd")
    BigDecimal expenseUsd;

    @JsonProperty("provider_id")
    UUID providerId;

    @JsonProperty("category_id")
    UUID categoryId;

    @JsonProperty("is_client_payment")
    boolean clientPayment;

    public NewLedgerEntry toDraft() {
        return new NewLedgerEntry(date, paymentMethod, detail,
            MoneyPair.of(incomeArs, incomeUsd), MoneyPair.of(expenseArs, expenseUsd),
            providerId, categoryId, clientPayment);
    }
}
