package com.caradonti.finance_ledger.register.dto;

import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.register.CashRegisterEntry;
import com.caradonti.finance_ledger.register.NewRegisterEntry;
import com.caradonti.finance_ledger.register.SaleLine;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Body of an append to a cash register. A shop sale carries {@code sku} and
 * {@code quantity}.
 */
@Value
public class AppendRegisterEntryRequest {

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @NotBlank(message = "Description is required")
    @Size(max = CashRegisterEntry.MAX_DESCRIPTION_LENGTH, message = "Description is too long")
    @JsonProperty("description")
    String description;

    @Size(max = 100, message = "Application is too long")
    @JsonProperty("application")
    String application;

    @JsonProperty("provider_id")
    UUID providerId;

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

    @Size(max = 50, message = "SKU is too long")
    @JsonProperty("sku")
    String sku;

    @Min(value = 1, message = "Quantity must be positive")
    @JsonProperty("quantity")
    Integer quantity;

    @JsonProperty("notes")
    String notes;

    public NewRegisterEntry toDraft() {
        SaleLine saleLine = null;
        if (sku != null || quantity != null) {
            saleLine = new SaleLine(sku, quantity != null ? quantity : 0);
        }
        return new NewRegisterEntry(date, description, application, providerId,
            MoneyPair.of(incomeArs, incomeUsd), MoneyPair.of(expenseArs, expenseUsd), saleLine, notes);
    }
}
