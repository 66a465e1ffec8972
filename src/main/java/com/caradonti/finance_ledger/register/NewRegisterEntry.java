package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.ledger.Movement;
import com.caradonti.finance_ledger.money.MoneyPair;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Validated input of an append to a cash register. Missing amounts are zero.
 */
@Value
public class NewRegisterEntry implements Movement {
    LocalDate date;
    String description;
    String application;
    UUID providerRef;
    MoneyPair income;
    MoneyPair expense;
    SaleLine saleLine;
    String notes;

    public NewRegisterEntry(LocalDate date, String description, String application, UUID providerRef,
                            MoneyPair income, MoneyPair expense, SaleLine saleLine, String notes) {
        this.date = date;
        this.description = description;
        this.application = application;
        this.providerRef = providerRef;
        this.income = income != null ? income : MoneyPair.ZERO;
        this.expense = expense != null ? expense : MoneyPair.ZERO;
        this.saleLine = saleLine;
        this.notes = notes;
    }
}
