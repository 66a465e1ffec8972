package com.caradonti.finance_ledger.eventcash;

import com.caradonti.finance_ledger.ledger.PaymentMethod;
import com.caradonti.finance_ledger.money.MoneyPair;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Validated input of an append to an event ledger.
 */
@Value
public class NewLedgerEntry {
    LocalDate date;
    PaymentMethod paymentMethod;
    String detail;
    MoneyPair income;
    MoneyPair expense;
    UUID providerRef;
    UUID categoryRef;
    boolean clientPayment;
}
