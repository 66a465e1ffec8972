package com.caradonti.finance_ledger.eventcash;

import com.caradonti.finance_ledger.ledger.LedgerBalance;
import com.caradonti.finance_ledger.ledger.LedgerEntry;
import lombok.Value;

/**
 * An entry appended to an event with the balance and schedule it produced.
 * {@code allocation} is null unless the entry was an ARS client payment.
 */
@Value
public class EventEntryAppended {
    LedgerEntry entry;
    LedgerBalance balance;
    PaymentStatus paymentStatus;
    WaterfallAllocation allocation;
}
