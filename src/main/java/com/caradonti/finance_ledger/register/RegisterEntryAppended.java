package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.inventory.StockLevel;
import com.caradonti.finance_ledger.ledger.LedgerBalance;
import lombok.Value;

/**
 * A freshly appended entry with the register balance it produced. {@code stock}
 * is only set for shop sales.
 */
@Value
public class RegisterEntryAppended {
    CashRegisterEntry entry;
    LedgerBalance balance;
    StockLevel stock;
}
