package com.caradonti.finance_ledger.register;

/**
 * Business line a cash register belongs to.
 */
public enum RegisterType {
    GENERAL, // General cash, the only register with two approver roles
    SHOP,    // Retail shop sales
    DECO     // One register per decoration project
}
