package com.caradonti.finance_ledger.identity;

import lombok.Value;

/**
 * Who is acting, for audit fields such as created_by and approved_by.
 */
@Value
public class Actor {

    public static final Actor SYSTEM = new Actor("system", "system");

    String id;
    String displayName;

    /**
     * Name written to audit columns.
     */
    public String getAuditName() {
        return displayName != null && !displayName.isBlank() ? displayName : id;
    }
}
