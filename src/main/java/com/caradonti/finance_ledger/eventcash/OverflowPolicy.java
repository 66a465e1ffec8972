package com.caradonti.finance_ledger.eventcash;

/**
 * What happens to the part of a client payment that exceeds the cap of the
 * installment bucket it was routed to.
 */
public enum OverflowPolicy {
    /**
     * The excess is not applied to any bucket. Matches how the business
     * has recorded installments so far.
     */
    CAP_AND_DROP,

    /**
     * The excess rolls into the following bucket(s) within the same payment,
     * so the whole payment is always accounted for.
     */
    CAP_AND_CARRY
}
