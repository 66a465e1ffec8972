package com.caradonti.finance_ledger.eventcash;

/**
 * The three installments of an event's payment schedule, in fill order.
 */
public enum InstallmentBucket {
    ANTICIPO,
    SEGUNDO_PAGO,
    TERCER_PAGO
}
