package com.caradonti.finance_ledger.eventcash;

import com.caradonti.finance_ledger.exception.InvalidAmountException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * What the client of an event has paid toward each installment, in ARS.
 *
 * Buckets are only ever increased, and only by {@link PaymentWaterfallAllocator}.
 */
@Value
public class PaymentStatus {

    BigDecimal totalBudget;
    BigDecimal anticipoReceived;
    BigDecimal segundoPago;
    BigDecimal tercerPago;

    public PaymentStatus(BigDecimal totalBudget, BigDecimal anticipoReceived,
                         BigDecimal segundoPago, BigDecimal tercerPago) {
        this.totalBudget = nonNegative("Total budget", totalBudget);
        this.anticipoReceived = nonNegative("Anticipo", anticipoReceived);
        this.segundoPago = nonNegative("Segundo pago", segundoPago);
        this.tercerPago = nonNegative("Tercer pago", tercerPago);
    }

    /**
     * A fresh schedule with nothing paid yet.
     */
    public static PaymentStatus initial(BigDecimal totalBudget) {
        return new PaymentStatus(totalBudget, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public BigDecimal getTotalPaid() {
        return anticipoReceived.add(segundoPago).add(tercerPago);
    }

    /**
     * Remaining balance, clamped at zero for display.
     */
    public BigDecimal getBalanceDue() {
        BigDecimal due = totalBudget.subtract(getTotalPaid());
        return due.signum() < 0 ? BigDecimal.ZERO.setScale(2) : due;
    }

    public BigDecimal get(InstallmentBucket bucket) {
        return switch (bucket) {
            case ANTICIPO -> anticipoReceived;
            case SEGUNDO_PAGO -> segundoPago;
            case TERCER_PAGO -> tercerPago;
        };
    }

    PaymentStatus plus(InstallmentBucket bucket, BigDecimal amount) {
        return switch (bucket) {
            case ANTICIPO -> new PaymentStatus(totalBudget, anticipoReceived.add(amount), segundoPago, tercerPago);
            case SEGUNDO_PAGO -> new PaymentStatus(totalBudget, anticipoReceived, segundoPago.add(amount), tercerPago);
            case TERCER_PAGO -> new PaymentStatus(totalBudget, anticipoReceived, segundoPago, tercerPago.add(amount));
        };
    }

    private static BigDecimal nonNegative(String field, BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO.setScale(2);
        }
        if (value.signum() < 0) {
            throw new InvalidAmountException(field + " must not be negative: " + value.toPlainString());
        }
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
