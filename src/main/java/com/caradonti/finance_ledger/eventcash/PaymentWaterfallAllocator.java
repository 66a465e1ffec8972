package com.caradonti.finance_ledger.eventcash;

import com.caradonti.finance_ledger.config.LedgerProperties;
import com.caradonti.finance_ledger.exception.InvalidAmountException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Decides which installment bucket(s) absorb an incoming ARS client payment.
 *
 * Bucket selection:
 * 1. ANTICIPO while it is exactly zero, capped at {@code anticipoRatio × budget}
 * 2. SEGUNDO_PAGO while it is exactly zero, capped at
 *    {@code segundoRatio × (budget − anticipo)} evaluated when it is set
 * 3. TERCER_PAGO otherwise, uncapped and cumulative
 *
 * Under {@link OverflowPolicy#CAP_AND_DROP} only the selected bucket is touched and
 * any excess over its cap is left unallocated. Under {@link OverflowPolicy#CAP_AND_CARRY}
 * the excess flows on to the following buckets in order.
 *
 * An event without a budget has nothing to cap against, so its payments go
 * straight to TERCER_PAGO.
 */
@Component
public class PaymentWaterfallAllocator {

    private final BigDecimal anticipoRatio;
    private final BigDecimal segundoRatio;
    private final OverflowPolicy policy;

    @Autowired
    public PaymentWaterfallAllocator(LedgerProperties properties) {
        this(properties.getWaterfall().getAnticipoRatio(),
             properties.getWaterfall().getSegundoRatio(),
             properties.getWaterfall().getOverflowPolicy());
    }

    public PaymentWaterfallAllocator(BigDecimal anticipoRatio, BigDecimal segundoRatio, OverflowPolicy policy) {
        this.anticipoRatio = anticipoRatio;
        this.segundoRatio = segundoRatio;
        this.policy = policy;
    }

    /**
     * Routes one payment into the schedule.
     *
     * @param status current schedule
     * @param paymentArs positive ARS amount received from the client
     * @return the allocation, including the new schedule
     * @throws InvalidAmountException if the payment is not positive
     */
    public WaterfallAllocation allocate(PaymentStatus status, BigDecimal paymentArs) {
        if (paymentArs == null || paymentArs.signum() <= 0) {
            throw new InvalidAmountException("Client payment must be positive: " + paymentArs);
        }

        BigDecimal payment = paymentArs.setScale(2, RoundingMode.HALF_UP);
        BigDecimal remaining = payment;
        PaymentStatus current = status;
        Map<InstallmentBucket, BigDecimal> applied = new EnumMap<>(InstallmentBucket.class);

        InstallmentBucket bucket = selectBucket(status);
        while (bucket != null && remaining.signum() > 0) {
            BigDecimal cap = capacityOf(bucket, current);
            BigDecimal amount = cap == null ? remaining : remaining.min(cap);
            if (amount.signum() > 0) {
                current = current.plus(bucket, amount);
                applied.put(bucket, amount);
                remaining = remaining.subtract(amount);
            }
            bucket = policy == OverflowPolicy.CAP_AND_CARRY ? next(bucket) : null;
        }

        return new WaterfallAllocation(payment, status, current,
            Collections.unmodifiableMap(applied), remaining, policy);
    }

    /**
     * The bucket a new payment is routed to first.
     */
    public InstallmentBucket selectBucket(PaymentStatus status) {
        if (status.getTotalBudget().signum() <= 0) {
            return InstallmentBucket.TERCER_PAGO;
        }
        // A bucket whose cap rounds to 0.00 can never take a cent and counts as full
        if (status.getAnticipoReceived().signum() == 0
                && capOf(InstallmentBucket.ANTICIPO, status).signum() > 0) {
            return InstallmentBucket.ANTICIPO;
        }
        if (status.getSegundoPago().signum() == 0
                && capOf(InstallmentBucket.SEGUNDO_PAGO, status).signum() > 0) {
            return InstallmentBucket.SEGUNDO_PAGO;
        }
        return InstallmentBucket.TERCER_PAGO;
    }

    /**
     * Remaining room in a bucket, or {@code null} when it is uncapped.
     */
    private BigDecimal capacityOf(InstallmentBucket bucket, PaymentStatus status) {
        return switch (bucket) {
            case ANTICIPO -> roomLeft(capOf(bucket, status), status.getAnticipoReceived());
            case SEGUNDO_PAGO -> roomLeft(capOf(bucket, status), status.getSegundoPago());
            case TERCER_PAGO -> null;
        };
    }

    /**
     * Cap of a capped bucket, rounded down to cents so a filled bucket never sits above it.
     */
    private BigDecimal capOf(InstallmentBucket bucket, PaymentStatus status) {
        BigDecimal budget = status.getTotalBudget();
        BigDecimal cap = switch (bucket) {
            case ANTICIPO -> budget.multiply(anticipoRatio);
            case SEGUNDO_PAGO -> budget.subtract(status.getAnticipoReceived()).multiply(segundoRatio);
            case TERCER_PAGO -> throw new IllegalArgumentException("Tercer pago is uncapped");
        };
        return cap.setScale(2, RoundingMode.DOWN);
    }

    private static BigDecimal roomLeft(BigDecimal cap, BigDecimal alreadyPaid) {
        BigDecimal room = cap.subtract(alreadyPaid);
        return room.signum() < 0 ? BigDecimal.ZERO : room;
    }

    private static InstallmentBucket next(InstallmentBucket bucket) {
        return switch (bucket) {
            case ANTICIPO -> InstallmentBucket.SEGUNDO_PAGO;
            case SEGUNDO_PAGO -> InstallmentBucket.TERCER_PAGO;
            case TERCER_PAGO -> null;
        };
    }

    public OverflowPolicy getPolicy() {
        return policy;
    }
}
