package com.caradonti.finance_ledger.eventcash;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Outcome of routing one client payment through the installment waterfall.
 *
 * {@code applied} holds only the buckets that received money. {@code unallocated}
 * is the part of the payment no bucket took (always zero under
 * {@link OverflowPolicy#CAP_AND_CARRY}).
 */
@Value
public class WaterfallAllocation {
    BigDecimal paymentAmount;
    PaymentStatus before;
    PaymentStatus after;
    Map<InstallmentBucket, BigDecimal> applied;
    BigDecimal unallocated;
    OverflowPolicy policy;

    public BigDecimal appliedTo(InstallmentBucket bucket) {
        return applied.getOrDefault(bucket, BigDecimal.ZERO.setScale(2));
    }

    public boolean hasUnallocated() {
        return unallocated.signum() > 0;
    }
}
