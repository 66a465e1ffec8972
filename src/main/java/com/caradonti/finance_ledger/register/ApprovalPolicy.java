package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.config.LedgerProperties;
import com.caradonti.finance_ledger.ledger.Movement;
import com.caradonti.finance_ledger.money.Currency;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Materiality rules for cash register entries.
 *
 * An entry needs approval iff its ARS movement (income + expense) is strictly above
 * the ARS threshold, or its USD movement is strictly above the USD threshold.
 *
 * General Cash entries at or above the dual-sign threshold (a multiple of the
 * materiality thresholds) need both approver roles; every other material entry
 * needs one.
 */
@Component
public class ApprovalPolicy {

    private final BigDecimal arsThreshold;
    private final BigDecimal usdThreshold;
    private final BigDecimal dualSignArsThreshold;
    private final BigDecimal dualSignUsdThreshold;
    private final BigDecimal largeExpenseArs;

    @Autowired
    public ApprovalPolicy(LedgerProperties properties) {
        this(properties.getApproval().getArsThreshold(),
             properties.getApproval().getUsdThreshold(),
             properties.getApproval().getDualSignArsThreshold(),
             properties.getApproval().getDualSignUsdThreshold(),
             properties.getApproval().getLargeExpenseArs());
    }

    public ApprovalPolicy(BigDecimal arsThreshold, BigDecimal usdThreshold,
                          BigDecimal dualSignArsThreshold, BigDecimal dualSignUsdThreshold,
                          BigDecimal largeExpenseArs) {
        this.arsThreshold = arsThreshold;
        this.usdThreshold = usdThreshold;
        this.dualSignArsThreshold = dualSignArsThreshold;
        this.dualSignUsdThreshold = dualSignUsdThreshold;
        this.largeExpenseArs = largeExpenseArs;
    }

    public boolean needsApproval(Movement movement) {
        return movementIn(movement, Currency.ARS).compareTo(arsThreshold) > 0
            || movementIn(movement, Currency.USD).compareTo(usdThreshold) > 0;
    }

    public ApprovalRequirement requirementFor(RegisterType registerType, Movement movement) {
        if (!needsApproval(movement)) {
            return ApprovalRequirement.NONE;
        }
        if (registerType == RegisterType.GENERAL && isDualSign(movement)) {
            return ApprovalRequirement.DUAL;
        }
        return ApprovalRequirement.SINGLE;
    }

    /**
     * ARS expense alone strictly above the large-expense threshold, regardless
     * of approval state.
     */
    public boolean isLargeExpense(Movement movement) {
        return movement.getExpense().getArs().compareTo(largeExpenseArs) > 0;
    }

    private boolean isDualSign(Movement movement) {
        return movementIn(movement, Currency.ARS).compareTo(dualSignArsThreshold) >= 0
            || movementIn(movement, Currency.USD).compareTo(dualSignUsdThreshold) >= 0;
    }

    private static BigDecimal movementIn(Movement movement, Currency currency) {
        return movement.getIncome().get(currency).abs().add(movement.getExpense().get(currency).abs());
    }
}
