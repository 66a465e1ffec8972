package com.caradonti.finance_ledger.config;

import com.caradonti.finance_ledger.eventcash.OverflowPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Business thresholds for approvals, the payment waterfall and cash-count
 * reconciliation, bound from the {@code ledger.*} properties.
 *
 * Field defaults are the values the business runs with today.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    private Approval approval = new Approval();
    private Waterfall waterfall = new Waterfall();
    private Reconciliation reconciliation = new Reconciliation();

    @Getter
    @Setter
    public static class Approval {
        /** ARS movement above which an entry needs approval (exclusive). */
        private BigDecimal arsThreshold = new BigDecimal("10000");
        /** USD movement above which an entry needs approval (exclusive). */
        private BigDecimal usdThreshold = new BigDecimal("100");
        /** Entries at or above this multiple of the thresholds need both approver roles. */
        private BigDecimal dualSignMultiplier = new BigDecimal("2");
        /** ARS expense above which a large-expense alert is raised. */
        private BigDecimal largeExpenseArs = new BigDecimal("10000");

        public BigDecimal getDualSignArsThreshold() {
            return arsThreshold.multiply(dualSignMultiplier);
        }

        public BigDecimal getDualSignUsdThreshold() {
            return usdThreshold.multiply(dualSignMultiplier);
        }
    }

    @Getter
    @Setter
    public static class Waterfall {
        private BigDecimal anticipoRatio = new BigDecimal("0.30");
        private BigDecimal segundoRatio = new BigDecimal("0.60");
        private OverflowPolicy overflowPolicy = OverflowPolicy.CAP_AND_DROP;
    }

    @Getter
    @Setter
    public static class Reconciliation {
        /** Discrepancy percentage above which an alert is raised. */
        private BigDecimal alertThresholdPct = new BigDecimal("5");
        /** Discrepancy percentage at or below which a count is a match. */
        private BigDecimal matchThresholdPct = new BigDecimal("1");
    }
}
