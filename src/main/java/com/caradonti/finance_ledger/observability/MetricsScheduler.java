package com.caradonti.finance_ledger.observability;

import com.caradonti.finance_ledger.register.ApprovalStatus;
import com.caradonti.finance_ledger.register.CashRegisterEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;
    private final CashRegisterEntryRepository entryRepository;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        try {
            ledgerMetrics.setPendingApprovals(entryRepository.countByApprovalStatus(ApprovalStatus.PENDING));
        } catch (Exception e) {
            log.warn("Failed to refresh pending approval gauge: {}", e.getMessage());
        }
    }
}
