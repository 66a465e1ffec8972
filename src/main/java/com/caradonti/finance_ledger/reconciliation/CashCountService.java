package com.caradonti.finance_ledger.reconciliation;

import com.caradonti.finance_ledger.eventcash.EventCashService;
import com.caradonti.finance_ledger.exception.InvalidAmountException;
import com.caradonti.finance_ledger.exception.NotFoundException;
import com.caradonti.finance_ledger.identity.Actor;
import com.caradonti.finance_ledger.ledger.DateWindow;
import com.caradonti.finance_ledger.ledger.LedgerBalance;
import com.caradonti.finance_ledger.ledger.LedgerBalanceCalculator;
import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.money.SignedMoneyPair;
import com.caradonti.finance_ledger.notification.NotificationProperties;
import com.caradonti.finance_ledger.notification.NotificationPublisher;
import com.caradonti.finance_ledger.notification.NotificationTriggerPolicy;
import com.caradonti.finance_ledger.observability.CorrelationContext;
import com.caradonti.finance_ledger.observability.LedgerMetrics;
import com.caradonti.finance_ledger.register.CashRegisterService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Records physical cash counts against a register or an event.
 *
 * The expected total is either supplied by the caller or derived as the net of
 * the scope's ledger over the count window: pending and approved entries for a
 * register, every entry for an event. Counts are never edited; a recount is a
 * new record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CashCountService {

    static final String AGGREGATE = "CashCount";

    private final CashCountRepository countRepository;
    private final CashRegisterService registerService;
    private final EventCashService eventCashService;
    private final LedgerBalanceCalculator balanceCalculator;
    private final ReconciliationCalculator reconciliationCalculator;
    private final NotificationTriggerPolicy triggerPolicy;
    private final NotificationPublisher notificationPublisher;
    private final NotificationProperties notificationProperties;
    private final LedgerMetrics ledgerMetrics;

    /**
     * @throws NotFoundException if the scope does not exist
     * @throws InvalidAmountException if the derived expected total is negative
     */
    @Transactional
    public CashCount record(NewCashCount input, Actor actor) {
        if (input.getScopeType() == null || input.getScopeId() == null) {
            throw new IllegalArgumentException("Count scope is required");
        }
        DateWindow window = input.getWindow() != null ? input.getWindow() : DateWindow.ALL;

        boolean derived = input.getExpected() == null;
        MoneyPair expected = derived
            ? deriveExpected(input.getScopeType(), input.getScopeId(), window)
            : requireScope(input.getScopeType(), input.getScopeId(), input.getExpected());

        ReconciliationResult result = reconciliationCalculator.reconcile(input.getCounted(), expected);
        CashCount count = CashCount.record(input.getScopeType(), input.getScopeId(), input.getCountType(),
            input.getCountDate(), result, derived, window.getFrom(), window.getTo(), input.getNotes(),
            actor.getAuditName());

        MDC.put(CorrelationContext.COUNT_ID_MDC_KEY, count.getId().toString());
        try {
            countRepository.save(CashCountEntity.fromDomain(count));
            notificationPublisher.publish(triggerPolicy.onCashCounted(count, notificationProperties.toPreferences()));

            ledgerMetrics.recordReconciliation(count.getStatus().name(), count.isAlert());
            if (count.isAlert()) {
                log.warn("Cash count discrepancy above threshold: scope={} {}, discrepancy={}, pctArs={}, pctUsd={}",
                    count.getScopeType(), count.getScopeId(), count.getDiscrepancy(),
                    count.getArsDiscrepancyPct(), count.getUsdDiscrepancyPct());
            } else {
                log.info("Cash count recorded: scope={} {}, status={}", count.getScopeType(), count.getScopeId(),
                    count.getStatus());
            }
            return count;
        } finally {
            MDC.remove(CorrelationContext.COUNT_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public CashCount get(UUID countId) {
        return countRepository.findById(countId)
            .map(CashCountEntity::toDomain)
            .orElseThrow(() -> new NotFoundException(AGGREGATE, countId));
    }

    /**
     * Counts of a scope, most recent first.
     */
    @Transactional(readOnly = true)
    public List<CashCount> listForScope(ScopeType scopeType, UUID scopeId) {
        return countRepository.findByScopeTypeAndScopeIdOrderByCountDateDescCreatedAtDesc(scopeType, scopeId)
            .stream()
            .map(CashCountEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<CashCount> listAlerts() {
        return countRepository.findByAlertTrueOrderByCreatedAtDesc().stream()
            .map(CashCountEntity::toDomain)
            .toList();
    }

    private MoneyPair deriveExpected(ScopeType scopeType, UUID scopeId, DateWindow window) {
        LedgerBalance balance = switch (scopeType) {
            case REGISTER -> {
                registerService.get(scopeId);
                yield balanceCalculator.calculate(registerService.effectiveEntries(scopeId, window));
            }
            case EVENT -> {
                eventCashService.get(scopeId);
                yield balanceCalculator.calculate(eventCashService.entries(scopeId, window));
            }
        };
        SignedMoneyPair net = balance.getNet();
        if (!net.isNonNegative()) {
            throw new InvalidAmountException(String.format(
                "Ledger net for %s %s is negative (%s); supply the expected total explicitly",
                scopeType, scopeId, net));
        }
        return net.toMoneyPair();
    }

    private MoneyPair requireScope(ScopeType scopeType, UUID scopeId, MoneyPair expected) {
        switch (scopeType) {
            case REGISTER -> registerService.get(scopeId);
            case EVENT -> eventCashService.get(scopeId);
        }
        return expected;
    }
}
