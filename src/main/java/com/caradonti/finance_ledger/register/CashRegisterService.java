package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.exception.NotFoundException;
import com.caradonti.finance_ledger.exception.VersionConflictException;
import com.caradonti.finance_ledger.identity.Actor;
import com.caradonti.finance_ledger.inventory.StockLevel;
import com.caradonti.finance_ledger.inventory.StockService;
import com.caradonti.finance_ledger.ledger.DateWindow;
import com.caradonti.finance_ledger.ledger.LedgerBalance;
import com.caradonti.finance_ledger.ledger.LedgerBalanceCalculator;
import com.caradonti.finance_ledger.notification.NotificationIntent;
import com.caradonti.finance_ledger.notification.NotificationPreferences;
import com.caradonti.finance_ledger.notification.NotificationProperties;
import com.caradonti.finance_ledger.notification.NotificationPublisher;
import com.caradonti.finance_ledger.notification.NotificationTriggerPolicy;
import com.caradonti.finance_ledger.observability.CorrelationContext;
import com.caradonti.finance_ledger.observability.LedgerMetrics;
import com.caradonti.finance_ledger.provider.ProviderUsageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * General, Shop and Deco cash registers.
 *
 * Every write loads the register, runs the approval rules on the entry,
 * recomputes the register balance from its current entries and saves both in
 * one transaction, together with any stock, provider and notification side
 * effects. The register row carries a version, so of two concurrent writes to
 * the same register only one commits; the other surfaces as
 * {@link VersionConflictException}.
 *
 * The balance snapshot covers pending and approved entries. Rejected entries
 * never moved money and drop out of it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CashRegisterService {

    static final String AGGREGATE_REGISTER = "CashRegister";
    static final String AGGREGATE_ENTRY = "CashRegisterEntry";

    private final CashRegisterRepository registerRepository;
    private final CashRegisterEntryRepository entryRepository;
    private final RegisterSummaryQuery summaryQuery;
    private final ApprovalPolicy approvalPolicy;
    private final LedgerBalanceCalculator balanceCalculator;
    private final StockService stockService;
    private final ProviderUsageService providerUsageService;
    private final NotificationTriggerPolicy triggerPolicy;
    private final NotificationPublisher notificationPublisher;
    private final NotificationProperties notificationProperties;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public CashRegister open(RegisterType type, String name, Actor actor) {
        CashRegister register = CashRegister.open(type, name, actor.getAuditName());
        registerRepository.save(CashRegisterEntity.fromDomain(register));
        log.info("Cash register opened: id={}, type={}, name={}", register.getId(), type, register.getName());
        return register;
    }

    @Transactional(readOnly = true)
    public CashRegister get(UUID registerId) {
        return loadRegister(registerId).toDomain();
    }

    @Transactional(readOnly = true)
    public LedgerBalance getBalance(UUID registerId) {
        loadRegister(registerId);
        return balanceCalculator.calculate(effectiveEntries(registerId, DateWindow.ALL));
    }

    @Transactional(readOnly = true)
    public List<CashRegister> list(RegisterType type) {
        List<CashRegisterEntity> registers = type != null
            ? registerRepository.findByTypeOrderByCreatedAtAsc(type)
            : registerRepository.findAll();
        return registers.stream().map(CashRegisterEntity::toDomain).toList();
    }

    /**
     * Appends an entry. Material entries start PENDING; everything else is
     * approved on creation.
     *
     * @throws NotFoundException if the register, the sold product or the provider does not exist
     * @throws VersionConflictException if the register was written concurrently
     */
    @Transactional
    public RegisterEntryAppended append(UUID registerId, NewRegisterEntry draft, String idempotencyKey, Actor actor) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.REGISTER_ID_MDC_KEY, registerId.toString());
        try {
            CashRegisterEntity register = loadRegister(registerId);

            ApprovalRequirement requirement = approvalPolicy.requirementFor(register.getType(), draft);
            CashRegisterEntry entry = CashRegisterEntry.create(registerId, register.getType(), draft.getDate(),
                draft.getDescription(), draft.getApplication(), draft.getProviderRef(), draft.getIncome(),
                draft.getExpense(), draft.getSaleLine(), draft.getNotes(), requirement, actor.getAuditName());
            MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entry.getId().toString());

            StockLevel stock = null;
            if (entry.getSaleLine() != null) {
                stock = stockService.recordSale(entry.getSaleLine().getSku(), entry.getSaleLine().getQuantity(),
                    entry.getIncome());
            }
            if (entry.getProviderRef() != null && !entry.getExpense().isZero()) {
                providerUsageService.recordUsage(entry.getProviderRef(), entry.getExpense());
            }

            entryRepository.save(CashRegisterEntryEntity.fromDomain(entry, idempotencyKey));
            LedgerBalance balance = refreshBalance(register);

            NotificationPreferences preferences = notificationProperties.toPreferences();
            List<NotificationIntent> intents = new ArrayList<>(
                triggerPolicy.onRegisterEntryCreated(entry, register.getName(), preferences));
            if (stock != null) {
                intents.addAll(triggerPolicy.onSaleCompleted(entry, stock, preferences));
            }
            notificationPublisher.publish(intents);

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordEntryAppended(register.getType().name(), entry.getApprovalStatus().name());
            ledgerMetrics.recordLatency("register.append", duration);
            log.info("Register entry appended: status={}, requirement={}, income={}, expense={}, duration={}ms",
                entry.getApprovalStatus(), requirement, entry.getIncome(), entry.getExpense(), duration);

            return new RegisterEntryAppended(entry, balance, stock);
        } finally {
            MDC.remove(CorrelationContext.REGISTER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    /**
     * Records an approval by {@code role}. Approving an approved entry, or the
     * same role approving twice, changes nothing and raises no notification.
     *
     * @throws NotFoundException if the entry does not exist in this register
     */
    @Transactional
    public ApprovalOutcome approve(UUID registerId, UUID entryId, ApproverRole role, Actor actor) {
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryId.toString());
        try {
            CashRegisterEntryEntity entity = loadEntry(registerId, entryId);
            ApprovalOutcome outcome = entity.toDomain().approve(role, actor.getAuditName());

            if (outcome.isChanged()) {
                entity.applyApproval(outcome.getEntry());
                flushEntry(entity);
            }

            notificationPublisher.publish(triggerPolicy.onApprovalChanged(outcome, actor.getAuditName(),
                notificationProperties.toPreferences()));

            String result = !outcome.isChanged() ? "noop"
                : outcome.isNewlyApproved() ? "approved" : "partial";
            ledgerMetrics.recordApproval(role.name(), result);
            log.info("Approval recorded: role={}, by={}, result={}, status={}",
                role, actor.getAuditName(), result, outcome.getEntry().getApprovalStatus());
            return outcome;
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    /**
     * Rejects a pending entry and drops it from the register balance.
     *
     * @throws NotFoundException if the entry does not exist in this register
     */
    @Transactional
    public ApprovalOutcome reject(UUID registerId, UUID entryId, String reason, Actor actor) {
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryId.toString());
        try {
            CashRegisterEntryEntity entity = loadEntry(registerId, entryId);
            ApprovalOutcome outcome = entity.toDomain().reject(actor.getAuditName(), reason);

            if (outcome.isChanged()) {
                entity.applyApproval(outcome.getEntry());
                flushEntry(entity);
                refreshBalance(loadRegister(registerId));
            }

            ledgerMetrics.recordApproval("admin", outcome.isChanged() ? "rejected" : "noop");
            log.info("Rejection recorded: by={}, changed={}", actor.getAuditName(), outcome.isChanged());
            return outcome;
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public CashRegisterEntry getEntry(UUID registerId, UUID entryId) {
        return loadEntry(registerId, entryId).toDomain();
    }

    /**
     * Entries in insertion order, optionally only those in {@code status}.
     */
    @Transactional(readOnly = true)
    public List<CashRegisterEntry> listEntries(UUID registerId, ApprovalStatus status) {
        loadRegister(registerId);
        List<CashRegisterEntryEntity> entries = status != null
            ? entryRepository.findByRegisterIdAndApprovalStatusOrderBySequenceNumberAsc(registerId, status)
            : entryRepository.findByRegisterIdOrderBySequenceNumberAsc(registerId);
        return entries.stream().map(CashRegisterEntryEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public RegisterSummary summarize(UUID registerId, DateWindow window) {
        loadRegister(registerId);
        return summaryQuery.summarize(registerId, window);
    }

    /**
     * Pending and approved entries of a register within {@code window}, in
     * insertion order.
     */
    @Transactional(readOnly = true)
    public List<CashRegisterEntry> effectiveEntries(UUID registerId, DateWindow window) {
        return entryRepository.findEffectiveEntries(registerId, window).stream()
            .map(CashRegisterEntryEntity::toDomain)
            .toList();
    }

    private LedgerBalance refreshBalance(CashRegisterEntity register) {
        entryRepository.flush();
        LedgerBalance balance = balanceCalculator.calculate(effectiveEntries(register.getId(), DateWindow.ALL));
        register.applyBalance(balance);
        try {
            registerRepository.saveAndFlush(register);
        } catch (ObjectOptimisticLockingFailureException e) {
            ledgerMetrics.recordVersionConflict(AGGREGATE_REGISTER);
            throw new VersionConflictException(AGGREGATE_REGISTER, register.getId(), e);
        }
        return balance;
    }

    private void flushEntry(CashRegisterEntryEntity entity) {
        try {
            entryRepository.saveAndFlush(entity);
        } catch (ObjectOptimisticLockingFailureException e) {
            ledgerMetrics.recordVersionConflict(AGGREGATE_ENTRY);
            throw new VersionConflictException(AGGREGATE_ENTRY, entity.getId(), e);
        }
    }

    private CashRegisterEntity loadRegister(UUID registerId) {
        return registerRepository.findById(registerId)
            .orElseThrow(() -> new NotFoundException(AGGREGATE_REGISTER, registerId));
    }

    private CashRegisterEntryEntity loadEntry(UUID registerId, UUID entryId) {
        return entryRepository.findByIdAndRegisterId(entryId, registerId)
            .orElseThrow(() -> new NotFoundException(AGGREGATE_ENTRY, entryId));
    }
}
