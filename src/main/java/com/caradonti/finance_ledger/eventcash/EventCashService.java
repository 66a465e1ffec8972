package com.caradonti.finance_ledger.eventcash;

import com.caradonti.finance_ledger.exception.InvalidTransitionException;
import com.caradonti.finance_ledger.exception.NotFoundException;
import com.caradonti.finance_ledger.exception.VersionConflictException;
import com.caradonti.finance_ledger.identity.Actor;
import com.caradonti.finance_ledger.ledger.DateWindow;
import com.caradonti.finance_ledger.ledger.LedgerBalance;
import com.caradonti.finance_ledger.ledger.LedgerBalanceCalculator;
import com.caradonti.finance_ledger.ledger.LedgerEntry;
import com.caradonti.finance_ledger.ledger.LedgerEntryEntity;
import com.caradonti.finance_ledger.ledger.LedgerEntryRepository;
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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Event cash books: append-only ledgers with a client installment schedule.
 *
 * ARS client payments are routed through the {@link PaymentWaterfallAllocator}
 * in the same transaction that appends the entry. Corrections are new
 * reversing entries; installment buckets are never decreased, so reversing a
 * client payment leaves the schedule as it was.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventCashService {

    static final String AGGREGATE_EVENT = "EventCash";
    static final String AGGREGATE_ENTRY = "LedgerEntry";

    private final EventCashRepository eventRepository;
    private final LedgerEntryRepository entryRepository;
    private final PaymentWaterfallAllocator waterfallAllocator;
    private final LedgerBalanceCalculator balanceCalculator;
    private final ProviderUsageService providerUsageService;
    private final NotificationTriggerPolicy triggerPolicy;
    private final NotificationPublisher notificationPublisher;
    private final NotificationProperties notificationProperties;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public EventCash create(String name, String clientName, LocalDate eventDate, BigDecimal totalBudget, Actor actor) {
        EventCash event = EventCash.create(name, clientName, eventDate, totalBudget, actor.getAuditName());
        eventRepository.save(EventCashEntity.fromDomain(event));
        log.info("Event created: id={}, name={}, budget={}", event.getId(), event.getName(),
            event.getPaymentStatus().getTotalBudget());
        return event;
    }

    @Transactional(readOnly = true)
    public EventCash get(UUID eventId) {
        return loadEvent(eventId).toDomain();
    }

    @Transactional(readOnly = true)
    public List<EventCash> list() {
        return eventRepository.findAllByOrderByEventDateDescCreatedAtDesc().stream()
            .map(EventCashEntity::toDomain)
            .toList();
    }

    /**
     * Appends an entry to the event ledger and recomputes its balance.
     *
     * @throws NotFoundException if the event or the referenced provider does not exist
     * @throws VersionConflictException if the event was written concurrently
     */
    @Transactional
    public EventEntryAppended append(UUID eventId, NewLedgerEntry draft, String idempotencyKey, Actor actor) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.EVENT_ID_MDC_KEY, eventId.toString());
        try {
            EventCashEntity event = loadEvent(eventId);

            LedgerEntry entry = LedgerEntry.create(eventId, draft.getDate(), draft.getPaymentMethod(),
                draft.getDetail(), draft.getIncome(), draft.getExpense(), draft.getProviderRef(),
                draft.getCategoryRef(), draft.isClientPayment(), actor.getAuditName());
            MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entry.getId().toString());

            WaterfallAllocation allocation = null;
            if (entry.isWaterfallEligible()) {
                allocation = waterfallAllocator.allocate(event.toDomain().getPaymentStatus(), entry.getIncome().getArs());
                event.applyPaymentStatus(allocation.getAfter());
                ledgerMetrics.recordWaterfallAllocation(allocation.getPolicy().name(), allocation.hasUnallocated());
                if (allocation.hasUnallocated()) {
                    log.warn("Client payment exceeded installment cap: payment={}, unallocated={}, policy={}",
                        allocation.getPaymentAmount(), allocation.getUnallocated(), allocation.getPolicy());
                }
            } else if (entry.isClientPayment()) {
                log.info("Client payment without ARS income is not routed through the installment schedule");
            }

            if (entry.getProviderRef() != null && !entry.getExpense().isZero()) {
                providerUsageService.recordUsage(entry.getProviderRef(), entry.getExpense());
            }

            entryRepository.save(LedgerEntryEntity.fromDomain(entry, idempotencyKey));
            LedgerBalance balance = refreshBalance(event);
            EventCash updated = event.toDomain();

            notificationPublisher.publish(triggerPolicy.onEventEntryAppended(updated, entry, allocation,
                notificationProperties.toPreferences()));

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordEntryAppended("EVENT", entry.isClientPayment() ? "client_payment" : "movement");
            ledgerMetrics.recordLatency("event.append", duration);
            log.info("Event entry appended: income={}, expense={}, clientPayment={}, duration={}ms",
                entry.getIncome(), entry.getExpense(), entry.isClientPayment(), duration);

            return new EventEntryAppended(entry, balance, updated.getPaymentStatus(), allocation);
        } finally {
            MDC.remove(CorrelationContext.EVENT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    /**
     * Appends the entry that cancels {@code entryId}. An entry can be reversed
     * once, and reversals themselves cannot be reversed.
     *
     * @throws InvalidTransitionException if the entry was already reversed or is a reversal
     */
    @Transactional
    public EventEntryAppended reverse(UUID eventId, UUID entryId, LocalDate reversalDate, Actor actor) {
        MDC.put(CorrelationContext.EVENT_ID_MDC_KEY, eventId.toString());
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryId.toString());
        try {
            EventCashEntity event = loadEvent(eventId);
            LedgerEntry original = loadEntry(eventId, entryId).toDomain();
            if (original.isReversal()) {
                throw new InvalidTransitionException("Entry " + entryId + " is itself a reversal");
            }
            if (entryRepository.existsByReversesEntryId(entryId)) {
                throw new InvalidTransitionException("Entry " + entryId + " was already reversed");
            }

            LocalDate date = reversalDate != null ? reversalDate : LocalDate.now();
            LedgerEntry reversal = original.reverse(date, actor.getAuditName());
            entryRepository.save(LedgerEntryEntity.fromDomain(reversal, null));
            LedgerBalance balance = refreshBalance(event);

            ledgerMetrics.recordEntryAppended("EVENT", "reversal");
            log.info("Entry reversed: reversalId={}, by={}", reversal.getId(), actor.getAuditName());
            return new EventEntryAppended(reversal, balance, event.toDomain().getPaymentStatus(), null);
        } finally {
            MDC.remove(CorrelationContext.EVENT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    /**
     * Points an entry at a provider and an expense category. Amounts stay as
     * they are. When the provider changes, the entry's expense moves from the
     * previous provider's usage to the new one's.
     */
    @Transactional
    public LedgerEntry assignReferences(UUID eventId, UUID entryId, UUID providerRef, UUID categoryRef) {
        LedgerEntryEntity entity = loadEntry(eventId, entryId);
        LedgerEntry current = entity.toDomain();
        LedgerEntry updated = current.withReferences(providerRef, categoryRef);

        UUID previousProvider = current.getProviderRef();
        if (!Objects.equals(providerRef, previousProvider) && !updated.getExpense().isZero()) {
            if (previousProvider != null) {
                providerUsageService.reverseUsage(previousProvider, updated.getExpense());
            }
            if (providerRef != null) {
                providerUsageService.recordUsage(providerRef, updated.getExpense());
            }
        }

        entity.updateReferences(updated);
        entryRepository.save(entity);
        log.info("Entry references updated: entryId={}, providerRef={}, categoryRef={}",
            entryId, providerRef, categoryRef);
        return updated;
    }

    @Transactional(readOnly = true)
    public LedgerBalance getBalance(UUID eventId) {
        loadEvent(eventId);
        return balanceCalculator.calculate(entries(eventId, DateWindow.ALL));
    }

    @Transactional(readOnly = true)
    public PaymentStatus getPaymentStatus(UUID eventId) {
        return loadEvent(eventId).toDomain().getPaymentStatus();
    }

    @Transactional(readOnly = true)
    public LedgerEntry getEntry(UUID eventId, UUID entryId) {
        return loadEntry(eventId, entryId).toDomain();
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> listEntries(UUID eventId) {
        loadEvent(eventId);
        return entryRepository.findByEventIdOrderBySequenceNumberAsc(eventId).stream()
            .map(LedgerEntryEntity::toDomain)
            .toList();
    }

    /**
     * Entries of an event dated within {@code window}, in insertion order.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> entries(UUID eventId, DateWindow window) {
        return entryRepository.findForWindow(eventId, window).stream()
            .map(LedgerEntryEntity::toDomain)
            .toList();
    }

    private LedgerBalance refreshBalance(EventCashEntity event) {
        entryRepository.flush();
        LedgerBalance balance = balanceCalculator.calculate(entries(event.getId(), DateWindow.ALL));
        event.applyBalance(balance);
        try {
            eventRepository.saveAndFlush(event);
        } catch (ObjectOptimisticLockingFailureException e) {
            ledgerMetrics.recordVersionConflict(AGGREGATE_EVENT);
            throw new VersionConflictException(AGGREGATE_EVENT, event.getId(), e);
        }
        return balance;
    }

    private EventCashEntity loadEvent(UUID eventId) {
        return eventRepository.findById(eventId)
            .orElseThrow(() -> new NotFoundException(AGGREGATE_EVENT, eventId));
    }

    private LedgerEntryEntity loadEntry(UUID eventId, UUID entryId) {
        return entryRepository.findByIdAndEventId(entryId, eventId)
            .orElseThrow(() -> new NotFoundException(AGGREGATE_ENTRY, entryId));
    }
}
