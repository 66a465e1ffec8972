package com.caradonti.finance_ledger.notification;

import com.caradonti.finance_ledger.eventcash.EventCash;
import com.caradonti.finance_ledger.eventcash.InstallmentBucket;
import com.caradonti.finance_ledger.eventcash.WaterfallAllocation;
import com.caradonti.finance_ledger.inventory.StockLevel;
import com.caradonti.finance_ledger.ledger.LedgerEntry;
import com.caradonti.finance_ledger.ledger.Movement;
import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.reconciliation.CashCount;
import com.caradonti.finance_ledger.register.ApprovalOutcome;
import com.caradonti.finance_ledger.register.ApprovalPolicy;
import com.caradonti.finance_ledger.register.ApprovalStatus;
import com.caradonti.finance_ledger.register.CashRegisterEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Maps ledger outcomes to notification intents.
 *
 * Never talks to a dispatcher: the caller decides what to do with the returned
 * list. Types switched off in the preferences are filtered out here.
 */
@Component
@RequiredArgsConstructor
public class NotificationTriggerPolicy {

    public static final String AGGREGATE_REGISTER_ENTRY = "CashRegisterEntry";
    public static final String AGGREGATE_EVENT = "EventCash";
    public static final String AGGREGATE_CASH_COUNT = "CashCount";

    private final ApprovalPolicy approvalPolicy;

    /**
     * Intents for a newly created register entry: approval needed when it starts
     * PENDING, and a large-expense alert independently of approval.
     */
    public List<NotificationIntent> onRegisterEntryCreated(CashRegisterEntry entry, String registerName,
                                                           NotificationPreferences preferences) {
        List<NotificationIntent> intents = new ArrayList<>();

        if (entry.getApprovalStatus() == ApprovalStatus.PENDING) {
            Map<String, Object> payload = movementPayload(entry);
            payload.put("entryId", entry.getId());
            payload.put("registerId", entry.getRegisterId());
            payload.put("registerType", entry.getRegisterType().name());
            payload.put("description", entry.getDescription());
            payload.put("requiredApprovals", entry.getRequirement().getRequiredApprovals());
            payload.put("createdBy", entry.getCreatedBy());
            add(intents, preferences, new NotificationIntent(
                NotificationType.PAYMENT_APPROVAL_NEEDED,
                "Approval needed",
                String.format("%s in %s needs approval: %s", entry.getDescription(), registerName,
                    describe(entry)),
                payload, AGGREGATE_REGISTER_ENTRY, entry.getId()));
        }

        if (approvalPolicy.isLargeExpense(entry)) {
            add(intents, preferences, largeExpense(entry, entry.getDescription(), registerName,
                entry.getCreatedBy(), AGGREGATE_REGISTER_ENTRY, entry.getId()));
        }

        return intents;
    }

    /**
     * Intents for an approve or reject call. Only a transition into APPROVED
     * raises anything; no-op calls raise nothing.
     */
    public List<NotificationIntent> onApprovalChanged(ApprovalOutcome outcome, String actor,
                                                      NotificationPreferences preferences) {
        List<NotificationIntent> intents = new ArrayList<>();
        if (!outcome.isChanged() || !outcome.isNewlyApproved()) {
            return intents;
        }

        CashRegisterEntry entry = outcome.getEntry();
        Map<String, Object> payload = movementPayload(entry);
        payload.put("entryId", entry.getId());
        payload.put("registerId", entry.getRegisterId());
        payload.put("description", entry.getDescription());
        payload.put("approvedBy", actor);
        payload.put("roles", entry.getApprovals().keySet().stream().map(Enum::name).toList());
        add(intents, preferences, new NotificationIntent(
            NotificationType.PAYMENT_APPROVED,
            "Entry approved",
            String.format("%s approved by %s: %s", entry.getDescription(), actor, describe(entry)),
            payload, AGGREGATE_REGISTER_ENTRY, entry.getId()));
        return intents;
    }

    /**
     * Intents for an entry appended to an event: payment received when the
     * waterfall ran, plus the large-expense alert.
     */
    public List<NotificationIntent> onEventEntryAppended(EventCash event, LedgerEntry entry,
                                                         WaterfallAllocation allocation,
                                                         NotificationPreferences preferences) {
        List<NotificationIntent> intents = new ArrayList<>();

        if (allocation != null) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("eventId", event.getId());
            payload.put("eventName", event.getName());
            payload.put("entryId", entry.getId());
            payload.put("amountArs", plain(allocation.getPaymentAmount()));
            for (InstallmentBucket bucket : InstallmentBucket.values()) {
                payload.put(bucket.name().toLowerCase(), plain(allocation.appliedTo(bucket)));
            }
            payload.put("unallocatedArs", plain(allocation.getUnallocated()));
            payload.put("balanceDueArs", plain(allocation.getAfter().getBalanceDue()));
            payload.put("receivedBy", entry.getCreatedBy());
            add(intents, preferences, new NotificationIntent(
                NotificationType.EVENT_PAYMENT_RECEIVED,
                "Client payment received",
                String.format("ARS %s received for %s, balance due ARS %s",
                    plain(allocation.getPaymentAmount()), event.getName(),
                    plain(allocation.getAfter().getBalanceDue())),
                payload, AGGREGATE_EVENT, event.getId()));
        }

        if (approvalPolicy.isLargeExpense(entry)) {
            add(intents, preferences, largeExpense(entry, entry.getDetail(), event.getName(),
                entry.getCreatedBy(), AGGREGATE_EVENT, event.getId()));
        }

        return intents;
    }

    /**
     * Intents for a shop sale: always a sale notice, plus low stock when the
     * remaining quantity is at or below the product's threshold.
     */
    public List<NotificationIntent> onSaleCompleted(CashRegisterEntry entry, StockLevel stock,
                                                    NotificationPreferences preferences) {
        List<NotificationIntent> intents = new ArrayList<>();

        Map<String, Object> sale = movementPayload(entry);
        sale.put("entryId", entry.getId());
        sale.put("sku", stock.getSku());
        sale.put("productName", stock.getProductName());
        sale.put("quantity", stock.getQuantitySold());
        sale.put("soldBy", entry.getCreatedBy());
        add(intents, preferences, new NotificationIntent(
            NotificationType.SALE_COMPLETED,
            "Sale completed",
            String.format("Sold %d x %s for %s", stock.getQuantitySold(), stock.getProductName(),
                entry.getIncome()),
            sale, AGGREGATE_REGISTER_ENTRY, entry.getId()));

        if (stock.isLow()) {
            Map<String, Object> low = new LinkedHashMap<>();
            low.put("sku", stock.getSku());
            low.put("productName", stock.getProductName());
            low.put("remaining", stock.getRemaining());
            low.put("minThreshold", stock.getMinThreshold());
            add(intents, preferences, new NotificationIntent(
                NotificationType.LOW_STOCK,
                "Low stock",
                String.format("%s is down to %d units (threshold %d)", stock.getProductName(),
                    stock.getRemaining(), stock.getMinThreshold()),
                low, AGGREGATE_REGISTER_ENTRY, entry.getId()));
        }

        return intents;
    }

    public List<NotificationIntent> onCashCounted(CashCount count, NotificationPreferences preferences) {
        List<NotificationIntent> intents = new ArrayList<>();
        if (!count.isAlert()) {
            return intents;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("countId", count.getId());
        payload.put("scopeType", count.getScopeType().name());
        payload.put("scopeId", count.getScopeId());
        payload.put("countType", count.getCountType().name());
        payload.put("countDate", count.getCountDate().toString());
        payload.put("countedArs", plain(count.getCounted().getArs()));
        payload.put("countedUsd", plain(count.getCounted().getUsd()));
        payload.put("expectedArs", plain(count.getExpected().getArs()));
        payload.put("expectedUsd", plain(count.getExpected().getUsd()));
        payload.put("discrepancyArs", plain(count.getDiscrepancy().getArs()));
        payload.put("discrepancyUsd", plain(count.getDiscrepancy().getUsd()));
        payload.put("discrepancyPctArs", plain(count.getArsDiscrepancyPct()));
        payload.put("discrepancyPctUsd", plain(count.getUsdDiscrepancyPct()));
        payload.put("countedBy", count.getCountedBy());
        add(intents, preferences, new NotificationIntent(
            NotificationType.RECONCILIATION_DISCREPANCY,
            "Cash count discrepancy",
            String.format("%s count on %s is off by %s", count.getCountType(), count.getCountDate(),
                count.getDiscrepancy()),
            payload, AGGREGATE_CASH_COUNT, count.getId()));
        return intents;
    }

    private NotificationIntent largeExpense(Movement movement, String description, String scopeName,
                                            String actor, String aggregateType, UUID aggregateId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("amountArs", plain(movement.getExpense().getArs()));
        payload.put("description", description);
        payload.put("scope", scopeName);
        payload.put("createdBy", actor);
        return new NotificationIntent(
            NotificationType.LARGE_EXPENSE_ALERT,
            "Large expense",
            String.format("Expense of ARS %s in %s: %s", plain(movement.getExpense().getArs()),
                scopeName, description),
            payload, aggregateType, aggregateId);
    }

    private static Map<String, Object> movementPayload(Movement movement) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("incomeArs", plain(movement.getIncome().getArs()));
        payload.put("incomeUsd", plain(movement.getIncome().getUsd()));
        payload.put("expenseArs", plain(movement.getExpense().getArs()));
        payload.put("expenseUsd", plain(movement.getExpense().getUsd()));
        return payload;
    }

    private static String describe(Movement movement) {
        MoneyPair income = movement.getIncome();
        MoneyPair expense = movement.getExpense();
        if (income.isZero()) {
            return "expense " + expense;
        }
        if (expense.isZero()) {
            return "income " + income;
        }
        return "income " + income + ", expense " + expense;
    }

    private static String plain(BigDecimal value) {
        return value == null ? null : value.toPlainString();
    }

    private static void add(List<NotificationIntent> intents, NotificationPreferences preferences,
                            NotificationIntent intent) {
        if (preferences.allows(intent.getType())) {
            intents.add(intent);
        }
    }
}
