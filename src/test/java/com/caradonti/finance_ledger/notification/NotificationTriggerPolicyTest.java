package com.caradonti.finance_ledger.notification;

import com.caradonti.finance_ledger.eventcash.EventCash;
import com.caradonti.finance_ledger.eventcash.OverflowPolicy;
import com.caradonti.finance_ledger.eventcash.PaymentWaterfallAllocator;
import com.caradonti.finance_ledger.eventcash.WaterfallAllocation;
import com.caradonti.finance_ledger.inventory.StockLevel;
import com.caradonti.finance_ledger.ledger.LedgerEntry;
import com.caradonti.finance_ledger.ledger.PaymentMethod;
import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.reconciliation.CashCount;
import com.caradonti.finance_ledger.reconciliation.CashCountType;
import com.caradonti.finance_ledger.reconciliation.ReconciliationCalculator;
import com.caradonti.finance_ledger.reconciliation.ScopeType;
import com.caradonti.finance_ledger.register.ApprovalOutcome;
import com.caradonti.finance_ledger.register.ApprovalPolicy;
import com.caradonti.finance_ledger.register.ApprovalRequirement;
import com.caradonti.finance_ledger.register.ApproverRole;
import com.caradonti.finance_ledger.register.CashRegisterEntry;
import com.caradonti.finance_ledger.register.NewRegisterEntry;
import com.caradonti.finance_ledger.register.RegisterType;
import com.caradonti.finance_ledger.register.SaleLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class NotificationTriggerPolicyTest {

    private static final LocalDate DATE = LocalDate.of(2024, 6, 1);

    private final ApprovalPolicy approvalPolicy = new ApprovalPolicy(
        new BigDecimal("10000"), new BigDecimal("100"),
        new BigDecimal("20000"), new BigDecimal("200"),
        new BigDecimal("10000"));
    private final NotificationTriggerPolicy policy = new NotificationTriggerPolicy(approvalPolicy);
    private final NotificationPreferences all = NotificationPreferences.allEnabled();

    private CashRegisterEntry generalExpense(String ars) {
        NewRegisterEntry draft = new NewRegisterEntry(DATE, "Alquiler", null, null,
            null, MoneyPair.of(ars, "0"), null, null);
        return CashRegisterEntry.create(UUID.randomUUID(), RegisterType.GENERAL, DATE, draft.getDescription(),
            null, null, draft.getIncome(), draft.getExpense(), null, null,
            approvalPolicy.requirementFor(RegisterType.GENERAL, draft), "cashier");
    }

    @Test
    @DisplayName("A 15000 ARS General Cash expense asks for approval and raises a large-expense alert")
    void testLargePendingExpense_TwoIntents() {
        CashRegisterEntry entry = generalExpense("15000");

        List<NotificationIntent> intents = policy.onRegisterEntryCreated(entry, "Caja General", all);

        assertEquals(ApprovalRequirement.SINGLE, entry.getRequirement());
        assertEquals(List.of(NotificationType.PAYMENT_APPROVAL_NEEDED, NotificationType.LARGE_EXPENSE_ALERT),
            intents.stream().map(NotificationIntent::getType).toList());
        assertEquals(entry.getId(), intents.get(0).getAggregateId());
        assertEquals("15000.00", intents.get(1).getPayload().get("amountArs"));
    }

    @Test
    @DisplayName("Entries approved on creation raise nothing")
    void testSmallExpense_NoIntents() {
        assertTrue(policy.onRegisterEntryCreated(generalExpense("9000"), "Caja General", all).isEmpty());
    }

    @Test
    @DisplayName("Switched-off types are filtered out")
    void testPreferences_FilterTypes() {
        NotificationPreferences noAlerts = new NotificationPreferences(true,
            EnumSet.complementOf(EnumSet.of(NotificationType.LARGE_EXPENSE_ALERT)), List.of());

        List<NotificationIntent> intents = policy.onRegisterEntryCreated(generalExpense("15000"), "Caja", noAlerts);

        assertEquals(1, intents.size());
        assertEquals(NotificationType.PAYMENT_APPROVAL_NEEDED, intents.get(0).getType());
        assertTrue(policy.onRegisterEntryCreated(generalExpense("15000"), "Caja",
            NotificationPreferences.disabled()).isEmpty());
    }

    @Test
    @DisplayName("Only the transition into APPROVED is announced")
    void testApproval_OnlyFinalTransition() {
        CashRegisterEntry dual = generalExpense("25000");
        assertEquals(ApprovalRequirement.DUAL, dual.getRequirement());

        ApprovalOutcome first = dual.approve(ApproverRole.FEDE, "Fede");
        assertTrue(policy.onApprovalChanged(first, "Fede", all).isEmpty());

        ApprovalOutcome second = first.getEntry().approve(ApproverRole.SISTERS, "Ana");
        List<NotificationIntent> intents = policy.onApprovalChanged(second, "Ana", all);
        assertEquals(1, intents.size());
        assertEquals(NotificationType.PAYMENT_APPROVED, intents.get(0).getType());

        ApprovalOutcome noop = second.getEntry().approve(ApproverRole.FEDE, "Fede");
        assertTrue(policy.onApprovalChanged(noop, "Fede", all).isEmpty());
    }

    @Test
    @DisplayName("A client payment announces the received amount and balance due")
    void testEventPayment_Received() {
        EventCash event = EventCash.create("Boda Perez", "Perez", DATE, new BigDecimal("100000"), "cashier");
        LedgerEntry payment = LedgerEntry.create(event.getId(), DATE, PaymentMethod.CASH, "Anticipo",
            MoneyPair.of("30000", "0"), null, null, null, true, "cashier");
        WaterfallAllocation allocation = new PaymentWaterfallAllocator(new BigDecimal("0.30"),
            new BigDecimal("0.60"), OverflowPolicy.CAP_AND_DROP).allocate(event.getPaymentStatus(), new BigDecimal("30000"));

        List<NotificationIntent> intents = policy.onEventEntryAppended(
            event.withPaymentStatus(allocation.getAfter()), payment, allocation, all);

        assertEquals(1, intents.size());
        NotificationIntent intent = intents.get(0);
        assertEquals(NotificationType.EVENT_PAYMENT_RECEIVED, intent.getType());
        assertEquals("30000.00", intent.getPayload().get("anticipo"));
        assertEquals("70000.00", intent.getPayload().get("balanceDueArs"));
        assertEquals(event.getId(), intent.getAggregateId());
    }

    @Test
    @DisplayName("A sale leaving stock at the threshold also raises low stock")
    void testSale_LowStock() {
        CashRegisterEntry sale = CashRegisterEntry.create(UUID.randomUUID(), RegisterType.SHOP, DATE, "Venta",
            null, null, MoneyPair.of("3000", "0"), null, new SaleLine("VELA-01", 2), null,
            ApprovalRequirement.NONE, "cashier");

        List<NotificationIntent> low = policy.onSaleCompleted(sale, new StockLevel("VELA-01", "Vela", 2, 5, 5), all);
        List<NotificationIntent> ok = policy.onSaleCompleted(sale, new StockLevel("VELA-01", "Vela", 2, 6, 5), all);

        assertEquals(List.of(NotificationType.SALE_COMPLETED, NotificationType.LOW_STOCK),
            low.stream().map(NotificationIntent::getType).toList());
        assertEquals(List.of(NotificationType.SALE_COMPLETED),
            ok.stream().map(NotificationIntent::getType).toList());
    }

    @Test
    @DisplayName("Only alerting cash counts raise a discrepancy")
    void testCashCount_DiscrepancyOnAlert() {
        ReconciliationCalculator calculator = new ReconciliationCalculator(new BigDecimal("5"), new BigDecimal("1"));
        UUID registerId = UUID.randomUUID();
        CashCount shortCount = CashCount.record(ScopeType.REGISTER, registerId, CashCountType.DAILY, DATE,
            calculator.reconcile(MoneyPair.of("94000", "0"), MoneyPair.of("100000", "0")),
            false, null, null, null, "auditor");
        CashCount matching = CashCount.record(ScopeType.REGISTER, registerId, CashCountType.DAILY, DATE,
            calculator.reconcile(MoneyPair.of("100000", "0"), MoneyPair.of("100000", "0")),
            false, null, null, null, "auditor");

        List<NotificationIntent> intents = policy.onCashCounted(shortCount, all);

        assertEquals(1, intents.size());
        assertEquals(NotificationType.RECONCILIATION_DISCREPANCY, intents.get(0).getType());
        assertEquals("6.00", intents.get(0).getPayload().get("discrepancyPctArs"));
        assertTrue(policy.onCashCounted(matching, all).isEmpty());
    }
}
