package com.caradonti.finance_ledger.reconciliation;

import com.caradonti.finance_ledger.eventcash.EventCashService;
import com.caradonti.finance_ledger.exception.InvalidAmountException;
import com.caradonti.finance_ledger.exception.NotFoundException;
import com.caradonti.finance_ledger.identity.Actor;
import com.caradonti.finance_ledger.ledger.DateWindow;
import com.caradonti.finance_ledger.ledger.LedgerBalanceCalculator;
import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.notification.NotificationIntent;
import com.caradonti.finance_ledger.notification.NotificationProperties;
import com.caradonti.finance_ledger.notification.NotificationPublisher;
import com.caradonti.finance_ledger.notification.NotificationTriggerPolicy;
import com.caradonti.finance_ledger.notification.NotificationType;
import com.caradonti.finance_ledger.observability.LedgerMetrics;
import com.caradonti.finance_ledger.register.ApprovalPolicy;
import com.caradonti.finance_ledger.register.ApprovalRequirement;
import com.caradonti.finance_ledger.register.CashRegisterEntry;
import com.caradonti.finance_ledger.register.CashRegisterService;
import com.caradonti.finance_ledger.register.RegisterType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CashCountServiceTest {

    private static final LocalDate DATE = LocalDate.of(2024, 6, 30);
    private static final Actor AUDITOR = new Actor("u-9", "auditor");

    @Mock
    private CashCountRepository countRepository;
    @Mock
    private CashRegisterService registerService;
    @Mock
    private EventCashService eventCashService;
    @Mock
    private NotificationPublisher notificationPublisher;

    @Captor
    private ArgumentCaptor<List<NotificationIntent>> intentsCaptor;

    private CashCountService service;
    private final UUID registerId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        ApprovalPolicy approvalPolicy = new ApprovalPolicy(
            new BigDecimal("10000"), new BigDecimal("100"),
            new BigDecimal("20000"), new BigDecimal("200"),
            new BigDecimal("10000"));
        service = new CashCountService(countRepository, registerService, eventCashService,
            new LedgerBalanceCalculator(), new ReconciliationCalculator(new BigDecimal("5"), new BigDecimal("1")),
            new NotificationTriggerPolicy(approvalPolicy), notificationPublisher, new NotificationProperties(),
            new LedgerMetrics(new SimpleMeterRegistry()));
    }

    private CashRegisterEntry registerEntry(MoneyPair income, MoneyPair expense) {
        return CashRegisterEntry.create(registerId, RegisterType.GENERAL, DATE, "movement", null, null,
            income, expense, null, null, ApprovalRequirement.NONE, "cashier");
    }

    @Test
    @DisplayName("A count short by 6% against a supplied expected total raises a discrepancy")
    void testRecord_SuppliedExpected() {
        NewCashCount input = new NewCashCount(ScopeType.REGISTER, registerId, CashCountType.DAILY, DATE,
            MoneyPair.of("94000", "0"), MoneyPair.of("100000", "0"), null, "cierre");

        CashCount count = service.record(input, AUDITOR);

        assertEquals(CashCountStatus.MAJOR_DISCREPANCY, count.getStatus());
        assertEquals(new BigDecimal("-6000.00"), count.getDiscrepancy().getArs());
        assertEquals(new BigDecimal("6.00"), count.getArsDiscrepancyPct());
        assertFalse(count.isExpectedDerived());
        assertEquals("auditor", count.getCountedBy());
        verify(registerService).get(registerId);
        verify(countRepository).save(any(CashCountEntity.class));
        verify(notificationPublisher).publish(intentsCaptor.capture());
        assertEquals(NotificationType.RECONCILIATION_DISCREPANCY, intentsCaptor.getValue().get(0).getType());
    }

    @Test
    @DisplayName("Without an expected total, the register's ledger net over the window is used")
    void testRecord_DerivedExpected() {
        DateWindow window = DateWindow.of(DATE.withDayOfMonth(1), DATE);
        when(registerService.effectiveEntries(registerId, window)).thenReturn(List.of(
            registerEntry(MoneyPair.of("120000", "50"), null),
            registerEntry(null, MoneyPair.of("20000", "0"))));

        CashCount count = service.record(new NewCashCount(ScopeType.REGISTER, registerId, CashCountType.MONTHLY,
            DATE, MoneyPair.of("100000", "50"), null, window, null), AUDITOR);

        assertTrue(count.isExpectedDerived());
        assertEquals(MoneyPair.of("100000", "50"), count.getExpected());
        assertEquals(CashCountStatus.MATCH, count.getStatus());
        assertEquals(DATE.withDayOfMonth(1), count.getWindowFrom());
        verify(notificationPublisher).publish(List.of());
    }

    @Test
    @DisplayName("A negative ledger net cannot serve as the expected total")
    void testRecord_NegativeDerivedExpected() {
        when(registerService.effectiveEntries(any(), any())).thenReturn(List.of(
            registerEntry(null, MoneyPair.of("5000", "0"))));

        assertThrows(InvalidAmountException.class, () -> service.record(new NewCashCount(ScopeType.REGISTER,
            registerId, CashCountType.SPECIAL, DATE, MoneyPair.ZERO, null, null, null), AUDITOR));
        verify(countRepository, never()).save(any());
    }

    @Test
    @DisplayName("Counting an unknown event fails before anything is stored")
    void testRecord_UnknownScope() {
        UUID eventId = UUID.randomUUID();
        when(eventCashService.get(eventId)).thenThrow(new NotFoundException("EventCash", eventId));

        assertThrows(NotFoundException.class, () -> service.record(new NewCashCount(ScopeType.EVENT, eventId,
            CashCountType.AUDIT, DATE, MoneyPair.ZERO, MoneyPair.ZERO, null, null), AUDITOR));
        verify(countRepository, never()).save(any());
        verifyNoInteractions(notificationPublisher);
    }
}
