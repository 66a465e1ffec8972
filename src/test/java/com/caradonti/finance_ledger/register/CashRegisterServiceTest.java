package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.exception.NotFoundException;
import com.caradonti.finance_ledger.exception.VersionConflictException;
import com.caradonti.finance_ledger.identity.Actor;
import com.caradonti.finance_ledger.inventory.StockLevel;
import com.caradonti.finance_ledger.inventory.StockService;
import com.caradonti.finance_ledger.ledger.LedgerBalanceCalculator;
import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.notification.NotificationIntent;
import com.caradonti.finance_ledger.notification.NotificationProperties;
import com.caradonti.finance_ledger.notification.NotificationPublisher;
import com.caradonti.finance_ledger.notification.NotificationTriggerPolicy;
import com.caradonti.finance_ledger.notification.NotificationType;
import com.caradonti.finance_ledger.observability.LedgerMetrics;
import com.caradonti.finance_ledger.provider.ProviderUsageService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CashRegisterServiceTest {

    private static final LocalDate DATE = LocalDate.of(2024, 6, 3);
    private static final Actor CASHIER = new Actor("u-1", "cashier");

    @Mock
    private CashRegisterRepository registerRepository;
    @Mock
    private CashRegisterEntryRepository entryRepository;
    @Mock
    private RegisterSummaryQuery summaryQuery;
    @Mock
    private StockService stockService;
    @Mock
    private ProviderUsageService providerUsageService;
    @Mock
    private NotificationPublisher notificationPublisher;

    @Captor
    private ArgumentCaptor<List<NotificationIntent>> intentsCaptor;

    private final List<CashRegisterEntryEntity> stored = new ArrayList<>();
    private CashRegisterService service;

    @BeforeEach
    void setUp() {
        ApprovalPolicy approvalPolicy = new ApprovalPolicy(
            new BigDecimal("10000"), new BigDecimal("100"),
            new BigDecimal("20000"), new BigDecimal("200"),
            new BigDecimal("10000"));
        service = new CashRegisterService(registerRepository, entryRepository, summaryQuery, approvalPolicy,
            new LedgerBalanceCalculator(), stockService, providerUsageService,
            new NotificationTriggerPolicy(approvalPolicy), notificationPublisher, new NotificationProperties(),
            new LedgerMetrics(new SimpleMeterRegistry()));
    }

    private CashRegisterEntity givenRegister(RegisterType type) {
        CashRegisterEntity register = CashRegisterEntity.fromDomain(CashRegister.open(type, "Caja", "admin"));
        when(registerRepository.findById(register.getId())).thenReturn(Optional.of(register));
        return register;
    }

    private void givenEntriesAreStored(UUID registerId) {
        when(entryRepository.save(any(CashRegisterEntryEntity.class))).thenAnswer(invocation -> {
            CashRegisterEntryEntity entity = invocation.getArgument(0);
            stored.add(entity);
            return entity;
        });
        when(entryRepository.findEffectiveEntries(eq(registerId), any())).thenAnswer(invocation -> stored.stream()
            .filter(entity -> entity.getApprovalStatus() != ApprovalStatus.REJECTED)
            .toList());
    }

    private static NewRegisterEntry expense(String ars) {
        return new NewRegisterEntry(DATE, "Pago proveedor", null, null, null, MoneyPair.of(ars, "0"), null, null);
    }

    @Test
    @DisplayName("A 15000 ARS expense is pending and queues approval-needed and large-expense notices")
    void testAppend_MaterialExpense() {
        CashRegisterEntity register = givenRegister(RegisterType.GENERAL);
        givenEntriesAreStored(register.getId());

        RegisterEntryAppended result = service.append(register.getId(), expense("15000"), "key-1", CASHIER);

        assertEquals(ApprovalStatus.PENDING, result.getEntry().getApprovalStatus());
        assertEquals(ApprovalRequirement.SINGLE, result.getEntry().getRequirement());
        assertEquals(new BigDecimal("-15000.00"), result.getBalance().getNet().getArs());
        assertEquals(new BigDecimal("-15000.00"), register.getBalanceArs());
        assertEquals("key-1", stored.get(0).getIdempotencyKey());
        assertEquals("cashier", result.getEntry().getCreatedBy());

        verify(notificationPublisher).publish(intentsCaptor.capture());
        assertEquals(List.of(NotificationType.PAYMENT_APPROVAL_NEEDED, NotificationType.LARGE_EXPENSE_ALERT),
            intentsCaptor.getValue().stream().map(NotificationIntent::getType).toList());
        verify(registerRepository).saveAndFlush(register);
        verifyNoInteractions(stockService, providerUsageService);
    }

    @Test
    @DisplayName("A shop sale decrements stock and announces the sale")
    void testAppend_ShopSale() {
        CashRegisterEntity register = givenRegister(RegisterType.SHOP);
        givenEntriesAreStored(register.getId());
        MoneyPair revenue = MoneyPair.of("3000", "0");
        when(stockService.recordSale("VELA-01", 2, revenue)).thenReturn(new StockLevel("VELA-01", "Vela", 2, 3, 5));

        NewRegisterEntry sale = new NewRegisterEntry(DATE, "Venta velas", null, null, revenue, null,
            new SaleLine("VELA-01", 2), null);
        RegisterEntryAppended result = service.append(register.getId(), sale, "key-sale", CASHIER);

        assertEquals(ApprovalStatus.APPROVED, result.getEntry().getApprovalStatus());
        assertEquals(3, result.getStock().getRemaining());
        verify(notificationPublisher).publish(intentsCaptor.capture());
        assertEquals(List.of(NotificationType.SALE_COMPLETED, NotificationType.LOW_STOCK),
            intentsCaptor.getValue().stream().map(NotificationIntent::getType).toList());
    }

    @Test
    @DisplayName("An expense paid to a provider counts toward the provider's usage")
    void testAppend_ProviderUsage() {
        CashRegisterEntity register = givenRegister(RegisterType.DECO);
        givenEntriesAreStored(register.getId());
        UUID providerId = UUID.randomUUID();

        NewRegisterEntry draft = new NewRegisterEntry(DATE, "Telas", "Boda", providerId, null,
            MoneyPair.of("4000", "0"), null, null);
        service.append(register.getId(), draft, "key-prov", CASHIER);

        verify(providerUsageService).recordUsage(providerId, MoneyPair.of("4000", "0"));
    }

    @Test
    @DisplayName("A concurrent write to the register surfaces as a version conflict")
    void testAppend_VersionConflict() {
        CashRegisterEntity register = givenRegister(RegisterType.GENERAL);
        givenEntriesAreStored(register.getId());
        when(registerRepository.saveAndFlush(register))
            .thenThrow(new ObjectOptimisticLockingFailureException(CashRegisterEntity.class, register.getId()));

        VersionConflictException e = assertThrows(VersionConflictException.class,
            () -> service.append(register.getId(), expense("500"), "key-2", CASHIER));

        assertEquals(register.getId(), e.getAggregateId());
        verify(notificationPublisher, never()).publish(any());
    }

    @Test
    void testAppend_UnknownRegister() {
        UUID registerId = UUID.randomUUID();
        when(registerRepository.findById(registerId)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.append(registerId, expense("500"), "key-3", CASHIER));
        verify(entryRepository, never()).save(any());
    }

    @Test
    @DisplayName("Dual approval: first role leaves the entry pending, second approves it")
    void testApprove_DualFlow() {
        UUID registerId = UUID.randomUUID();
        CashRegisterEntry entry = CashRegisterEntry.create(registerId, RegisterType.GENERAL, DATE, "Sueldos",
            null, null, null, MoneyPair.of("25000", "0"), null, null, ApprovalRequirement.DUAL, "cashier");
        CashRegisterEntryEntity entity = CashRegisterEntryEntity.fromDomain(entry, "key-4");
        when(entryRepository.findByIdAndRegisterId(entry.getId(), registerId)).thenReturn(Optional.of(entity));

        ApprovalOutcome first = service.approve(registerId, entry.getId(), ApproverRole.FEDE, new Actor("f", "Fede"));
        assertTrue(first.isChanged());
        assertEquals(ApprovalStatus.PENDING, entity.getApprovalStatus());

        ApprovalOutcome second = service.approve(registerId, entry.getId(), ApproverRole.SISTERS, new Actor("a", "Ana"));
        assertTrue(second.isNewlyApproved());
        assertEquals(ApprovalStatus.APPROVED, entity.getApprovalStatus());
        assertEquals(2, entity.getApprovals().size());

        ApprovalOutcome repeat = service.approve(registerId, entry.getId(), ApproverRole.FEDE, new Actor("f", "Fede"));
        assertFalse(repeat.isChanged());

        verify(entryRepository, times(2)).saveAndFlush(entity);
    }

    @Test
    @DisplayName("Approving an entry that is not in the register fails with NotFound and notifies nobody")
    void testApprove_UnknownEntry() {
        UUID registerId = UUID.randomUUID();
        UUID entryId = UUID.randomUUID();
        when(entryRepository.findByIdAndRegisterId(entryId, registerId)).thenReturn(Optional.empty());

        NotFoundException error = assertThrows(NotFoundException.class,
            () -> service.approve(registerId, entryId, ApproverRole.FEDE, new Actor("f", "Fede")));

        assertTrue(error.getMessage().contains(entryId.toString()));
        verify(entryRepository, never()).saveAndFlush(any());
        verifyNoInteractions(notificationPublisher);
    }

    @Test
    @DisplayName("Rejecting a pending entry drops it from the register balance")
    void testReject_RefreshesBalance() {
        CashRegisterEntity register = givenRegister(RegisterType.GENERAL);
        givenEntriesAreStored(register.getId());
        RegisterEntryAppended appended = service.append(register.getId(), expense("15000"), "key-5", CASHIER);
        CashRegisterEntryEntity entity = stored.get(0);
        when(entryRepository.findByIdAndRegisterId(entity.getId(), register.getId())).thenReturn(Optional.of(entity));

        ApprovalOutcome outcome = service.reject(register.getId(), appended.getEntry().getId(), "Duplicado",
            new Actor("adm", "admin"));

        assertTrue(outcome.isNewlyRejected());
        assertEquals("Duplicado", entity.getRejectionReason());
        assertEquals(new BigDecimal("0.00"), register.getBalanceArs());
    }
}
