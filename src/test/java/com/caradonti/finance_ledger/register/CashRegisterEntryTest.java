package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.exception.InvalidAmountException;
import com.caradonti.finance_ledger.exception.InvalidTransitionException;
import com.caradonti.finance_ledger.money.MoneyPair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CashRegisterEntryTest {

    private final UUID registerId = UUID.randomUUID();

    private CashRegisterEntry entry(RegisterType type, ApprovalRequirement requirement) {
        return CashRegisterEntry.create(registerId, type, LocalDate.of(2024, 4, 2), "Pago proveedor", null, null,
            null, MoneyPair.of("15000", "0"), null, null, requirement, "cashier");
    }

    @Test
    @DisplayName("Entries below materiality are approved on creation")
    void testCreate_NoneIsApproved() {
        CashRegisterEntry entry = entry(RegisterType.GENERAL, ApprovalRequirement.NONE);

        assertEquals(ApprovalStatus.APPROVED, entry.getApprovalStatus());
        assertFalse(entry.needsApproval());
        assertTrue(entry.getApprovals().isEmpty());
    }

    @Test
    @DisplayName("A single sign-off approves a SINGLE entry")
    void testApprove_Single() {
        CashRegisterEntry entry = entry(RegisterType.GENERAL, ApprovalRequirement.SINGLE);
        assertEquals(ApprovalStatus.PENDING, entry.getApprovalStatus());

        ApprovalOutcome outcome = entry.approve(ApproverRole.SISTERS, "Ana");

        assertTrue(outcome.isChanged());
        assertTrue(outcome.isNewlyApproved());
        assertEquals(ApprovalStatus.PENDING, outcome.getPreviousStatus());
        assertEquals("Ana", outcome.getEntry().getApprovals().get(ApproverRole.SISTERS).getApprovedBy());
    }

    @Test
    @DisplayName("DUAL entries stay pending until both roles sign off")
    void testApprove_DualNeedsBothRoles() {
        CashRegisterEntry entry = entry(RegisterType.GENERAL, ApprovalRequirement.DUAL);

        ApprovalOutcome first = entry.approve(ApproverRole.FEDE, "Fede");
        assertTrue(first.isChanged());
        assertFalse(first.isNewlyApproved());
        assertEquals(ApprovalStatus.PENDING, first.getEntry().getApprovalStatus());

        ApprovalOutcome repeat = first.getEntry().approve(ApproverRole.FEDE, "Fede");
        assertFalse(repeat.isChanged());

        ApprovalOutcome second = first.getEntry().approve(ApproverRole.SISTERS, "Ana");
        assertTrue(second.isNewlyApproved());
        assertTrue(second.getEntry().isApprovedBy(ApproverRole.FEDE));
        assertTrue(second.getEntry().isApprovedBy(ApproverRole.SISTERS));
    }

    @Test
    @DisplayName("Approving an approved entry is a no-op")
    void testApprove_ApprovedIsNoop() {
        CashRegisterEntry approved = entry(RegisterType.SHOP, ApprovalRequirement.SINGLE)
            .approve(ApproverRole.FEDE, "Fede").getEntry();

        ApprovalOutcome outcome = approved.approve(ApproverRole.SISTERS, "Ana");

        assertFalse(outcome.isChanged());
        assertSame(approved, outcome.getEntry());
    }

    @Test
    @DisplayName("Rejected and approved are terminal")
    void testTerminalStates() {
        CashRegisterEntry pending = entry(RegisterType.GENERAL, ApprovalRequirement.SINGLE);
        CashRegisterEntry rejected = pending.reject("admin", "Duplicado").getEntry();
        CashRegisterEntry approved = pending.approve(ApproverRole.FEDE, "Fede").getEntry();

        assertEquals(ApprovalStatus.REJECTED, rejected.getApprovalStatus());
        assertEquals("Duplicado", rejected.getRejectionReason());
        assertThrows(InvalidTransitionException.class, () -> rejected.approve(ApproverRole.FEDE, "Fede"));
        assertThrows(InvalidTransitionException.class, () -> approved.reject("admin", "late"));
        assertFalse(rejected.reject("admin", "again").isChanged());
    }

    @Test
    void testReject_RequiresReason() {
        CashRegisterEntry pending = entry(RegisterType.GENERAL, ApprovalRequirement.SINGLE);

        assertThrows(IllegalArgumentException.class, () -> pending.reject("admin", " "));
    }

    @Test
    @DisplayName("Amounts are validated on creation")
    void testCreate_Validation() {
        assertThrows(InvalidAmountException.class, () -> CashRegisterEntry.create(registerId, RegisterType.SHOP,
            LocalDate.now(), "empty", null, null, MoneyPair.ZERO, MoneyPair.ZERO, null, null,
            ApprovalRequirement.NONE, "cashier"));
        assertThrows(IllegalArgumentException.class, () -> CashRegisterEntry.create(registerId, RegisterType.GENERAL,
            LocalDate.now(), "sale", null, null, MoneyPair.of("100", "0"), null, new SaleLine("SKU-1", 1), null,
            ApprovalRequirement.NONE, "cashier"));
    }

    @Test
    void testApproverRole_ParsesLooseCase() {
        assertEquals(ApproverRole.FEDE, ApproverRole.fromValue("fede"));
        assertEquals(ApproverRole.SISTERS, ApproverRole.fromValue(" Sisters "));
        assertThrows(IllegalArgumentException.class, () -> ApproverRole.fromValue("boss"));
    }
}
