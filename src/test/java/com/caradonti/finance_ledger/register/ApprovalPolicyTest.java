package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.money.MoneyPair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalPolicyTest {

    private final ApprovalPolicy policy = new ApprovalPolicy(
        new BigDecimal("10000"), new BigDecimal("100"),
        new BigDecimal("20000"), new BigDecimal("200"),
        new BigDecimal("10000"));

    private static NewRegisterEntry movement(String incomeArs, String incomeUsd, String expenseArs, String expenseUsd) {
        return new NewRegisterEntry(LocalDate.of(2024, 4, 1), "movement", null, null,
            MoneyPair.of(incomeArs, incomeUsd), MoneyPair.of(expenseArs, expenseUsd), null, null);
    }

    @Test
    @DisplayName("Materiality is strictly above the threshold")
    void testThreshold_IsExclusive() {
        assertFalse(policy.needsApproval(movement("0", "0", "10000.00", "0")));
        assertTrue(policy.needsApproval(movement("0", "0", "10000.01", "0")));
        assertFalse(policy.needsApproval(movement("0", "100.00", "0", "0")));
        assertTrue(policy.needsApproval(movement("0", "100.01", "0", "0")));
    }

    @Test
    @DisplayName("Income and expense both count toward the movement")
    void testMovement_AddsIncomeAndExpense() {
        assertEquals(ApprovalRequirement.SINGLE,
            policy.requirementFor(RegisterType.SHOP, movement("6000", "0", "5000", "0")));
    }

    @Test
    @DisplayName("Large General Cash entries need both roles")
    void testGeneral_DualAboveMultiple() {
        assertEquals(ApprovalRequirement.SINGLE,
            policy.requirementFor(RegisterType.GENERAL, movement("0", "0", "19999.99", "0")));
        assertEquals(ApprovalRequirement.DUAL,
            policy.requirementFor(RegisterType.GENERAL, movement("0", "0", "20000", "0")));
        assertEquals(ApprovalRequirement.DUAL,
            policy.requirementFor(RegisterType.GENERAL, movement("0", "0", "0", "200")));
    }

    @Test
    @DisplayName("Shop and Deco never need more than one role")
    void testOtherRegisters_SingleOnly() {
        assertEquals(ApprovalRequirement.SINGLE,
            policy.requirementFor(RegisterType.SHOP, movement("0", "0", "50000", "0")));
        assertEquals(ApprovalRequirement.SINGLE,
            policy.requirementFor(RegisterType.DECO, movement("0", "0", "50000", "0")));
        assertEquals(ApprovalRequirement.NONE,
            policy.requirementFor(RegisterType.DECO, movement("500", "0", "0", "0")));
    }

    @Test
    @DisplayName("Large expense looks at ARS expense only")
    void testLargeExpense() {
        assertTrue(policy.isLargeExpense(movement("0", "0", "10000.01", "0")));
        assertFalse(policy.isLargeExpense(movement("0", "0", "10000", "0")));
        assertFalse(policy.isLargeExpense(movement("50000", "0", "0", "0")));
        assertFalse(policy.isLargeExpense(movement("0", "0", "0", "5000")));
    }
}
