package com.caradonti.finance_ledger.money;

import com.caradonti.finance_ledger.exception.InvalidAmountException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyPairTest {

    @Test
    @DisplayName("Amounts are normalized to two decimals and missing amounts are zero")
    void testOf_NormalizesScale() {
        MoneyPair pair = MoneyPair.of(new BigDecimal("10"), null);

        assertEquals(new BigDecimal("10.00"), pair.getArs());
        assertEquals(new BigDecimal("0.00"), pair.getUsd());
        assertEquals(MoneyPair.of("10.00", "0"), pair);
    }

    @Test
    @DisplayName("Negative amounts are rejected in either currency")
    void testOf_RejectsNegative() {
        assertThrows(InvalidAmountException.class, () -> MoneyPair.of("-0.01", "0"));
        assertThrows(InvalidAmountException.class, () -> MoneyPair.of("0", "-5"));
    }

    @Test
    @DisplayName("Currencies add independently and are never converted")
    void testAdd_KeepsCurrenciesApart() {
        MoneyPair sum = MoneyPair.of("1500.50", "20").add(MoneyPair.of("499.50", "0.25"));

        assertEquals(new BigDecimal("2000.00"), sum.getArs());
        assertEquals(new BigDecimal("20.25"), sum.getUsd());
    }

    @Test
    @DisplayName("Subtracting into a negative field fails instead of going below zero")
    void testSubtract_BelowZeroFails() {
        MoneyPair pair = MoneyPair.of("100", "10");

        assertEquals(MoneyPair.of("40", "10"), pair.subtract(MoneyPair.ars(new BigDecimal("60"))));
        assertThrows(InvalidAmountException.class, () -> pair.subtract(MoneyPair.usd(new BigDecimal("10.01"))));
    }

    @Test
    @DisplayName("Net of income and expense may be negative")
    void testNet_CanBeNegative() {
        SignedMoneyPair net = MoneyPair.net(MoneyPair.of("1000", "0"), MoneyPair.of("1500", "30"));

        assertEquals(new BigDecimal("-500.00"), net.getArs());
        assertEquals(new BigDecimal("-30.00"), net.getUsd());
        assertFalse(net.isNonNegative());
        assertThrows(InvalidAmountException.class, net::toMoneyPair);
    }

    @Test
    void testSmallAmountsDoNotDrift() {
        MoneyPair total = MoneyPair.ZERO;
        for (int i = 0; i < 1000; i++) {
            total = total.add(MoneyPair.of("0.10", "0.01"));
        }

        assertEquals(new BigDecimal("100.00"), total.getArs());
        assertEquals(new BigDecimal("10.00"), total.getUsd());
    }

    @Test
    void testIsZeroAndHasAmountIn() {
        assertTrue(MoneyPair.ZERO.isZero());
        assertTrue(MoneyPair.usd(new BigDecimal("1")).hasAmountIn(Currency.USD));
        assertFalse(MoneyPair.usd(new BigDecimal("1")).hasAmountIn(Currency.ARS));
    }
}
