package com.caradonti.finance_ledger.ledger;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DateWindowTest {

    @Test
    void testOpenEndsFallBackToWideBounds() {
        DateWindow window = DateWindow.of(null, LocalDate.of(2024, 6, 30));

        assertTrue(window.lowerBound().isBefore(LocalDate.of(2000, 1, 1)));
        assertEquals(LocalDate.of(2024, 6, 30), window.upperBound());
        assertTrue(DateWindow.ALL.upperBound().isAfter(LocalDate.of(3000, 1, 1)));
    }

    @Test
    void testStartAfterEndIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> DateWindow.of(LocalDate.of(2024, 7, 1), LocalDate.of(2024, 6, 30)));
    }

    @Test
    void testSingleDayWindow() {
        LocalDate day = LocalDate.of(2024, 6, 15);
        DateWindow window = DateWindow.of(day, day);

        assertEquals(day, window.lowerBound());
        assertEquals(day, window.upperBound());
    }
}
