package com.caradonti.finance_ledger.ledger;

import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive date range over entry dates. Either end may be open.
 */
@Value
public class DateWindow {

    public static final DateWindow ALL = new DateWindow(null, null);

    private static final LocalDate EARLIEST = LocalDate.of(1900, 1, 1);
    private static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

    LocalDate from;
    LocalDate to;

    public static DateWindow of(LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("Window start " + from + " is after its end " + to);
        }
        return new DateWindow(from, to);
    }

    public LocalDate lowerBound() {
        return from != null ? from : EARLIEST;
    }

    public LocalDate upperBound() {
        return to != null ? to : LATEST;
    }
}
