package com.caradonti.finance_ledger.ledger;

import com.caradonti.finance_ledger.exception.InvalidAmountException;
import com.caradonti.finance_ledger.money.MoneyPair;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A single dated ARS/USD movement in an event's ledger.
 *
 * Entries are append-only. The only fields that may change after creation are
 * the provider and category references used for statistics; amounts and detail
 * are corrected by appending a reversing entry (see {@link #reverse}).
 */
@Value
public class LedgerEntry implements Movement {

    public static final int MAX_DETAIL_LENGTH = 300;

    UUID id;
    UUID eventId;
    LocalDate date;
    PaymentMethod paymentMethod;
    String detail;
    MoneyPair income;
    MoneyPair expense;
    UUID providerRef;
    UUID categoryRef;
    boolean clientPayment;
    UUID reversesEntryId;
    String createdBy;
    Instant createdAt;

    /**
     * Creates a new entry for an event.
     *
     * @throws IllegalArgumentException if the detail is blank or too long
     * @throws InvalidAmountException if the entry moves no money at all
     */
    public static LedgerEntry create(UUID eventId, LocalDate date, PaymentMethod paymentMethod,
                                     String detail, MoneyPair income, MoneyPair expense,
                                     UUID providerRef, UUID categoryRef, boolean clientPayment,
                                     String createdBy) {
        if (eventId == null) {
            throw new IllegalArgumentException("Event ID is required");
        }
        if (date == null) {
            throw new IllegalArgumentException("Entry date is required");
        }
        if (paymentMethod == null) {
            throw new IllegalArgumentException("Payment method is required");
        }
        validateDetail(detail);
        MoneyPair in = income != null ? income : MoneyPair.ZERO;
        MoneyPair out = expense != null ? expense : MoneyPair.ZERO;
        if (in.isZero() && out.isZero()) {
            throw new InvalidAmountException("Ledger entry must carry an income or an expense");
        }
        return new LedgerEntry(
            UUID.randomUUID(),
            eventId,
            date,
            paymentMethod,
            detail.trim(),
            in,
            out,
            providerRef,
            categoryRef,
            clientPayment,
            null,
            createdBy,
            Instant.now()
        );
    }

    /**
     * Builds the entry that cancels this one: income and expense swapped,
     * never flagged as a client payment.
     */
    public LedgerEntry reverse(LocalDate reversalDate, String actor) {
        if (reversesEntryId != null) {
            throw new IllegalStateException("Entry " + id + " is itself a reversal and cannot be reversed");
        }
        String reversalDetail = "Reversal: " + detail;
        if (reversalDetail.length() > MAX_DETAIL_LENGTH) {
            reversalDetail = reversalDetail.substring(0, MAX_DETAIL_LENGTH);
        }
        return new LedgerEntry(
            UUID.randomUUID(),
            eventId,
            reversalDate,
            paymentMethod,
            reversalDetail,
            expense,
            income,
            providerRef,
            categoryRef,
            false,
            id,
            actor,
            Instant.now()
        );
    }

    /**
     * Returns a copy with new provider/category references. Amounts are untouched.
     */
    public LedgerEntry withReferences(UUID newProviderRef, UUID newCategoryRef) {
        return new LedgerEntry(id, eventId, date, paymentMethod, detail, income, expense,
            newProviderRef, newCategoryRef, clientPayment, reversesEntryId, createdBy, createdAt);
    }

    /**
     * Whether this entry is fed to the payment waterfall. USD client payments are not.
     */
    public boolean isWaterfallEligible() {
        return clientPayment && income.getArs().signum() > 0;
    }

    public boolean isReversal() {
        return reversesEntryId != null;
    }

    private static void validateDetail(String detail) {
        if (detail == null || detail.isBlank()) {
            throw new IllegalArgumentException("Entry detail is required");
        }
        if (detail.trim().length() > MAX_DETAIL_LENGTH) {
            throw new IllegalArgumentException(
                "Entry detail must be at most " + MAX_DETAIL_LENGTH + " characters");
        }
    }
}
