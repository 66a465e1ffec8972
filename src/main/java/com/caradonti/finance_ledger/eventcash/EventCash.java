package com.caradonti.finance_ledger.eventcash;

import com.caradonti.finance_ledger.exception.InvalidAmountException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Cash book of a single event, owning its ledger entries and installment schedule.
 */
@Value
public class EventCash {
    UUID id;
    String name;
    String clientName;
    LocalDate eventDate;
    PaymentStatus paymentStatus;
    String createdBy;
    Instant createdAt;

    public static EventCash create(String name, String clientName, LocalDate eventDate,
                                   BigDecimal totalBudget, String createdBy) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Event name is required");
        }
        if (totalBudget != null && totalBudget.signum() < 0) {
            throw new InvalidAmountException("Total budget must not be negative: " + totalBudget.toPlainString());
        }
        return new EventCash(
            UUID.randomUUID(),
            name.trim(),
            clientName,
            eventDate,
            PaymentStatus.initial(totalBudget),
            createdBy,
            Instant.now()
        );
    }

    public EventCash withPaymentStatus(PaymentStatus newStatus) {
        return new EventCash(id, name, clientName, eventDate, newStatus, createdBy, createdAt);
    }
}
