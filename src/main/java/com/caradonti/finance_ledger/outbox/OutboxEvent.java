package com.caradonti.finance_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A message waiting in the outbox table to be published.
 *
 * Written in the same transaction as the ledger change that produced it and
 * picked up later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g. "CashRegisterEntry", "EventCash"
    UUID aggregateId;
    String eventType;          // notification wire name, e.g. "PaymentApproved"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return publishedAt == null && retryCount >= maxRetries;
    }
}
