package com.caradonti.finance_ledger.notification;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Outbox/Kafka payload for one notification intent.
 *
 * {@code eventId} is unique per message and is what consumers deduplicate on.
 */
@Value
public class NotificationMessage {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String title;
    String message;
    Map<String, Object> payload;
    String correlationId;
    Instant occurredAt;

    public static NotificationMessage from(NotificationIntent intent, String correlationId) {
        return new NotificationMessage(
            UUID.randomUUID(),
            intent.getType().getWireName(),
            intent.getAggregateType(),
            intent.getAggregateId(),
            intent.getTitle(),
            intent.getMessage(),
            intent.getPayload(),
            correlationId,
            Instant.now()
        );
    }
}
