package com.caradonti.finance_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled (or deliberately skipped) a message.
 * Its presence is what makes redelivered Kafka messages a no-op.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED,    // not meant for this consumer
        FAILED      // handled best-effort, not retried
    }

    public static ProcessedEvent of(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                                    String consumerGroup, ProcessingResult result, String errorMessage) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            Instant.now(), result, errorMessage);
    }
}
