package com.caradonti.finance_ledger.consumer;

import com.caradonti.finance_ledger.consumer.ProcessedEvent.ProcessingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs a message handler at most once per (event id, consumer group).
 *
 * Covers consumer crashes before the offset commit, rebalances and manual
 * replays: a message that already has a processed_events row is acknowledged
 * without calling the handler again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * Runs {@code handler} best-effort.
     *
     * A handler failure is logged and recorded as FAILED instead of being
     * rethrown, so the message is not redelivered.
     *
     * @return the recorded result, or {@code null} if the message was a duplicate
     */
    @Transactional
    public ProcessingResult processBestEffort(UUID eventId, String eventType,
                                              String aggregateType, UUID aggregateId,
                                              String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return null;
        }

        ProcessingResult result;
        String error = null;
        try {
            handler.run();
            result = ProcessingResult.SUCCESS;
        } catch (RuntimeException e) {
            result = ProcessingResult.FAILED;
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Handler failed for event {} ({}) in consumer group {}: {}",
                    eventId, eventType, consumerGroup, error, e);
        }

        record(ProcessedEvent.of(eventId, eventType, aggregateType, aggregateId, consumerGroup, result, error));
        return result;
    }

    /**
     * Records a message this consumer does not handle, so replays skip it fast.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        record(ProcessedEvent.of(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            ProcessingResult.SKIPPED, reason));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void record(ProcessedEvent event) {
        repository.save(ProcessedEventEntity.fromDomain(event));
    }
}
