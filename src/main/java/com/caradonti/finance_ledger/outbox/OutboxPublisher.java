package com.caradonti.finance_ledger.outbox;

import com.caradonti.finance_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Polls the outbox and publishes notification messages to Kafka.
 *
 * - Batches are locked with FOR UPDATE SKIP LOCKED, so several instances can run
 * - Sends are synchronous, keyed by aggregate id, to keep per-aggregate order
 * - A failed send bumps the retry count; after max retries the row is left as a
 *   dead letter for manual inspection
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.notifications:notifications}")
    private String notificationsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.retention.days:7}")
    private int retentionDays;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishable(maxRetries, batchSize);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    /**
     * Deletes published rows older than the retention window.
     */
    @Scheduled(cron = "${outbox.retention.cron:0 30 3 * * *}")
    public void purgePublishedEvents() {
        int deleted = outboxService.purgePublishedBefore(Instant.now().minus(Duration.ofDays(retentionDays)));
        if (deleted > 0) {
            log.info("Purged {} published outbox events older than {} days", deleted, retentionDays);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String key = event.getAggregateId().toString();

        try {
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(notificationsTopic, key, event.getPayload());
            SendResult<String, String> result = future.get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), leaving it as a dead letter. eventType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    /**
     * Publishes immediately instead of waiting for the next poll.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
