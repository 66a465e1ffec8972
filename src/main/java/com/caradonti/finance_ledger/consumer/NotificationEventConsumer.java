package com.caradonti.finance_ledger.consumer;

import com.caradonti.finance_ledger.consumer.ProcessedEvent.ProcessingResult;
import com.caradonti.finance_ledger.notification.NotificationIntent;
import com.caradonti.finance_ledger.notification.NotificationType;
import com.caradonti.finance_ledger.observability.CorrelationContext;
import com.caradonti.finance_ledger.observability.LedgerMetrics;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Consumes the notifications topic and delivers each message once.
 *
 * Offsets are acknowledged manually after the processed_events row is written.
 * Delivery is best-effort: a dispatcher failure is logged and counted, and the
 * message is still acknowledged.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class NotificationEventConsumer {

    static final String CONSUMER_GROUP = "notification-dispatcher";

    private final IdempotentEventProcessor eventProcessor;
    private final NotificationEventHandler eventHandler;
    private final LedgerMetrics ledgerMetrics;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.notifications:notifications}",
        groupId = "${spring.kafka.consumer.group-id:finance-ledger-notifications}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        JsonNode node = parse(record.value());
        if (node == null) {
            log.warn("Could not parse notification, acknowledging to skip: offset={}", record.offset());
            ack.acknowledge();
            return;
        }

        UUID eventId = UUID.fromString(node.path("eventId").asText());
        String eventType = node.path("eventType").asText();
        String aggregateType = node.path("aggregateType").asText();
        UUID aggregateId = UUID.fromString(node.path("aggregateId").asText());

        String correlationId = node.path("correlationId").asText(null);
        if (correlationId != null) {
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        }

        try {
            NotificationType type;
            try {
                type = NotificationType.fromWireName(eventType);
            } catch (IllegalArgumentException e) {
                eventProcessor.skipEvent(eventId, eventType, aggregateType, aggregateId,
                        CONSUMER_GROUP, "Unknown notification type");
                ack.acknowledge();
                return;
            }

            NotificationIntent intent = toIntent(type, node, aggregateType, aggregateId);
            ProcessingResult result = eventProcessor.processBestEffort(eventId, eventType, aggregateType,
                    aggregateId, CONSUMER_GROUP, () -> eventHandler.onNotification(intent));

            ack.acknowledge();

            if (result == ProcessingResult.SUCCESS) {
                ledgerMetrics.recordNotificationDispatched(eventType);
                log.info("Dispatched notification: type={}, eventId={}, aggregateId={}",
                        eventType, eventId, aggregateId);
            } else if (result == ProcessingResult.FAILED) {
                ledgerMetrics.recordNotificationFailed(eventType);
            }

        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    private NotificationIntent toIntent(NotificationType type, JsonNode node,
                                        String aggregateType, UUID aggregateId) {
        Map<String, Object> payload = node.hasNonNull("payload")
                ? objectMapper.convertValue(node.get("payload"), new TypeReference<Map<String, Object>>() { })
                : Map.of();
        return new NotificationIntent(type, node.path("title").asText(), node.path("message").asText(),
                payload, aggregateType, aggregateId);
    }

    private JsonNode parse(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("aggregateId")) {
                return null;
            }
            UUID.fromString(node.get("eventId").asText());
            UUID.fromString(node.get("aggregateId").asText());
            return node;
        } catch (Exception e) {
            log.error("Failed to parse notification envelope: {}", e.getMessage());
            return null;
        }
    }
}
