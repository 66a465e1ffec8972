package com.caradonti.finance_ledger.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.caradonti.finance_ledger.consumer.ProcessedEvent.ProcessingResult;
import com.caradonti.finance_ledger.notification.NotificationIntent;
import com.caradonti.finance_ledger.notification.NotificationMessage;
import com.caradonti.finance_ledger.notification.NotificationType;
import com.caradonti.finance_ledger.observability.LedgerMetrics;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * At-most-once notification handling against a real processed_events table.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class IdempotentEventProcessorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("finance_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("spring.data.redis.port", () -> "6390");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    @Autowired
    private LedgerMetrics ledgerMetrics;

    @Autowired
    private ObjectMapper objectMapper;

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "PaymentApproved";
    private static final String AGGREGATE_TYPE = "CashRegisterEntry";

    private UUID eventId;
    private UUID aggregateId;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        eventId = UUID.randomUUID();
        aggregateId = UUID.randomUUID();

        System.out.println("\n--- Test Setup ---");
        System.out.println("Event ID: " + eventId);
        System.out.println("Aggregate ID: " + aggregateId);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private ProcessingResult process(String consumerGroup, Runnable handler) {
        return eventProcessor.processBestEffort(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            consumerGroup, handler);
    }

    @Test
    @DisplayName("First delivery runs the handler and records SUCCESS")
    void testFirstEventProcessing_ExecutesHandler() {
        printTestHeader("First Delivery");

        AtomicInteger calls = new AtomicInteger();
        ProcessingResult result = process(CONSUMER_GROUP, calls::incrementAndGet);

        assertEquals(ProcessingResult.SUCCESS, result);
        assertEquals(1, calls.get());
        assertTrue(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));
        printSuccess("Handler ran once and the event was recorded");
    }

    @Test
    @DisplayName("A redelivered event is acknowledged without running the handler")
    void testDuplicateEvent_SkipsHandler() {
        printTestHeader("Duplicate Delivery");

        AtomicInteger calls = new AtomicInteger();
        process(CONSUMER_GROUP, calls::incrementAndGet);
        ProcessingResult second = process(CONSUMER_GROUP, calls::incrementAndGet);

        assertNull(second);
        assertEquals(1, calls.get());
        assertEquals(1, repository.findByAggregateIdOrderByProcessedAtAsc(aggregateId).size());
        printSuccess("Duplicate skipped");
    }

    @Test
    @DisplayName("Independent consumer groups each handle the same event")
    void testDifferentConsumerGroups_ProcessSameEvent() {
        printTestHeader("Different Consumer Groups");

        AtomicInteger calls = new AtomicInteger();
        assertEquals(ProcessingResult.SUCCESS, process("group-a", calls::incrementAndGet));
        assertEquals(ProcessingResult.SUCCESS, process("group-b", calls::incrementAndGet));

        assertEquals(2, calls.get());
        assertEquals(2, repository.findByAggregateIdOrderByProcessedAtAsc(aggregateId).size());
        printSuccess("Both groups processed the event");
    }

    @Test
    @DisplayName("A failing handler is recorded as FAILED and not rethrown")
    void testFailedProcessing_RecordsFailureWithoutRethrow() {
        printTestHeader("Handler Failure");

        ProcessingResult result = process(CONSUMER_GROUP, () -> {
            throw new IllegalStateException("push gateway down");
        });

        assertEquals(ProcessingResult.FAILED, result);
        ProcessedEventEntity row = repository.findByAggregateIdOrderByProcessedAtAsc(aggregateId).get(0);
        assertEquals(ProcessingResult.FAILED, row.getProcessingResult());
        assertEquals("push gateway down", row.getErrorMessage());
        assertEquals(1, repository.countByConsumerGroupAndProcessingResult(CONSUMER_GROUP, ProcessingResult.FAILED));

        // Best-effort: the failed delivery is not retried on replay
        AtomicInteger calls = new AtomicInteger();
        assertNull(process(CONSUMER_GROUP, calls::incrementAndGet));
        assertEquals(0, calls.get());
        printSuccess("Failure recorded, replay skipped");
    }

    @Test
    @DisplayName("A skipped event is never handled later")
    void testSkipEvent_PreventsFutureProcessing() {
        printTestHeader("Skip Event");

        eventProcessor.skipEvent(eventId, "SomethingElse", AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP,
            "Unknown notification type");

        AtomicInteger calls = new AtomicInteger();
        assertNull(process(CONSUMER_GROUP, calls::incrementAndGet));
        assertEquals(0, calls.get());
        assertEquals(1, repository.countByConsumerGroupAndProcessingResult(CONSUMER_GROUP, ProcessingResult.SKIPPED));
        printSuccess("Skipped event stays skipped");
    }

    @Test
    @DisplayName("Consumer dispatches a notification once and acknowledges every delivery")
    void testConsumerCrashAndReplay() throws Exception {
        printTestHeader("Consumer Replay");

        List<NotificationIntent> dispatched = new ArrayList<>();
        NotificationEventConsumer consumer = new NotificationEventConsumer(eventProcessor,
            new NotificationEventHandler(dispatched::add), ledgerMetrics, objectMapper);

        NotificationIntent intent = new NotificationIntent(NotificationType.PAYMENT_APPROVED, "Payment approved",
            "Flete approved", Map.of("registerId", UUID.randomUUID().toString()), AGGREGATE_TYPE, aggregateId);
        NotificationMessage message = NotificationMessage.from(intent, "corr-1");
        ConsumerRecord<String, String> record = new ConsumerRecord<>("notifications", 0, 42L,
            aggregateId.toString(), objectMapper.writeValueAsString(message));

        Acknowledgment ack = mock(Acknowledgment.class);
        consumer.consume(record, ack);
        // Same offset again, as after a crash before the commit
        consumer.consume(record, ack);

        assertEquals(1, dispatched.size());
        assertEquals("Flete approved", dispatched.get(0).getMessage());
        assertEquals(NotificationType.PAYMENT_APPROVED, dispatched.get(0).getType());
        verify(ack, times(2)).acknowledge();
        assertTrue(eventProcessor.isAlreadyProcessed(message.getEventId(), NotificationEventConsumer.CONSUMER_GROUP));
        printSuccess("Dispatched once, acknowledged twice");
    }

    @Test
    @DisplayName("Unknown notification types and garbage payloads are acknowledged and dropped")
    void testConsumer_SkipsUnknownAndMalformed() {
        printTestHeader("Unknown And Malformed Messages");

        List<NotificationIntent> dispatched = new ArrayList<>();
        NotificationEventConsumer consumer = new NotificationEventConsumer(eventProcessor,
            new NotificationEventHandler(dispatched::add), ledgerMetrics, objectMapper);
        Acknowledgment ack = mock(Acknowledgment.class);

        String unknown = String.format(
            "{\"eventId\":\"%s\",\"eventType\":\"PaymentCreated\",\"aggregateType\":\"Payment\",\"aggregateId\":\"%s\"}",
            eventId, aggregateId);
        consumer.consume(new ConsumerRecord<>("notifications", 0, 1L, aggregateId.toString(), unknown), ack);
        consumer.consume(new ConsumerRecord<>("notifications", 0, 2L, "x", "not json"), ack);

        assertTrue(dispatched.isEmpty());
        verify(ack, times(2)).acknowledge();
        assertTrue(eventProcessor.isAlreadyProcessed(eventId, NotificationEventConsumer.CONSUMER_GROUP));
        printSuccess("Both messages acknowledged, nothing dispatched");
    }
}
