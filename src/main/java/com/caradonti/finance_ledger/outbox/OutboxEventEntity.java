package com.caradonti.finance_ledger.outbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * A queued notification in {@code outbox_events}.
 *
 * The payload is a serialized {@link com.caradonti.finance_ledger.notification.NotificationMessage};
 * the aggregate columns name the register entry, event or cash count it is about
 * and become the Kafka key, so all notices for one entry stay in order.
 * Rows are only ever changed by a publish attempt.
 */
@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEventEntity {

    static final int MAX_ERROR_LENGTH = 2000;

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "aggregate_type", nullable = false, updatable = false, length = 100)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, updatable = false)
    private UUID aggregateId;

    /** Notification wire name, e.g. {@code LargeExpenseAlert}. */
    @Column(name = "event_type", nullable = false, updatable = false, length = 100)
    private String notificationType;

    @Column(nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant queuedAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    private int failedAttempts;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    // BIGSERIAL, drives publish order
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static OutboxEventEntity fromDomain(OutboxEvent event) {
        OutboxEventEntity entity = new OutboxEventEntity();
        entity.id = event.getId();
        entity.aggregateType = event.getAggregateType();
        entity.aggregateId = event.getAggregateId();
        entity.notificationType = event.getEventType();
        entity.payload = event.getPayload();
        entity.queuedAt = event.getCreatedAt();
        entity.publishedAt = event.getPublishedAt();
        entity.failedAttempts = event.getRetryCount();
        entity.lastError = event.getLastError();
        return entity;
    }

    public OutboxEvent toDomain() {
        return new OutboxEvent(id, aggregateType, aggregateId, notificationType, payload,
            queuedAt, publishedAt, failedAttempts, lastError, sequenceNumber);
    }

    /**
     * The notification reached the topic. Clears the error left by earlier attempts.
     */
    void markPublished() {
        this.publishedAt = Instant.now();
        this.lastError = null;
    }

    /**
     * One more failed send. Broker errors can be long, only the head is kept.
     */
    void markFailed(String errorMessage) {
        this.failedAttempts++;
        this.lastError = errorMessage != null && errorMessage.length() > MAX_ERROR_LENGTH
            ? errorMessage.substring(0, MAX_ERROR_LENGTH)
            : errorMessage;
    }
}
