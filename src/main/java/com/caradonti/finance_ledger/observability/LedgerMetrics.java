package com.caradonti.finance_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.entries.appended: entries appended, by scope and outcome
 * - ledger.operation.latency: timer per service operation
 * - ledger.approvals: approval/rejection calls, by role and result
 * - ledger.approvals.pending: gauge of entries waiting for sign-off
 * - ledger.waterfall.allocations: client payments routed through the waterfall
 * - ledger.reconciliations: cash counts recorded, by status
 * - notifications.*: queued, dispatched and failed notifications by type
 * - idempotency.cache: idempotency-key hits and misses
 * - ledger.version_conflicts: optimistic lock failures by aggregate
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter duplicateAppends;
    private final AtomicLong pendingApprovals = new AtomicLong(0);

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.duplicateAppends = Counter.builder("ledger.entries.duplicate_requests")
                .description("Append requests answered from an earlier idempotency key")
                .register(registry);

        Gauge.builder("ledger.approvals.pending", pendingApprovals, AtomicLong::get)
                .description("Cash register entries waiting for approval")
                .register(registry);
    }

    public void recordEntryAppended(String scope, String status) {
        registry.counter("ledger.entries.appended",
                "scope", sanitizeTag(scope),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer.builder("ledger.operation.latency")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordApproval(String role, String result) {
        registry.counter("ledger.approvals",
                "role", sanitizeTag(role),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordWaterfallAllocation(String policy, boolean leftUnallocated) {
        registry.counter("ledger.waterfall.allocations",
                "policy", sanitizeTag(policy),
                "unallocated", String.valueOf(leftUnallocated)
        ).increment();
    }

    public void recordReconciliation(String status, boolean alert) {
        registry.counter("ledger.reconciliations",
                "status", sanitizeTag(status),
                "alert", String.valueOf(alert)
        ).increment();
    }

    public void recordNotificationQueued(String type) {
        registry.counter("notifications.queued", "type", sanitizeTag(type)).increment();
    }

    public void recordNotificationDispatched(String type) {
        registry.counter("notifications.dispatched", "type", sanitizeTag(type)).increment();
    }

    public void recordNotificationFailed(String type) {
        registry.counter("notifications.failed", "type", sanitizeTag(type)).increment();
    }

    public void recordIdempotencyHit() {
        duplicateAppends.increment();
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordVersionConflict(String aggregateType) {
        registry.counter("ledger.version_conflicts", "aggregate", sanitizeTag(aggregateType)).increment();
    }

    public void setPendingApprovals(long count) {
        pendingApprovals.set(count);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
