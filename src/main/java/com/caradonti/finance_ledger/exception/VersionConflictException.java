package com.caradonti.finance_ledger.exception;

import java.util.UUID;

/**
 * Raised when an aggregate was modified concurrently between load and save.
 *
 * Callers should retry the whole read-compute-write cycle.
 */
public class VersionConflictException extends RuntimeException {

    private final UUID aggregateId;

    public VersionConflictException(String aggregateType, UUID aggregateId, Throwable cause) {
        super(String.format("%s %s was modified concurrently, retry the operation", aggregateType, aggregateId), cause);
        this.aggregateId = aggregateId;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }
}
