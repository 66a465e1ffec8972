package com.caradonti.finance_ledger.exception;

import java.util.UUID;

/**
 * Raised when a referenced aggregate, entry, cash count or product does not exist.
 */
public class NotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public NotFoundException(String resourceType, UUID resourceId) {
        this(resourceType, String.valueOf(resourceId));
    }

    public NotFoundException(String resourceType, String resourceId) {
        super(String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
