package com.caradonti.finance_ledger.notification;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A decision that something should be signalled, with enough data for the
 * dispatcher to render a message without calling back into the ledger.
 */
@Value
public class NotificationIntent {
    NotificationType type;
    String title;
    String message;
    Map<String, Object> payload;
    String aggregateType;
    UUID aggregateId;

    public NotificationIntent(NotificationType type, String title, String message,
                              Map<String, Object> payload, String aggregateType, UUID aggregateId) {
        this.type = type;
        this.title = title;
        this.message = message;
        this.payload = payload == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
    }
}
