package com.caradonti.finance_ledger.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default dispatcher: writes each notification to the application log.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    private final NotificationProperties properties;

    @Override
    public void dispatch(NotificationIntent intent) {
        log.info("Notification [{}] to {}: {} - {} (aggregate={} {})",
                intent.getType().getWireName(),
                properties.getRecipients().isEmpty() ? "all" : properties.getRecipients(),
                intent.getTitle(),
                intent.getMessage(),
                intent.getAggregateType(),
                intent.getAggregateId());
    }
}
