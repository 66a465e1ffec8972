package com.caradonti.finance_ledger.notification;

import com.caradonti.finance_ledger.observability.CorrelationContext;
import com.caradonti.finance_ledger.observability.LedgerMetrics;
import com.caradonti.finance_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Queues notification intents on the transactional outbox.
 *
 * Must run inside the transaction that made the state change, so intents are
 * written if and only if that change commits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationPublisher {

    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    @Transactional(propagation = Propagation.MANDATORY)
    public void publish(List<NotificationIntent> intents) {
        for (NotificationIntent intent : intents) {
            NotificationMessage message = NotificationMessage.from(intent, CorrelationContext.getCorrelationId());
            outboxService.saveEvent(intent.getAggregateType(), intent.getAggregateId(),
                    message.getEventType(), message);
            ledgerMetrics.recordNotificationQueued(message.getEventType());
            log.debug("Queued notification: type={}, aggregateId={}",
                    message.getEventType(), intent.getAggregateId());
        }
    }
}
