package com.caradonti.finance_ledger.consumer;

import com.caradonti.finance_ledger.notification.NotificationDispatcher;
import com.caradonti.finance_ledger.notification.NotificationIntent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hands a deduplicated notification to the dispatcher.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationEventHandler {

    private final NotificationDispatcher dispatcher;

    public void onNotification(NotificationIntent intent) {
        log.debug("Dispatching notification: type={}, aggregateType={}, aggregateId={}",
                intent.getType().getWireName(), intent.getAggregateType(), intent.getAggregateId());
        dispatcher.dispatch(intent);
    }
}
