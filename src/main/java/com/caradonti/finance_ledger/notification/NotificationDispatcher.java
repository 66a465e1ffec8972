package com.caradonti.finance_ledger.notification;

/**
 * Delivers a notification to people (push, e-mail, chat...).
 *
 * Implementations may throw; callers log the failure and move on, a failed
 * delivery never undoes the ledger change that caused it.
 */
public interface NotificationDispatcher {

    void dispatch(NotificationIntent intent);
}
