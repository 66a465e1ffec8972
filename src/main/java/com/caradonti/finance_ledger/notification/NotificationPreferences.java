package com.caradonti.finance_ledger.notification;

import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Which notification types are switched on, and who receives them.
 * Passed explicitly into {@link NotificationTriggerPolicy} on every call.
 */
@Value
public class NotificationPreferences {
    boolean enabled;
    Set<NotificationType> enabledTypes;
    List<String> recipients;

    public static NotificationPreferences allEnabled() {
        return new NotificationPreferences(true, EnumSet.allOf(NotificationType.class), Collections.emptyList());
    }

    public static NotificationPreferences disabled() {
        return new NotificationPreferences(false, EnumSet.noneOf(NotificationType.class), Collections.emptyList());
    }

    public boolean allows(NotificationType type) {
        return enabled && enabledTypes.contains(type);
    }
}
