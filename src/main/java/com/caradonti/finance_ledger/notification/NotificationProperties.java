package com.caradonti.finance_ledger.notification;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Notification settings bound from {@code notifications.*}.
 */
@ConfigurationProperties(prefix = "notifications")
@Getter
@Setter
public class NotificationProperties {

    private boolean enabled = true;
    private Set<NotificationType> disabledTypes = EnumSet.noneOf(NotificationType.class);
    private List<String> recipients = new ArrayList<>();

    public NotificationPreferences toPreferences() {
        Set<NotificationType> types = EnumSet.allOf(NotificationType.class);
        types.removeAll(disabledTypes);
        return new NotificationPreferences(enabled, types, List.copyOf(recipients));
    }
}
