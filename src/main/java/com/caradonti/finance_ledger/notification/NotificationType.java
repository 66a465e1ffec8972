package com.caradonti.finance_ledger.notification;

/**
 * Kinds of alert the engine can raise. The wire name is what travels on the
 * outbox and the {@code notifications} topic.
 */
public enum NotificationType {
    PAYMENT_APPROVAL_NEEDED("PaymentApprovalNeeded"),
    PAYMENT_APPROVED("PaymentApproved"),
    LARGE_EXPENSE_ALERT("LargeExpenseAlert"),
    RECONCILIATION_DISCREPANCY("ReconciliationDiscrepancy"),
    LOW_STOCK("LowStock"),
    SALE_COMPLETED("SaleCompleted"),
    EVENT_PAYMENT_RECEIVED("EventPaymentReceived");

    private final String wireName;

    NotificationType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static NotificationType fromWireName(String wireName) {
        for (NotificationType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown notification type: " + wireName);
    }
}
