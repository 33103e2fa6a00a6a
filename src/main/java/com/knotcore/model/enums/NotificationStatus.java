package com.knotcore.model.enums;

/**
 * Lifecycle of a queued milestone notification.
 * PENDING -> CLAIMED | CANCELLED, CLAIMED -> SENT | FAILED | CANCELLED | PENDING.
 */
public enum NotificationStatus {
    PENDING,
    CLAIMED,
    SENT,
    FAILED,
    CANCELLED;

    public boolean isLive() {
        return this == PENDING || this == CLAIMED;
    }

    public boolean isDelivered() {
        return this == SENT || this == FAILED;
    }
}
