package com.flagship.escrow_engine.notification;

public enum NotificationType {
    PAIRING_CODE_ISSUED,
    CONTRACT_ACCEPTED,
    FUNDS_HELD,
    WORK_COMPLETED,
    CONTRACT_COMPLETED,
    APPROVAL_REMINDER,
    ESCROW_RELEASED,
    ESCROW_AUTO_RELEASED,
    CONTRACT_OVERDUE,
    CONTRACT_CANCELLED,
    PAIRING_EXPIRED,
    DISPUTE_OPENED,
    DISPUTE_RESOLVED,
    EXTENSION_REQUESTED,
    EXTENSION_ACCEPTED,
    EXTENSION_REJECTED,
    PAYMENT_REFUNDED,
    REFERRAL_REWARD_GRANTED
}
