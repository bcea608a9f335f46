package com.flagship.escrow_engine.audit;

public enum AuditCategory {
    CONTRACT,
    PAYMENT,
    REFERRAL,
    MEMBERSHIP,
    SYSTEM
}
