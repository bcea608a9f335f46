package com.flagship.escrow_engine.audit;

/**
 * LOW and MEDIUM entries expire after the retention window; HIGH and CRITICAL are kept.
 */
public enum AuditSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isRetentionExempt() {
        return this == HIGH || this == CRITICAL;
    }
}
