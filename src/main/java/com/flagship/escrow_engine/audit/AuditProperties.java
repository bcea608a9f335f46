package com.flagship.escrow_engine.audit;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Audit trail settings, bound from escrow.audit.*.
 */
@ConfigurationProperties(prefix = "escrow.audit")
@Getter
@Setter
public class AuditProperties {

    /** HMAC-SHA256 key used to sign entries. */
    private String signingSecret = "change-me";

    /** Days LOW and MEDIUM entries are kept. */
    private int retentionDays = 90;

    /** Entries held in memory for a later write after a failed insert. */
    private int retryQueueCapacity = 10_000;
}
