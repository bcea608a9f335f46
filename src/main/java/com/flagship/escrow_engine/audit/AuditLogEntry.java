package com.flagship.escrow_engine.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Immutable record of a privileged or financial action.
 *
 * A null performedBy means the action was taken by the system (scheduler, webhook).
 */
@Value
@Builder(toBuilder = true)
public class AuditLogEntry {
    UUID id;
    UUID performedBy;
    String action;
    AuditCategory category;
    AuditSeverity severity;
    String targetModel;
    UUID targetId;
    String description;
    @Builder.Default
    List<FieldChange> changes = List.of();
    String ipAddress;
    String userAgent;
    String correlationId;
    Instant createdAt;
    String signature;

    /**
     * The fields covered by the signature, in a fixed order.
     */
    public String canonicalForm() {
        String changeList = changes.stream()
            .map(c -> c.field() + "=" + c.before() + "->" + c.after())
            .collect(Collectors.joining(","));
        return String.join("|",
            String.valueOf(id),
            String.valueOf(performedBy),
            String.valueOf(action),
            String.valueOf(category),
            String.valueOf(severity),
            String.valueOf(targetModel),
            String.valueOf(targetId),
            String.valueOf(description),
            changeList,
            String.valueOf(ipAddress),
            String.valueOf(userAgent),
            String.valueOf(createdAt != null ? createdAt.toEpochMilli() : null));
    }
}
