package com.flagship.escrow_engine.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for audit_logs. Rows are inserted once and never updated.
 */
@Entity
@Immutable
@Table(
    name = "audit_logs",
    indexes = {
        @Index(name = "idx_audit_logs_target", columnList = "target_model, target_id"),
        @Index(name = "idx_audit_logs_created_at", columnList = "created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditLogEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "performed_by")
    private UUID performedBy;

    @Column(nullable = false, length = 100)
    private String action;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AuditCategory category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AuditSeverity severity;

    @Column(name = "target_model", nullable = false, length = 50)
    private String targetModel;

    @Column(name = "target_id")
    private UUID targetId;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Convert(converter = FieldChangesConverter.class)
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private List<FieldChange> changes;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "TEXT")
    private String userAgent;

    @Column(name = "correlation_id", length = 64)
    private String correlationId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(length = 64)
    private String signature;

    static AuditLogEntity fromDomain(AuditLogEntry entry) {
        return new AuditLogEntity(
            entry.getId(),
            entry.getPerformedBy(),
            entry.getAction(),
            entry.getCategory(),
            entry.getSeverity(),
            entry.getTargetModel(),
            entry.getTargetId(),
            entry.getDescription(),
            entry.getChanges(),
            entry.getIpAddress(),
            entry.getUserAgent(),
            entry.getCorrelationId(),
            entry.getCreatedAt(),
            entry.getSignature()
        );
    }

    public AuditLogEntry toDomain() {
        return AuditLogEntry.builder()
            .id(id)
            .performedBy(performedBy)
            .action(action)
            .category(category)
            .severity(severity)
            .targetModel(targetModel)
            .targetId(targetId)
            .description(description)
            .changes(changes != null ? List.copyOf(changes) : List.of())
            .ipAddress(ipAddress)
            .userAgent(userAgent)
            .correlationId(correlationId)
            .createdAt(createdAt)
            .signature(signature)
            .build();
    }
}
