package com.flagship.escrow_engine.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogEntity, UUID> {


    /**
     * Retention cleanup. Only the given severities are eligible.
     */
    @Modifying
    @Query("DELETE FROM AuditLogEntity a WHERE a.createdAt < :before AND a.severity IN :severities")
    int deleteExpired(@Param("before") Instant before,
                      @Param("severities") Collection<AuditSeverity> severities);
}
