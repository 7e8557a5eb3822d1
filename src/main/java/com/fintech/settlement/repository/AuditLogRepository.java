package com.fintech.settlement.repository;

import com.fintech.settlement.entity.AuditLog;
import com.fintech.settlement.entity.AuditSeverity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByResourceTypeAndResourceIdOrderByCreatedAtAsc(String resourceType, String resourceId);

    List<AuditLog> findBySeverityInOrderByCreatedAtDesc(List<AuditSeverity> severities);
}
