package com.jay.formulaengine.repository;

import com.jay.formulaengine.entity.AuditLogEntry;
import com.jay.formulaengine.model.enums.AuditEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogEntry, Long> {

    List<AuditLogEntry> findByEntityIdOrderByIdAsc(String entityId);

    List<AuditLogEntry> findByUserIdOrderByTimestampDesc(String userId);

    List<AuditLogEntry> findByEventTypeAndTimestampAfter(AuditEventType eventType, LocalDateTime since);
}
