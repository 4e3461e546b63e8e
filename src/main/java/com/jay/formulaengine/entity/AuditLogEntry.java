package com.jay.formulaengine.entity;

import com.jay.formulaengine.model.enums.AuditActor;
import com.jay.formulaengine.model.enums.AuditEventType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "audit_log", indexes = {
    @Index(name = "idx_audit_entity", columnList = "entityId"),
    @Index(name = "idx_audit_user", columnList = "userId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private LocalDateTime timestamp;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private AuditEventType eventType;

    @Column(length = 64)
    private String entityId;      // trade id for routing events, formula id otherwise

    private String userId;
    private String formulaId;
    private String symbol;

    @Column(length = 32)
    private String fromState;
    @Column(length = 32)
    private String toState;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private AuditActor actor;

    @Column(length = 4000)
    private String payload;       // JSON
}
