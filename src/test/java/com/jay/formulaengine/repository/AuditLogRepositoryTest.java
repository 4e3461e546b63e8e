package com.jay.formulaengine.repository;

import com.jay.formulaengine.entity.AuditLogEntry;
import com.jay.formulaengine.model.enums.AuditActor;
import com.jay.formulaengine.model.enums.AuditEventType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class AuditLogRepositoryTest {

    @Autowired
    private AuditLogRepository repository;

    @Test
    void historyOfEntityIsInsertionOrdered() {
        LocalDateTime now = LocalDateTime.now();
        repository.save(entry("TRD-00000001", "alice", AuditEventType.ROUTE_TRANSITION, "RECEIVED", now));
        repository.save(entry("TRD-00000002", "alice", AuditEventType.ROUTE_TRANSITION, "RECEIVED", now));
        repository.save(entry("TRD-00000001", "alice", AuditEventType.ROUTE_TRANSITION, "VALIDATED", now));
        repository.save(entry("TRD-00000001", "alice", AuditEventType.ROUTE_TRANSITION, "EXECUTED", now));

        List<AuditLogEntry> history = repository.findByEntityIdOrderByIdAsc("TRD-00000001");

        assertThat(history).extracting(AuditLogEntry::getToState)
            .containsExactly("RECEIVED", "VALIDATED", "EXECUTED");
    }

    @Test
    void userEntriesNewestFirst() {
        LocalDateTime now = LocalDateTime.now();
        repository.save(entry("F-1", "bob", AuditEventType.EVALUATION_FAILED, null, now.minusMinutes(10)));
        repository.save(entry("F-2", "bob", AuditEventType.EVALUATION_FAILED, null, now));
        repository.save(entry("F-3", "carol", AuditEventType.EVALUATION_FAILED, null, now));

        assertThat(repository.findByUserIdOrderByTimestampDesc("bob"))
            .extracting(AuditLogEntry::getEntityId)
            .containsExactly("F-2", "F-1");
    }

    @Test
    void eventsOfTypeSinceCutoff() {
        LocalDateTime now = LocalDateTime.now();
        repository.save(entry("F-1", "bob", AuditEventType.EVALUATION_FAILED, null, now.minusHours(2)));
        repository.save(entry("F-2", "bob", AuditEventType.EVALUATION_FAILED, null, now.minusMinutes(5)));
        repository.save(entry("F-3", "bob", AuditEventType.PIPELINE_FAILED, null, now.minusMinutes(5)));

        assertThat(repository.findByEventTypeAndTimestampAfter(AuditEventType.EVALUATION_FAILED, now.minusHours(1)))
            .extracting(AuditLogEntry::getEntityId)
            .containsExactly("F-2");
    }

    private static AuditLogEntry entry(String entityId, String userId, AuditEventType type,
                                       String toState, LocalDateTime at) {
        return AuditLogEntry.builder()
            .timestamp(at)
            .eventType(type)
            .entityId(entityId)
            .userId(userId)
            .toState(toState)
            .actor(AuditActor.SYSTEM)
            .build();
    }
}
