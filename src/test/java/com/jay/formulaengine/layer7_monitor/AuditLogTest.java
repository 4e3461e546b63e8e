package com.jay.formulaengine.layer7_monitor;

import com.jay.formulaengine.entity.AuditLogEntry;
import com.jay.formulaengine.model.enums.AuditActor;
import com.jay.formulaengine.model.enums.AuditEventType;
import com.jay.formulaengine.model.enums.RouteState;
import com.jay.formulaengine.model.enums.SignalType;
import com.jay.formulaengine.repository.AuditLogRepository;
import com.jay.formulaengine.util.TestSignals;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DataJpaTest
@Import(AuditLog.class)
class AuditLogTest {

    @Autowired
    private AuditLog auditLog;

    @Test
    void transitionsAreStampedWithSignalContext() {
        var signal = TestSignals.signal("AAPL", SignalType.ENTRY_LONG, 100);

        auditLog.transition("TRD-00000001", signal, null, RouteState.RECEIVED, AuditActor.SYSTEM, Map.of("price", 100.0));
        auditLog.transition("TRD-00000001", signal, RouteState.RECEIVED, RouteState.VALIDATED, AuditActor.SYSTEM, null);

        List<AuditLogEntry> history = auditLog.history("TRD-00000001");
        assertThat(history).hasSize(2);
        AuditLogEntry first = history.get(0);
        assertThat(first.getEventType()).isEqualTo(AuditEventType.ROUTE_TRANSITION);
        assertThat(first.getFromState()).isNull();
        assertThat(first.getToState()).isEqualTo("RECEIVED");
        assertThat(first.getUserId()).isEqualTo(TestSignals.USER);
        assertThat(first.getFormulaId()).isEqualTo("F-AAPL");
        assertThat(first.getSymbol()).isEqualTo("AAPL");
        assertThat(first.getPayload()).isEqualTo("{\"price\":100.0}");
        assertThat(first.getTimestamp()).isNotNull();
        assertThat(history.get(1).getFromState()).isEqualTo("RECEIVED");
        assertThat(history.get(1).getPayload()).isNull();
    }

    @Test
    void oversizedPayloadIsTruncated() {
        auditLog.event(AuditEventType.EVALUATION_FAILED, "F-1", "bob", "F-1", "AAPL", Map.of("error", "x".repeat(5000)));

        String payload = auditLog.forUser("bob").get(0).getPayload();
        assertThat(payload).hasSize(4000).endsWith("...");
    }

    @Test
    void eventsSinceCutoff() {
        auditLog.event(AuditEventType.EVALUATION_FAILED, "F-1", "bob", "F-1", "AAPL", Map.of("error", "timeout"));
        auditLog.event(AuditEventType.CYCLE_COMPLETED, "cycle", null, null, null, Map.of());

        assertThat(auditLog.since(AuditEventType.EVALUATION_FAILED, LocalDateTime.now().minusMinutes(1)))
            .extracting(AuditLogEntry::getEntityId)
            .containsExactly("F-1");
    }

    @Test
    void failingWriteDoesNotPropagate() {
        AuditLogRepository broken = mock(AuditLogRepository.class);
        when(broken.save(any())).thenThrow(new IllegalStateException("disk full"));
        AuditLog log = new AuditLog(broken);

        assertThatCode(() -> log.event(AuditEventType.PIPELINE_FAILED, "F-1", "bob", "F-1", "AAPL", "boom"))
            .doesNotThrowAnyException();
    }
}
