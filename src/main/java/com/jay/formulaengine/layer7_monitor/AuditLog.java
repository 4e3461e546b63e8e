package com.jay.formulaengine.layer7_monitor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jay.formulaengine.entity.AuditLogEntry;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.enums.AuditActor;
import com.jay.formulaengine.model.enums.AuditEventType;
import com.jay.formulaengine.model.enums.RouteState;
import com.jay.formulaengine.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Layer 7 — Append-only audit trail.
 * Every routing transition and every evaluation failure lands here. Writes are best-effort:
 * a failing write is logged and never propagates into the pipeline that caused it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLog {

    private static final int MAX_PAYLOAD = 4000;

    private final AuditLogRepository repository;
    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /** Records one state transition of a routed trade. {@code from} is null for the initial entry. */
    public void transition(String tradeId, Signal signal, RouteState from, RouteState to,
                           AuditActor actor, Object payload) {
        write(AuditLogEntry.builder()
            .eventType(AuditEventType.ROUTE_TRANSITION)
            .entityId(tradeId)
            .userId(signal != null ? signal.getUserId() : null)
            .formulaId(signal != null ? signal.getFormulaId() : null)
            .symbol(signal != null ? signal.getSymbol() : null)
            .fromState(from != null ? from.name() : null)
            .toState(to.name())
            .actor(actor)
            .payload(toJson(payload))
            .build());
    }

    public void event(AuditEventType type, String entityId, String userId, String formulaId,
                      String symbol, Object payload) {
        write(AuditLogEntry.builder()
            .eventType(type)
            .entityId(entityId)
            .userId(userId)
            .formulaId(formulaId)
            .symbol(symbol)
            .actor(AuditActor.SYSTEM)
            .payload(toJson(payload))
            .build());
    }

    public List<AuditLogEntry> history(String entityId) {
        return repository.findByEntityIdOrderByIdAsc(entityId);
    }

    public List<AuditLogEntry> forUser(String userId) {
        return repository.findByUserIdOrderByTimestampDesc(userId);
    }

    public List<AuditLogEntry> since(AuditEventType type, LocalDateTime since) {
        return repository.findByEventTypeAndTimestampAfter(type, since);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void write(AuditLogEntry entry) {
        entry.setTimestamp(LocalDateTime.now());
        try {
            repository.save(entry);
        } catch (Exception e) {
            log.error("Audit write failed for {} {} → {}: {}",
                entry.getEntityId(), entry.getFromState(), entry.getToState(), e.getMessage());
        }
    }

    private String toJson(Object payload) {
        if (payload == null) return null;
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (Exception e) {
            log.warn("Audit payload not serialisable ({}): {}", payload.getClass().getSimpleName(), e.getMessage());
            json = String.valueOf(payload);
        }
        return json.length() <= MAX_PAYLOAD ? json : json.substring(0, MAX_PAYLOAD - 3) + "...";
    }
}
