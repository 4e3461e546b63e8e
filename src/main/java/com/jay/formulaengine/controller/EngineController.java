package com.jay.formulaengine.controller;

import com.jay.formulaengine.config.EngineConfig;
import com.jay.formulaengine.entity.AuditLogEntry;
import com.jay.formulaengine.layer1_data.SubscriptionProvider;
import com.jay.formulaengine.layer6_execution.ApprovalGateway;
import com.jay.formulaengine.layer6_execution.broker.BrokerPosition;
import com.jay.formulaengine.layer6_execution.broker.BrokerRegistry;
import com.jay.formulaengine.layer7_monitor.AuditLog;
import com.jay.formulaengine.layer7_monitor.EngineStatistics;
import com.jay.formulaengine.model.CycleReport;
import com.jay.formulaengine.model.enums.AuditEventType;
import com.jay.formulaengine.notification.TelegramService;
import com.jay.formulaengine.scheduler.EvaluationEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API — Engine control and monitoring.
 *
 * Endpoints:
 *   GET  /api/status                         — Engine health and configuration summary
 *   GET  /api/statistics                     — Evaluation counters
 *   POST /api/statistics/reset               — Zero the counters
 *   POST /api/evaluate                       — Run a full evaluation cycle now
 *   POST /api/evaluate/{userId}              — Evaluate one user's subscriptions
 *   POST /api/evaluate/{userId}/{formulaId}  — Evaluate one (user, formula) pair
 *   GET  /api/brokers/{type}/positions       — Open positions at a broker
 *   GET  /api/brokers/{type}/profile         — Broker account summary
 *   GET  /api/audit/{entityId}               — Audit trail of a trade or formula
 *   GET  /api/audit?userId=                  — Audit entries of a user, newest first
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EngineController {

    private final EngineConfig config;
    private final EvaluationEngine engine;
    private final EngineStatistics statistics;
    private final SubscriptionProvider subscriptions;
    private final ApprovalGateway approvalGateway;
    private final BrokerRegistry brokerRegistry;
    private final TelegramService telegramService;
    private final AuditLog auditLog;

    // ── GET /api/status ────────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "RUNNING");
        body.put("timestamp", LocalDateTime.now().toString());
        body.put("schedulerEnabled", config.scheduler().isEnabled());
        body.put("intervalMs", config.scheduler().getIntervalMs());
        body.put("cycleRunning", engine.isCycleRunning());
        body.put("activeSubscriptions", subscriptions.activeSubscriptions().size());
        body.put("pendingApprovals", approvalGateway.pendingCount());
        body.put("brokers", brokerRegistry.brokerTypes());
        body.put("telegramConfigured", telegramService.isConfigured());
        body.put("lastCycleAt", statistics.snapshot().lastCycleAt());
        body.put("evaluationFailuresLastHour",
            auditLog.since(AuditEventType.EVALUATION_FAILED, LocalDateTime.now().minusHours(1)).size());
        return ResponseEntity.ok(body);
    }

    // ── Statistics ─────────────────────────────────────────────────────────────

    @GetMapping("/statistics")
    public ResponseEntity<EngineStatistics.Snapshot> statistics() {
        return ResponseEntity.ok(statistics.snapshot());
    }

    @PostMapping("/statistics/reset")
    public ResponseEntity<EngineStatistics.Snapshot> resetStatistics() {
        statistics.reset();
        return ResponseEntity.ok(statistics.snapshot());
    }

    // ── Evaluation triggers ────────────────────────────────────────────────────

    @PostMapping("/evaluate")
    public ResponseEntity<CycleReport> evaluateAll() {
        return ResponseEntity.ok(engine.evaluateAll());
    }

    @PostMapping("/evaluate/{userId}")
    public ResponseEntity<CycleReport> evaluateUser(@PathVariable String userId) {
        return ResponseEntity.ok(engine.evaluateUser(userId));
    }

    @PostMapping("/evaluate/{userId}/{formulaId}")
    public ResponseEntity<CycleReport> evaluateOne(@PathVariable String userId, @PathVariable String formulaId) {
        return ResponseEntity.ok(engine.evaluateOne(userId, formulaId));
    }

    // ── Brokers ────────────────────────────────────────────────────────────────

    @GetMapping("/brokers/{type}/positions")
    public ResponseEntity<List<BrokerPosition>> positions(@PathVariable String type) {
        return ResponseEntity.ok(brokerRegistry.resolve(type).getPositions());
    }

    @GetMapping("/brokers/{type}/profile")
    public ResponseEntity<Map<String, Object>> profile(@PathVariable String type) {
        return ResponseEntity.ok(brokerRegistry.resolve(type).getProfile());
    }

    // ── Audit ──────────────────────────────────────────────────────────────────

    @GetMapping("/audit/{entityId}")
    public ResponseEntity<List<AuditLogEntry>> audit(@PathVariable String entityId) {
        return ResponseEntity.ok(auditLog.history(entityId));
    }

    @GetMapping("/audit")
    public ResponseEntity<List<AuditLogEntry>> auditForUser(@RequestParam String userId) {
        return ResponseEntity.ok(auditLog.forUser(userId));
    }
}
