package com.jay.formulaengine.controller;

import com.jay.formulaengine.layer6_execution.ApprovalGateway;
import com.jay.formulaengine.layer6_execution.ApprovalNotFoundException;
import com.jay.formulaengine.model.PendingApproval;
import com.jay.formulaengine.model.enums.ApprovalStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API — Approval decisions for MANUAL-mode trades.
 *
 * Endpoints:
 *   GET  /api/approvals?userId=&status=        — Approvals, optionally filtered
 *   GET  /api/approvals/{tradeId}              — One approval
 *   POST /api/approvals/{tradeId}/approve      — Body: optional {position_size, take_profit, stop_loss}
 *   POST /api/approvals/{tradeId}/reject       — Body: optional {"reason": "..."}
 */
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalGateway approvalGateway;

    @GetMapping
    public ResponseEntity<List<PendingApproval>> list(@RequestParam(required = false) String userId,
                                                      @RequestParam(required = false) ApprovalStatus status) {
        return ResponseEntity.ok(approvalGateway.query(userId, status));
    }

    @GetMapping("/{tradeId}")
    public ResponseEntity<PendingApproval> get(@PathVariable String tradeId) {
        return ResponseEntity.ok(approvalGateway.find(tradeId)
            .orElseThrow(() -> new ApprovalNotFoundException(tradeId)));
    }

    @PostMapping("/{tradeId}/approve")
    public ResponseEntity<PendingApproval> approve(@PathVariable String tradeId,
                                                   @RequestBody(required = false) Map<String, Double> adjustments) {
        return ResponseEntity.ok(approvalGateway.approve(tradeId, adjustments != null ? adjustments : Map.of()));
    }

    @PostMapping("/{tradeId}/reject")
    public ResponseEntity<PendingApproval> reject(@PathVariable String tradeId,
                                                  @RequestBody(required = false) Map<String, String> body) {
        String reason = body != null ? body.get("reason") : null;
        return ResponseEntity.ok(approvalGateway.reject(tradeId, reason));
    }
}
