package com.jay.formulaengine.layer3_signal;

import com.jay.formulaengine.layer2_formula.EvaluationError;
import com.jay.formulaengine.layer2_formula.EvaluationResult;
import com.jay.formulaengine.layer2_formula.FormulaEvaluator;
import com.jay.formulaengine.layer6_execution.ExecutionRouter;
import com.jay.formulaengine.layer7_monitor.AuditLog;
import com.jay.formulaengine.layer7_monitor.EngineStatistics;
import com.jay.formulaengine.model.ExecutionResult;
import com.jay.formulaengine.model.Formula;
import com.jay.formulaengine.model.MarketSnapshot;
import com.jay.formulaengine.model.Signal;
import com.jay.formulaengine.model.Subscription;
import com.jay.formulaengine.model.TradeProposal;
import com.jay.formulaengine.model.enums.AuditEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Layer 3 — Per-subscription pipeline: evaluate → validate → route, strictly in that order.
 * Evaluation failures are recorded (statistics, audit, log) and returned as an outcome, never thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalPipeline {

    private final FormulaEvaluator evaluator;
    private final TradeProposalFactory proposalFactory;
    private final ExecutionRouter router;
    private final AuditLog audit;
    private final EngineStatistics stats;

    public PipelineOutcome run(Subscription subscription, Map<String, MarketSnapshot> market) {
        Formula formula = subscription.getFormula();
        stats.evaluationAttempted();

        EvaluationResult result = evaluator.evaluate(formula, market);
        if (!result.isSuccess()) {
            EvaluationError error = result.error();
            stats.evaluationFailed();
            log.warn("Formula {} for {} failed: {}", formula.getId(), subscription.getUserId(), error.describe());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("subscription_id", subscription.getId());
            payload.put("error_type", error.type().name());
            payload.put("message", error.message());
            audit.event(AuditEventType.EVALUATION_FAILED, formula.getId(), subscription.getUserId(),
                formula.getId(), error.symbol(), payload);
            return PipelineOutcome.failed(subscription.getId(), error);
        }

        stats.evaluationSucceeded();
        Signal signal = result.signal().toBuilder().userId(subscription.getUserId()).build();
        stats.signalGenerated();
        log.debug("Formula {} → {} {} @ {} (confidence {})", formula.getId(), signal.getSignalType(),
            signal.getSymbol(), signal.getPrice(), signal.getConfidence());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subscription_id", subscription.getId());
        payload.put("signal_type", signal.getSignalType().name());
        payload.put("confidence", signal.getConfidence());
        payload.put("price", signal.getPrice());
        audit.event(AuditEventType.SIGNAL_GENERATED, formula.getId(), subscription.getUserId(),
            formula.getId(), signal.getSymbol(), payload);

        if (!signal.getSignalType().isActionable()) {
            return PipelineOutcome.signalled(subscription.getId(), signal, null);
        }

        TradeProposal proposal = proposalFactory.create(signal, subscription.getSizing());
        ExecutionResult execution = router.route(subscription, signal, proposal);
        return PipelineOutcome.signalled(subscription.getId(), signal, execution);
    }
}
