package com.jay.formulaengine.controller;

import com.jay.formulaengine.layer1_data.SubscriptionRegistry;
import com.jay.formulaengine.layer2_formula.FormulaCompiler;
import com.jay.formulaengine.model.Formula;
import com.jay.formulaengine.model.Subscription;
import com.jay.formulaengine.model.enums.ExecutionMode;
import com.jay.formulaengine.notification.ConnectionRegistry;
import com.jay.formulaengine.notification.TelegramChatChannel;
import com.jay.formulaengine.notification.TelegramService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * REST API — Subscriptions evaluated by the scheduler.
 *
 * Endpoints:
 *   GET    /api/subscriptions          — All subscriptions, optionally for one user
 *   POST   /api/subscriptions          — Register or replace a subscription
 *   DELETE /api/subscriptions/{id}     — Remove a subscription
 */
@Slf4j
@RestController
@RequestMapping("/api/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

    private final SubscriptionRegistry registry;
    private final FormulaCompiler compiler;
    private final ConnectionRegistry connections;
    private final TelegramService telegramService;

    @GetMapping
    public ResponseEntity<List<Subscription>> list(@RequestParam(required = false) String userId) {
        return ResponseEntity.ok(userId == null ? registry.all() : registry.subscriptionsForUser(userId));
    }

    @PostMapping
    public ResponseEntity<Subscription> register(@RequestBody SubscriptionRequest request) {
        if (request.userId() == null || request.userId().isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        SubscriptionRequest.FormulaRequest fr = request.formula();
        if (fr == null || fr.symbols() == null || fr.symbols().isEmpty()) {
            throw new IllegalArgumentException("formula with at least one symbol is required");
        }
        List<String> symbols = normaliseSymbols(fr.symbols());
        if (request.sizing() != null && request.sizing().getPortfolioValue() <= 0) {
            throw new IllegalArgumentException("sizing.portfolioValue must be positive");
        }
        String body = fr.bodyText();
        // throws FormulaSyntaxException, mapped to 400
        compiler.compile(body, symbols);

        LocalDateTime now = LocalDateTime.now();
        Formula formula = Formula.builder()
            .id(fr.id() != null && !fr.id().isBlank() ? fr.id() : "FRM-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase())
            .userId(fr.userId() != null ? fr.userId() : request.userId())
            .name(fr.name())
            .body(body)
            .symbols(symbols)
            .active(fr.active() == null || fr.active())
            .executionMode(fr.executionMode() != null ? fr.executionMode() : ExecutionMode.ALERT_ONLY)
            .createdAt(now)
            .updatedAt(now)
            .build();

        Subscription.SubscriptionBuilder builder = Subscription.builder()
            .id(request.id())
            .userId(request.userId())
            .formula(formula)
            .executionMode(request.executionMode());
        if (request.riskPolicy() != null) builder.riskPolicy(request.riskPolicy());
        if (request.sizing() != null) builder.sizing(request.sizing());
        if (request.brokerType() != null && !request.brokerType().isBlank()) builder.brokerType(request.brokerType());
        if (request.notifyOnRiskRejection() != null) builder.notifyOnRiskRejection(request.notifyOnRiskRejection());
        if (request.active() != null) builder.active(request.active());

        Subscription stored = registry.register(builder.build());

        if (request.telegramChatId() != null && !request.telegramChatId().isBlank()) {
            connections.register(stored.getUserId(), new TelegramChatChannel(telegramService, request.telegramChatId()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(stored);
    }

    private static List<String> normaliseSymbols(List<String> raw) {
        List<String> symbols = new ArrayList<>(raw.size());
        for (String symbol : raw) {
            if (symbol == null || symbol.isBlank()) {
                throw new IllegalArgumentException("symbols must not be blank");
            }
            symbols.add(symbol.trim());
        }
        return List.copyOf(symbols);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> remove(@PathVariable String id) {
        if (!registry.remove(id)) {
            throw new NoSuchElementException("Unknown subscription: " + id);
        }
        return ResponseEntity.noContent().build();
    }
}
