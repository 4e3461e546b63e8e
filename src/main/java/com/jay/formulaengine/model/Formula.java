package com.jay.formulaengine.model;

import com.jay.formulaengine.model.enums.ExecutionMode;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A user-authored trading formula. The body is a JSON rule document
 * interpreted by {@link com.jay.formulaengine.layer2_formula.FormulaEvaluator}.
 */
@Data
@Builder(toBuilder = true)
public class Formula {

    private String id;
    private String userId;               // owner / author
    private String name;
    private String body;

    @Builder.Default
    private List<String> symbols = List.of();

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private ExecutionMode executionMode = ExecutionMode.ALERT_ONLY;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /** Symbol the formula is keyed on when it has to be named without a signal (errors, logs). */
    public String primarySymbol() {
        return symbols == null || symbols.isEmpty() ? null : symbols.get(0);
    }
}
