package com.calc.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root configuration for the calculator.
 *
 * @param name          Configuration name
 * @param statementMode How statements are separated
 * @param constants     Symbols preset in every new evaluation context, after {@code PI}
 */
public record CalculatorConfig(
        String name,
        StatementMode statementMode,
        Map<String, Double> constants
) {
    public CalculatorConfig {
        if (statementMode == null) {
            statementMode = StatementMode.SINGLE_EXPRESSION;
        }
        constants = constants == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(constants));
    }

    /**
     * Single-expression configuration with no extra constants.
     */
    public static CalculatorConfig defaults() {
        return new CalculatorConfig("calculator", StatementMode.SINGLE_EXPRESSION, Map.of());
    }
}
