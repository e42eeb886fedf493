package com.calc.eval;

import java.util.Map;

/**
 * State shared by all statements of one evaluation run.
 * <p>
 * A fresh context always knows {@code PI}. Extra constants are added after it
 * and may be reassigned like any other symbol.
 */
public class EvaluationContext {

    public static final String PI = "PI";

    private final SymbolTable symbols = new SymbolTable();

    public EvaluationContext() {
        this(Map.of());
    }

    public EvaluationContext(Map<String, Double> constants) {
        symbols.assign(PI, Math.PI);
        constants.forEach(symbols::assign);
    }

    public SymbolTable getSymbols() {
        return symbols;
    }
}
