package com.calc.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable mapping from identifier to value for one evaluation run.
 */
public class SymbolTable {

    private final Map<String, Double> symbols = new LinkedHashMap<>();

    /**
     * Look up the current value of a symbol.
     *
     * @param name Identifier
     * @return Value, or empty if the symbol was never assigned
     */
    public Optional<Double> lookup(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * Store a value, replacing any previous one.
     */
    public void assign(String name, double value) {
        symbols.put(name, value);
    }

    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    public int size() {
        return symbols.size();
    }

    /**
     * Read-only view of all symbols in assignment order.
     */
    public Map<String, Double> asMap() {
        return Collections.unmodifiableMap(symbols);
    }
}
