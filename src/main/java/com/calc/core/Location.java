package com.calc.core;

/**
 * Zero-based position in the source text.
 *
 * @param line   Line number
 * @param column Column number
 */
public record Location(int line, int column) {

    public static final Location START = new Location(0, 0);

    @Override
    public String toString() {
        return "(" + line + ", " + column + ")";
    }
}
