package com.calc.fsm;

/**
 * States of the number literal automaton.
 */
public enum NumberState {
    INITIAL,
    INTEGER,
    BEGIN_FRACTIONAL,
    FRACTIONAL,
    BEGIN_EXPONENT,
    BEGIN_SIGNED_EXPONENT,
    EXPONENT;

    /**
     * Whether a literal may end in this state.
     */
    public boolean isAccepting() {
        return this == INTEGER || this == FRACTIONAL || this == EXPONENT;
    }
}
