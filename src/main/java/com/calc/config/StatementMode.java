package com.calc.config;

/**
 * How many statements a source text may contain.
 */
public enum StatementMode {
    /**
     * Exactly one expression; anything after it is an error.
     */
    SINGLE_EXPRESSION,

    /**
     * One or more expressions; a token that begins on a later line than the
     * end of a complete expression starts the next statement.
     */
    LINE_SEPARATED
}
