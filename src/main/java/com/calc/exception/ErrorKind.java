package com.calc.exception;

/**
 * Kinds of errors raised while lexing, parsing or evaluating source text.
 */
public enum ErrorKind {
    // Lexical
    UNRECOGNIZED_CHARACTER("UnrecognizedCharacter"),
    INVALID_NUMBER("InvalidNumber"),

    // Syntax
    UNEXPECTED_TOKEN("UnexpectedToken"),
    UNEXPECTED_END_OF_LINE("UnexpectedEndOfLine"),
    EXPECTED_CLOSE_PAREN("ExpectedCloseParen"),

    // Evaluation
    SYMBOL_NOT_FOUND("SymbolNotFound"),
    UNIMPLEMENTED("Unimplemented");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
