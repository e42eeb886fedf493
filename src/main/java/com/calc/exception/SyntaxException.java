package com.calc.exception;

import com.calc.core.Location;

/**
 * Exception thrown when a token sequence does not match the grammar.
 */
public class SyntaxException extends SourceException {

    /**
     * Placeholder used for {@code found} when the input ended.
     */
    public static final String END_OF_LINE = "EOL";

    private SyntaxException(ErrorKind kind, String detail, Location location) {
        super(kind, detail, location);
    }

    public static SyntaxException unexpectedToken(String lexeme, Location location) {
        return new SyntaxException(ErrorKind.UNEXPECTED_TOKEN, lexeme, location);
    }

    public static SyntaxException unexpectedEndOfLine(Location location) {
        return new SyntaxException(ErrorKind.UNEXPECTED_END_OF_LINE, null, location);
    }

    public static SyntaxException expectedCloseParen(String found, Location location) {
        return new SyntaxException(ErrorKind.EXPECTED_CLOSE_PAREN, found, location);
    }
}
