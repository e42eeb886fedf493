package com.calc.lexer;

import com.calc.core.Location;

/**
 * Represents a token in the source text.
 *
 * @param type   Token type
 * @param text   Lexeme as it appears in the source
 * @param line   Line of the first character
 * @param column Column of the first character
 */
public record Token(TokenType type, String text, int line, int column) {

    public Location location() {
        return new Location(line, column);
    }

    /**
     * Location of the last character of the lexeme.
     */
    public Location endLocation() {
        return new Location(line, column + Math.max(text.length() - 1, 0));
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
