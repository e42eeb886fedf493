package com.calc.exception;

import com.calc.core.Location;

/**
 * Exception thrown when source text cannot be split into tokens.
 */
public class LexerException extends SourceException {

    private LexerException(ErrorKind kind, String detail, Location location) {
        super(kind, detail, location);
    }

    public static LexerException unrecognizedCharacter(char character, int line, int column) {
        return new LexerException(ErrorKind.UNRECOGNIZED_CHARACTER, String.valueOf(character),
                new Location(line, column));
    }

    public static LexerException invalidNumber(int line, int column) {
        return new LexerException(ErrorKind.INVALID_NUMBER, null, new Location(line, column));
    }
}
