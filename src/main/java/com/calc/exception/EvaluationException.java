package com.calc.exception;

import com.calc.core.Location;

/**
 * Exception thrown while evaluating a syntax tree.
 */
public class EvaluationException extends SourceException {

    private EvaluationException(ErrorKind kind, String detail, Location location) {
        super(kind, detail, location);
    }

    public static EvaluationException symbolNotFound(String name, Location location) {
        return new EvaluationException(ErrorKind.SYMBOL_NOT_FOUND, name, location);
    }

    public static EvaluationException unimplemented(String description) {
        return new EvaluationException(ErrorKind.UNIMPLEMENTED, description, null);
    }
}
