package com.calc.exception;

import com.calc.core.Location;

import java.util.Optional;

/**
 * Error found in the source text by one of the processing stages.
 * <p>
 * The message reads {@code Kind 'detail' at (line, column)}.
 */
public abstract class SourceException extends CalcException {

    private final ErrorKind kind;
    private final String detail;
    private final Location location;

    protected SourceException(ErrorKind kind, String detail, Location location) {
        super(render(kind, detail, location));
        this.kind = kind;
        this.detail = detail;
        this.location = location;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Offending character, lexeme, symbol name or description, if any.
     */
    public String getDetail() {
        return detail;
    }

    public Optional<Location> getLocation() {
        return Optional.ofNullable(location);
    }

    private static String render(ErrorKind kind, String detail, Location location) {
        StringBuilder sb = new StringBuilder(kind.getDisplayName());
        if (detail != null) {
            sb.append(" '").append(detail).append('\'');
        }
        if (location != null) {
            sb.append(" at ").append(location);
        }
        return sb.toString();
    }
}
