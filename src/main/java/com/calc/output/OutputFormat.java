package com.calc.output;

/**
 * How the driver prints results.
 */
public enum OutputFormat {
    /**
     * One value per line, errors as {@code error: <message>} on the error stream.
     */
    TEXT,

    /**
     * A single JSON document with the results and, on failure, the error.
     */
    JSON
}
