package com.calc.output;

import com.calc.exception.CalcException;
import com.calc.exception.SourceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes statement values and errors in the selected {@link OutputFormat}.
 * <p>
 * Text output is written as values arrive. JSON output is collected and
 * written once by {@link #finish()} or {@link #fail(CalcException)}.
 */
public class ResultWriter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final OutputFormat format;
    private final PrintStream out;
    private final PrintStream err;
    private final List<Double> results = new ArrayList<>();

    public ResultWriter(OutputFormat format, PrintStream out, PrintStream err) {
        this.format = format;
        this.out = out;
        this.err = err;
    }

    /**
     * Record the value of one statement.
     */
    public void value(double value) {
        results.add(value);
        if (format == OutputFormat.TEXT) {
            out.println(formatValue(value));
        }
    }

    /**
     * Complete a successful run.
     */
    public void finish() {
        if (format == OutputFormat.JSON) {
            out.println(toJson(document(null)));
        }
    }

    /**
     * Complete a failed run.
     */
    public void fail(CalcException error) {
        if (format == OutputFormat.JSON) {
            out.println(toJson(document(error)));
        } else {
            err.println("error: " + error.getMessage());
        }
    }

    public List<Double> getResults() {
        return List.copyOf(results);
    }

    /**
     * Render integral values without a fractional part.
     */
    public static String formatValue(double value) {
        if (!Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private Map<String, Object> document(CalcException error) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("results", results);
        if (error != null) {
            document.put("error", describe(error));
        }
        return document;
    }

    private static Map<String, Object> describe(CalcException error) {
        Map<String, Object> description = new LinkedHashMap<>();
        if (error instanceof SourceException source) {
            description.put("kind", source.getKind().getDisplayName());
            description.put("message", source.getMessage());
            source.getLocation().ifPresent(location -> {
                description.put("line", location.line());
                description.put("column", location.column());
            });
        } else {
            description.put("kind", "Configuration");
            description.put("message", error.getMessage());
        }
        return description;
    }

    private static String toJson(Map<String, Object> document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize results: " + e.getMessage(), e);
        }
    }
}
