package com.calc.output;

import com.calc.core.Calculator;
import com.calc.exception.ConfigurationException;
import com.calc.exception.SourceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResultWriter.
 */
class ResultWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @Test
    @DisplayName("Text output prints one value per line")
    void textPrintsValues() {
        ResultWriter writer = writer(OutputFormat.TEXT);

        writer.value(3.0);
        writer.value(0.25);
        writer.finish();

        assertEquals("3" + System.lineSeparator() + "0.25" + System.lineSeparator(), text(out));
        assertEquals("", text(err));
    }

    @Test
    @DisplayName("Text output prints errors to the error stream")
    void textPrintsErrors() {
        ResultWriter writer = writer(OutputFormat.TEXT);
        SourceException error = assertThrows(SourceException.class, () -> new Calculator().evaluate("(hello"));

        writer.fail(error);

        assertEquals("", text(out));
        assertEquals("error: ExpectedCloseParen 'EOL' at (0, 5)" + System.lineSeparator(), text(err));
    }

    @Test
    @DisplayName("JSON output collects results into one document")
    void jsonCollectsResults() throws Exception {
        ResultWriter writer = writer(OutputFormat.JSON);

        writer.value(1.5);
        writer.value(2.0);
        assertEquals("", text(out));
        writer.finish();

        JsonNode document = objectMapper.readTree(text(out));
        assertEquals(2, document.get("results").size());
        assertEquals(1.5, document.get("results").get(0).asDouble());
        assertFalse(document.has("error"));
    }

    @Test
    @DisplayName("JSON output describes errors with kind and location")
    void jsonDescribesErrors() throws Exception {
        ResultWriter writer = writer(OutputFormat.JSON);
        SourceException error = assertThrows(SourceException.class, () -> new Calculator().evaluate("3.14 hello"));

        writer.value(7.0);
        writer.fail(error);

        JsonNode document = objectMapper.readTree(text(out));
        assertEquals(7.0, document.get("results").get(0).asDouble());
        JsonNode description = document.get("error");
        assertEquals("UnexpectedToken", description.get("kind").asText());
        assertEquals(0, description.get("line").asInt());
        assertEquals(5, description.get("column").asInt());
    }

    @Test
    @DisplayName("JSON output describes configuration errors without location")
    void jsonDescribesConfigurationErrors() throws Exception {
        ResultWriter writer = writer(OutputFormat.JSON);

        writer.fail(new ConfigurationException("bad config"));

        JsonNode description = objectMapper.readTree(text(out)).get("error");
        assertEquals("Configuration", description.get("kind").asText());
        assertFalse(description.has("line"));
    }

    @Test
    @DisplayName("Integral values print without a fraction")
    void formatsValues() {
        assertEquals("42", ResultWriter.formatValue(42.0));
        assertEquals("-3", ResultWriter.formatValue(-3.0));
        assertEquals("3.14", ResultWriter.formatValue(3.14));
        assertEquals("Infinity", ResultWriter.formatValue(Double.POSITIVE_INFINITY));
        assertEquals("NaN", ResultWriter.formatValue(Double.NaN));
        assertEquals("1.0E20", ResultWriter.formatValue(1e20));
    }

    private ResultWriter writer(OutputFormat format) {
        return new ResultWriter(format,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static String text(ByteArrayOutputStream stream) {
        return stream.toString(StandardCharsets.UTF_8);
    }
}
