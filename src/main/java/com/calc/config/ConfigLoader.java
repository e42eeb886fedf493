package com.calc.config;

import com.calc.exception.ConfigurationException;
import com.calc.lexer.LexerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads calculator configuration from YAML files.
 * <p>
 * Example:
 * <pre>
 * calculator:
 *   name: desk
 *   statement-mode: LINE_SEPARATED
 *   constants:
 *     E: 2.718281828459045
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static CalculatorConfig load(String path) {
        log.info("Loading calculator configuration from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Parse configuration from YAML text.
     */
    public static CalculatorConfig parse(String yamlText) {
        return parseYaml(new ByteArrayInputStream(yamlText.getBytes(StandardCharsets.UTF_8)));
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static CalculatorConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded;
        try {
            loaded = yaml.load(inputStream);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getMessage(), e);
        }

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // Section may be at root or under 'calculator'
        Object sectionValue = root.containsKey("calculator") ? root.get("calculator") : root;
        if (!(sectionValue instanceof Map)) {
            throw new ConfigurationException("'calculator' section must be a mapping");
        }
        Map<String, Object> section = (Map<String, Object>) sectionValue;

        String name = getString(section, "name", "calculator");
        StatementMode statementMode = parseStatementMode(section);
        Map<String, Double> constants = parseConstants(section.get("constants"));

        CalculatorConfig config = new CalculatorConfig(name, statementMode, constants);

        log.info("Loaded calculator configuration: {} with statement mode {} and {} extra constant(s)",
                name, statementMode, constants.size());

        return config;
    }

    private static StatementMode parseStatementMode(Map<String, Object> section) {
        String mode = getString(section, "statement-mode", null);
        if (mode == null) {
            mode = getString(section, "statementMode", null);
        }
        if (mode == null || mode.isBlank()) {
            return StatementMode.SINGLE_EXPRESSION;
        }
        try {
            return StatementMode.valueOf(mode.trim().toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown statement-mode '" + mode + "'", e);
        }
    }

    private static Map<String, Double> parseConstants(Object value) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new ConfigurationException("'constants' must be a mapping of name to number");
        }

        Map<String, Double> constants = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (!isIdentifier(name)) {
                throw new ConfigurationException("Constant name '" + name + "' is not a valid identifier");
            }
            constants.put(name, toDouble(name, entry.getValue()));
            log.debug("Parsed constant: {}={}", name, constants.get(name));
        }
        return constants;
    }

    private static double toDouble(String name, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Constant '" + name + "' is not a number: " + value, e);
            }
        }
        throw new ConfigurationException("Constant '" + name + "' has no value");
    }

    private static boolean isIdentifier(String name) {
        if (name.isEmpty() || !LexerConfig.isIdentifierStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!LexerConfig.isIdentifierPart(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
