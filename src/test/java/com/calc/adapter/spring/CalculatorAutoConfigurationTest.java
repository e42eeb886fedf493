package com.calc.adapter.spring;

import com.calc.config.CalculatorConfig;
import com.calc.config.StatementMode;
import com.calc.core.Calculator;
import com.calc.output.OutputFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CalculatorAutoConfiguration.
 */
class CalculatorAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(CalculatorAutoConfiguration.class);

    @Test
    @DisplayName("Should create calculator from the configured file")
    void shouldCreateCalculator() {
        contextRunner
                .withPropertyValues("calc.config-path=classpath:calculator-test.yaml")
                .run(context -> {
                    Calculator calculator = context.getBean(Calculator.class);
                    assertEquals(StatementMode.LINE_SEPARATED, calculator.getConfig().statementMode());
                    assertEquals(List.of(1.0, 2.0), calculator.evaluate("x = 1\nx + 1"));
                });
    }

    @Test
    @DisplayName("Should bind output format property")
    void shouldBindOutputFormat() {
        contextRunner
                .withPropertyValues("calc.output-format=JSON")
                .run(context -> assertEquals(
                        OutputFormat.JSON,
                        context.getBean(CalculatorProperties.class).getOutputFormat()));
    }

    @Test
    @DisplayName("Should create nothing when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("calc.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(Calculator.class).isEmpty()));
    }

    @Test
    @DisplayName("Should keep a user-defined configuration bean")
    void shouldKeepUserConfig() {
        contextRunner
                .withBean(CalculatorConfig.class, CalculatorConfig::defaults)
                .withPropertyValues("calc.config-path=classpath:missing.yaml")
                .run(context -> assertEquals("calculator",
                        context.getBean(Calculator.class).getConfig().name()));
    }
}
