package com.calc;

import com.calc.adapter.spring.CalculatorProperties;
import com.calc.core.Calculator;
import com.calc.exception.CalcException;
import com.calc.output.ResultWriter;
import com.calc.spring.EnableCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Command line calculator.
 * <p>
 * The arguments are joined with spaces into one source text. Each statement
 * value is printed; on the first error the error is printed and the process
 * exits with status 1.
 */
@SpringBootApplication
@EnableCalculator
public class CalculatorApplication {

    private static final Logger log = LoggerFactory.getLogger(CalculatorApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CalculatorApplication.class, args);
    }

    @Bean
    public CommandLineRunner evaluate(Calculator calculator, CalculatorProperties properties) {
        return args -> {
            String source = String.join(" ", args);
            if (source.isBlank()) {
                log.warn("Usage: calc <expression>, e.g. calc \"x = 2 * PI\"");
                return;
            }

            ResultWriter writer = new ResultWriter(properties.getOutputFormat(), System.out, System.err);
            try {
                calculator.evaluate(source, calculator.newContext(), writer::value);
                writer.finish();
            } catch (CalcException e) {
                log.debug("Evaluation of '{}' failed", source, e);
                writer.fail(e);
                System.exit(1);
            }
        };
    }
}
