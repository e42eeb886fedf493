package com.calc.adapter.spring;

import com.calc.config.CalculatorConfig;
import com.calc.config.ConfigLoader;
import com.calc.core.Calculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the calculator.
 */
@Configuration
@ConditionalOnProperty(prefix = "calc", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CalculatorProperties.class)
public class CalculatorAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CalculatorAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CalculatorConfig calculatorConfig(CalculatorProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public Calculator calculator(CalculatorConfig config) {
        log.info("Creating Calculator: {} ({})", config.name(), config.statementMode());
        return new Calculator(config);
    }
}
