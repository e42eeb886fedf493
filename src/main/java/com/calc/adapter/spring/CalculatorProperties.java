package com.calc.adapter.spring;

import com.calc.output.OutputFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the calculator.
 */
@ConfigurationProperties(prefix = "calc")
public class CalculatorProperties {

    /**
     * Whether the calculator beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the calculator configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:calculator.yaml";

    /**
     * Output format of the command line runner.
     */
    private OutputFormat outputFormat = OutputFormat.TEXT;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(OutputFormat outputFormat) {
        this.outputFormat = outputFormat;
    }
}
