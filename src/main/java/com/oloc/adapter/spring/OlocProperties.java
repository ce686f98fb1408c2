package com.oloc.adapter.spring;

import com.oloc.config.OlocConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for oloc.
 */
@ConfigurationProperties(prefix = "oloc")
public class OlocProperties {

    /**
     * Whether oloc is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the alias table file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = OlocConfig.DEFAULT_TABLES;

    /**
     * Overrides the time limit of the table file when set. Negative disables supervision.
     */
    private Long timeLimitMillis;

    /**
     * Overrides the decimal places of the table file when set.
     */
    private Integer decimalPlaces;

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

    public Long getTimeLimitMillis() {
        return timeLimitMillis;
    }

    public void setTimeLimitMillis(Long timeLimitMillis) {
        this.timeLimitMillis = timeLimitMillis;
    }

    public Integer getDecimalPlaces() {
        return decimalPlaces;
    }

    public void setDecimalPlaces(Integer decimalPlaces) {
        this.decimalPlaces = decimalPlaces;
    }
}
