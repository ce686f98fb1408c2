package com.oloc.adapter.spring;

import com.oloc.adapter.executor.CalculationSupervisor;
import com.oloc.config.ConfigLoader;
import com.oloc.config.OlocConfig;
import com.oloc.core.Calculator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for oloc.
 */
@Configuration
@ConditionalOnProperty(prefix = "oloc", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(OlocProperties.class)
public class OlocAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OlocAutoConfiguration.class);

    private CalculationSupervisor supervisor;

    @Bean
    @ConditionalOnMissingBean
    public OlocConfig olocConfig(OlocProperties properties) {
        log.info("Loading oloc configuration from: {}", properties.getConfigPath());
        OlocConfig config = ConfigLoader.load(properties.getConfigPath());
        if (properties.getDecimalPlaces() != null) {
            config = config.withDecimalPlaces(properties.getDecimalPlaces());
        }
        if (properties.getTimeLimitMillis() != null) {
            config = config.withTimeLimitMillis(properties.getTimeLimitMillis());
        }
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    public Calculator calculator(OlocConfig config) {
        return new Calculator(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public CalculationSupervisor calculationSupervisor(Calculator calculator) {
        log.info("Creating CalculationSupervisor, time limit {} ms", calculator.getConfig().timeLimitMillis());
        this.supervisor = new CalculationSupervisor(calculator);
        return this.supervisor;
    }

    @PreDestroy
    public void shutdown() {
        if (supervisor != null && !supervisor.isShutdown()) {
            log.info("Shutting down CalculationSupervisor");
            supervisor.shutdown();
        }
    }
}
