package com.oloc.adapter.spring;

import com.oloc.adapter.executor.CalculationSupervisor;
import com.oloc.config.OlocConfig;
import com.oloc.core.Calculator;
import com.oloc.spring.EnableOloc;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OlocAutoConfiguration.
 */
class OlocAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(OlocAutoConfiguration.class));

    @Configuration
    @EnableOloc
    static class UserConfiguration {
    }

    @Test
    @DisplayName("Should create the calculator beans from the default tables")
    void shouldCreateBeans() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(OlocConfig.class));
            assertNotNull(context.getBean(CalculationSupervisor.class));
            Calculator calculator = context.getBean(Calculator.class);
            assertEquals("1/2y", calculator.calculate("3x/6xy").formatted());
            assertEquals(OlocConfig.DEFAULT_DECIMAL_PLACES, calculator.getConfig().decimalPlaces());
        });
    }

    @Test
    @DisplayName("Properties override the table file defaults")
    void shouldApplyPropertyOverrides() {
        contextRunner
                .withPropertyValues("oloc.decimal-places=3", "oloc.time-limit-millis=5000")
                .run(context -> {
                    OlocConfig config = context.getBean(OlocConfig.class);
                    assertEquals(3, config.decimalPlaces());
                    assertEquals(5000, config.timeLimitMillis());
                    assertEquals("0.333", context.getBean(CalculationSupervisor.class)
                            .calculate("1/3").toDecimalString());
                });
    }

    @Test
    @DisplayName("Should load tables from a configured path")
    void shouldLoadConfiguredPath() {
        contextRunner
                .withPropertyValues("oloc.config-path=classpath:config/custom-tables.yaml")
                .run(context -> {
                    OlocConfig config = context.getBean(OlocConfig.class);
                    assertEquals(3, config.decimalPlaces());
                    assertEquals(250, config.timeLimitMillis());
                });
    }

    @Test
    @DisplayName("Should back off when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("oloc.enabled=false")
                .run(context -> {
                    assertTrue(context.getBeansOfType(Calculator.class).isEmpty());
                    assertTrue(context.getBeansOfType(CalculationSupervisor.class).isEmpty());
                });
    }

    @Test
    @DisplayName("Should shut the supervisor down with the context")
    void shouldShutDownSupervisor() {
        CalculationSupervisor[] supervisor = new CalculationSupervisor[1];
        contextRunner.run(context -> supervisor[0] = context.getBean(CalculationSupervisor.class));

        assertTrue(supervisor[0].isShutdown());
    }

    @Test
    @DisplayName("@EnableOloc imports the configuration")
    void shouldImportWithAnnotation() {
        new ApplicationContextRunner()
                .withUserConfiguration(UserConfiguration.class)
                .run(context -> assertNotNull(context.getBean(Calculator.class)));
    }
}
