package com.flagship.vendor_finance.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binds the shipped {@code application.yml} without starting a context.
 */
class ApplicationConfigTest {

    private PropertySource<?> applicationYml;
    private Binder binder;

    @BeforeEach
    void setUp() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
            .load("application.yml", new ClassPathResource("application.yml"));
        applicationYml = sources.get(0);
        binder = new Binder(ConfigurationPropertySources.from(applicationYml));
    }

    @Test
    void bindsFinancePolicy() {
        FinancePolicyProperties policy = binder.bind("finance.policy", FinancePolicyProperties.class).get();

        assertEquals(0, new BigDecimal("0.14").compareTo(policy.getVatRate()));
        assertEquals(14, policy.getEscrowHoldDays());
        assertEquals(0, new BigDecimal("500").compareTo(policy.getMinimumPayoutThreshold()));
        assertEquals(8, policy.getCategories().size());
        assertEquals(0, new BigDecimal("0.22").compareTo(
            policy.getCategories().get("fashion-apparel").getDefaultUpliftRate()));
    }

    @Test
    @DisplayName("No actuator web exposure is configured: the host application owns the HTTP layer")
    void configuresNoWebEndpoints() {
        assertNull(applicationYml.getProperty("management.endpoints.web.exposure.include"));
    }
}
