package com.ivamare.rollout.health;

import com.ivamare.rollout.connector.ConnectorDispatcher;
import com.ivamare.rollout.repository.AuditRepository;
import com.ivamare.rollout.repository.impl.InMemoryAuditRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("HealthAutoConfiguration")
class HealthAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(HealthAutoConfiguration.class))
        .withUserConfiguration(StoreAndDispatcherConfig.class);

    @Test
    @DisplayName("should create both indicators when enabled")
    void shouldCreateIndicatorsWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(AuditStoreHealthIndicator.class);
            assertThat(context).hasSingleBean(ConnectorHealthIndicator.class);
        });
    }

    @Test
    @DisplayName("should not create indicators when disabled")
    void shouldNotCreateIndicatorsWhenDisabled() {
        contextRunner
            .withPropertyValues("rollout.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(AuditStoreHealthIndicator.class);
                assertThat(context).doesNotHaveBean(ConnectorHealthIndicator.class);
            });
    }

    @Test
    @DisplayName("should skip the connector indicator without a dispatcher")
    void shouldSkipConnectorIndicatorWithoutDispatcher() {
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(HealthAutoConfiguration.class))
            .withUserConfiguration(StoreOnlyConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(AuditStoreHealthIndicator.class);
                assertThat(context).doesNotHaveBean(ConnectorHealthIndicator.class);
            });
    }

    @Test
    @DisplayName("should not create a duplicate indicator if one exists")
    void shouldNotCreateDuplicateIndicator() {
        contextRunner
            .withUserConfiguration(CustomIndicatorConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(AuditStoreHealthIndicator.class);
                assertThat(context.getBean(AuditStoreHealthIndicator.class))
                    .isSameAs(CustomIndicatorConfig.CUSTOM_INDICATOR);
            });
    }

    @Configuration
    static class StoreOnlyConfig {
        @Bean
        public AuditRepository auditRepository() {
            return new InMemoryAuditRepository();
        }
    }

    @Configuration
    static class StoreAndDispatcherConfig {
        @Bean
        public AuditRepository auditRepository() {
            return new InMemoryAuditRepository();
        }

        @Bean
        public ConnectorDispatcher connectorDispatcher() {
            return mock(ConnectorDispatcher.class);
        }
    }

    @Configuration
    static class CustomIndicatorConfig {
        static final AuditStoreHealthIndicator CUSTOM_INDICATOR =
            new AuditStoreHealthIndicator(new InMemoryAuditRepository());

        @Bean
        public AuditStoreHealthIndicator auditStoreHealthIndicator() {
            return CUSTOM_INDICATOR;
        }
    }
}
