package com.ivamare.rollout;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.rollout.api.BearerTokenInterceptor;
import com.ivamare.rollout.api.RolloutController;
import com.ivamare.rollout.connector.ConnectorCapability;
import com.ivamare.rollout.connector.ConnectorDispatcher;
import com.ivamare.rollout.connector.ConnectorRegistry;
import com.ivamare.rollout.connector.http.HttpConnector;
import com.ivamare.rollout.promotion.PromotionGateConfig;
import com.ivamare.rollout.promotion.PromotionService;
import com.ivamare.rollout.repository.AuditRepository;
import com.ivamare.rollout.repository.CabApprovalRepository;
import com.ivamare.rollout.repository.impl.InMemoryAuditRepository;
import com.ivamare.rollout.repository.impl.InMemoryCabApprovalRepository;
import com.ivamare.rollout.repository.impl.JdbcAuditRepository;
import com.ivamare.rollout.repository.impl.JdbcCabApprovalRepository;
import com.ivamare.rollout.risk.RiskScoringEngine;
import com.ivamare.rollout.rollback.RollbackOrchestrator;
import com.ivamare.rollout.service.RolloutService;
import com.ivamare.rollout.support.FakeConnector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("RolloutAutoConfiguration")
class RolloutAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(RolloutAutoConfiguration.class));

    @Test
    @DisplayName("should create all beans with in-memory stores without a JdbcTemplate")
    void shouldCreateAllBeansInMemory() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ObjectMapper.class);
            assertThat(context).hasSingleBean(RiskScoringEngine.class);
            assertThat(context).hasSingleBean(ConnectorDispatcher.class);
            assertThat(context).hasSingleBean(PromotionService.class);
            assertThat(context).hasSingleBean(RollbackOrchestrator.class);
            assertThat(context).hasSingleBean(RolloutService.class);
            assertThat(context.getBean(AuditRepository.class)).isInstanceOf(InMemoryAuditRepository.class);
            assertThat(context.getBean(CabApprovalRepository.class))
                .isInstanceOf(InMemoryCabApprovalRepository.class);
            assertThat(context.getBean(PromotionGateConfig.class).getPolicies()).hasSize(5);
        });
    }

    @Test
    @DisplayName("should use JDBC stores when a JdbcTemplate exists")
    void shouldUseJdbcStores() {
        contextRunner
            .withUserConfiguration(MockJdbcConfig.class)
            .run(context -> {
                assertThat(context.getBean(AuditRepository.class)).isInstanceOf(JdbcAuditRepository.class);
                assertThat(context.getBean(CabApprovalRepository.class))
                    .isInstanceOf(JdbcCabApprovalRepository.class);
            });
    }

    @Test
    @DisplayName("should not create beans when disabled")
    void shouldNotCreateBeansWhenDisabled() {
        contextRunner
            .withPropertyValues("rollout.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(RolloutService.class);
                assertThat(context).doesNotHaveBean(ConnectorDispatcher.class);
            });
    }

    @Test
    @DisplayName("should register HTTP connectors from properties and connector beans")
    void shouldRegisterConnectors() {
        contextRunner
            .withUserConfiguration(ConnectorBeanConfig.class)
            .withPropertyValues(
                "rollout.connectors.intune.base-url=https://intune.example.com",
                "rollout.connectors.intune.token=abc",
                "rollout.connectors.intune.capabilities=publish,status,version-pin")
            .run(context -> {
                ConnectorRegistry registry = context.getBean(ConnectorRegistry.class);
                assertThat(registry.names()).containsExactlyInAnyOrder("intune", "sccm");
                assertThat(registry.get("intune")).isInstanceOf(HttpConnector.class);
                assertThat(registry.get("intune").capabilities())
                    .containsExactlyInAnyOrder(ConnectorCapability.PUBLISH, ConnectorCapability.STATUS,
                        ConnectorCapability.VERSION_PIN);
            });
    }

    @Test
    @DisplayName("should fail when a configured connector has no credentials")
    void shouldFailWithoutCredentials() {
        contextRunner
            .withPropertyValues("rollout.connectors.jamf.base-url=https://jamf.example.com")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("should use custom ObjectMapper if provided")
    void shouldUseCustomObjectMapperIfProvided() {
        contextRunner
            .withUserConfiguration(CustomObjectMapperConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(ObjectMapper.class);
                assertThat(context.getBean(ObjectMapper.class)).isSameAs(CustomObjectMapperConfig.CUSTOM_MAPPER);
            });
    }

    @Test
    @DisplayName("should expose the REST API only in servlet web applications")
    void shouldCreateApiInWebApplications() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(RolloutController.class));

        new WebApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RolloutAutoConfiguration.class))
            .withPropertyValues("rollout.api.tokens.s3cret=release-bot")
            .run(context -> {
                assertThat(context).hasSingleBean(RolloutController.class);
                assertThat(context).hasSingleBean(BearerTokenInterceptor.class);
            });
    }

    @Configuration
    static class MockJdbcConfig {
        @Bean
        public JdbcTemplate jdbcTemplate() {
            return mock(JdbcTemplate.class);
        }
    }

    @Configuration
    static class ConnectorBeanConfig {
        @Bean
        public FakeConnector sccmConnector() {
            return new FakeConnector("sccm");
        }
    }

    @Configuration
    static class CustomObjectMapperConfig {
        static final ObjectMapper CUSTOM_MAPPER = new ObjectMapper();

        @Bean
        public ObjectMapper customObjectMapper() {
            return CUSTOM_MAPPER;
        }
    }
}
