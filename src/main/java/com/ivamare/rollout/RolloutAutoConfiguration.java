package com.ivamare.rollout;

import com.ivamare.rollout.api.ApiExceptionHandler;
import com.ivamare.rollout.api.BearerTokenInterceptor;
import com.ivamare.rollout.api.RequestNormalizer;
import com.ivamare.rollout.api.RolloutController;
import com.ivamare.rollout.api.WebConfiguration;
import com.ivamare.rollout.audit.AuditExporter;
import com.ivamare.rollout.connector.Connector;
import com.ivamare.rollout.connector.ConnectorDispatcher;
import com.ivamare.rollout.connector.ConnectorRateLimiter;
import com.ivamare.rollout.connector.ConnectorRegistry;
import com.ivamare.rollout.connector.http.ClientCredentialsTokenProvider;
import com.ivamare.rollout.connector.http.HttpConnector;
import com.ivamare.rollout.connector.http.StaticTokenProvider;
import com.ivamare.rollout.connector.http.TokenProvider;
import com.ivamare.rollout.evidence.EvidencePackValidator;
import com.ivamare.rollout.governance.ApplicationEventGovernanceNotifier;
import com.ivamare.rollout.governance.GovernanceNotifier;
import com.ivamare.rollout.model.TargetScope;
import com.ivamare.rollout.policy.ErrorClassifier;
import com.ivamare.rollout.policy.RetryExecutor;
import com.ivamare.rollout.policy.RetryPolicy;
import com.ivamare.rollout.policy.Sleeper;
import com.ivamare.rollout.promotion.PromotionGateConfig;
import com.ivamare.rollout.promotion.PromotionGateEvaluator;
import com.ivamare.rollout.promotion.PromotionService;
import com.ivamare.rollout.repository.AuditRepository;
import com.ivamare.rollout.repository.CabApprovalRepository;
import com.ivamare.rollout.repository.DeploymentHistory;
import com.ivamare.rollout.repository.impl.InMemoryAuditRepository;
import com.ivamare.rollout.repository.impl.InMemoryCabApprovalRepository;
import com.ivamare.rollout.repository.impl.JdbcAuditRepository;
import com.ivamare.rollout.repository.impl.JdbcCabApprovalRepository;
import com.ivamare.rollout.risk.RiskFactorExtractor;
import com.ivamare.rollout.risk.RiskModelProvider;
import com.ivamare.rollout.risk.RiskScoringEngine;
import com.ivamare.rollout.rollback.RollbackOrchestrator;
import com.ivamare.rollout.scope.CabApprovalValidator;
import com.ivamare.rollout.scope.PropertiesScopeDirectory;
import com.ivamare.rollout.scope.ScopeDirectory;
import com.ivamare.rollout.scope.ScopeValidator;
import com.ivamare.rollout.service.RolloutService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.autoconfigure.web.client.RestClientAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.client.RestClient;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Auto-configuration for the rollout control plane.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Audit and CAB stores (JDBC when a {@link JdbcTemplate} exists, in-memory otherwise)</li>
 *   <li>Risk scoring, scope, CAB and evidence validation</li>
 *   <li>HTTP connectors from {@code rollout.connectors}, plus any {@link Connector} beans</li>
 *   <li>Connector dispatch with retry, rate limiting and call timeouts</li>
 *   <li>Promotion, rollback and the {@link RolloutService} facade</li>
 *   <li>The REST API for servlet web applications</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * rollout.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    JacksonAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    RestClientAutoConfiguration.class
})
@ConditionalOnProperty(prefix = "rollout", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RolloutProperties.class)
public class RolloutAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RolloutAutoConfiguration.class);

    /**
     * Longest a connector call waits for a concurrency permit or a rate-limit token.
     */
    static final Duration RATE_LIMIT_WAIT = Duration.ofSeconds(10);

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper rolloutObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock rolloutClock() {
        return Clock.systemUTC();
    }

    // --- Stores ---

    @Bean
    @ConditionalOnMissingBean
    public AuditRepository auditRepository(ObjectProvider<JdbcTemplate> jdbcTemplate, ObjectMapper objectMapper,
                                           Clock clock) {
        JdbcTemplate jdbc = jdbcTemplate.getIfAvailable();
        if (jdbc == null) {
            log.warn("No JdbcTemplate available, audit log and idempotency keys are kept in memory");
            return new InMemoryAuditRepository(clock);
        }
        return new JdbcAuditRepository(jdbc, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public CabApprovalRepository cabApprovalRepository(ObjectProvider<JdbcTemplate> jdbcTemplate,
                                                       ObjectMapper objectMapper) {
        JdbcTemplate jdbc = jdbcTemplate.getIfAvailable();
        return jdbc != null ? new JdbcCabApprovalRepository(jdbc, objectMapper) : new InMemoryCabApprovalRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeploymentHistory deploymentHistory(AuditRepository auditRepository, ObjectMapper objectMapper) {
        return new DeploymentHistory(auditRepository, objectMapper);
    }

    // --- Risk ---

    @Bean
    @ConditionalOnMissingBean
    public RiskModelProvider riskModelProvider(RolloutProperties properties) {
        return new RiskModelProvider(properties.getRiskModel().toModel());
    }

    @Bean
    @ConditionalOnMissingBean
    public RiskScoringEngine riskScoringEngine(RiskModelProvider riskModelProvider, RolloutProperties properties) {
        return new RiskScoringEngine(riskModelProvider,
            properties.getApprovalTiers().getAutoApproveMax(),
            properties.getApprovalTiers().getManualReviewMax());
    }

    @Bean
    @ConditionalOnMissingBean
    public RiskFactorExtractor riskFactorExtractor() {
        return new RiskFactorExtractor();
    }

    // --- Governance validators ---

    @Bean
    @ConditionalOnMissingBean
    public ScopeDirectory scopeDirectory(RolloutProperties properties) {
        Map<String, TargetScope> publishers = new LinkedHashMap<>();
        properties.getScopes().getPublishers().forEach((id, entry) -> publishers.put(id, entry.toScope()));
        Map<String, TargetScope> apps = new LinkedHashMap<>();
        properties.getScopes().getApps().forEach((id, entry) -> apps.put(id, entry.toScope()));
        return new PropertiesScopeDirectory(publishers, apps);
    }

    @Bean
    @ConditionalOnMissingBean
    public CabApprovalValidator cabApprovalValidator(CabApprovalRepository cabApprovalRepository, Clock clock) {
        return new CabApprovalValidator(cabApprovalRepository, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScopeValidator scopeValidator(ScopeDirectory scopeDirectory, CabApprovalValidator cabApprovalValidator) {
        return new ScopeValidator(scopeDirectory, cabApprovalValidator);
    }

    @Bean
    @ConditionalOnMissingBean
    public EvidencePackValidator evidencePackValidator(RolloutProperties properties) {
        return new EvidencePackValidator(properties.getEvidence().getRequiredFields());
    }

    @Bean
    @ConditionalOnMissingBean
    public GovernanceNotifier governanceNotifier(ApplicationEventPublisher publisher) {
        return new ApplicationEventGovernanceNotifier(publisher);
    }

    // --- Retry Policy ---

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(RolloutProperties properties) {
        RolloutProperties.RetryProperties retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMaxDelay());
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier() {
        return new ErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor(RetryPolicy retryPolicy, ErrorClassifier errorClassifier) {
        return new RetryExecutor(retryPolicy, errorClassifier);
    }

    // --- Connectors ---

    @Bean
    @ConditionalOnMissingBean
    public ConnectorRegistry connectorRegistry(RolloutProperties properties,
                                               ObjectProvider<Connector> connectorBeans,
                                               ObjectProvider<RestClient.Builder> restClientBuilder,
                                               Clock clock) {
        List<Connector> connectors = new ArrayList<>();
        connectorBeans.orderedStream().forEach(connectors::add);
        properties.getConnectors().forEach((name, config) ->
            connectors.add(httpConnector(name, config, restClientBuilder, clock)));
        log.info("Registered connectors: {}", connectors.stream().map(Connector::name).toList());
        return new ConnectorRegistry(connectors);
    }

    private static HttpConnector httpConnector(String name, RolloutProperties.ConnectorProperties config,
                                               ObjectProvider<RestClient.Builder> restClientBuilder,
                                               Clock clock) {
        if (config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
            throw new IllegalStateException("rollout.connectors." + name + ".base-url is required");
        }
        TokenProvider tokenProvider;
        RolloutProperties.OAuthProperties oauth = config.getOauth();
        if (oauth.isConfigured()) {
            tokenProvider = new ClientCredentialsTokenProvider(name,
                restClientBuilder.getIfAvailable(RestClient::builder).build(),
                oauth.getTokenUrl(), oauth.getClientId(), oauth.getClientSecret(), oauth.getScope(), clock);
        } else if (config.getToken() != null) {
            tokenProvider = new StaticTokenProvider(config.getToken());
        } else {
            throw new IllegalStateException("rollout.connectors." + name + " needs token or oauth.token-url");
        }
        RestClient restClient = restClientBuilder.getIfAvailable(RestClient::builder)
            .baseUrl(config.getBaseUrl())
            .build();
        return new HttpConnector(name, config.getCapabilities(), restClient, tokenProvider);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectorRateLimiter connectorRateLimiter(RolloutProperties properties) {
        return new ConnectorRateLimiter(name -> {
            RolloutProperties.ConnectorProperties config = properties.getConnectorConfig(name);
            return new ConnectorRateLimiter.Limits(config.getMaxConcurrency(), config.getRequestsPerSecond());
        }, RATE_LIMIT_WAIT);
    }

    @Bean(name = "rolloutExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "rolloutExecutor")
    public ExecutorService rolloutExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "rollout-connector-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectorDispatcher connectorDispatcher(
            ConnectorRegistry connectorRegistry,
            AuditRepository auditRepository,
            RetryExecutor retryExecutor,
            ConnectorRateLimiter connectorRateLimiter,
            GovernanceNotifier governanceNotifier,
            @Qualifier("rolloutExecutor") ExecutorService rolloutExecutor,
            RolloutProperties properties,
            ObjectMapper objectMapper) {
        return new ConnectorDispatcher(
            connectorRegistry,
            auditRepository,
            retryExecutor,
            connectorRateLimiter,
            governanceNotifier,
            rolloutExecutor,
            name -> properties.getConnectorConfig(name).getCallTimeout(),
            objectMapper
        );
    }

    // --- Promotion and rollback ---

    @Bean
    @ConditionalOnMissingBean
    public PromotionGateConfig promotionGateConfig(RolloutProperties properties) {
        return properties.toGateConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public PromotionGateEvaluator promotionGateEvaluator(PromotionGateConfig promotionGateConfig,
                                                         CabApprovalValidator cabApprovalValidator) {
        return new PromotionGateEvaluator(promotionGateConfig, cabApprovalValidator);
    }

    @Bean
    @ConditionalOnMissingBean
    public PromotionService promotionService(
            DeploymentHistory deploymentHistory,
            AuditRepository auditRepository,
            PromotionGateEvaluator promotionGateEvaluator,
            RiskScoringEngine riskScoringEngine,
            RiskFactorExtractor riskFactorExtractor,
            EvidencePackValidator evidencePackValidator,
            ConnectorDispatcher connectorDispatcher,
            GovernanceNotifier governanceNotifier) {
        return new PromotionService(
            deploymentHistory,
            auditRepository,
            promotionGateEvaluator,
            riskScoringEngine,
            riskFactorExtractor,
            evidencePackValidator,
            connectorDispatcher,
            governanceNotifier
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public RollbackOrchestrator rollbackOrchestrator(
            DeploymentHistory deploymentHistory,
            AuditRepository auditRepository,
            ConnectorDispatcher connectorDispatcher,
            ObjectMapper objectMapper,
            RolloutProperties properties) {
        RolloutProperties.RollbackProperties rollback = properties.getRollback();
        return new RollbackOrchestrator(
            deploymentHistory,
            auditRepository,
            connectorDispatcher,
            Sleeper.threadSleep(),
            objectMapper,
            rollback.getPollInterval(),
            rollback.getReconcileTimeout(),
            rollback.getMaxRedispatches()
        );
    }

    // --- Audit export and facade ---

    @Bean
    @ConditionalOnMissingBean
    public AuditExporter auditExporter(ObjectMapper objectMapper) {
        return new AuditExporter(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public RolloutService rolloutService(
            AuditRepository auditRepository,
            DeploymentHistory deploymentHistory,
            RiskScoringEngine riskScoringEngine,
            RiskFactorExtractor riskFactorExtractor,
            ScopeValidator scopeValidator,
            CabApprovalValidator cabApprovalValidator,
            CabApprovalRepository cabApprovalRepository,
            EvidencePackValidator evidencePackValidator,
            PromotionGateConfig promotionGateConfig,
            PromotionService promotionService,
            RollbackOrchestrator rollbackOrchestrator,
            ConnectorDispatcher connectorDispatcher,
            GovernanceNotifier governanceNotifier,
            AuditExporter auditExporter,
            ObjectMapper objectMapper,
            Clock clock) {
        return new RolloutService(
            auditRepository,
            deploymentHistory,
            riskScoringEngine,
            riskFactorExtractor,
            scopeValidator,
            cabApprovalValidator,
            cabApprovalRepository,
            evidencePackValidator,
            promotionGateConfig,
            promotionService,
            rollbackOrchestrator,
            connectorDispatcher,
            governanceNotifier,
            auditExporter,
            objectMapper,
            clock
        );
    }

    // --- REST API ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(WebMvcConfigurer.class)
    static class RolloutWebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RequestNormalizer requestNormalizer() {
            return new RequestNormalizer();
        }

        @Bean
        @ConditionalOnMissingBean
        public BearerTokenInterceptor bearerTokenInterceptor(RolloutProperties properties) {
            return new BearerTokenInterceptor(properties.getApi().getTokens(),
                properties.getApi().isAllowAnonymous());
        }

        @Bean
        public WebConfiguration rolloutWebMvcConfiguration(BearerTokenInterceptor bearerTokenInterceptor) {
            return new WebConfiguration(bearerTokenInterceptor);
        }

        @Bean
        @ConditionalOnMissingBean
        public RolloutController rolloutController(RolloutService rolloutService,
                                                   RequestNormalizer requestNormalizer) {
            return new RolloutController(rolloutService, requestNormalizer);
        }

        @Bean
        @ConditionalOnMissingBean
        public ApiExceptionHandler rolloutApiExceptionHandler() {
            return new ApiExceptionHandler();
        }
    }
}
