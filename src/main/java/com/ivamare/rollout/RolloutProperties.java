package com.ivamare.rollout;

import com.ivamare.rollout.connector.ConnectorCapability;
import com.ivamare.rollout.evidence.EvidencePack;
import com.ivamare.rollout.model.Ring;
import com.ivamare.rollout.model.TargetScope;
import com.ivamare.rollout.promotion.PromotionGateConfig;
import com.ivamare.rollout.promotion.RingPolicy;
import com.ivamare.rollout.risk.RiskModel;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the rollout control plane.
 *
 * <p>Example configuration:
 * <pre>
 * rollout:
 *   enabled: true
 *   retry:
 *     max-attempts: 5
 *     base-delay: 500ms
 *     max-delay: 30s
 *   risk-model:
 *     version: v1.0
 *     weights:
 *       blast_radius: 0.20
 *   rings:
 *     - ring: lab
 *       success-rate-threshold: 0.95
 *       time-to-compliance:
 *         online-hours: 24
 *       rollback-validation-required: true
 *   connectors:
 *     intune:
 *       base-url: https://intune-gateway.example.com
 *       oauth:
 *         token-url: https://login.example.com/oauth2/token
 *         client-id: rollout
 *         client-secret: ${INTUNE_SECRET}
 *       capabilities: [publish, remove, status, health, version-pin]
 *       max-concurrency: 4
 *       requests-per-second: 10
 *   api:
 *     tokens:
 *       s3cr3t: release-manager
 * </pre>
 */
@ConfigurationProperties(prefix = "rollout")
public class RolloutProperties {

    /**
     * Enable/disable rollout auto-configuration.
     */
    private boolean enabled = true;

    private RetryProperties retry = new RetryProperties();

    private RiskModelProperties riskModel = new RiskModelProperties();

    private ApprovalTierProperties approvalTiers = new ApprovalTierProperties();

    /**
     * Ring policies in promotion order. Empty means the built-in Lab to Global table.
     */
    private List<RingProperties> rings = new ArrayList<>();

    private EvidenceProperties evidence = new EvidenceProperties();

    /**
     * Connectors by name.
     */
    private Map<String, ConnectorProperties> connectors = new LinkedHashMap<>();

    private RollbackProperties rollback = new RollbackProperties();

    private ScopeProperties scopes = new ScopeProperties();

    private ApiProperties api = new ApiProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public RiskModelProperties getRiskModel() {
        return riskModel;
    }

    public void setRiskModel(RiskModelProperties riskModel) {
        this.riskModel = riskModel;
    }

    public ApprovalTierProperties getApprovalTiers() {
        return approvalTiers;
    }

    public void setApprovalTiers(ApprovalTierProperties approvalTiers) {
        this.approvalTiers = approvalTiers;
    }

    public List<RingProperties> getRings() {
        return rings;
    }

    public void setRings(List<RingProperties> rings) {
        this.rings = rings;
    }

    public EvidenceProperties getEvidence() {
        return evidence;
    }

    public void setEvidence(EvidenceProperties evidence) {
        this.evidence = evidence;
    }

    public Map<String, ConnectorProperties> getConnectors() {
        return connectors;
    }

    public void setConnectors(Map<String, ConnectorProperties> connectors) {
        this.connectors = connectors;
    }

    public RollbackProperties getRollback() {
        return rollback;
    }

    public void setRollback(RollbackProperties rollback) {
        this.rollback = rollback;
    }

    public ScopeProperties getScopes() {
        return scopes;
    }

    public void setScopes(ScopeProperties scopes) {
        this.scopes = scopes;
    }

    public ApiProperties getApi() {
        return api;
    }

    public void setApi(ApiProperties api) {
        this.api = api;
    }

    /**
     * Get connector configuration, returning defaults if not explicitly configured.
     *
     * @param name connector name
     * @return connector configuration (never null)
     */
    public ConnectorProperties getConnectorConfig(String name) {
        return connectors.getOrDefault(name, new ConnectorProperties());
    }

    /**
     * Build the ring table, falling back to the defaults when none is configured.
     */
    public PromotionGateConfig toGateConfig() {
        if (rings.isEmpty()) {
            return PromotionGateConfig.defaults();
        }
        return new PromotionGateConfig(rings.stream().map(RingProperties::toPolicy).toList());
    }

    /**
     * Retry-with-backoff settings for connector calls.
     */
    public static class RetryProperties {

        private int maxAttempts = 5;

        private Duration baseDelay = Duration.ofMillis(500);

        private Duration maxDelay = Duration.ofSeconds(30);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    /**
     * Risk model. Without weights the built-in model is used.
     */
    public static class RiskModelProperties {

        private String version = "v1.0";

        private Map<String, Double> weights = new LinkedHashMap<>();

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public Map<String, Double> getWeights() {
            return weights;
        }

        public void setWeights(Map<String, Double> weights) {
            this.weights = weights;
        }

        public RiskModel toModel() {
            if (weights.isEmpty()) {
                return RiskModel.defaultModel();
            }
            return new RiskModel(version, weights);
        }
    }

    /**
     * Score bounds of the approval tiers.
     */
    public static class ApprovalTierProperties {

        private double autoApproveMax = 50.0;

        private double manualReviewMax = 75.0;

        public double getAutoApproveMax() {
            return autoApproveMax;
        }

        public void setAutoApproveMax(double autoApproveMax) {
            this.autoApproveMax = autoApproveMax;
        }

        public double getManualReviewMax() {
            return manualReviewMax;
        }

        public void setManualReviewMax(double manualReviewMax) {
            this.manualReviewMax = manualReviewMax;
        }
    }

    /**
     * Promotion thresholds for one ring.
     */
    public static class RingProperties {

        private Ring ring;

        private double successRateThreshold = 0.95;

        private TimeToCompliance timeToCompliance = new TimeToCompliance();

        private int maxIncidents = 0;

        private boolean cabApprovalRequired = false;

        /**
         * Risk score above which CAB approval is required. Unset means always
         * when {@code cab-approval-required} is true.
         */
        private Double cabApprovalRequiredIfRiskGt;

        private boolean rollbackValidationRequired = false;

        public Ring getRing() {
            return ring;
        }

        public void setRing(Ring ring) {
            this.ring = ring;
        }

        public double getSuccessRateThreshold() {
            return successRateThreshold;
        }

        public void setSuccessRateThreshold(double successRateThreshold) {
            this.successRateThreshold = successRateThreshold;
        }

        public TimeToCompliance getTimeToCompliance() {
            return timeToCompliance;
        }

        public void setTimeToCompliance(TimeToCompliance timeToCompliance) {
            this.timeToCompliance = timeToCompliance;
        }

        public int getMaxIncidents() {
            return maxIncidents;
        }

        public void setMaxIncidents(int maxIncidents) {
            this.maxIncidents = maxIncidents;
        }

        public boolean isCabApprovalRequired() {
            return cabApprovalRequired;
        }

        public void setCabApprovalRequired(boolean cabApprovalRequired) {
            this.cabApprovalRequired = cabApprovalRequired;
        }

        public Double getCabApprovalRequiredIfRiskGt() {
            return cabApprovalRequiredIfRiskGt;
        }

        public void setCabApprovalRequiredIfRiskGt(Double cabApprovalRequiredIfRiskGt) {
            this.cabApprovalRequiredIfRiskGt = cabApprovalRequiredIfRiskGt;
        }

        public boolean isRollbackValidationRequired() {
            return rollbackValidationRequired;
        }

        public void setRollbackValidationRequired(boolean rollbackValidationRequired) {
            this.rollbackValidationRequired = rollbackValidationRequired;
        }

        public RingPolicy toPolicy() {
            return new RingPolicy(ring, successRateThreshold, timeToCompliance.getOnlineHours(), maxIncidents,
                cabApprovalRequired, cabApprovalRequiredIfRiskGt, rollbackValidationRequired);
        }
    }

    public static class TimeToCompliance {

        private double onlineHours = 24;

        public double getOnlineHours() {
            return onlineHours;
        }

        public void setOnlineHours(double onlineHours) {
            this.onlineHours = onlineHours;
        }
    }

    public static class EvidenceProperties {

        private List<String> requiredFields = new ArrayList<>(List.of(
            EvidencePack.ARTIFACT_HASH,
            EvidencePack.SIGNATURE,
            EvidencePack.SBOM_REFERENCE,
            EvidencePack.VULNERABILITY_SCAN,
            EvidencePack.ROLLBACK,
            EvidencePack.INSTALL_TESTS));

        public List<String> getRequiredFields() {
            return requiredFields;
        }

        public void setRequiredFields(List<String> requiredFields) {
            this.requiredFields = requiredFields;
        }
    }

    /**
     * One execution-plane backend speaking the generic deployment REST contract.
     */
    public static class ConnectorProperties {

        private String baseUrl;

        /**
         * Static bearer token. Ignored when {@code oauth.token-url} is set.
         */
        private String token;

        private OAuthProperties oauth = new OAuthProperties();

        private Set<ConnectorCapability> capabilities = EnumSet.of(
            ConnectorCapability.PUBLISH, ConnectorCapability.REMOVE,
            ConnectorCapability.STATUS, ConnectorCapability.HEALTH);

        private int maxConcurrency = 4;

        private int requestsPerSecond = 10;

        private Duration callTimeout = Duration.ofSeconds(30);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public OAuthProperties getOauth() {
            return oauth;
        }

        public void setOauth(OAuthProperties oauth) {
            this.oauth = oauth;
        }

        public Set<ConnectorCapability> getCapabilities() {
            return capabilities;
        }

        public void setCapabilities(Set<ConnectorCapability> capabilities) {
            this.capabilities = capabilities;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public int getRequestsPerSecond() {
            return requestsPerSecond;
        }

        public void setRequestsPerSecond(int requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
        }

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }
    }

    /**
     * OAuth2 client-credentials grant for a connector.
     */
    public static class OAuthProperties {

        private String tokenUrl;

        private String clientId;

        private String clientSecret;

        private String scope;

        public boolean isConfigured() {
            return tokenUrl != null && !tokenUrl.isBlank();
        }

        public String getTokenUrl() {
            return tokenUrl;
        }

        public void setTokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        public String getScope() {
            return scope;
        }

        public void setScope(String scope) {
            this.scope = scope;
        }
    }

    public static class RollbackProperties {

        private Duration pollInterval = Duration.ofSeconds(30);

        private Duration reconcileTimeout = Duration.ofMinutes(30);

        private int maxRedispatches = 2;

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getReconcileTimeout() {
            return reconcileTimeout;
        }

        public void setReconcileTimeout(Duration reconcileTimeout) {
            this.reconcileTimeout = reconcileTimeout;
        }

        public int getMaxRedispatches() {
            return maxRedispatches;
        }

        public void setMaxRedispatches(int maxRedispatches) {
            this.maxRedispatches = maxRedispatches;
        }
    }

    /**
     * Authorized scopes of publishers and registered scopes of apps.
     */
    public static class ScopeProperties {

        private Map<String, ScopeEntry> publishers = new LinkedHashMap<>();

        private Map<String, ScopeEntry> apps = new LinkedHashMap<>();

        public Map<String, ScopeEntry> getPublishers() {
            return publishers;
        }

        public void setPublishers(Map<String, ScopeEntry> publishers) {
            this.publishers = publishers;
        }

        public Map<String, ScopeEntry> getApps() {
            return apps;
        }

        public void setApps(Map<String, ScopeEntry> apps) {
            this.apps = apps;
        }
    }

    public static class ScopeEntry {

        private String orgUnit = TargetScope.ANY;

        private String businessUnit = TargetScope.ANY;

        private String site = TargetScope.ANY;

        public String getOrgUnit() {
            return orgUnit;
        }

        public void setOrgUnit(String orgUnit) {
            this.orgUnit = orgUnit;
        }

        public String getBusinessUnit() {
            return businessUnit;
        }

        public void setBusinessUnit(String businessUnit) {
            this.businessUnit = businessUnit;
        }

        public String getSite() {
            return site;
        }

        public void setSite(String site) {
            this.site = site;
        }

        public TargetScope toScope() {
            return new TargetScope(orgUnit, businessUnit, site);
        }
    }

    public static class ApiProperties {

        /**
         * Bearer token to actor name. With none configured every request is rejected.
         */
        private Map<String, String> tokens = new LinkedHashMap<>();

        /**
         * Accept requests without a bearer token, acting as the {@code X-Actor} header.
         * Meant for local development only.
         */
        private boolean allowAnonymous = false;

        public Map<String, String> getTokens() {
            return tokens;
        }

        public void setTokens(Map<String, String> tokens) {
            this.tokens = tokens;
        }

        public boolean isAllowAnonymous() {
            return allowAnonymous;
        }

        public void setAllowAnonymous(boolean allowAnonymous) {
            this.allowAnonymous = allowAnonymous;
        }
    }
}
