package com.ivamare.rollout.connector.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ivamare.rollout.exception.ConnectorCallException;
import com.ivamare.rollout.model.ErrorClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * OAuth2 client-credentials token provider. Tokens are cached until shortly
 * before they expire.
 */
public class ClientCredentialsTokenProvider implements TokenProvider {

    private static final Logger log = LoggerFactory.getLogger(ClientCredentialsTokenProvider.class);

    private static final Duration REFRESH_SKEW = Duration.ofSeconds(60);
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final String connectorName;
    private final RestClient restClient;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final String scope;
    private final Clock clock;

    private String cachedToken;
    private Instant expiresAt = Instant.MIN;

    public ClientCredentialsTokenProvider(String connectorName, RestClient restClient, String tokenUrl,
                                          String clientId, String clientSecret, String scope, Clock clock) {
        this.connectorName = connectorName;
        this.restClient = restClient;
        this.tokenUrl = tokenUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.scope = scope;
        this.clock = clock;
    }

    @Override
    public synchronized String getToken() {
        if (cachedToken != null && clock.instant().isBefore(expiresAt)) {
            return cachedToken;
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);
        if (scope != null && !scope.isBlank()) {
            form.add("scope", scope);
        }

        TokenResponse response = restClient.post()
            .uri(tokenUrl)
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body(form)
            .retrieve()
            .body(TokenResponse.class);

        if (response == null || response.accessToken() == null || response.accessToken().isBlank()) {
            throw new ConnectorCallException(connectorName, ErrorClassification.PERMANENT, null,
                "token endpoint returned no access_token");
        }

        long expiresIn = response.expiresIn() != null ? response.expiresIn() : DEFAULT_EXPIRES_IN_SECONDS;
        cachedToken = response.accessToken();
        expiresAt = clock.instant().plusSeconds(expiresIn).minus(REFRESH_SKEW);
        log.debug("Fetched access token for connector {}, valid for {}s", connectorName, expiresIn);
        return cachedToken;
    }

    @Override
    public synchronized void invalidate() {
        cachedToken = null;
        expiresAt = Instant.MIN;
    }

    record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("expires_in") Long expiresIn
    ) {}
}
