package com.ivamare.rollout.connector.http;

import java.util.Objects;

/**
 * Fixed, pre-provisioned API token.
 */
public class StaticTokenProvider implements TokenProvider {

    private final String token;

    public StaticTokenProvider(String token) {
        this.token = Objects.requireNonNull(token, "token");
    }

    @Override
    public String getToken() {
        return token;
    }
}
