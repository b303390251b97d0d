package com.ivamare.rollout.connector.http;

/**
 * Supplies bearer tokens for backend calls.
 */
public interface TokenProvider {

    /**
     * @return A currently valid access token
     */
    String getToken();

    /**
     * Drop any cached token, e.g. after the backend answered 401.
     */
    default void invalidate() {
    }
}
