package com.ivamare.rollout.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BearerTokenInterceptor")
class BearerTokenInterceptorTest {

    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/deployments");
    private final MockHttpServletResponse response = new MockHttpServletResponse();

    @Test
    @DisplayName("should resolve the actor of a known token")
    void shouldResolveActor() throws Exception {
        BearerTokenInterceptor interceptor = new BearerTokenInterceptor(Map.of("s3cret", "release-bot"), false);
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer s3cret");

        assertTrue(interceptor.preHandle(request, response, new Object()));
        assertEquals("release-bot", request.getAttribute(BearerTokenInterceptor.ACTOR_ATTRIBUTE));
    }

    @Test
    @DisplayName("should answer 401 for an unknown token")
    void shouldRejectUnknownToken() throws Exception {
        BearerTokenInterceptor interceptor = new BearerTokenInterceptor(Map.of("s3cret", "release-bot"), false);
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer guess");

        assertFalse(interceptor.preHandle(request, response, new Object()));
        assertEquals(401, response.getStatus());
        assertTrue(response.getContentAsString().contains("UNAUTHORIZED"));
        assertNull(request.getAttribute(BearerTokenInterceptor.ACTOR_ATTRIBUTE));
    }

    @Test
    @DisplayName("should answer 401 without an authorization header")
    void shouldRejectMissingHeader() throws Exception {
        BearerTokenInterceptor interceptor = new BearerTokenInterceptor(Map.of("s3cret", "release-bot"), false);
        request.addHeader(BearerTokenInterceptor.ACTOR_HEADER, "mallory");

        assertFalse(interceptor.preHandle(request, response, new Object()));
        assertEquals(401, response.getStatus());
    }

    @Test
    @DisplayName("should reject every request when no tokens are configured")
    void shouldRejectWhenNoTokensConfigured() throws Exception {
        BearerTokenInterceptor interceptor = new BearerTokenInterceptor(Map.of(), false);
        request.addHeader(BearerTokenInterceptor.ACTOR_HEADER, "mallory");

        assertFalse(interceptor.preHandle(request, response, new Object()));
        assertEquals(401, response.getStatus());
        assertNull(request.getAttribute(BearerTokenInterceptor.ACTOR_ATTRIBUTE));
    }

    @Test
    @DisplayName("should take the actor header when anonymous access is enabled")
    void shouldUseActorHeaderWhenAnonymousAllowed() throws Exception {
        BearerTokenInterceptor interceptor = new BearerTokenInterceptor(Map.of(), true);
        request.addHeader(BearerTokenInterceptor.ACTOR_HEADER, "alice");

        assertTrue(interceptor.preHandle(request, response, new Object()));
        assertEquals("alice", request.getAttribute(BearerTokenInterceptor.ACTOR_ATTRIBUTE));
    }

    @Test
    @DisplayName("should fall back to anonymous when no actor is given")
    void shouldFallBackToAnonymous() throws Exception {
        BearerTokenInterceptor interceptor = new BearerTokenInterceptor(Map.of(), true);

        assertTrue(interceptor.preHandle(request, response, new Object()));
        assertEquals(BearerTokenInterceptor.ANONYMOUS, request.getAttribute(BearerTokenInterceptor.ACTOR_ATTRIBUTE));
    }

    @Test
    @DisplayName("should still reject a wrong token when anonymous access is enabled")
    void shouldRejectWrongTokenWhenAnonymousAllowed() throws Exception {
        BearerTokenInterceptor interceptor = new BearerTokenInterceptor(Map.of("s3cret", "release-bot"), true);
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer guess");

        assertFalse(interceptor.preHandle(request, response, new Object()));
        assertEquals(401, response.getStatus());
    }
}
