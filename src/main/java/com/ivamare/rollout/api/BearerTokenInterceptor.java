package com.ivamare.rollout.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Map;

/**
 * Resolves the acting principal of an API call from its bearer token.
 *
 * <p>A request without a known token is answered with 401, including every
 * request when no tokens are configured. Only with anonymous access turned on
 * is a request that carries no {@code Authorization} header let through; its
 * actor is taken from {@value #ACTOR_HEADER}, falling back to
 * {@value #ANONYMOUS}.
 */
public class BearerTokenInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(BearerTokenInterceptor.class);

    public static final String ACTOR_ATTRIBUTE = "rollout.actor";
    public static final String ACTOR_HEADER = "X-Actor";
    public static final String ANONYMOUS = "anonymous";

    private static final String BEARER_PREFIX = "Bearer ";

    private final Map<String, String> tokenActors;
    private final boolean allowAnonymous;

    /**
     * @param tokenActors Bearer token to actor name
     * @param allowAnonymous Accept requests without an {@code Authorization} header
     */
    public BearerTokenInterceptor(Map<String, String> tokenActors, boolean allowAnonymous) {
        this.tokenActors = Map.copyOf(tokenActors);
        this.allowAnonymous = allowAnonymous;
        if (allowAnonymous) {
            log.warn("Anonymous access enabled, rollout API accepts requests without a bearer token");
        } else if (this.tokenActors.isEmpty()) {
            log.warn("No API tokens configured, every rollout API request will be rejected");
        }
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null && allowAnonymous) {
            String actor = request.getHeader(ACTOR_HEADER);
            request.setAttribute(ACTOR_ATTRIBUTE, actor != null && !actor.isBlank() ? actor : ANONYMOUS);
            return true;
        }

        String actor = null;
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            actor = tokenActors.get(header.substring(BEARER_PREFIX.length()).trim());
        }
        if (actor == null) {
            log.warn("Rejected unauthenticated {} {}", request.getMethod(), request.getRequestURI());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.getWriter().write("{\"error_code\":\"UNAUTHORIZED\",\"message\":\"a valid bearer token is required\"}");
            return false;
        }
        request.setAttribute(ACTOR_ATTRIBUTE, actor);
        return true;
    }
}
