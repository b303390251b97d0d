package com.ivamare.rollout.policy;

import com.ivamare.rollout.exception.ConnectorCallException;
import com.ivamare.rollout.exception.PolicyViolationException;
import com.ivamare.rollout.exception.RetryExhaustedException;
import com.ivamare.rollout.model.ErrorClassification;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Classifies connector failures into the transient / permanent /
 * policy_violation taxonomy.
 *
 * <p>Transient conditions:
 * <ul>
 *   <li>HTTP 408, 429, 500, 502, 503, 504 and any other 5xx</li>
 *   <li>Call timeouts, connection refused or reset</li>
 *   <li>Spring {@link ResourceAccessException} (I/O failure before a response)</li>
 * </ul>
 *
 * <p>Policy violations are HTTP 403 responses that carry an approval,
 * compliance or scope-breach signal, either in the {@value #POLICY_HEADER}
 * header or as a whole token in the response body ({@code approval_required},
 * {@code compliance_violation}, ...). A 403 without such a signal is
 * permanent, as are 400, 401, 404 and 409. OAuth authorization errors such
 * as {@code insufficient_scope} carry no signal and stay permanent.
 */
public class ErrorClassifier {

    /** Response header a backend sets to flag a governance rejection */
    public static final String POLICY_HEADER = "X-Policy-Violation";

    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 429, 500, 502, 503, 504);

    private static final int CONFLICT = 409;

    private static final List<String> DEFAULT_POLICY_SIGNALS = List.of(
        "approval_required",
        "cab",
        "cab_required",
        "cab_approval_required",
        "compliance_violation",
        "policy_violation",
        "scope_violation",
        "out_of_scope"
    );

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^a-z0-9_]+");

    /**
     * Message patterns that indicate transient network conditions.
     * These are checked case-insensitively against exception messages.
     */
    private static final String[] TRANSIENT_MESSAGE_PATTERNS = {
        "connection refused",
        "connection reset",
        "connection timed out",
        "socket timeout",
        "read timed out",
        "connect timed out",
        "connection closed",
        "connection was aborted",
        "broken pipe",
        "network is unreachable",
        "host is unreachable",
        "no route to host",
        "service unavailable",
        "too many requests",
        "rate limit"
    };

    private final Set<String> policySignals;

    public ErrorClassifier() {
        this(DEFAULT_POLICY_SIGNALS);
    }

    /**
     * @param policySignals Lower-case tokens that mark a 403 body as a governance rejection
     */
    public ErrorClassifier(List<String> policySignals) {
        this.policySignals = Set.copyOf(policySignals);
    }

    /**
     * Classify a failure.
     *
     * <p>Checks, in order: explicitly classified connector exceptions,
     * governance exceptions, HTTP responses, I/O and timeout types, message
     * patterns, then the wrapped cause (recursive).
     *
     * @param ex the failure
     * @return its classification; PERMANENT when nothing marks it otherwise
     */
    public ErrorClassification classify(Throwable ex) {
        if (ex == null) {
            return ErrorClassification.PERMANENT;
        }

        if (ex instanceof ConnectorCallException callEx) {
            return callEx.getClassification();
        }
        if (ex instanceof PolicyViolationException) {
            return ErrorClassification.POLICY_VIOLATION;
        }
        if (ex instanceof RetryExhaustedException) {
            return ErrorClassification.TRANSIENT;
        }
        if (ex instanceof RestClientResponseException responseEx) {
            return classifyHttpStatus(
                responseEx.getStatusCode().value(),
                responseEx.getResponseBodyAsString(),
                responseEx.getResponseHeaders()
            );
        }

        // Check subclasses before parent classes to ensure all branches are reachable
        if (ex instanceof ResourceAccessException) {
            return ErrorClassification.TRANSIENT;
        }
        if (ex instanceof SocketTimeoutException
                || ex instanceof HttpTimeoutException
                || ex instanceof TimeoutException
                || ex instanceof ConnectException
                || ex instanceof SocketException) {
            return ErrorClassification.TRANSIENT;
        }

        if (matchesTransientPattern(ex.getMessage())) {
            return ErrorClassification.TRANSIENT;
        }

        Throwable cause = ex.getCause();
        if (cause != null && cause != ex) {
            return classify(cause);
        }

        return ErrorClassification.PERMANENT;
    }

    /**
     * Classify an HTTP error response.
     *
     * @param status HTTP status code
     * @param body Response body (nullable)
     * @param headers Response headers (nullable)
     * @return the classification
     */
    public ErrorClassification classifyHttpStatus(int status, String body, HttpHeaders headers) {
        if (TRANSIENT_STATUSES.contains(status) || status >= 500) {
            return ErrorClassification.TRANSIENT;
        }
        if (status == 403 && hasPolicySignal(body, headers)) {
            return ErrorClassification.POLICY_VIOLATION;
        }
        return ErrorClassification.PERMANENT;
    }

    /**
     * Determine if the failure is the backend rejecting a call as a duplicate
     * of one it already executed (HTTP 409). For publish and remove this is
     * treated as success.
     *
     * @param ex the failure
     * @return true for duplicate rejections
     */
    public boolean isDuplicate(Throwable ex) {
        if (ex == null) {
            return false;
        }
        if (ex instanceof ConnectorCallException callEx) {
            Integer status = callEx.getHttpStatus();
            return status != null && status == CONFLICT;
        }
        if (ex instanceof RestClientResponseException responseEx) {
            return responseEx.getStatusCode().value() == CONFLICT;
        }
        Throwable cause = ex.getCause();
        return cause != null && cause != ex && isDuplicate(cause);
    }

    /**
     * Get a brief description of why the failure was classified as it was.
     * Useful for logging and audit payloads.
     *
     * @param ex the failure
     * @return a short reason
     */
    public String getReason(Throwable ex) {
        if (ex == null) {
            return "Unknown";
        }
        if (ex instanceof ConnectorCallException callEx) {
            return callEx.getHttpStatus() != null
                ? "HTTP " + callEx.getHttpStatus()
                : "Connector " + callEx.getClassification();
        }
        if (ex instanceof RestClientResponseException responseEx) {
            return "HTTP " + responseEx.getStatusCode().value();
        }
        if (ex instanceof TimeoutException || ex instanceof SocketTimeoutException
                || ex instanceof HttpTimeoutException) {
            return "Timeout";
        }
        if (ex instanceof ResourceAccessException || ex instanceof ConnectException
                || ex instanceof SocketException) {
            return "I/O " + ex.getClass().getSimpleName();
        }
        String message = ex.getMessage();
        if (message != null) {
            String lower = message.toLowerCase(Locale.ROOT);
            for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
                if (lower.contains(pattern)) {
                    return "Message pattern: " + pattern;
                }
            }
        }
        Throwable cause = ex.getCause();
        if (cause != null && cause != ex) {
            String causeReason = getReason(cause);
            if (!"Unknown".equals(causeReason)) {
                return causeReason;
            }
        }
        return ex.getClass().getSimpleName();
    }

    private boolean hasPolicySignal(String body, HttpHeaders headers) {
        if (headers != null && headers.containsKey(POLICY_HEADER)) {
            return true;
        }
        if (body == null || body.isBlank()) {
            return false;
        }
        return TOKEN_SEPARATOR.splitAsStream(body.toLowerCase(Locale.ROOT))
            .anyMatch(policySignals::contains);
    }

    private static boolean matchesTransientPattern(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
