package com.ivamare.rollout.api;

import com.ivamare.rollout.exception.ConnectorCallException;
import com.ivamare.rollout.exception.ConnectorCapabilityException;
import com.ivamare.rollout.exception.DeploymentNotFoundException;
import com.ivamare.rollout.exception.InvalidCorrelationIdException;
import com.ivamare.rollout.exception.InvalidOperationException;
import com.ivamare.rollout.exception.OperationCancelledException;
import com.ivamare.rollout.exception.PolicyViolationException;
import com.ivamare.rollout.exception.RetryExhaustedException;
import com.ivamare.rollout.exception.UnsupportedConnectorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions to the machine-readable error body:
 * <pre>
 * {
 *   "error_code": "POLICY_VIOLATION",
 *   "message": "...",
 *   "timestamp": "2026-...",
 *   "errors": ["..."]
 * }
 * </pre>
 * {@code errors} is present only for policy violations.
 */
@RestControllerAdvice(assignableTypes = RolloutController.class)
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PolicyViolationException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handlePolicyViolation(PolicyViolationException ex) {
        Map<String, Object> body = errorResponse("POLICY_VIOLATION", ex.getMessage());
        body.put("correlation_id", ex.getCorrelationId());
        body.put("errors", ex.getViolations());
        return body;
    }

    @ExceptionHandler(InvalidCorrelationIdException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidCorrelationId(InvalidCorrelationIdException ex) {
        return errorResponse("INVALID_CORRELATION_ID", ex.getMessage());
    }

    @ExceptionHandler(UnsupportedConnectorException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnsupportedConnector(UnsupportedConnectorException ex) {
        return errorResponse("UNSUPPORTED_CONNECTOR", ex.getMessage());
    }

    @ExceptionHandler(ConnectorCapabilityException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleCapability(ConnectorCapabilityException ex) {
        return errorResponse("CONNECTOR_CAPABILITY_MISSING", ex.getMessage());
    }

    @ExceptionHandler(DeploymentNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(DeploymentNotFoundException ex) {
        return errorResponse("DEPLOYMENT_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidOperationException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleInvalidOperation(InvalidOperationException ex) {
        log.warn("Rejected operation: {}", ex.getMessage());
        return errorResponse("INVALID_OPERATION", ex.getMessage());
    }

    @ExceptionHandler(OperationCancelledException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleCancelled(OperationCancelledException ex) {
        return errorResponse("CANCELLED", ex.getMessage());
    }

    @ExceptionHandler({ConnectorCallException.class, RetryExhaustedException.class})
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleConnectorFailure(RuntimeException ex) {
        log.warn("Connector failure: {}", ex.getMessage());
        return errorResponse("CONNECTOR_ERROR", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
