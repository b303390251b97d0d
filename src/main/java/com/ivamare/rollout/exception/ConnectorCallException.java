package com.ivamare.rollout.exception;

import com.ivamare.rollout.model.ErrorClassification;

/**
 * Raised by connectors for a failed backend call whose classification is known
 * at the call site.
 *
 * <p>The classification drives retry: TRANSIENT is retried with backoff,
 * PERMANENT and POLICY_VIOLATION are surfaced immediately.
 */
public class ConnectorCallException extends RolloutException {

    private final String connectorName;
    private final ErrorClassification classification;
    private final Integer httpStatus;

    public ConnectorCallException(String connectorName, ErrorClassification classification,
                                  Integer httpStatus, String message) {
        this(connectorName, classification, httpStatus, message, null);
    }

    public ConnectorCallException(String connectorName, ErrorClassification classification,
                                  Integer httpStatus, String message, Throwable cause) {
        super("[" + connectorName + "/" + classification + "] " + message, cause);
        this.connectorName = connectorName;
        this.classification = classification;
        this.httpStatus = httpStatus;
    }

    public String getConnectorName() {
        return connectorName;
    }

    public ErrorClassification getClassification() {
        return classification;
    }

    /**
     * HTTP status reported by the backend, or null for non-HTTP failures.
     */
    public Integer getHttpStatus() {
        return httpStatus;
    }
}
