package com.ivamare.rollout.model;

/**
 * Standard audit event types.
 */
public final class AuditEventType {
    private AuditEventType() {}

    /** Deployment intent accepted for processing */
    public static final String DEPLOYMENT_SUBMITTED = "DEPLOYMENT_SUBMITTED";

    /** Risk score computed */
    public static final String RISK_ASSESSED = "RISK_ASSESSED";

    /** Evidence pack validated (payload carries the result) */
    public static final String EVIDENCE_VALIDATED = "EVIDENCE_VALIDATED";

    /** Governance rejection: scope, CAB or evidence violation */
    public static final String POLICY_VIOLATION = "POLICY_VIOLATION";

    /** Outcome of one connector publish/remove call */
    public static final String CONNECTOR_RESULT = "CONNECTOR_RESULT";

    /** A timed-out connector call finished after its failure was recorded */
    public static final String CONNECTOR_LATE_RESULT = "CONNECTOR_LATE_RESULT";

    /** Connector call scheduled for retry after a transient failure */
    public static final String RETRY_SCHEDULED = "RETRY_SCHEDULED";

    /** Intent dispatched to a ring */
    public static final String DEPLOYMENT_DISPATCHED = "DEPLOYMENT_DISPATCHED";

    /** Final outcome of a deployment submission */
    public static final String DEPLOYMENT_OUTCOME = "DEPLOYMENT_OUTCOME";

    /** Promotion gates evaluated */
    public static final String PROMOTION_EVALUATED = "PROMOTION_EVALUATED";

    /** Promotion dispatch failed; a later promote retries under the next attempt key */
    public static final String PROMOTION_FAILED = "PROMOTION_FAILED";

    /** Deployment advanced to the next ring */
    public static final String RING_ADVANCED = "RING_ADVANCED";

    /** CAB decision recorded */
    public static final String CAB_DECISION_RECORDED = "CAB_DECISION_RECORDED";

    /** Rollback started */
    public static final String ROLLBACK_INITIATED = "ROLLBACK_INITIATED";

    /** One reconciliation poll of a rollback */
    public static final String ROLLBACK_RECONCILED = "ROLLBACK_RECONCILED";

    /** Rollback re-dispatched to the still-failing subset */
    public static final String ROLLBACK_REDISPATCHED = "ROLLBACK_REDISPATCHED";

    /** Rollback finished (converged, partial, escalated or cancelled) */
    public static final String ROLLBACK_COMPLETED = "ROLLBACK_COMPLETED";

    /** Rollback handed over to manual intervention */
    public static final String ROLLBACK_ESCALATED = "ROLLBACK_ESCALATED";
}
