package com.ivamare.rollout.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of logical operation a correlation ID belongs to. The prefix is the
 * first segment of the textual ID, e.g. {@code deployment-<uuid>}.
 */
public enum CorrelationIdType {
    DEPLOYMENT("deployment"),
    CAB("cab"),
    EVIDENCE("evidence"),
    ROLLBACK("rollback"),
    PROMOTION("promotion");

    private final String prefix;

    CorrelationIdType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Resolve a type from its textual prefix.
     *
     * @param prefix the prefix (case-sensitive)
     * @return the matching type, or empty if unknown
     */
    public static Optional<CorrelationIdType> fromPrefix(String prefix) {
        return Arrays.stream(values())
            .filter(t -> t.prefix.equals(prefix))
            .findFirst();
    }
}
