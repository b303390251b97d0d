package com.ivamare.rollout.scope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status of a CAB approval record. {@link #MISSING} is never stored; it is
 * reported when a lookup finds no record.
 */
public enum CabApprovalStatus {
    APPROVED,
    DENIED,
    PENDING,
    MISSING;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CabApprovalStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
