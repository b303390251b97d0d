package com.ivamare.rollout.audit;

import java.util.Locale;

/**
 * Export formats for governance review.
 */
public enum AuditExportFormat {
    JSON("application/json"),
    CSV("text/csv"),
    TABLE("text/plain");

    private final String contentType;

    AuditExportFormat(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }

    public static AuditExportFormat fromValue(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported export format: " + value, e);
        }
    }
}
