package com.ivamare.rollout.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a validator pass. Validators collect every violated constraint
 * rather than stopping at the first.
 *
 * @param valid Whether no errors were found
 * @param errors Named errors, each {@code CODE: detail}
 */
public record ValidationResult(
    boolean valid,
    List<String> errors
) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors.isEmpty(), errors);
    }

    /**
     * Combine two results; valid only if both are.
     */
    public ValidationResult and(ValidationResult other) {
        List<String> merged = new ArrayList<>(errors);
        merged.addAll(other.errors);
        return of(merged);
    }

    public boolean hasErrorCode(String code) {
        return errors.stream().anyMatch(e -> e.equals(code) || e.startsWith(code + ":"));
    }
}
