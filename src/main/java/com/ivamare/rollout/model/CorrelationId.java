package com.ivamare.rollout.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ivamare.rollout.exception.InvalidCorrelationIdException;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Idempotency and audit key for one logical operation.
 *
 * <p>Textual form is {@code <prefix>-<uuid>}. The UUID is accepted in either
 * case and always rendered in lower case. IDs are immutable and never
 * reused across distinct operations. Equality is defined on the textual form
 * only; {@code issuedAt} is informational.
 *
 * @param type Kind of operation the ID belongs to
 * @param id Random component
 * @param issuedAt When the ID was generated; null when parsed from external input
 */
public record CorrelationId(
    CorrelationIdType type,
    UUID id,
    Instant issuedAt
) {

    private static final Pattern FORMAT = Pattern.compile(
        "^([a-z]+)-([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})$");

    public CorrelationId {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
    }

    /**
     * Generate a fresh correlation ID.
     *
     * @param type The operation kind
     * @return New ID stamped with the current time
     */
    public static CorrelationId generate(CorrelationIdType type) {
        return new CorrelationId(type, UUID.randomUUID(), Instant.now());
    }

    /**
     * Parse and validate a correlation ID.
     *
     * @param value Textual ID
     * @return Parsed ID
     * @throws InvalidCorrelationIdException if the value is null, has an unknown prefix or a malformed UUID
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CorrelationId parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidCorrelationIdException(value, "correlation ID is required");
        }
        Matcher matcher = FORMAT.matcher(value);
        if (!matcher.matches()) {
            throw new InvalidCorrelationIdException(value, "expected <prefix>-<uuid>");
        }
        CorrelationIdType type = CorrelationIdType.fromPrefix(matcher.group(1))
            .orElseThrow(() -> new InvalidCorrelationIdException(value, "unknown prefix " + matcher.group(1)));
        return new CorrelationId(type, UUID.fromString(matcher.group(2)), null);
    }

    /**
     * Parse a correlation ID and require a specific type.
     *
     * @param value Textual ID
     * @param expected Required type
     * @return Parsed ID
     * @throws InvalidCorrelationIdException if malformed or of another type
     */
    public static CorrelationId parse(String value, CorrelationIdType expected) {
        CorrelationId parsed = parse(value);
        parsed.requireType(expected);
        return parsed;
    }

    /**
     * Ensure this ID is of the expected type.
     *
     * @throws InvalidCorrelationIdException on mismatch
     */
    public CorrelationId requireType(CorrelationIdType expected) {
        if (type != expected) {
            throw new InvalidCorrelationIdException(value(),
                "expected prefix " + expected.prefix() + " but was " + type.prefix());
        }
        return this;
    }

    @JsonValue
    public String value() {
        return type.prefix() + "-" + id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorrelationId other)) return false;
        return type == other.type && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id);
    }

    @Override
    public String toString() {
        return value();
    }
}
