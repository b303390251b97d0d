package com.ivamare.rollout.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Second half of the idempotency key: the operation type plus optional
 * qualifiers, rendered as {@code TYPE[:q1[:q2...]]}.
 *
 * <p>Two distinct operations sharing one correlation ID (a publish and a
 * later rollback, or publishes to two rings) therefore never collapse.
 *
 * @param type Operation type
 * @param qualifiers Ordered qualifiers (ring, connector, resource, attempt)
 */
public record OperationKey(
    OperationType type,
    List<String> qualifiers
) {

    public OperationKey {
        Objects.requireNonNull(type, "type");
        qualifiers = List.copyOf(qualifiers);
        for (String qualifier : qualifiers) {
            if (qualifier == null || qualifier.isBlank() || qualifier.contains(":")) {
                throw new IllegalArgumentException("Invalid operation key qualifier: " + qualifier);
            }
        }
    }

    public static OperationKey of(OperationType type, String... qualifiers) {
        return new OperationKey(type, Arrays.asList(qualifiers));
    }

    public String value() {
        return Stream.concat(Stream.of(type.name()), qualifiers.stream())
            .collect(Collectors.joining(":"));
    }

    @Override
    public String toString() {
        return value();
    }
}
