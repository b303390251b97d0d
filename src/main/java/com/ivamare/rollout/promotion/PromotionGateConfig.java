package com.ivamare.rollout.promotion;

import com.ivamare.rollout.exception.InvalidOperationException;
import com.ivamare.rollout.model.Ring;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered ring sequence with the promotion policy of each ring.
 */
public class PromotionGateConfig {

    private final List<RingPolicy> policies;
    private final Map<Ring, Integer> positions = new EnumMap<>(Ring.class);

    public PromotionGateConfig(List<RingPolicy> policies) {
        if (policies.isEmpty()) {
            throw new IllegalArgumentException("At least one ring policy is required");
        }
        this.policies = List.copyOf(policies);
        for (int i = 0; i < this.policies.size(); i++) {
            Ring ring = this.policies.get(i).ring();
            if (positions.put(ring, i) != null) {
                throw new IllegalArgumentException("Ring configured twice: " + ring);
            }
            if (i > 0 && ring.ordinal() < this.policies.get(i - 1).ring().ordinal()) {
                throw new IllegalArgumentException("Rings must be configured in promotion order: " + ring);
            }
        }
    }

    /**
     * Lab to Global with the default thresholds.
     */
    public static PromotionGateConfig defaults() {
        return new PromotionGateConfig(List.of(
            new RingPolicy(Ring.LAB, 0.95, 24, 0, false, null, true),
            new RingPolicy(Ring.CANARY, 0.98, 24, 0, true, 50.0, false),
            new RingPolicy(Ring.PILOT, 0.97, 48, 2, true, 50.0, false),
            new RingPolicy(Ring.DEPARTMENT, 0.95, 72, 5, true, 75.0, false),
            new RingPolicy(Ring.GLOBAL, 0.95, 168, 10, false, null, false)
        ));
    }

    public List<RingPolicy> getPolicies() {
        return policies;
    }

    public Ring firstRing() {
        return policies.get(0).ring();
    }

    public boolean isConfigured(Ring ring) {
        return positions.containsKey(ring);
    }

    /**
     * @throws InvalidOperationException if the ring is not in the sequence
     */
    public RingPolicy policyFor(Ring ring) {
        Integer position = positions.get(ring);
        if (position == null) {
            throw new InvalidOperationException("Ring " + ring + " is not configured");
        }
        return policies.get(position);
    }

    /**
     * @return The ring after the given one, empty at the last ring
     */
    public Optional<Ring> next(Ring ring) {
        int position = policyIndex(ring);
        return position + 1 < policies.size()
            ? Optional.of(policies.get(position + 1).ring())
            : Optional.empty();
    }

    private int policyIndex(Ring ring) {
        Integer position = positions.get(ring);
        if (position == null) {
            throw new InvalidOperationException("Ring " + ring + " is not configured");
        }
        return position;
    }
}
