package com.ivamare.rollout.governance;

/**
 * Governance notification path for policy violations.
 */
@FunctionalInterface
public interface GovernanceNotifier {

    void notify(PolicyViolationEvent event);
}
