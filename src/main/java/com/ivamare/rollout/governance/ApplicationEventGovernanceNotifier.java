package com.ivamare.rollout.governance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Publishes policy violations as Spring application events so governance
 * listeners (ticketing, chat, SIEM forwarders) can subscribe with
 * {@code @EventListener}.
 */
public class ApplicationEventGovernanceNotifier implements GovernanceNotifier {

    private static final Logger log = LoggerFactory.getLogger(ApplicationEventGovernanceNotifier.class);

    private final ApplicationEventPublisher publisher;

    public ApplicationEventGovernanceNotifier(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void notify(PolicyViolationEvent event) {
        log.warn("Policy violation for {} from {}: {}", event.correlationId(), event.source(), event.violations());
        publisher.publishEvent(event);
    }
}
