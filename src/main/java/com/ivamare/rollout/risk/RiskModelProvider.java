package com.ivamare.rollout.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active risk model. Reloads swap the whole model atomically, so an
 * evaluation that took a snapshot with {@link #current()} never sees a mix of
 * two versions.
 */
public class RiskModelProvider {

    private static final Logger log = LoggerFactory.getLogger(RiskModelProvider.class);

    private final AtomicReference<RiskModel> model;

    public RiskModelProvider(RiskModel initial) {
        this.model = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    public RiskModel current() {
        return model.get();
    }

    /**
     * Replace the active model.
     *
     * @param next The new model
     * @return The model it replaced
     */
    public RiskModel reload(RiskModel next) {
        Objects.requireNonNull(next, "next");
        RiskModel previous = model.getAndSet(next);
        log.info("Risk model reloaded: {} -> {}", previous.version(), next.version());
        return previous;
    }
}
