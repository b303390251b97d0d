package com.ivamare.rollout.scope;

import com.ivamare.rollout.model.TargetScope;

import java.util.Map;
import java.util.Optional;

/**
 * ScopeDirectory backed by the {@code rollout.scopes} configuration.
 */
public class PropertiesScopeDirectory implements ScopeDirectory {

    private final Map<String, TargetScope> publishers;
    private final Map<String, TargetScope> apps;

    public PropertiesScopeDirectory(Map<String, TargetScope> publishers, Map<String, TargetScope> apps) {
        this.publishers = Map.copyOf(publishers);
        this.apps = Map.copyOf(apps);
    }

    @Override
    public Optional<TargetScope> publisherScope(String publisherId) {
        return publisherId == null ? Optional.empty() : Optional.ofNullable(publishers.get(publisherId));
    }

    @Override
    public Optional<TargetScope> appScope(String appId) {
        return appId == null ? Optional.empty() : Optional.ofNullable(apps.get(appId));
    }
}
