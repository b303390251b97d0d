package com.ivamare.rollout.scope;

import com.ivamare.rollout.model.TargetScope;

import java.util.Optional;

/**
 * Source of authorized scopes for publishers and registered scopes for apps.
 */
public interface ScopeDirectory {

    Optional<TargetScope> publisherScope(String publisherId);

    Optional<TargetScope> appScope(String appId);
}
