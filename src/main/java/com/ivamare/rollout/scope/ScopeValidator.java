package com.ivamare.rollout.scope;

import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.TargetScope;
import com.ivamare.rollout.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Enforces tenant boundary containment.
 *
 * <p>Each dimension of the target must lie within both the publisher's
 * authorized scope and the app's registered scope. A target whose org unit
 * differs from the publisher's is cross-boundary: it is rejected unless a
 * currently valid CAB approval is supplied, in which case publisher-scope
 * mismatches are waived. App-scope mismatches are never waived.
 *
 * <p>Error codes: {@code PUBLISHER_SCOPE_VIOLATION:<dimension>},
 * {@code APP_SCOPE_VIOLATION:<dimension>}, {@code CROSS_BOUNDARY_WITHOUT_CAB},
 * {@code UNKNOWN_PUBLISHER}, {@code UNKNOWN_APP}.
 */
public class ScopeValidator {

    private static final Logger log = LoggerFactory.getLogger(ScopeValidator.class);

    public static final String PUBLISHER_SCOPE_VIOLATION = "PUBLISHER_SCOPE_VIOLATION";
    public static final String APP_SCOPE_VIOLATION = "APP_SCOPE_VIOLATION";
    public static final String CROSS_BOUNDARY_WITHOUT_CAB = "CROSS_BOUNDARY_WITHOUT_CAB";
    public static final String UNKNOWN_PUBLISHER = "UNKNOWN_PUBLISHER";
    public static final String UNKNOWN_APP = "UNKNOWN_APP";

    private final ScopeDirectory directory;
    private final CabApprovalValidator cabValidator;

    public ScopeValidator(ScopeDirectory directory, CabApprovalValidator cabValidator) {
        this.directory = directory;
        this.cabValidator = cabValidator;
    }

    /**
     * Validate an intent, resolving publisher and app scopes from the directory.
     */
    public ValidationResult validate(DeploymentIntent intent) {
        Optional<TargetScope> publisher = directory.publisherScope(intent.publisherId());
        Optional<TargetScope> app = directory.appScope(intent.appId());

        List<String> errors = new ArrayList<>();
        if (publisher.isEmpty()) {
            errors.add(UNKNOWN_PUBLISHER + ":" + intent.publisherId());
        }
        if (app.isEmpty()) {
            errors.add(UNKNOWN_APP + ":" + intent.appId());
        }
        if (!errors.isEmpty()) {
            return ValidationResult.of(errors);
        }
        return validateScope(intent.targetScope(), publisher.get(), app.get(), intent.cabApprovalId());
    }

    /**
     * Validate a target scope.
     *
     * @param target Target scope
     * @param publisher Publisher's authorized scope
     * @param app App's registered scope
     * @param cabApprovalId CAB approval ID (nullable)
     * @return All violations found
     */
    public ValidationResult validateScope(TargetScope target, TargetScope publisher, TargetScope app,
                                          String cabApprovalId) {
        boolean crossBoundary = isCrossBoundary(target, publisher);
        boolean cabValid = false;
        List<String> errors = new ArrayList<>();

        if (crossBoundary) {
            CabApprovalCheck check = cabValidator.check(cabApprovalId);
            cabValid = check.approved();
            if (!cabValid) {
                errors.add(CROSS_BOUNDARY_WITHOUT_CAB + ": target org unit " + target.orgUnit()
                    + " is outside publisher org unit " + publisher.orgUnit()
                    + " and approval " + cabApprovalId + " is " + check.status().value());
            }
        }

        if (!cabValid) {
            collectViolations(PUBLISHER_SCOPE_VIOLATION, target, publisher, errors);
        }
        collectViolations(APP_SCOPE_VIOLATION, target, app, errors);

        if (!errors.isEmpty()) {
            log.debug("Scope validation found {} violations for target {}", errors.size(), target);
        }
        return ValidationResult.of(errors);
    }

    /**
     * Cross-boundary means the target's top-level unit is not the publisher's.
     * A publisher authorized for every org unit never crosses a boundary.
     */
    public static boolean isCrossBoundary(TargetScope target, TargetScope publisher) {
        if (TargetScope.isAny(publisher.orgUnit())) {
            return false;
        }
        return TargetScope.isAny(target.orgUnit()) || !publisher.orgUnit().equalsIgnoreCase(target.orgUnit());
    }

    private static void collectViolations(String code, TargetScope target, TargetScope authorized,
                                          List<String> errors) {
        Map<String, String> targetDims = target.dimensions();
        Map<String, String> authorizedDims = authorized.dimensions();
        for (Map.Entry<String, String> dim : targetDims.entrySet()) {
            if (!contains(authorizedDims.get(dim.getKey()), dim.getValue())) {
                errors.add(code + ":" + dim.getKey());
            }
        }
    }

    private static boolean contains(String authorized, String target) {
        if (TargetScope.isAny(authorized)) {
            return true;
        }
        return !TargetScope.isAny(target) && authorized.equalsIgnoreCase(target);
    }
}
