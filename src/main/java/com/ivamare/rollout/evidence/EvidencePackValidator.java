package com.ivamare.rollout.evidence;

import com.ivamare.rollout.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates evidence packs. Every failing check is reported; nothing
 * short-circuits.
 *
 * <p>Error codes:
 * <ul>
 *   <li>{@code EVIDENCE_PACK_MISSING}</li>
 *   <li>{@code MISSING_FIELD:<name>} for each absent or empty required field</li>
 *   <li>{@code ARTIFACT_NOT_SIGNED}</li>
 *   <li>{@code UNRESOLVED_CRITICAL_VULNERABILITIES: <n> critical findings}</li>
 *   <li>{@code ROLLBACK_NOT_VALIDATED}</li>
 *   <li>{@code NO_INSTALL_SUCCESSES}</li>
 * </ul>
 */
public class EvidencePackValidator {

    private static final Logger log = LoggerFactory.getLogger(EvidencePackValidator.class);

    public static final String EVIDENCE_PACK_MISSING = "EVIDENCE_PACK_MISSING";
    public static final String MISSING_FIELD = "MISSING_FIELD";
    public static final String ARTIFACT_NOT_SIGNED = "ARTIFACT_NOT_SIGNED";
    public static final String UNRESOLVED_CRITICAL_VULNERABILITIES = "UNRESOLVED_CRITICAL_VULNERABILITIES";
    public static final String ROLLBACK_NOT_VALIDATED = "ROLLBACK_NOT_VALIDATED";
    public static final String NO_INSTALL_SUCCESSES = "NO_INSTALL_SUCCESSES";

    private final List<String> defaultRequiredFields;

    public EvidencePackValidator(List<String> defaultRequiredFields) {
        this.defaultRequiredFields = List.copyOf(defaultRequiredFields);
    }

    public List<String> getDefaultRequiredFields() {
        return defaultRequiredFields;
    }

    /**
     * Validate against the configured required-field list.
     */
    public ValidationResult validate(EvidencePack pack) {
        return validate(pack, defaultRequiredFields);
    }

    /**
     * Validate a pack.
     *
     * @param pack The pack (nullable)
     * @param requiredFields Top-level fields that must be present and non-empty
     * @return The complete set of violations
     */
    public ValidationResult validate(EvidencePack pack, List<String> requiredFields) {
        if (pack == null) {
            return ValidationResult.of(List.of(EVIDENCE_PACK_MISSING));
        }

        List<String> errors = new ArrayList<>();
        for (String field : requiredFields) {
            if (isEmpty(pack.fieldValue(field))) {
                errors.add(MISSING_FIELD + ":" + field);
            }
        }

        if (!pack.signed()) {
            errors.add(ARTIFACT_NOT_SIGNED);
        }

        EvidencePack.VulnerabilityScan scan = pack.vulnerabilityScan();
        if (scan != null && scan.critical() > 0 && !scan.exceptionGranted()) {
            errors.add(UNRESOLVED_CRITICAL_VULNERABILITIES + ": " + scan.critical()
                + " critical findings without a granted exception");
        }

        if (pack.rollback() == null || !pack.rollback().validated()) {
            errors.add(ROLLBACK_NOT_VALIDATED);
        }

        if (pack.installTests() == null || pack.installTests().successCount() <= 0) {
            errors.add(NO_INSTALL_SUCCESSES);
        }

        if (!errors.isEmpty()) {
            log.debug("Evidence pack for artifact {} failed {} checks", pack.artifactHash(), errors.size());
        }
        return ValidationResult.of(errors);
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        return value instanceof String s && s.isBlank();
    }
}
