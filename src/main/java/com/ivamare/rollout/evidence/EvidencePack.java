package com.ivamare.rollout.evidence;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Proof bundle produced by the packaging pipeline for one artifact.
 * Validated, never created, by the control plane.
 *
 * @param artifactHash Content hash of the artifact
 * @param signature Detached signature reference (nullable)
 * @param signed Whether the artifact is signed
 * @param sbomReference Reference to the software bill of materials
 * @param vulnerabilityScan Result of the vulnerability scan
 * @param rollback Rollback plan evidence
 * @param installTests Install test results
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvidencePack(
    String artifactHash,
    String signature,
    boolean signed,
    String sbomReference,
    VulnerabilityScan vulnerabilityScan,
    RollbackEvidence rollback,
    InstallTestResults installTests
) {

    public static final String ARTIFACT_HASH = "artifact_hash";
    public static final String SIGNATURE = "signature";
    public static final String SBOM_REFERENCE = "sbom_reference";
    public static final String VULNERABILITY_SCAN = "vulnerability_scan";
    public static final String ROLLBACK = "rollback";
    public static final String INSTALL_TESTS = "install_tests";

    /**
     * Look up a top-level field by its wire name.
     *
     * @param name Field name, e.g. {@code sbom_reference}
     * @return The field value, or null if absent or unknown
     */
    public Object fieldValue(String name) {
        return switch (name) {
            case ARTIFACT_HASH -> artifactHash;
            case SIGNATURE -> signature;
            case SBOM_REFERENCE -> sbomReference;
            case VULNERABILITY_SCAN -> vulnerabilityScan;
            case ROLLBACK -> rollback;
            case INSTALL_TESTS -> installTests;
            default -> null;
        };
    }

    /**
     * @param critical Critical findings
     * @param high High findings
     * @param medium Medium findings
     * @param policyDecision Scan policy decision, e.g. {@code pass}, {@code fail}, {@code exception_granted}
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record VulnerabilityScan(int critical, int high, int medium, String policyDecision) {

        public static final String EXCEPTION_GRANTED = "exception_granted";

        public boolean exceptionGranted() {
            return EXCEPTION_GRANTED.equalsIgnoreCase(policyDecision);
        }
    }

    /**
     * @param validated Whether the rollback was exercised
     * @param testedVersion Version the rollback was tested against (nullable)
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RollbackEvidence(boolean validated, String testedVersion) {}

    /**
     * @param successCount Successful install test runs
     * @param failureCount Failed install test runs
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record InstallTestResults(int successCount, int failureCount) {}
}
