package com.ivamare.rollout.evidence;

import com.ivamare.rollout.model.ValidationResult;
import com.ivamare.rollout.support.TestIntents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EvidencePackValidator")
class EvidencePackValidatorTest {

    private static final List<String> DEFAULT_FIELDS = List.of(
        EvidencePack.ARTIFACT_HASH,
        EvidencePack.SIGNATURE,
        EvidencePack.SBOM_REFERENCE,
        EvidencePack.VULNERABILITY_SCAN,
        EvidencePack.ROLLBACK,
        EvidencePack.INSTALL_TESTS
    );

    private final EvidencePackValidator validator = new EvidencePackValidator(DEFAULT_FIELDS);

    @Test
    @DisplayName("should accept a complete pack")
    void shouldAcceptCompletePack() {
        ValidationResult result = validator.validate(TestIntents.completeEvidence());

        assertTrue(result.valid());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    @DisplayName("should report a missing pack")
    void shouldReportMissingPack() {
        ValidationResult result = validator.validate(null);

        assertFalse(result.valid());
        assertEquals(List.of(EvidencePackValidator.EVIDENCE_PACK_MISSING), result.errors());
    }

    @Test
    @DisplayName("should report every failing check without short-circuiting")
    void shouldReportAllErrors() {
        EvidencePack pack = new EvidencePack(
            "sha256:abc",
            "sig",
            false,
            " ",
            new EvidencePack.VulnerabilityScan(2, 0, 0, "fail"),
            new EvidencePack.RollbackEvidence(false, null),
            new EvidencePack.InstallTestResults(0, 3)
        );

        ValidationResult result = validator.validate(pack);

        assertFalse(result.valid());
        assertEquals(5, result.errors().size());
        assertTrue(result.errors().contains("MISSING_FIELD:sbom_reference"));
        assertTrue(result.hasErrorCode(EvidencePackValidator.ARTIFACT_NOT_SIGNED));
        assertTrue(result.hasErrorCode(EvidencePackValidator.UNRESOLVED_CRITICAL_VULNERABILITIES));
        assertTrue(result.hasErrorCode(EvidencePackValidator.ROLLBACK_NOT_VALIDATED));
        assertTrue(result.hasErrorCode(EvidencePackValidator.NO_INSTALL_SUCCESSES));
    }

    @Nested
    class VulnerabilityTests {

        @Test
        void shouldAcceptCriticalFindingsWithGrantedException() {
            EvidencePack base = TestIntents.completeEvidence();
            EvidencePack pack = new EvidencePack(base.artifactHash(), base.signature(), true, base.sbomReference(),
                new EvidencePack.VulnerabilityScan(1, 0, 0, "exception_granted"),
                base.rollback(), base.installTests());

            assertTrue(validator.validate(pack).valid());
        }

        @Test
        void shouldNameCriticalCount() {
            EvidencePack base = TestIntents.completeEvidence();
            EvidencePack pack = new EvidencePack(base.artifactHash(), base.signature(), true, base.sbomReference(),
                new EvidencePack.VulnerabilityScan(3, 0, 0, "fail"),
                base.rollback(), base.installTests());

            ValidationResult result = validator.validate(pack);

            assertEquals(1, result.errors().size());
            assertTrue(result.errors().get(0).contains("3 critical findings"));
        }
    }

    @Test
    @DisplayName("should check only the fields requested by the caller")
    void shouldHonorCallerFieldList() {
        EvidencePack base = TestIntents.completeEvidence();
        EvidencePack pack = new EvidencePack(base.artifactHash(), null, true, null,
            base.vulnerabilityScan(), base.rollback(), base.installTests());

        assertFalse(validator.validate(pack).valid());
        assertTrue(validator.validate(pack, List.of(EvidencePack.ARTIFACT_HASH)).valid());
        assertEquals(List.of("MISSING_FIELD:signature"),
            validator.validate(pack, List.of(EvidencePack.SIGNATURE)).errors());
    }
}
