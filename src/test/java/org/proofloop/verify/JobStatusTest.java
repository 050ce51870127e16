package org.proofloop.verify;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class JobStatusTest {

    @Test
    void terminalStatesHaveNoSuccessors() {
        for (JobStatus s : EnumSet.of(JobStatus.VERIFIED, JobStatus.EXHAUSTED_RETRIES, JobStatus.PROVISION_ERROR,
                JobStatus.ASSEMBLY_ERROR, JobStatus.CANCELLED)) {
            assertTrue(s.isTerminal(), s.name());
            for (JobStatus next : JobStatus.values()) {
                assertFalse(s.canTransitionTo(next), s + " -> " + next);
            }
        }
    }

    @Test
    void everyLiveStateCanBeCancelled() {
        for (JobStatus s : JobStatus.values()) {
            if (!s.isTerminal()) assertTrue(s.canTransitionTo(JobStatus.CANCELLED), s.name());
        }
    }

    @Test
    void refinementGoesBackToProvisioning() {
        assertTrue(JobStatus.FAILED.canTransitionTo(JobStatus.REFINEMENT_REQUESTED));
        assertTrue(JobStatus.REFINEMENT_REQUESTED.canTransitionTo(JobStatus.PROVISIONING));
        assertTrue(JobStatus.FAILED.canTransitionTo(JobStatus.EXHAUSTED_RETRIES));
        assertFalse(JobStatus.FAILED.canTransitionTo(JobStatus.VERIFIED));
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.ASSEMBLING));
    }

    @Test
    void jobRejectsIllegalTransitions() {
        VerificationJob job = new VerificationJob(new VerificationRequest(Path.of("."), Proofs.expecting("pass")));
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertThrows(IllegalStateException.class, () -> job.transition(JobStatus.VERIFIED));
        job.transition(JobStatus.PROVISIONING);
        job.transition(JobStatus.PROVISION_ERROR);
        assertThrows(IllegalStateException.class, () -> job.transition(JobStatus.PROVISIONING));
    }

    @Test
    void onlyProofQualityFailuresDriveRefinement() {
        assertTrue(FailureKind.REVERT.drivesRefinement());
        assertTrue(FailureKind.INCONCLUSIVE.drivesRefinement());
        assertFalse(FailureKind.PROVISION_ERROR.drivesRefinement());
        assertFalse(FailureKind.ASSEMBLY_ERROR.drivesRefinement());
    }

    @Test
    void jobIdsAreUnique() {
        VerificationRequest request = new VerificationRequest(Path.of("."), Proofs.expecting("pass"));
        assertNotEquals(new VerificationJob(request).getId(), new VerificationJob(request).getId());
    }
}
