package org.proofloop.refine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.proofloop.verify.CandidateProof;
import org.proofloop.verify.FailureKind;
import org.proofloop.verify.JobStatus;
import org.proofloop.verify.Proofs;
import org.proofloop.verify.ScriptedToolchainRunner;
import org.proofloop.verify.VerificationJob;
import org.proofloop.verify.VerificationOrchestrator;
import org.proofloop.verify.VerificationRequest;
import org.proofloop.verify.VerificationResult;
import org.proofloop.verify.WorkspaceSandboxProvider;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RefinementLoopControllerTest {

    @TempDir
    Path tmp;

    private Path target;
    private WorkspaceSandboxProvider sandboxes;
    private ScriptedToolchainRunner runner;

    @BeforeEach
    void setUp() throws Exception {
        target = Proofs.targetProject(tmp.resolve("target"));
        sandboxes = new WorkspaceSandboxProvider(tmp.resolve("sandboxes"));
        runner = new ScriptedToolchainRunner();
    }

    private RefinementLoopController controller(int budget) {
        VerificationOrchestrator orchestrator = new VerificationOrchestrator(sandboxes, runner, Proofs.TOOLCHAIN,
                Proofs.budget(5_000), null);
        return new RefinementLoopController(orchestrator, budget);
    }

    private VerificationJob job(CandidateProof proof) {
        return new VerificationJob(new VerificationRequest(target, proof));
    }

    @Test
    void compileErrorIsRefinedIntoAPassingProof() {
        VerificationJob job = job(Proofs.broken());
        List<RefinementAttempt> chain = new ArrayList<>();
        VerificationResult result = controller(3).run(job, attempt -> Optional.of(Proofs.expecting("pass")), chain);

        assertEquals(JobStatus.VERIFIED, result.status());
        assertTrue(result.verified());
        assertEquals(2, result.attempts());
        assertNull(result.lastFailure());
        assertEquals(1, chain.size());
        RefinementAttempt request = chain.get(0);
        assertEquals(job.getId(), request.jobId());
        assertEquals(1, request.attemptIndex());
        assertEquals(FailureKind.COMPILATION_ERROR, request.failure());
        assertEquals(Proofs.broken(), request.priorProof());
        assertTrue(request.failureLog().contains("syntax check failed"));
        assertTrue(job.history().contains(JobStatus.REFINEMENT_REQUESTED));
        assertEquals(0, sandboxes.liveSandboxes());
    }

    @Test
    void failingGeneratorEndsTheJobNotVerified() {
        VerificationJob job = job(Proofs.expecting("assert"));
        VerificationResult result = controller(3).run(job, attempt -> {
            throw new IllegalStateException("generator backend down");
        });

        assertEquals(JobStatus.EXHAUSTED_RETRIES, result.status());
        assertTrue(job.getStatus().isTerminal());
        assertEquals(1, result.attempts());
        assertEquals(FailureKind.ASSERTION_FAILURE, result.lastFailure());
        assertTrue(result.logs().stream().anyMatch(l -> l.contains("generator backend down")));
        assertEquals(0, sandboxes.liveSandboxes());
    }

    @Test
    void budgetCountsTotalAttempts() {
        VerificationJob job = job(Proofs.expecting("assert"));
        List<RefinementAttempt> chain = new ArrayList<>();
        VerificationResult result = controller(3).run(job, attempt -> Optional.of(Proofs.expecting("assert")), chain);

        assertEquals(JobStatus.EXHAUSTED_RETRIES, result.status());
        assertFalse(result.verified());
        assertEquals(3, result.attempts());
        assertEquals(3, runner.invocations().size());
        assertEquals(2, chain.size());
        assertEquals(FailureKind.ASSERTION_FAILURE, result.lastFailure());
        assertEquals(3, result.sandboxIds().size());
        assertEquals(0, sandboxes.liveSandboxes());
    }

    @Test
    void refinementSeesTheToolchainLog() {
        VerificationJob job = job(Proofs.expecting("revert"));
        List<RefinementAttempt> chain = new ArrayList<>();
        controller(2).run(job, attempt -> Optional.of(Proofs.expecting("pass")), chain);

        RefinementAttempt request = chain.get(0);
        assertEquals(FailureKind.REVERT, request.failure());
        assertTrue(request.failureLog().contains("insufficient balance"));
        assertTrue(request.failureSummary().startsWith("reverted"));
    }

    @Test
    void generatorThatGivesUpEndsTheLoop() {
        VerificationJob job = job(Proofs.expecting("assert"));
        VerificationResult result = controller(5).run(job, attempt -> Optional.empty());

        assertEquals(JobStatus.EXHAUSTED_RETRIES, result.status());
        assertEquals(1, result.attempts());
    }

    @Test
    void budgetOfOneMeansNoRefinement() {
        VerificationJob job = job(Proofs.expecting("assert"));
        VerificationResult result = controller(1).run(job, attempt -> fail("must not refine"));
        assertEquals(JobStatus.EXHAUSTED_RETRIES, result.status());
        assertEquals(1, result.attempts());
    }

    @Test
    void toolingErrorsAreNotRetried() {
        runner.unavailable();
        VerificationJob job = job(Proofs.expecting("pass"));
        VerificationResult result = controller(3).run(job, attempt -> fail("must not refine"));

        assertEquals(JobStatus.PROVISION_ERROR, result.status());
        assertEquals(1, result.attempts());
        assertEquals(FailureKind.PROVISION_ERROR, result.lastFailure());
    }

    @Test
    void cancelDuringRefinementStopsTheLoop() {
        VerificationJob job = job(Proofs.expecting("assert"));
        VerificationResult result = controller(3).run(job, attempt -> {
            job.cancel();
            return Optional.of(Proofs.expecting("pass"));
        });
        assertEquals(JobStatus.CANCELLED, result.status());
        assertEquals(1, result.attempts());
    }

    @Test
    void budgetMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> controller(0));
    }
}
