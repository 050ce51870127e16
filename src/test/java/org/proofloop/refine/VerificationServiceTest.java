package org.proofloop.refine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.proofloop.config.ProofLoopConfig;
import org.proofloop.symbolic.CorroborationMode;
import org.proofloop.symbolic.FixedVerdictAdapter;
import org.proofloop.symbolic.SymbolicCorroborator;
import org.proofloop.symbolic.SymbolicVerdict;
import org.proofloop.verify.JobStatus;
import org.proofloop.verify.Proofs;
import org.proofloop.verify.ScriptedToolchainRunner;
import org.proofloop.verify.VerificationOrchestrator;
import org.proofloop.verify.VerificationRequest;
import org.proofloop.verify.VerificationResult;
import org.proofloop.verify.WorkspaceSandboxProvider;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class VerificationServiceTest {

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

    private VerificationService service(long timeoutMillis, int workers) {
        VerificationOrchestrator orchestrator = new VerificationOrchestrator(sandboxes, runner, Proofs.TOOLCHAIN,
                Proofs.budget(timeoutMillis), null);
        return new VerificationService(new RefinementLoopController(orchestrator, 3), workers);
    }

    @Test
    void concurrentJobsUseIsolatedSandboxes() throws Exception {
        runner.delay(200);
        List<VerificationService.Submission> submissions = new ArrayList<>();
        try (VerificationService service = service(5_000, 5)) {
            for (int i = 0; i < 5; i++) {
                submissions.add(service.submit(new VerificationRequest(target, Proofs.expecting("pass")),
                        attempt -> Optional.empty()));
            }
            Set<String> allSandboxes = new HashSet<>();
            for (VerificationService.Submission s : submissions) {
                VerificationResult result = s.result().get(30, TimeUnit.SECONDS);
                assertEquals(JobStatus.VERIFIED, result.status());
                assertEquals(1, result.sandboxIds().size());
                String own = result.sandboxIds().get(0);
                assertTrue(allSandboxes.add(own), "sandbox shared: " + own);
                // 日志只包含本任务沙箱的输出
                assertTrue(result.logs().stream().anyMatch(l -> l.contains("sandbox " + own)));
                for (String line : result.logs()) {
                    assertTrue(line.startsWith("[" + own + "]") || line.startsWith("[" + result.jobId() + "]"), line);
                }
            }
            assertEquals(5, allSandboxes.size());
        }
        assertTrue(runner.maxConcurrentRuns() > 1);
        assertEquals(0, sandboxes.liveSandboxes());
    }

    @Test
    void cancelStopsARunningJobAndTearsDown() throws Exception {
        try (VerificationService service = service(60_000, 2)) {
            VerificationService.Submission s = service.submit(
                    new VerificationRequest(target, Proofs.expecting("hang")), attempt -> Optional.empty());
            long until = System.currentTimeMillis() + 10_000;
            while (s.job().getStatus() != JobStatus.RUNNING && System.currentTimeMillis() < until) {
                Thread.sleep(10);
            }
            assertTrue(service.cancel(s.job().getId()));

            VerificationResult result = s.result().get(10, TimeUnit.SECONDS);
            assertEquals(JobStatus.CANCELLED, result.status());
            assertFalse(service.job(s.job().getId()).isPresent());
        }
        assertEquals(0, sandboxes.liveSandboxes());
    }

    @Test
    void configuredServiceUsesTheConfiguredKnobs() throws Exception {
        Properties p = new Properties();
        p.setProperty("slice.maxDepth", "5");
        p.setProperty("slice.maxNodes", "50");
        p.setProperty("verify.retryBudget", "2");
        p.setProperty("verify.timeoutSeconds", "30");
        p.setProperty("verify.stepBudget", "1000");
        p.setProperty("verify.workers", "2");
        p.setProperty("toolchain.executable", "forge");
        p.setProperty("toolchain.version", "0.2.0");
        p.setProperty("toolchain.command", "{executable} test --match-test {testName} --gas-limit {stepBudget}");
        p.setProperty("symbolic.mode", "corroborate");
        ProofLoopConfig config = ProofLoopConfig.from(p);
        FixedVerdictAdapter adapter = new FixedVerdictAdapter(SymbolicVerdict.Outcome.FEASIBLE);

        SymbolicCorroborator symbolic;
        try (VerificationService service = VerificationService.create(config, adapter, sandboxes, runner)) {
            RefinementLoopController controller = service.getController();
            symbolic = controller.getOrchestrator().symbolic();
            assertEquals(2, controller.getRetryBudget());
            assertEquals(CorroborationMode.CORROBORATE, symbolic.mode());

            VerificationResult failing = service.submit(new VerificationRequest(target, Proofs.expecting("assert")),
                    attempt -> Optional.of(Proofs.expecting("assert"))).result().get(30, TimeUnit.SECONDS);
            assertEquals(JobStatus.EXHAUSTED_RETRIES, failing.status());
            assertEquals(2, failing.attempts());
            assertEquals(List.of("forge", "test", "--match-test", "testExploit", "--gas-limit", "1000"),
                    runner.invocations().get(0).command());

            VerificationResult passing = service.submit(new VerificationRequest(target, Proofs.expecting("pass")),
                    attempt -> Optional.empty()).result().get(30, TimeUnit.SECONDS);
            assertEquals(JobStatus.VERIFIED, passing.status());
            assertTrue(passing.symbolicVerdict().orElseThrow().feasible());
            assertFalse(passing.symbolicallyVerified());
        }
        assertTrue(symbolic.isClosed());
        assertEquals(0, sandboxes.liveSandboxes());
    }

    @Test
    void unknownJobCannotBeCancelled() throws Exception {
        try (VerificationService service = service(5_000, 1)) {
            assertFalse(service.cancel("job-does-not-exist"));
        }
    }
}
