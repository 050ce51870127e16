package org.proofloop.verify;

import org.proofloop.parse.ParseProblem;
import org.proofloop.parse.SyntaxValidator;
import org.proofloop.symbolic.CorroborationMode;
import org.proofloop.symbolic.SymbolicCorroborator;
import org.proofloop.symbolic.SymbolicVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * 单次验证尝试：PROVISIONING -> ASSEMBLING -> RUNNING -> VERIFIED | FAILED
 * <p>
 * 每次尝试使用新的沙箱；离开 RUNNING（或更早失败）时先拆除沙箱，再进入下一个状态。
 */
public class VerificationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(VerificationOrchestrator.class);

    static final String MDC_JOB = "job";
    static final String MDC_SANDBOX = "sandbox";

    private final SandboxProvider sandboxes;
    private final ToolchainRunner runner;
    private final ToolchainSpec toolchain;
    private final ExecutionBudget budget;
    private final SymbolicCorroborator symbolic;
    private final ProofAssembler assembler = new ProofAssembler();
    private final TestLogClassifier classifier = new TestLogClassifier();

    public VerificationOrchestrator(SandboxProvider sandboxes, ToolchainRunner runner, ToolchainSpec toolchain,
                                    ExecutionBudget budget, SymbolicCorroborator symbolic) {
        this.sandboxes = sandboxes;
        this.runner = runner;
        this.toolchain = toolchain;
        this.budget = budget;
        this.symbolic = symbolic == null ? SymbolicCorroborator.disabled() : symbolic;
    }

    public AttemptOutcome runAttempt(VerificationJob job, CandidateProof proof) {
        if (job.isCancelled()) {
            AttemptOutcome outcome = cancelled(job.getAttempts());
            job.recordOutcome(outcome);
            job.transition(JobStatus.CANCELLED);
            return outcome;
        }
        int attempt = job.beginAttempt(proof);
        MDC.put(MDC_JOB, job.getId());
        try {
            AttemptOutcome outcome = provisionAndRun(job, proof, attempt);
            job.recordOutcome(outcome);
            job.transition(outcome.status());
            log.info("{} attempt {} -> {}{}", job.getId(), attempt, outcome.status(),
                    outcome.failure() == null ? "" : " (" + outcome.failure() + ": " + outcome.summary() + ")");
            return outcome;
        } finally {
            MDC.remove(MDC_JOB);
        }
    }

    private AttemptOutcome provisionAndRun(VerificationJob job, CandidateProof proof, int attempt) {
        job.transition(JobStatus.PROVISIONING);
        Sandbox sandbox;
        try {
            if (!runner.isAvailable(toolchain)) {
                throw new ProvisionException("Toolchain " + toolchain + " is not available");
            }
            sandbox = sandboxes.provision(job.getId(), attempt, toolchain);
        } catch (ProvisionException e) {
            log.error("{} provisioning failed: {}", job.getId(), e.getMessage());
            job.appendLog(job.getId(), "provision error: " + e.getMessage());
            return new AttemptOutcome(attempt, JobStatus.PROVISION_ERROR, FailureKind.PROVISION_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} sandbox provider failed", job.getId(), e);
            job.appendLog(job.getId(), "provision error: " + e);
            return new AttemptOutcome(attempt, JobStatus.PROVISION_ERROR, FailureKind.PROVISION_ERROR,
                    "sandbox provider failed: " + e);
        }

        job.recordSandbox(sandbox.id());
        MDC.put(MDC_SANDBOX, sandbox.id());
        AttemptOutcome outcome;
        try {
            outcome = assembleAndRun(job, sandbox, proof, attempt);
        } catch (RuntimeException e) {
            outcome = unexpectedFault(job, sandbox, attempt, e);
        } finally {
            teardown(job, sandbox);
            MDC.remove(MDC_SANDBOX);
        }
        return corroborate(job, proof, outcome);
    }

    private AttemptOutcome assembleAndRun(VerificationJob job, Sandbox sandbox, CandidateProof proof, int attempt) {
        if (job.isCancelled()) {
            return cancelled(attempt);
        }
        job.transition(JobStatus.ASSEMBLING);
        try {
            assembler.assemble(sandbox.workspace(), job.getRequest().targetProject(), proof);
        } catch (AssemblyException e) {
            log.error("[{}] assembly failed: {}", sandbox.id(), e.getMessage());
            job.appendLog(sandbox.id(), "assembly error: " + e.getMessage());
            return new AttemptOutcome(attempt, JobStatus.ASSEMBLY_ERROR, FailureKind.ASSEMBLY_ERROR, e.getMessage());
        }

        // 语法不通过的证明不必交给工具链
        List<ParseProblem> problems = SyntaxValidator.validate(proof.source());
        if (!problems.isEmpty()) {
            String summary = "compile error: " + problems.get(0);
            job.appendLog(sandbox.id(), "attempt " + attempt + " syntax check failed: " + problems);
            return new AttemptOutcome(attempt, JobStatus.FAILED, FailureKind.COMPILATION_ERROR, summary);
        }

        if (job.isCancelled()) {
            return cancelled(attempt);
        }
        job.transition(JobStatus.RUNNING);
        ToolchainInvocation inv = new ToolchainInvocation(sandbox.id(), sandbox.workspace(),
                toolchain.command(proof, budget, sandbox.workspace()),
                Map.of(ToolchainSpec.STEP_BUDGET_ENV, Long.toString(budget.stepBudget())),
                budget.timeout(), proof);
        ToolchainRun run;
        try {
            run = runner.run(inv, job::isCancelled);
        } catch (IOException e) {
            log.error("[{}] toolchain could not be launched: {}", sandbox.id(), e.getMessage());
            job.appendLog(sandbox.id(), "toolchain error: " + e.getMessage());
            return new AttemptOutcome(attempt, JobStatus.PROVISION_ERROR, FailureKind.PROVISION_ERROR,
                    "toolchain could not be launched: " + e.getMessage());
        }
        job.appendLog(sandbox.id(), "attempt " + attempt + " exit " + run.exitCode() + "\n" + run.output());
        if (run.cancelled()) {
            return cancelled(attempt);
        }

        TestOutcome result = classifier.classify(run, proof);
        if (result.passed()) {
            return new AttemptOutcome(attempt, JobStatus.VERIFIED, null, result.summary());
        }
        return new AttemptOutcome(attempt, JobStatus.FAILED, result.failure(), result.summary());
    }

    // 组装阶段的意外错误记为组装错误，之后的记为工具错误；两者都是终止状态
    private AttemptOutcome unexpectedFault(VerificationJob job, Sandbox sandbox, int attempt, RuntimeException e) {
        log.error("[{}] unexpected fault while {}", sandbox.id(), job.getStatus(), e);
        job.appendLog(sandbox.id(), "unexpected fault while " + job.getStatus() + ": " + e);
        if (job.getStatus() == JobStatus.ASSEMBLING) {
            return new AttemptOutcome(attempt, JobStatus.ASSEMBLY_ERROR, FailureKind.ASSEMBLY_ERROR,
                    "assembly fault: " + e);
        }
        return new AttemptOutcome(attempt, JobStatus.PROVISION_ERROR, FailureKind.PROVISION_ERROR,
                "tooling fault: " + e);
    }

    // 符号执行只附加证据；只有动态无结论且配置允许时，可达性确认才能单独给出通过
    private AttemptOutcome corroborate(VerificationJob job, CandidateProof proof, AttemptOutcome outcome) {
        if (symbolic.mode() == CorroborationMode.DISABLED || job.isCancelled()) {
            return outcome;
        }
        boolean inconclusive = outcome.status() == JobStatus.FAILED && outcome.failure() == FailureKind.INCONCLUSIVE;
        if (!outcome.verified() && !(inconclusive && symbolic.mode() == CorroborationMode.CONFIRM_WHEN_INCONCLUSIVE)) {
            return outcome;
        }
        SymbolicVerdict verdict;
        try {
            verdict = symbolic.check(proof.source(), proof.testClass(), proof.testName(), job::isCancelled);
        } catch (RuntimeException e) {
            log.warn("{} symbolic check failed", job.getId(), e);
            verdict = new SymbolicVerdict(SymbolicVerdict.Outcome.ERROR, "symbolic", e.toString());
        }
        if (job.isCancelled()) {
            return cancelled(outcome.attempt());
        }
        boolean confirms = inconclusive && verdict.feasible();
        job.recordSymbolicVerdict(verdict, confirms);
        job.appendLog(job.getId(), "symbolic " + verdict.engine() + ": " + verdict.outcome() + " " + verdict.detail());
        if (confirms) {
            return new AttemptOutcome(outcome.attempt(), JobStatus.VERIFIED, null,
                    "reachability confirmed by " + verdict.engine());
        }
        return outcome;
    }

    private void teardown(VerificationJob job, Sandbox sandbox) {
        try {
            sandbox.close();
        } catch (IOException | RuntimeException e) {
            log.error("[{}] teardown failed: {}", sandbox.id(), e.toString());
            job.appendLog(sandbox.id(), "teardown error: " + e);
        }
    }

    private static AttemptOutcome cancelled(int attempt) {
        return new AttemptOutcome(attempt, JobStatus.CANCELLED, null, "cancelled");
    }

    public SandboxProvider sandboxes() {
        return sandboxes;
    }

    public ToolchainSpec toolchain() {
        return toolchain;
    }

    public ExecutionBudget budget() {
        return budget;
    }

    public SymbolicCorroborator symbolic() {
        return symbolic;
    }
}
