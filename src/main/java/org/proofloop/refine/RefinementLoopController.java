package org.proofloop.refine;

import org.proofloop.verify.AttemptOutcome;
import org.proofloop.verify.CandidateProof;
import org.proofloop.verify.JobStatus;
import org.proofloop.verify.VerificationJob;
import org.proofloop.verify.VerificationOrchestrator;
import org.proofloop.verify.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 细化循环：显式的有界循环，尝试之间严格顺序执行
 * <p>
 * 重试预算是总尝试次数。预算用完、生成器放弃或生成器出错都以 EXHAUSTED_RETRIES 结束，表示"未能验证"，
 * 不是错误；供给/组装错误直接终止，不进入细化。
 */
public class RefinementLoopController {

    private static final Logger log = LoggerFactory.getLogger(RefinementLoopController.class);

    private final VerificationOrchestrator orchestrator;
    private final int retryBudget;

    public RefinementLoopController(VerificationOrchestrator orchestrator, int retryBudget) {
        if (retryBudget < 1) {
            throw new IllegalArgumentException("retry budget must be at least 1: " + retryBudget);
        }
        this.orchestrator = orchestrator;
        this.retryBudget = retryBudget;
    }

    public int getRetryBudget() {
        return retryBudget;
    }

    public VerificationOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public VerificationResult run(VerificationJob job, ProofGenerator generator) {
        return run(job, generator, Collections.synchronizedList(new ArrayList<>()));
    }

    /**
     * @param chain 收集本任务产生的细化请求，按顺序追加
     */
    public VerificationResult run(VerificationJob job, ProofGenerator generator, List<RefinementAttempt> chain) {
        CandidateProof proof = job.getRequest().proof();
        while (true) {
            AttemptOutcome outcome = orchestrator.runAttempt(job, proof);
            if (job.getStatus().isTerminal()) {
                break;
            }
            // 此时任务处于 FAILED
            if (!outcome.refinable() || job.getAttempts() >= retryBudget) {
                log.info("{} not verified after {} attempt(s)", job.getId(), job.getAttempts());
                job.transition(JobStatus.EXHAUSTED_RETRIES);
                break;
            }
            if (job.isCancelled()) {
                job.transition(JobStatus.CANCELLED);
                break;
            }
            job.transition(JobStatus.REFINEMENT_REQUESTED);
            RefinementAttempt request = new RefinementAttempt(job.getId(), outcome.attempt(), proof,
                    outcome.failure(), outcome.summary(), lastLog(job));
            chain.add(request);
            Optional<CandidateProof> next;
            try {
                next = generator.refine(request);
            } catch (RuntimeException e) {
                // 生成器故障不丢结果：任务以未验证结束
                log.error("{} generator failed after attempt {}", job.getId(), outcome.attempt(), e);
                job.appendLog(job.getId(), "generator error: " + e);
                next = Optional.empty();
            }
            if (job.isCancelled()) {
                job.transition(JobStatus.CANCELLED);
                break;
            }
            if (next == null || next.isEmpty()) {
                log.info("{} generator declined after attempt {}", job.getId(), outcome.attempt());
                job.transition(JobStatus.EXHAUSTED_RETRIES);
                break;
            }
            proof = next.get();
        }
        return job.toResult();
    }

    // 最近一个沙箱里捕获的日志
    private static String lastLog(VerificationJob job) {
        List<String> sandboxes = job.sandboxIds();
        if (sandboxes.isEmpty()) return "";
        String prefix = "[" + sandboxes.get(sandboxes.size() - 1) + "] ";
        StringBuilder sb = new StringBuilder();
        for (String line : job.logs()) {
            if (line.startsWith(prefix)) sb.append(line.substring(prefix.length())).append('\n');
        }
        return sb.toString();
    }
}
