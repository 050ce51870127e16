package org.proofloop.refine;

import org.proofloop.config.ProofLoopConfig;
import org.proofloop.symbolic.SymbolicCorroborator;
import org.proofloop.symbolic.SymbolicExecutionAdapter;
import org.proofloop.verify.ProcessToolchainRunner;
import org.proofloop.verify.SandboxProvider;
import org.proofloop.verify.ToolchainRunner;
import org.proofloop.verify.VerificationJob;
import org.proofloop.verify.VerificationOrchestrator;
import org.proofloop.verify.VerificationRequest;
import org.proofloop.verify.VerificationResult;
import org.proofloop.verify.WorkspaceSandboxProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 并发运行相互独立的验证任务，每个任务在自己的工作线程上跑完整个细化链
 */
public class VerificationService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    private final RefinementLoopController controller;
    private final ExecutorService executor;
    // create() 创建的符号执行协作者归本服务所有，随服务关闭
    private final SymbolicCorroborator symbolic;
    private final Map<String, VerificationJob> jobs = new ConcurrentHashMap<>();

    public record Submission(VerificationJob job, Future<VerificationResult> result) {
    }

    public VerificationService(RefinementLoopController controller, int workers) {
        this(controller, workers, null);
    }

    private VerificationService(RefinementLoopController controller, int workers, SymbolicCorroborator symbolic) {
        this.controller = controller;
        this.symbolic = symbolic;
        int n = workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(n, r -> new Thread(r, "verify-" + seq.incrementAndGet()));
    }

    /**
     * 按配置组装：临时目录沙箱 + 本地进程工具链
     *
     * @param adapter 符号执行引擎，可以为 null
     */
    public static VerificationService create(ProofLoopConfig config, SymbolicExecutionAdapter adapter) {
        return create(config, adapter,
                new WorkspaceSandboxProvider(config.getWorkspaceDir().orElse(null)), new ProcessToolchainRunner());
    }

    public static VerificationService create(ProofLoopConfig config, SymbolicExecutionAdapter adapter,
                                             SandboxProvider sandboxes, ToolchainRunner runner) {
        SymbolicCorroborator symbolic = new SymbolicCorroborator(adapter, config.getSymbolicMode(),
                config.getSymbolicTimeout());
        VerificationOrchestrator orchestrator = new VerificationOrchestrator(sandboxes, runner,
                config.getToolchain(), config.getExecutionBudget(), symbolic);
        RefinementLoopController controller = new RefinementLoopController(orchestrator, config.getRetryBudget());
        log.info("Verification service: toolchain {}, {} attempt(s) per job, symbolic {}",
                config.getToolchain(), config.getRetryBudget(), symbolic.mode());
        return new VerificationService(controller, config.getVerifyWorkers(), symbolic);
    }

    public RefinementLoopController getController() {
        return controller;
    }

    public Submission submit(VerificationRequest request, ProofGenerator generator) {
        VerificationJob job = new VerificationJob(request);
        jobs.put(job.getId(), job);
        Future<VerificationResult> future = executor.submit(() -> {
            try {
                VerificationResult result = controller.run(job, generator);
                log.info("{} finished: {} after {} attempt(s)", job.getId(), result.status(), result.attempts());
                return result;
            } finally {
                jobs.remove(job.getId());
            }
        });
        return new Submission(job, future);
    }

    /**
     * 请求取消；任务在下一个挂起点结束并仍然拆除沙箱
     */
    public boolean cancel(String jobId) {
        VerificationJob job = jobs.get(jobId);
        if (job == null) return false;
        job.cancel();
        return true;
    }

    public Optional<VerificationJob> job(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public void close() throws InterruptedException {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                log.warn("Verification workers still busy after shutdown, interrupting");
                executor.shutdownNow();
            }
        } finally {
            if (symbolic != null) {
                symbolic.close();
            }
        }
    }
}
