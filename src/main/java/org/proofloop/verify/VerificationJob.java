package org.proofloop.verify;

import org.proofloop.symbolic.SymbolicVerdict;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 一个验证任务：同一目标项目上的一串顺序尝试
 * <p>
 * 由单个工作线程推进；{@link #cancel()} 可以从任意线程调用，在下一个挂起点生效。
 */
public class VerificationJob {

    private static final AtomicLong SEQ = new AtomicLong();

    private final String id;
    private final VerificationRequest request;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    private volatile JobStatus status = JobStatus.PENDING;
    private final List<JobStatus> history = new ArrayList<>();
    private final List<String> logs = new ArrayList<>();
    private final List<String> sandboxIds = new ArrayList<>();
    private int attempts;
    private CandidateProof currentProof;
    private AttemptOutcome lastOutcome;
    private SymbolicVerdict symbolicVerdict;
    private boolean symbolicallyVerified;

    public VerificationJob(VerificationRequest request) {
        this.id = "job-" + SEQ.incrementAndGet();
        this.request = request;
        this.currentProof = request.proof();
        this.history.add(status);
    }

    public String getId() {
        return id;
    }

    public VerificationRequest getRequest() {
        return request;
    }

    public JobStatus getStatus() {
        return status;
    }

    public synchronized void transition(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(id + ": illegal transition " + status + " -> " + next);
        }
        status = next;
        history.add(next);
    }

    public synchronized List<JobStatus> history() {
        return List.copyOf(history);
    }

    synchronized int beginAttempt(CandidateProof proof) {
        currentProof = proof;
        return ++attempts;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized CandidateProof getCurrentProof() {
        return currentProof;
    }

    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelled() {
        return cancelRequested.get();
    }

    public synchronized void appendLog(String source, String text) {
        logs.add("[" + source + "] " + text);
    }

    public synchronized List<String> logs() {
        return List.copyOf(logs);
    }

    synchronized void recordSandbox(String sandboxId) {
        sandboxIds.add(sandboxId);
    }

    public synchronized List<String> sandboxIds() {
        return List.copyOf(sandboxIds);
    }

    synchronized void recordOutcome(AttemptOutcome outcome) {
        lastOutcome = outcome;
    }

    public synchronized Optional<AttemptOutcome> lastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    synchronized void recordSymbolicVerdict(SymbolicVerdict verdict, boolean confirmsReachability) {
        symbolicVerdict = verdict;
        symbolicallyVerified = confirmsReachability;
    }

    public synchronized Optional<SymbolicVerdict> symbolicVerdict() {
        return Optional.ofNullable(symbolicVerdict);
    }

    public synchronized VerificationResult toResult() {
        FailureKind failure = lastOutcome == null || status == JobStatus.VERIFIED ? null : lastOutcome.failure();
        String summary = lastOutcome == null ? status.name() : lastOutcome.summary();
        return new VerificationResult(id, status, attempts, List.copyOf(logs), List.copyOf(sandboxIds),
                failure, summary, Optional.ofNullable(symbolicVerdict), symbolicallyVerified);
    }

    @Override
    public String toString() {
        return id + "[" + status + ", attempt " + attempts + "]";
    }
}
