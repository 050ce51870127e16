package org.proofloop.verify;

/**
 * 单次尝试的结果：下一个状态 + 失败原因
 *
 * @param failure 通过或取消时为 null
 */
public record AttemptOutcome(int attempt, JobStatus status, FailureKind failure, String summary) {

    public boolean verified() {
        return status == JobStatus.VERIFIED;
    }

    /**
     * 证明质量问题导致的失败，可以进入细化
     */
    public boolean refinable() {
        return status == JobStatus.FAILED && failure != null && failure.drivesRefinement();
    }
}
