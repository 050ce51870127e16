package org.proofloop.refine;

import org.proofloop.verify.CandidateProof;
import org.proofloop.verify.FailureKind;

/**
 * 一次细化请求
 *
 * @param attemptIndex 失败的那次尝试的序号（从 1 开始）
 * @param failureLog   失败尝试捕获的原始编译/测试日志
 */
public record RefinementAttempt(String jobId, int attemptIndex, CandidateProof priorProof,
                                FailureKind failure, String failureSummary, String failureLog) {
}
