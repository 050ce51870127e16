package org.proofloop.verify;

import org.proofloop.symbolic.SymbolicVerdict;

import java.util.List;
import java.util.Optional;

/**
 * 任务的最终记录
 *
 * @param lastFailure         最后一次失败的原因，验证通过时为 null
 * @param symbolicallyVerified 通过结论来自符号执行的可达性确认而不是动态测试
 */
public record VerificationResult(String jobId, JobStatus status, int attempts, List<String> logs,
                                 List<String> sandboxIds, FailureKind lastFailure, String summary,
                                 Optional<SymbolicVerdict> symbolicVerdict, boolean symbolicallyVerified) {

    public boolean verified() {
        return status == JobStatus.VERIFIED;
    }
}
