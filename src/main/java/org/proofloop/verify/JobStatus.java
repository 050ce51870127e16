package org.proofloop.verify;

import java.util.EnumSet;
import java.util.Set;

/**
 * 验证任务状态机
 * <pre>
 * PENDING -> PROVISIONING -> ASSEMBLING -> RUNNING -> VERIFIED | FAILED
 * FAILED -> REFINEMENT_REQUESTED -> PROVISIONING（新的沙箱）
 * FAILED | REFINEMENT_REQUESTED -> EXHAUSTED_RETRIES
 * </pre>
 * 任何非终止状态都可以进入 CANCELLED。
 */
public enum JobStatus {
    PENDING,
    PROVISIONING,
    ASSEMBLING,
    RUNNING,
    VERIFIED,
    FAILED,
    REFINEMENT_REQUESTED,
    EXHAUSTED_RETRIES,
    PROVISION_ERROR,
    ASSEMBLY_ERROR,
    CANCELLED;

    public boolean isTerminal() {
        switch (this) {
            case VERIFIED:
            case EXHAUSTED_RETRIES:
            case PROVISION_ERROR:
            case ASSEMBLY_ERROR:
            case CANCELLED:
                return true;
            default:
                return false;
        }
    }

    public boolean canTransitionTo(JobStatus next) {
        return successors().contains(next);
    }

    private Set<JobStatus> successors() {
        if (isTerminal()) return EnumSet.noneOf(JobStatus.class);
        switch (this) {
            case PENDING:
                return EnumSet.of(PROVISIONING, CANCELLED);
            case PROVISIONING:
                return EnumSet.of(ASSEMBLING, PROVISION_ERROR, CANCELLED);
            case ASSEMBLING:
                // 证明语法检查失败属于编译错误，直接进入 FAILED
                return EnumSet.of(RUNNING, FAILED, ASSEMBLY_ERROR, CANCELLED);
            case RUNNING:
                // 工具链进程无法启动按供给错误处理
                return EnumSet.of(VERIFIED, FAILED, PROVISION_ERROR, CANCELLED);
            case FAILED:
                return EnumSet.of(REFINEMENT_REQUESTED, EXHAUSTED_RETRIES, CANCELLED);
            case REFINEMENT_REQUESTED:
                return EnumSet.of(PROVISIONING, EXHAUSTED_RETRIES, CANCELLED);
            default:
                return EnumSet.noneOf(JobStatus.class);
        }
    }
}
