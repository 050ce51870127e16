package org.proofloop.verify;

/**
 * 单次尝试的失败原因。前五种是证明质量问题，会驱动细化；后两种是工具问题，不重试。
 */
public enum FailureKind {
    COMPILATION_ERROR,
    ASSERTION_FAILURE,
    REVERT,
    TIMEOUT,
    INCONCLUSIVE,
    PROVISION_ERROR,
    ASSEMBLY_ERROR;

    public boolean drivesRefinement() {
        return this != PROVISION_ERROR && this != ASSEMBLY_ERROR;
    }
}
