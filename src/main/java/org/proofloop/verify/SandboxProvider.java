package org.proofloop.verify;

public interface SandboxProvider {

    /**
     * 为一次尝试准备新的沙箱，沙箱从不在尝试之间复用
     */
    Sandbox provision(String jobId, int attempt, ToolchainSpec toolchain) throws ProvisionException;

    /**
     * 当前尚未拆除的沙箱数
     */
    int liveSandboxes();
}
