package org.proofloop.verify;

import java.io.IOException;
import java.util.function.BooleanSupplier;

/**
 * 测试工具链的调用点。这是验证过程中的挂起点之一：
 * 实现必须遵守超时，并在 {@code cancelled} 变为 true 后尽快结束。
 */
public interface ToolchainRunner {

    /**
     * 工具链是否可用，供给阶段调用
     */
    boolean isAvailable(ToolchainSpec toolchain);

    ToolchainRun run(ToolchainInvocation invocation, BooleanSupplier cancelled) throws IOException;
}
