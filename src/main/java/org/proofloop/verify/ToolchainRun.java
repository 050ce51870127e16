package org.proofloop.verify;

import java.time.Duration;

/**
 * 工具链运行结果；超时或取消时进程已被强制结束
 */
public record ToolchainRun(int exitCode, String output, boolean timedOut, boolean cancelled, Duration elapsed) {

    public static ToolchainRun completed(int exitCode, String output, Duration elapsed) {
        return new ToolchainRun(exitCode, output, false, false, elapsed);
    }
}
