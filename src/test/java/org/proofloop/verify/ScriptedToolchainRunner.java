package org.proofloop.verify;

import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * 测试用工具链：读取沙箱里的证明文件，按其中的 "// expect: xxx" 标记输出 Foundry 风格日志
 * <ul>
 *     <li>pass / assert / revert / compile / silent：对应的日志</li>
 *     <li>hang：一直运行到超时或被取消</li>
 * </ul>
 */
public class ScriptedToolchainRunner implements ToolchainRunner {

    private final List<ToolchainInvocation> invocations = new ArrayList<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private volatile boolean available = true;
    private volatile long delayMillis;

    public ScriptedToolchainRunner unavailable() {
        available = false;
        return this;
    }

    /**
     * 每次运行额外耗时，用来让并发任务的运行区间重叠
     */
    public ScriptedToolchainRunner delay(long millis) {
        delayMillis = millis;
        return this;
    }

    @Override
    public boolean isAvailable(ToolchainSpec toolchain) {
        return available;
    }

    @Override
    public ToolchainRun run(ToolchainInvocation inv, BooleanSupplier cancelled) throws IOException {
        synchronized (invocations) {
            invocations.add(inv);
        }
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        long start = System.nanoTime();
        try {
            String source = FileUtils.readFileToString(
                    inv.workspace().resolve(inv.proof().relativePath()).toFile(), StandardCharsets.UTF_8);
            String expect = expectation(source);
            String test = inv.proof().testName();
            if (expect.equals("hang")) {
                return hang(inv, cancelled, start);
            }
            if (!sleep(delayMillis, cancelled)) {
                return new ToolchainRun(-1, "", false, true, since(start));
            }
            switch (expect) {
                case "pass":
                    return ToolchainRun.completed(0, "Ran 1 test for " + inv.proof().testClass()
                            + "\n[PASS] " + test + "() (gas: 41230)\nsandbox " + inv.sandboxId(), since(start));
                case "assert":
                    return ToolchainRun.completed(1, "[FAIL. Reason: assertion failed] " + test + "() (gas: 9120)",
                            since(start));
                case "revert":
                    return ToolchainRun.completed(1, "[FAIL. Reason: revert: insufficient balance] " + test + "()",
                            since(start));
                case "compile":
                    return ToolchainRun.completed(1, "Compiler run failed:\nError (7576): Undeclared identifier.",
                            since(start));
                default:
                    return ToolchainRun.completed(0, "No tests to run", since(start));
            }
        } finally {
            running.decrementAndGet();
        }
    }

    private static ToolchainRun hang(ToolchainInvocation inv, BooleanSupplier cancelled, long start) {
        long deadline = start + inv.timeout().toNanos();
        while (System.nanoTime() < deadline) {
            if (!sleep(20, cancelled)) {
                return new ToolchainRun(-1, "running...", false, true, since(start));
            }
        }
        return new ToolchainRun(-1, "running...", true, false, since(start));
    }

    // 返回 false 表示期间被取消
    private static boolean sleep(long millis, BooleanSupplier cancelled) {
        long end = System.currentTimeMillis() + millis;
        while (System.currentTimeMillis() < end) {
            if (cancelled.getAsBoolean()) return false;
            try {
                Thread.sleep(Math.min(10, millis));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return !cancelled.getAsBoolean();
    }

    private static Duration since(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }

    private static String expectation(String source) {
        int i = source.indexOf("// expect: ");
        if (i < 0) return "silent";
        int s = i + "// expect: ".length();
        int e = s;
        while (e < source.length() && Character.isLetter(source.charAt(e))) e++;
        return source.substring(s, e);
    }

    public List<ToolchainInvocation> invocations() {
        synchronized (invocations) {
            return List.copyOf(invocations);
        }
    }

    public List<Path> workspaces() {
        return invocations().stream().map(ToolchainInvocation::workspace).toList();
    }

    public int maxConcurrentRuns() {
        return maxRunning.get();
    }
}
