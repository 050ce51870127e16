package org.proofloop.verify;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * 用外部进程运行工具链命令。输出重定向到工作区内的日志文件，避免管道写满阻塞。
 */
public class ProcessToolchainRunner implements ToolchainRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessToolchainRunner.class);

    static final String LOG_FILE = ".proofloop-run.log";
    private static final long POLL_MILLIS = 100;

    @Override
    public boolean isAvailable(ToolchainSpec toolchain) {
        String exe = toolchain.executable();
        if (exe.contains(File.separator)) {
            return Files.isExecutable(Path.of(exe));
        }
        String path = System.getenv("PATH");
        if (path == null) return false;
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) continue;
            Path candidate = Path.of(dir, exe);
            if (Files.isExecutable(candidate)) return true;
        }
        return false;
    }

    @Override
    public ToolchainRun run(ToolchainInvocation inv, BooleanSupplier cancelled) throws IOException {
        File logFile = inv.workspace().resolve(LOG_FILE).toFile();
        ProcessBuilder pb = new ProcessBuilder(inv.command())
                .directory(inv.workspace().toFile())
                .redirectErrorStream(true)
                .redirectOutput(logFile);
        pb.environment().putAll(inv.environment());

        long start = System.nanoTime();
        long deadline = start + inv.timeout().toNanos();
        log.info("[{}] exec {}", inv.sandboxId(), inv.command());
        Process p = pb.start();

        boolean timedOut = false;
        boolean stopped = false;
        try {
            while (!p.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (cancelled.getAsBoolean()) {
                    stopped = true;
                    break;
                }
                if (System.nanoTime() > deadline) {
                    timedOut = true;
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopped = true;
        }
        if (timedOut || stopped) {
            destroy(inv.sandboxId(), p);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        String output = logFile.exists() ? FileUtils.readFileToString(logFile, StandardCharsets.UTF_8) : "";
        int exit = p.isAlive() ? -1 : p.exitValue();
        if (timedOut) {
            log.warn("[{}] timed out after {} ms", inv.sandboxId(), elapsed.toMillis());
        }
        return new ToolchainRun(exit, output, timedOut, stopped, elapsed);
    }

    private static void destroy(String sandboxId, Process p) {
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
        try {
            if (!p.waitFor(5, TimeUnit.SECONDS)) {
                log.error("[{}] process {} did not exit after forced kill", sandboxId, p.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
