package org.proofloop.verify;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 以临时目录作为沙箱工作区
 */
public class WorkspaceSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceSandboxProvider.class);

    private final Path baseDir;
    private final AtomicInteger counter = new AtomicInteger();
    private final Set<String> live = ConcurrentHashMap.newKeySet();

    /**
     * @param baseDir 工作区的父目录，为 null 时使用系统临时目录
     */
    public WorkspaceSandboxProvider(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public Sandbox provision(String jobId, int attempt, ToolchainSpec toolchain) throws ProvisionException {
        String id = "sbx-" + jobId + "-a" + attempt + "-" + counter.incrementAndGet();
        try {
            Path ws;
            if (baseDir == null) {
                ws = Files.createTempDirectory(id + "-");
            } else {
                Files.createDirectories(baseDir);
                ws = Files.createTempDirectory(baseDir, id + "-");
            }
            live.add(id);
            log.debug("[{}] workspace {} with toolchain {}", id, ws, toolchain);
            return new WorkspaceSandbox(id, ws, toolchain);
        } catch (IOException e) {
            throw new ProvisionException("Cannot create sandbox workspace for " + jobId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int liveSandboxes() {
        return live.size();
    }

    private final class WorkspaceSandbox implements Sandbox {

        private final String id;
        private final Path workspace;
        private final ToolchainSpec toolchain;
        private volatile boolean alive = true;

        WorkspaceSandbox(String id, Path workspace, ToolchainSpec toolchain) {
            this.id = id;
            this.workspace = workspace;
            this.toolchain = toolchain;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public Path workspace() {
            return workspace;
        }

        @Override
        public ToolchainSpec toolchain() {
            return toolchain;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }

        @Override
        public synchronized void close() throws IOException {
            if (!alive) return;
            alive = false;
            live.remove(id);
            if (Files.exists(workspace)) {
                FileUtils.deleteDirectory(workspace.toFile());
            }
            log.debug("[{}] torn down", id);
        }

        @Override
        public String toString() {
            return id;
        }
    }
}
