package org.proofloop.config;

import org.proofloop.slice.SliceBounds;
import org.proofloop.symbolic.CorroborationMode;
import org.proofloop.verify.ExecutionBudget;
import org.proofloop.verify.ToolchainSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * 运行配置
 * <p>
 * 加载顺序：classpath 上的 proofloop.properties，然后是外部文件（-Dproofloop.config=...），
 * 最后是以 "proofloop." 为前缀的系统属性。切片上界和重试预算等必填项没有隐藏的默认值。
 */
public final class ProofLoopConfig {

    private static final Logger log = LoggerFactory.getLogger(ProofLoopConfig.class);

    public static final String RESOURCE = "proofloop.properties";
    public static final String EXTERNAL_FILE_PROPERTY = "proofloop.config";
    public static final String SYSTEM_PREFIX = "proofloop.";

    private final Properties props;

    private final SliceBounds sliceBounds;
    private final int retryBudget;
    private final ExecutionBudget executionBudget;
    private final ToolchainSpec toolchain;
    private final int analysisWorkers;
    private final int verifyWorkers;
    private final Path workspaceDir;
    private final CorroborationMode symbolicMode;
    private final Duration symbolicTimeout;
    private final Path vocabularyPath;

    private ProofLoopConfig(Properties props) throws ConfigException {
        this.props = props;
        int maxDepth = requireInt("slice.maxDepth");
        int maxNodes = requireInt("slice.maxNodes");
        this.sliceBounds = checked(() -> new SliceBounds(maxDepth, maxNodes));
        this.retryBudget = requireInt("verify.retryBudget");
        if (retryBudget < 1) {
            throw new ConfigException("verify.retryBudget must be at least 1, got " + retryBudget);
        }
        long timeoutSeconds = requireLong("verify.timeoutSeconds");
        long stepBudget = requireLong("verify.stepBudget");
        this.executionBudget = checked(() -> new ExecutionBudget(Duration.ofSeconds(timeoutSeconds), stepBudget));
        String executable = require("toolchain.executable");
        String version = require("toolchain.version");
        String command = require("toolchain.command");
        this.toolchain = checked(() -> new ToolchainSpec(executable, version, command));

        this.analysisWorkers = optionalInt("analysis.workers", 0);
        this.verifyWorkers = optionalInt("verify.workers", 0);
        String ws = props.getProperty("verify.workspaceDir", "").trim();
        this.workspaceDir = ws.isEmpty() ? null : Path.of(ws);
        String mode = props.getProperty("symbolic.mode", CorroborationMode.DISABLED.name()).trim();
        try {
            this.symbolicMode = CorroborationMode.valueOf(mode.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("symbolic.mode has unknown value '" + mode + "'", e);
        }
        this.symbolicTimeout = Duration.ofSeconds(optionalInt("symbolic.timeoutSeconds", 60));
        String vocab = props.getProperty("anchors.vocabulary", "").trim();
        this.vocabularyPath = vocab.isEmpty() ? null : Path.of(vocab);
    }

    /**
     * classpath 默认值 + 外部文件 + 系统属性
     */
    public static ProofLoopConfig load() throws ConfigException {
        String external = System.getProperty(EXTERNAL_FILE_PROPERTY);
        return load(external == null || external.isBlank() ? null : Path.of(external));
    }

    public static ProofLoopConfig load(Path externalFile) throws ConfigException {
        Properties p = new Properties();
        try (InputStream in = ProofLoopConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new ConfigException("Configuration resource " + RESOURCE + " not found on classpath");
            }
            p.load(in);
        } catch (IOException e) {
            throw new ConfigException("Cannot read " + RESOURCE + ": " + e.getMessage(), e);
        }
        if (externalFile != null) {
            try (Reader r = Files.newBufferedReader(externalFile, StandardCharsets.UTF_8)) {
                p.load(r);
                log.info("Configuration overridden from {}", externalFile);
            } catch (IOException e) {
                throw new ConfigException("Cannot read configuration file " + externalFile + ": " + e.getMessage(), e);
            }
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX) && !name.equals(EXTERNAL_FILE_PROPERTY)) {
                p.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
            }
        }
        return from(p);
    }

    public static ProofLoopConfig from(Properties props) throws ConfigException {
        Properties copy = new Properties();
        copy.putAll(props);
        return new ProofLoopConfig(copy);
    }

    private interface Builder<T> {
        T build();
    }

    // 值对象的构造器校验失败时转成配置错误
    private static <T> T checked(Builder<T> builder) throws ConfigException {
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private String require(String key) throws ConfigException {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) {
            throw new ConfigException("Missing required configuration key '" + key + "'");
        }
        return v.trim();
    }

    private int requireInt(String key) throws ConfigException {
        String v = require(key);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new ConfigException("Key '" + key + "' must be an integer, got '" + v + "'", e);
        }
    }

    private long requireLong(String key) throws ConfigException {
        String v = require(key);
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new ConfigException("Key '" + key + "' must be an integer, got '" + v + "'", e);
        }
    }

    private int optionalInt(String key, int fallback) throws ConfigException {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return fallback;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("Key '" + key + "' must be an integer, got '" + v + "'", e);
        }
    }

    public SliceBounds getSliceBounds() {
        return sliceBounds;
    }

    public int getRetryBudget() {
        return retryBudget;
    }

    public ExecutionBudget getExecutionBudget() {
        return executionBudget;
    }

    public ToolchainSpec getToolchain() {
        return toolchain;
    }

    /**
     * 0 表示按可用核数
     */
    public int getAnalysisWorkers() {
        return analysisWorkers;
    }

    /**
     * 同时运行的验证任务数，0 表示按可用核数
     */
    public int getVerifyWorkers() {
        return verifyWorkers;
    }

    /**
     * 沙箱工作区的父目录；为空时使用系统临时目录
     */
    public Optional<Path> getWorkspaceDir() {
        return Optional.ofNullable(workspaceDir);
    }

    public CorroborationMode getSymbolicMode() {
        return symbolicMode;
    }

    public Duration getSymbolicTimeout() {
        return symbolicTimeout;
    }

    /**
     * 外部锚点词表；为空时使用内置词表
     */
    public Optional<Path> getVocabularyPath() {
        return Optional.ofNullable(vocabularyPath);
    }
}
