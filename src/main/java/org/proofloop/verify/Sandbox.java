package org.proofloop.verify;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 一次性的隔离执行环境：独占的工作区 + 固定版本的工具链
 */
public interface Sandbox extends AutoCloseable {

    String id();

    Path workspace();

    ToolchainSpec toolchain();

    boolean isAlive();

    /**
     * 拆除沙箱并删除工作区；重复调用无副作用
     */
    @Override
    void close() throws IOException;
}
