package org.proofloop.verify;

/**
 * 无法在沙箱内组装项目：目标缺失、文件冲突、路径越界
 */
public class AssemblyException extends Exception {

    public AssemblyException(String message) {
        super(message);
    }

    public AssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
