package org.proofloop.verify;

/**
 * 无法准备沙箱：工作区创建失败、工具链缺失等
 */
public class ProvisionException extends Exception {

    public ProvisionException(String message) {
        super(message);
    }

    public ProvisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
