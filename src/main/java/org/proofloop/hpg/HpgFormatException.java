package org.proofloop.hpg;

/**
 * HPG 文件无法解码或内容违反图约束
 */
public class HpgFormatException extends Exception {

    public HpgFormatException(String message) {
        super(message);
    }

    public HpgFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
