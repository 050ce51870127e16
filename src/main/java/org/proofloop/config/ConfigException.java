package org.proofloop.config;

/**
 * 配置缺失、格式错误或无法读取
 */
public class ConfigException extends Exception {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
