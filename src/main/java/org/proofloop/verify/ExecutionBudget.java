package org.proofloop.verify;

import java.time.Duration;

/**
 * 单次运行的资源上限：墙钟超时 + gas/步数预算
 */
public record ExecutionBudget(Duration timeout, long stepBudget) {

    public ExecutionBudget {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (stepBudget <= 0) {
            throw new IllegalArgumentException("stepBudget must be positive: " + stepBudget);
        }
    }
}
