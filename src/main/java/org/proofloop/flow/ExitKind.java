package org.proofloop.flow;

/**
 * 函数的终止出口类型
 */
public enum ExitKind {
    RETURN,
    THROW,
    REVERT,
    FALLTHROUGH
}
