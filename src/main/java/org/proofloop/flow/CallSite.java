package org.proofloop.flow;

/**
 * 调用点。target 为被调函数编号；无法解析时指向 unresolved 哨兵函数。
 */
public record CallSite(int statementId, int callerFunctionId, String calleeName, int targetId, boolean resolved) {
}
