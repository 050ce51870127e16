package org.proofloop.flow;

/**
 * 静态无法确定的调用目标。只是警告：调用边仍然记录到哨兵节点上。
 */
public record UnresolvedReference(String unitName, int line, int statementId, String calleeName, String reason) {

    @Override
    public String toString() {
        return unitName + ":" + line + " unresolved call '" + calleeName + "' (" + reason + ")";
    }
}
