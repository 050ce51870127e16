package org.proofloop.anchor;

/**
 * 一次锚点命中：模式 + 被锚定的语句节点 + 所在函数/合约
 */
public record AnchorOccurrence(String patternId, String category, int nodeId,
                               int functionId, int contractId, String unitName, int line) {

    @Override
    public String toString() {
        return patternId + "@" + unitName + ":" + line + " (node " + nodeId + ")";
    }
}
