package org.proofloop.hpg;

/**
 * @param slot 仅 dfg_reaches 使用：传递的变量/存储槽
 */
public record HpgEdge(EdgeType type, int source, int target, String slot) {

    public HpgEdge(EdgeType type, int source, int target) {
        this(type, source, target, null);
    }
}
