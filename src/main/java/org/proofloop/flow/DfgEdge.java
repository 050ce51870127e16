package org.proofloop.flow;

/**
 * 定值语句 -> 使用语句，slot 为传递的变量/存储槽
 */
public record DfgEdge(int from, int to, SlotKey slot) {
}
