package org.proofloop.flow;

public enum SlotKind {
    LOCAL,
    STATE,
    /** 结构体成员 / mapping 元素，owner 沿用根变量 */
    MEMBER,
    /** 既不是局部变量也不是已知字段（如 msg、block） */
    UNRESOLVED
}
