package org.proofloop.anchor;

/**
 * 锚点表达式在语句中的上下文角色
 */
public enum ContextRole {
    /** 不限 */
    ANY,
    /** 调用结果被丢弃（表达式语句） */
    DISCARDED_RESULT,
    /** 出现在分支/循环条件或 require/assert 参数中 */
    CONDITION
}
