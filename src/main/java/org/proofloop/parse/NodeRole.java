package org.proofloop.parse;

/**
 * 节点在程序结构中的角色，对应 HPG 的三种节点类型
 */
public enum NodeRole {
    CONTRACT,
    FUNCTION,
    STATEMENT
}
