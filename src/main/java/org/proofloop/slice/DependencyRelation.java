package org.proofloop.slice;

/**
 * 切片遍历所沿的依赖方向
 */
public enum DependencyRelation {
    CONTROL_PREDECESSOR,
    DATA_DEFINITION,
    CONTROL_SUCCESSOR,
    DATA_USE
}
