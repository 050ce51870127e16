package org.proofloop.symbolic;

/**
 * 符号执行结果如何参与验证结论
 */
public enum CorroborationMode {
    /** 不调用符号执行 */
    DISABLED,
    /** 只给动态通过的结果附加佐证 */
    CORROBORATE,
    /** 同上；动态测试无结论时，可由可达性确认单独判定为通过 */
    CONFIRM_WHEN_INCONCLUSIVE
}
