package org.proofloop.symbolic;

import java.util.List;

/**
 * 利用测试中的一次外部调用
 *
 * @param sender 发起方（最近一次 prank 的参数，默认 "this"）
 * @param target 被调对象的源码表达式
 */
public record Transaction(String sender, String target, String function, List<String> arguments, int line) {
}
