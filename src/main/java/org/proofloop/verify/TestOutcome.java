package org.proofloop.verify;

/**
 * 对一次运行日志的判定
 *
 * @param failure 通过时为 null
 * @param summary 一行摘要，交给细化循环
 */
public record TestOutcome(boolean passed, FailureKind failure, String summary) {

    static TestOutcome pass(String summary) {
        return new TestOutcome(true, null, summary);
    }

    static TestOutcome fail(FailureKind kind, String summary) {
        return new TestOutcome(false, kind, summary);
    }
}
