package org.proofloop.symbolic;

/**
 * 符号执行引擎对一个交易序列的判定，只作为附加证据记录在任务上
 */
public record SymbolicVerdict(Outcome outcome, String engine, String detail) {

    public enum Outcome {
        FEASIBLE,
        INFEASIBLE,
        UNKNOWN,
        TIMEOUT,
        ERROR
    }

    public boolean feasible() {
        return outcome == Outcome.FEASIBLE;
    }
}
