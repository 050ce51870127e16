package org.proofloop.symbolic;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用符号执行引擎：固定返回某个结论，可选地先等待一段时间或直接抛错
 */
public class FixedVerdictAdapter implements SymbolicExecutionAdapter {

    private final SymbolicVerdict.Outcome outcome;
    private final long delayMillis;
    private final boolean broken;
    private final List<TransactionSequence> seen = new ArrayList<>();

    public FixedVerdictAdapter(SymbolicVerdict.Outcome outcome) {
        this(outcome, 0, false);
    }

    public FixedVerdictAdapter(SymbolicVerdict.Outcome outcome, long delayMillis, boolean broken) {
        this.outcome = outcome;
        this.delayMillis = delayMillis;
        this.broken = broken;
    }

    @Override
    public String engine() {
        return "fixed";
    }

    @Override
    public SymbolicVerdict checkFeasibility(TransactionSequence sequence) throws IOException {
        synchronized (seen) {
            seen.add(sequence);
        }
        if (broken) {
            throw new IOException("solver crashed");
        }
        if (delayMillis > 0) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
        }
        return new SymbolicVerdict(outcome, engine(), sequence.transactions().size() + " transaction(s)");
    }

    public List<TransactionSequence> seen() {
        synchronized (seen) {
            return List.copyOf(seen);
        }
    }
}
