package org.proofloop.symbolic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * 在超时约束下调用符号执行引擎
 * <p>
 * 调用本身是挂起点：超时或取消会中断进行中的调用，并给出 TIMEOUT / UNKNOWN 判定。
 */
public class SymbolicCorroborator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SymbolicCorroborator.class);
    private static final long POLL_MILLIS = 100;

    private final SymbolicExecutionAdapter adapter;
    private final CorroborationMode mode;
    private final Duration timeout;
    private final TransactionExtractor extractor = new TransactionExtractor();
    // 第一次真正调用引擎时才创建
    private ExecutorService executor;
    private boolean closed;

    public SymbolicCorroborator(SymbolicExecutionAdapter adapter, CorroborationMode mode, Duration timeout) {
        this.adapter = adapter;
        this.mode = adapter == null ? CorroborationMode.DISABLED : mode;
        this.timeout = timeout;
    }

    public static SymbolicCorroborator disabled() {
        return new SymbolicCorroborator(null, CorroborationMode.DISABLED, Duration.ofSeconds(1));
    }

    public CorroborationMode mode() {
        return mode;
    }

    public SymbolicVerdict check(String source, String testClass, String testName, BooleanSupplier cancelled) {
        String engine = adapter == null ? "none" : adapter.engine();
        if (mode == CorroborationMode.DISABLED) {
            return new SymbolicVerdict(SymbolicVerdict.Outcome.UNKNOWN, engine, "symbolic execution disabled");
        }
        TransactionSequence seq = extractor.extract(source, testClass, testName);
        if (seq.isEmpty()) {
            return new SymbolicVerdict(SymbolicVerdict.Outcome.UNKNOWN, engine, "no transactions in " + testName);
        }
        if (isClosed()) {
            return new SymbolicVerdict(SymbolicVerdict.Outcome.ERROR, engine, "symbolic corroborator closed");
        }
        Future<SymbolicVerdict> pending = executor().submit(() -> adapter.checkFeasibility(seq));
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                try {
                    return pending.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    if (cancelled.getAsBoolean()) {
                        pending.cancel(true);
                        return new SymbolicVerdict(SymbolicVerdict.Outcome.UNKNOWN, engine, "cancelled");
                    }
                    if (System.nanoTime() > deadline) {
                        pending.cancel(true);
                        log.warn("Symbolic engine {} timed out after {} s", engine, timeout.toSeconds());
                        return new SymbolicVerdict(SymbolicVerdict.Outcome.TIMEOUT, engine,
                                "no answer within " + timeout.toSeconds() + " s");
                    }
                }
            }
        } catch (ExecutionException e) {
            log.warn("Symbolic engine {} failed: {}", engine, e.getCause().toString());
            return new SymbolicVerdict(SymbolicVerdict.Outcome.ERROR, engine, e.getCause().toString());
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return new SymbolicVerdict(SymbolicVerdict.Outcome.UNKNOWN, engine, "interrupted");
        }
    }

    private synchronized ExecutorService executor() {
        if (executor == null) {
            executor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "symbolic-" + adapter.engine());
                t.setDaemon(true);
                return t;
            });
        }
        return executor;
    }

    synchronized boolean hasExecutor() {
        return executor != null;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
