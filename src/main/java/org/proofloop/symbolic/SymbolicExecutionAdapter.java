package org.proofloop.symbolic;

import java.io.IOException;

/**
 * 外部符号执行引擎的适配接口。调用方负责超时，实现应当响应线程中断。
 */
public interface SymbolicExecutionAdapter {

    String engine();

    SymbolicVerdict checkFeasibility(TransactionSequence sequence) throws IOException;
}
