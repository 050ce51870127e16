package org.proofloop.refine;

import org.proofloop.verify.CandidateProof;

import java.util.Optional;

/**
 * 外部生成器的回调接口：根据上一次的失败给出新的候选证明
 * <p>
 * 多个任务并发运行时同一个实例可能被多个线程调用。
 */
public interface ProofGenerator {

    /**
     * @return 新的候选证明；返回 empty 表示放弃，细化循环以 EXHAUSTED_RETRIES 结束
     */
    Optional<CandidateProof> refine(RefinementAttempt attempt);
}
