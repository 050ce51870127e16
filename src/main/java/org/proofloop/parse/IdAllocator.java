package org.proofloop.parse;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 一次分析运行内共享的节点编号器，编号单调递增，绝不复用
 */
public class IdAllocator {

    private final AtomicInteger next = new AtomicInteger();

    public int next() {
        return next.getAndIncrement();
    }

    public int peek() {
        return next.get();
    }
}
