package org.proofloop.slice;

/**
 * 切片上界，由配置提供
 *
 * @param maxDepth 从锚点出发的最大依赖步数
 * @param maxNodes 切片最多包含的语句数（含锚点）
 */
public record SliceBounds(int maxDepth, int maxNodes) {

    public SliceBounds {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0: " + maxDepth);
        if (maxNodes < 1) throw new IllegalArgumentException("maxNodes must be >= 1: " + maxNodes);
    }
}
