package org.proofloop.slice;

import org.proofloop.anchor.AnchorOccurrence;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 锚点的控制 + 数据依赖闭包
 * <p>
 * 因上界而没有纳入的依赖边全部记录在 {@link #boundaries()} 中，不会被静默丢弃。
 */
public final class Slice {

    private final AnchorOccurrence anchor;
    private final SortedSet<Integer> nodeIds;
    private final SortedSet<Integer> functionIds;
    private final SortedSet<Integer> contractIds;
    private final List<SliceBoundary> boundaries;
    private final int depth;

    public Slice(AnchorOccurrence anchor, SortedSet<Integer> nodeIds, SortedSet<Integer> functionIds,
                 SortedSet<Integer> contractIds, List<SliceBoundary> boundaries, int depth) {
        this.anchor = anchor;
        this.nodeIds = Collections.unmodifiableSortedSet(new TreeSet<>(nodeIds));
        this.functionIds = Collections.unmodifiableSortedSet(new TreeSet<>(functionIds));
        this.contractIds = Collections.unmodifiableSortedSet(new TreeSet<>(contractIds));
        this.boundaries = List.copyOf(boundaries);
        this.depth = depth;
    }

    public AnchorOccurrence anchor() {
        return anchor;
    }

    public SortedSet<Integer> nodeIds() {
        return nodeIds;
    }

    public SortedSet<Integer> functionIds() {
        return functionIds;
    }

    public SortedSet<Integer> contractIds() {
        return contractIds;
    }

    public List<SliceBoundary> boundaries() {
        return boundaries;
    }

    public boolean boundaryReached() {
        return !boundaries.isEmpty();
    }

    /**
     * 实际展开的依赖层数
     */
    public int depth() {
        return depth;
    }

    public boolean contains(int nodeId) {
        return nodeIds.contains(nodeId);
    }

    @Override
    public String toString() {
        return "Slice[" + anchor.patternId() + " @" + anchor.nodeId() + ": " + nodeIds
                + (boundaryReached() ? " (boundary " + boundaries.size() + ")" : "") + "]";
    }
}
