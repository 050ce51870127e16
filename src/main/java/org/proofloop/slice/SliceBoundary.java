package org.proofloop.slice;

/**
 * 因上界未被纳入切片的依赖边：inside 在切片内，outside 不在
 */
public record SliceBoundary(int inside, int outside, DependencyRelation relation, Reason reason) {

    public enum Reason {
        DEPTH,
        NODE_COUNT
    }
}
