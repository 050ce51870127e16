package org.proofloop.flow;

public record CfgEdge(int from, int to, CfgEdgeKind kind) {
}
