package org.proofloop.flow;

public enum CfgEdgeKind {
    SEQUENTIAL,
    BRANCH,
    LOOP_BACK,
    JUMP
}
