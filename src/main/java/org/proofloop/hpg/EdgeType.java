package org.proofloop.hpg;

import com.google.gson.annotations.SerializedName;

import java.util.Set;

import static org.proofloop.hpg.NodeType.CONTRACT;
import static org.proofloop.hpg.NodeType.FUNCTION;
import static org.proofloop.hpg.NodeType.STATEMENT;

/**
 * HPG 边类型及其允许连接的节点类型
 */
public enum EdgeType {
    @SerializedName("ast_child_of")
    AST_CHILD_OF(Set.of(pair(STATEMENT, STATEMENT), pair(STATEMENT, FUNCTION),
            pair(FUNCTION, CONTRACT), pair(CONTRACT, CONTRACT)), false),
    @SerializedName("cfg_next")
    CFG_NEXT(Set.of(pair(STATEMENT, STATEMENT)), true),
    @SerializedName("dfg_reaches")
    DFG_REACHES(Set.of(pair(STATEMENT, STATEMENT)), true),
    @SerializedName("calls")
    CALLS(Set.of(pair(STATEMENT, FUNCTION), pair(FUNCTION, FUNCTION)), false),
    @SerializedName("inherits_from")
    INHERITS_FROM(Set.of(pair(CONTRACT, CONTRACT)), false);

    private final Set<String> allowed;
    private final boolean sameFunction;

    EdgeType(Set<String> allowed, boolean sameFunction) {
        this.allowed = allowed;
        this.sameFunction = sameFunction;
    }

    private static String pair(NodeType from, NodeType to) {
        return from + "->" + to;
    }

    public boolean accepts(NodeType from, NodeType to) {
        return allowed.contains(pair(from, to));
    }

    /**
     * 两端必须属于同一个函数
     */
    public boolean requiresSameFunction() {
        return sameFunction;
    }
}
