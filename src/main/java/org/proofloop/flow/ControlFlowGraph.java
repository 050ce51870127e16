package org.proofloop.flow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 单个函数的控制流图，节点为语句编号
 */
public class ControlFlowGraph {

    private final int functionId;
    private final List<CfgEdge> edges;
    private final Set<Integer> entries;
    private final Map<Integer, ExitKind> exits;
    private final Map<Integer, List<Integer>> succ = new TreeMap<>();
    private final Map<Integer, List<Integer>> pred = new TreeMap<>();

    ControlFlowGraph(int functionId, List<CfgEdge> edges, Set<Integer> entries, Map<Integer, ExitKind> exits) {
        this.functionId = functionId;
        this.edges = List.copyOf(edges);
        this.entries = Collections.unmodifiableSet(new TreeSet<>(entries));
        this.exits = Collections.unmodifiableMap(new TreeMap<>(exits));
        for (CfgEdge e : edges) {
            succ.computeIfAbsent(e.from(), k -> new ArrayList<>()).add(e.to());
            pred.computeIfAbsent(e.to(), k -> new ArrayList<>()).add(e.from());
        }
        succ.values().forEach(Collections::sort);
        pred.values().forEach(Collections::sort);
    }

    public int getFunctionId() {
        return functionId;
    }

    public List<CfgEdge> edges() {
        return edges;
    }

    /**
     * 函数入口处的第一批语句
     */
    public Set<Integer> entries() {
        return entries;
    }

    /**
     * 终止出口：return / throw / revert / 落出函数末尾
     */
    public Map<Integer, ExitKind> exits() {
        return exits;
    }

    public List<Integer> successors(int id) {
        return succ.getOrDefault(id, List.of());
    }

    public List<Integer> predecessors(int id) {
        return pred.getOrDefault(id, List.of());
    }
}
