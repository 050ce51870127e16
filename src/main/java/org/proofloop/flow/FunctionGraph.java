package org.proofloop.flow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 一个函数的所有语句 + CFG + DFG + 每条语句的 def/use
 */
public class FunctionGraph {

    private final int functionId;
    private final List<Integer> statements;
    private final Map<Integer, Set<SlotKey>> defs;
    private final Map<Integer, Set<SlotKey>> uses;
    private final ControlFlowGraph cfg;
    private final List<DfgEdge> dfg;

    // DFG 后继 / 前驱：定义语句 id -> 使用语句 id
    private final Map<Integer, List<Integer>> dfgSucc = new TreeMap<>();
    private final Map<Integer, List<Integer>> dfgPred = new TreeMap<>();

    FunctionGraph(int functionId, List<Integer> statements, Map<Integer, Set<SlotKey>> defs,
                  Map<Integer, Set<SlotKey>> uses, ControlFlowGraph cfg, List<DfgEdge> dfg) {
        this.functionId = functionId;
        this.statements = List.copyOf(statements);
        this.defs = Collections.unmodifiableMap(defs);
        this.uses = Collections.unmodifiableMap(uses);
        this.cfg = cfg;
        this.dfg = List.copyOf(dfg);
        for (DfgEdge e : dfg) {
            List<Integer> s = dfgSucc.computeIfAbsent(e.from(), k -> new ArrayList<>());
            if (!s.contains(e.to())) s.add(e.to());
            List<Integer> p = dfgPred.computeIfAbsent(e.to(), k -> new ArrayList<>());
            if (!p.contains(e.from())) p.add(e.from());
        }
        dfgSucc.values().forEach(Collections::sort);
        dfgPred.values().forEach(Collections::sort);
    }

    public int getFunctionId() {
        return functionId;
    }

    public List<Integer> statements() {
        return statements;
    }

    public Set<SlotKey> defsOf(int stmtId) {
        return defs.getOrDefault(stmtId, Set.of());
    }

    public Set<SlotKey> usesOf(int stmtId) {
        return uses.getOrDefault(stmtId, Set.of());
    }

    public ControlFlowGraph cfg() {
        return cfg;
    }

    public List<DfgEdge> dfg() {
        return dfg;
    }

    public List<Integer> dataUses(int stmtId) {
        return dfgSucc.getOrDefault(stmtId, List.of());
    }

    public List<Integer> dataDefinitions(int stmtId) {
        return dfgPred.getOrDefault(stmtId, List.of());
    }
}
