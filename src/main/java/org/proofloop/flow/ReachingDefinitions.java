package org.proofloop.flow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 构建数据流图 (DFG) - 使用到达定值 (Reaching Definitions) 分析
 * <p>
 * 对普通槽的写入是强更新（杀死同一槽的其它定值）；
 * 对 mapping/数组元素槽的写入是弱更新，不杀死任何定值。
 */
public class ReachingDefinitions {

    private ReachingDefinitions() {
    }

    public static List<DfgEdge> compute(List<Integer> stmts, ControlFlowGraph cfg,
                                        Map<Integer, Set<SlotKey>> defs, Map<Integer, Set<SlotKey>> uses) {
        // 1. 预处理：槽 -> 定义它的所有语句
        Map<SlotKey, Set<Integer>> slotToDefs = new HashMap<>();
        for (int s : stmts) {
            for (SlotKey v : defs.getOrDefault(s, Set.of())) {
                slotToDefs.computeIfAbsent(v, k -> new HashSet<>()).add(s);
            }
        }

        // 2. 初始化 IN 和 OUT 集合
        Map<Integer, Set<Integer>> in = new HashMap<>();
        Map<Integer, Set<Integer>> out = new HashMap<>();
        for (int s : stmts) {
            in.put(s, new HashSet<>());
            out.put(s, new HashSet<>());
        }

        // 3. 迭代计算直到不动点
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int u : stmts) {
                // IN[u] = Union(OUT[p]) for p in preds[u]
                Set<Integer> newIn = new HashSet<>();
                for (int p : cfg.predecessors(u)) {
                    Set<Integer> o = out.get(p);
                    if (o != null) newIn.addAll(o);
                }

                // OUT[u] = GEN[u] U (IN[u] - KILL[u])
                Set<Integer> newOut = new HashSet<>(newIn);
                Set<SlotKey> defined = defs.getOrDefault(u, Set.of());
                for (SlotKey v : defined) {
                    if (!v.isElement()) {
                        newOut.removeAll(slotToDefs.get(v));
                    }
                }
                if (!defined.isEmpty()) {
                    newOut.add(u);
                }

                if (!newIn.equals(in.get(u)) || !newOut.equals(out.get(u))) {
                    in.put(u, newIn);
                    out.put(u, newOut);
                    changed = true;
                }
            }
        }

        // 4. 构建 DFG 边：对 u 使用的槽 v，IN[u] 中定义了 v 的语句 d，添加 d -> u
        List<DfgEdge> edges = new ArrayList<>();
        for (int u : stmts) {
            for (SlotKey v : uses.getOrDefault(u, Set.of())) {
                Set<Integer> reaching = new TreeSet<>(in.get(u));
                for (int d : reaching) {
                    if (defs.getOrDefault(d, Set.of()).contains(v)) {
                        edges.add(new DfgEdge(d, u, v));
                    }
                }
            }
        }
        edges.sort(Comparator.comparingInt(DfgEdge::from)
                .thenComparingInt(DfgEdge::to)
                .thenComparing(e -> e.slot().toString()));
        return edges;
    }
}
