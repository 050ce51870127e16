package org.proofloop.slice;

import org.proofloop.anchor.AnchorOccurrence;
import org.proofloop.flow.CallSite;
import org.proofloop.flow.FunctionGraph;
import org.proofloop.flow.ProgramModel;
import org.proofloop.parse.AstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 锚点切片：从锚点出发做广度优先的双向遍历
 * （后向沿控制前驱/数据定值，前向沿控制后继/数据使用），直到没有新的依赖或到达上界。
 * <p>
 * 每一层按节点编号升序处理，结果只依赖输入，不依赖线程调度。
 */
public class DependencySlicer {

    private final ProgramModel model;
    private final SliceBounds bounds;

    public DependencySlicer(ProgramModel model, SliceBounds bounds) {
        this.model = model;
        this.bounds = bounds;
    }

    private record Neighbor(int id, DependencyRelation relation) {
    }

    public Slice slice(AnchorOccurrence anchor) {
        int fnId = anchor.functionId();
        FunctionGraph graph = model.function(fnId).orElseThrow(() -> new IllegalStateException(
                "No dependency graph for function " + fnId + ": "
                        + model.failedFunctions().getOrDefault(fnId, "not analyzed")));
        if (!graph.statements().contains(anchor.nodeId())) {
            throw new IllegalArgumentException("Anchor node " + anchor.nodeId() + " is not a statement of function " + fnId);
        }

        SortedSet<Integer> visited = new TreeSet<>();
        visited.add(anchor.nodeId());
        List<SliceBoundary> boundaries = new ArrayList<>();
        SortedSet<Integer> frontier = new TreeSet<>(visited);
        int depth = 0;

        while (!frontier.isEmpty()) {
            SortedSet<Integer> next = new TreeSet<>();
            for (int node : frontier) {
                for (Neighbor n : neighbors(graph, node)) {
                    if (visited.contains(n.id())) continue;
                    if (depth + 1 > bounds.maxDepth()) {
                        boundaries.add(new SliceBoundary(node, n.id(), n.relation(), SliceBoundary.Reason.DEPTH));
                    } else if (visited.size() >= bounds.maxNodes()) {
                        boundaries.add(new SliceBoundary(node, n.id(), n.relation(), SliceBoundary.Reason.NODE_COUNT));
                    } else {
                        visited.add(n.id());
                        next.add(n.id());
                    }
                }
            }
            if (next.isEmpty()) break;
            frontier = next;
            depth++;
        }

        // 同一层里先被记为边界、后又经其它路径纳入的节点不算边界
        boundaries.removeIf(b -> visited.contains(b.outside()));

        SortedSet<Integer> functions = new TreeSet<>();
        SortedSet<Integer> contracts = new TreeSet<>();
        for (int id : visited) {
            AstNode n = model.node(id);
            functions.add(n.functionId);
            contracts.add(n.contractId);
        }
        // 切片内调用点涉及的被调函数（跨合约）
        for (CallSite call : model.callSites()) {
            if (visited.contains(call.statementId()) && call.resolved()) {
                functions.add(call.targetId());
                contracts.add(model.node(call.targetId()).contractId);
            }
        }
        return new Slice(anchor, visited, functions, contracts, boundaries, depth);
    }

    private static List<Neighbor> neighbors(FunctionGraph g, int node) {
        List<Neighbor> out = new ArrayList<>();
        for (int p : g.cfg().predecessors(node)) out.add(new Neighbor(p, DependencyRelation.CONTROL_PREDECESSOR));
        for (int d : g.dataDefinitions(node)) out.add(new Neighbor(d, DependencyRelation.DATA_DEFINITION));
        for (int s : g.cfg().successors(node)) out.add(new Neighbor(s, DependencyRelation.CONTROL_SUCCESSOR));
        for (int u : g.dataUses(node)) out.add(new Neighbor(u, DependencyRelation.DATA_USE));
        return out;
    }
}
