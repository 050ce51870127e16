package org.proofloop.hpg;

import org.proofloop.flow.CallSite;
import org.proofloop.flow.CfgEdge;
import org.proofloop.flow.DfgEdge;
import org.proofloop.flow.FunctionGraph;
import org.proofloop.flow.Inheritance;
import org.proofloop.flow.ProgramModel;
import org.proofloop.parse.AstNode;
import org.proofloop.slice.Slice;
import org.proofloop.slice.SliceBoundary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 把一组切片合并成一张 HPG：
 * - 切片语句及其语法祖先链（直到根合约）
 * - 切片语句之间的 cfg_next / dfg_reaches
 * - 调用点 -> 被调函数、调用方函数 -> 被调函数的 calls（含跨合约与未解析的哨兵）
 * - 图中合约之间的 inherits_from
 */
public class HpgAssembler {

    private static final Logger log = LoggerFactory.getLogger(HpgAssembler.class);

    static final String UNRESOLVED_KIND = "UnresolvedFunction";

    private final ProgramModel model;

    public HpgAssembler(ProgramModel model) {
        this.model = model;
    }

    public HeterogeneousProgramGraph assemble(List<Slice> slices, String vocabularyVersion) {
        HeterogeneousProgramGraph g = new HeterogeneousProgramGraph();
        g.setVocabularyVersion(vocabularyVersion);

        SortedSet<Integer> sliced = new TreeSet<>();
        SortedSet<Integer> functions = new TreeSet<>();
        for (Slice slice : slices) {
            sliced.addAll(slice.nodeIds());
            functions.addAll(slice.functionIds());
            g.addAnchor(slice.anchor());
            for (SliceBoundary b : slice.boundaries()) g.addBoundary(b);
        }

        for (int id : sliced) addWithAncestors(g, id);
        for (int fn : functions) {
            if (model.hasNode(fn)) addWithAncestors(g, fn);
        }

        // 控制流 / 数据流只连接两端都在切片里的语句
        for (int fn : functions) {
            FunctionGraph fg = model.function(fn).orElse(null);
            if (fg == null) continue;
            for (CfgEdge e : fg.cfg().edges()) {
                if (sliced.contains(e.from()) && sliced.contains(e.to())) {
                    g.addEdge(EdgeType.CFG_NEXT, e.from(), e.to());
                }
            }
            for (DfgEdge e : fg.dfg()) {
                if (sliced.contains(e.from()) && sliced.contains(e.to())) {
                    g.addEdge(new HpgEdge(EdgeType.DFG_REACHES, e.from(), e.to(), e.slot().toString()));
                }
            }
        }

        for (CallSite call : model.callSites()) {
            if (!sliced.contains(call.statementId())) continue;
            int target = call.targetId();
            if (call.resolved()) {
                addWithAncestors(g, target);
            } else {
                g.addNode(sentinel(target));
            }
            g.addEdge(EdgeType.CALLS, call.statementId(), target);
            g.addEdge(EdgeType.CALLS, call.callerFunctionId(), target);
        }

        for (Inheritance inh : model.inheritance()) {
            if (g.hasNode(inh.childContractId()) && g.hasNode(inh.parentContractId())) {
                g.addEdge(EdgeType.INHERITS_FROM, inh.childContractId(), inh.parentContractId());
            }
        }

        List<String> problems = g.validate();
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Assembled HPG is inconsistent: " + problems);
        }
        log.info("HPG assembled from {} slices: {} nodes, {} edges", slices.size(), g.nodeCount(), g.edgeCount());
        return g;
    }

    private void addWithAncestors(HeterogeneousProgramGraph g, int id) {
        AstNode n = model.node(id);
        g.addNode(toHpgNode(n));
        while (!n.isRoot()) {
            AstNode parent = model.node(n.parentId);
            g.addNode(toHpgNode(parent));
            g.addEdge(EdgeType.AST_CHILD_OF, n.id, parent.id);
            n = parent;
        }
    }

    private HpgNode sentinel(int id) {
        String name = model.unresolvedTargets().getOrDefault(id, "?");
        return new HpgNode(id, NodeType.FUNCTION, UNRESOLVED_KIND, name, 0, 0, id, -1);
    }

    static HpgNode toHpgNode(AstNode n) {
        return new HpgNode(n.id, NodeType.of(n.role), n.kind, n.name, n.lineStart, n.lineEnd,
                n.functionId, n.contractId);
    }
}
