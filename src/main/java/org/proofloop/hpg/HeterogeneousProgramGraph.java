package org.proofloop.hpg;

import org.proofloop.anchor.AnchorOccurrence;
import org.proofloop.slice.SliceBoundary;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 异构程序图：节点按编号寻址，边是 (类型, 源, 目标) 的集合
 * <p>
 * 加边时检查节点类型兼容性；ast_child_of 保持无环且每个节点只有一个父节点，
 * cfg_next / dfg_reaches 上的环（循环、递归）是合法结构。
 */
public class HeterogeneousProgramGraph {

    private final Map<Integer, HpgNode> nodes = new TreeMap<>();
    private final Set<HpgEdge> edges = new LinkedHashSet<>();
    private final Map<Integer, Integer> astParent = new HashMap<>();

    // 产物元数据：生成这张图的锚点、切片边界、词表版本
    private final List<AnchorOccurrence> anchors = new ArrayList<>();
    private final List<SliceBoundary> boundaries = new ArrayList<>();
    private String vocabularyVersion = "";

    /**
     * 按编号去重；同一编号的类型必须一致
     */
    public HpgNode addNode(HpgNode node) {
        HpgNode existing = nodes.get(node.id());
        if (existing != null) {
            if (existing.type() != node.type()) {
                throw new IllegalArgumentException("Node " + node.id() + " already present as " + existing.type()
                        + ", cannot re-add as " + node.type());
            }
            return existing;
        }
        nodes.put(node.id(), node);
        return node;
    }

    public boolean addEdge(EdgeType type, int source, int target) {
        return addEdge(new HpgEdge(type, source, target));
    }

    public boolean addEdge(HpgEdge edge) {
        HpgNode from = requireNode(edge.source());
        HpgNode to = requireNode(edge.target());
        EdgeType type = edge.type();
        if (!type.accepts(from.type(), to.type())) {
            throw new IllegalArgumentException(type + " cannot connect " + from.type() + " -> " + to.type()
                    + " (" + edge.source() + " -> " + edge.target() + ")");
        }
        if (type.requiresSameFunction() && from.functionId() != to.functionId()) {
            throw new IllegalArgumentException(type + " must stay within one function: "
                    + edge.source() + " in " + from.functionId() + ", " + edge.target() + " in " + to.functionId());
        }
        if (type == EdgeType.AST_CHILD_OF) {
            Integer parent = astParent.get(edge.source());
            if (parent != null) {
                if (parent == edge.target()) return false;
                throw new IllegalArgumentException("Node " + edge.source() + " already has syntactic parent " + parent);
            }
            if (isAstAncestor(edge.source(), edge.target())) {
                throw new IllegalArgumentException("ast_child_of cycle through " + edge.source());
            }
            astParent.put(edge.source(), edge.target());
        }
        return edges.add(edge);
    }

    // candidate 是否是 node 的语法祖先（含自身）
    private boolean isAstAncestor(int candidate, int node) {
        Integer cur = node;
        while (cur != null) {
            if (cur == candidate) return true;
            cur = astParent.get(cur);
        }
        return false;
    }

    private HpgNode requireNode(int id) {
        HpgNode n = nodes.get(id);
        if (n == null) {
            throw new IllegalArgumentException("Edge endpoint " + id + " is not a node of the graph");
        }
        return n;
    }

    public boolean hasNode(int id) {
        return nodes.containsKey(id);
    }

    public HpgNode node(int id) {
        return requireNode(id);
    }

    /**
     * 按编号升序
     */
    public Collection<HpgNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Set<HpgEdge> edges() {
        return Collections.unmodifiableSet(edges);
    }

    public List<HpgNode> nodesOf(NodeType type) {
        List<HpgNode> out = new ArrayList<>();
        for (HpgNode n : nodes.values()) {
            if (n.type() == type) out.add(n);
        }
        return out;
    }

    public List<HpgEdge> edgesOf(EdgeType type) {
        List<HpgEdge> out = new ArrayList<>();
        for (HpgEdge e : edges) {
            if (e.type() == type) out.add(e);
        }
        return out;
    }

    public boolean hasEdge(EdgeType type, int source, int target) {
        for (HpgEdge e : edges) {
            if (e.type() == type && e.source() == source && e.target() == target) return true;
        }
        return false;
    }

    public Integer astParentOf(int id) {
        return astParent.get(id);
    }

    /**
     * 结构约束检查：每个语句节点都必须有语法父节点
     *
     * @return 违反约束的描述，为空表示图合法
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        for (HpgNode n : nodes.values()) {
            if (n.type() == NodeType.STATEMENT && !astParent.containsKey(n.id())) {
                problems.add("Statement " + n.id() + " has no ast_child_of edge");
            }
            if (n.type() == NodeType.FUNCTION && n.contractId() >= 0 && !astParent.containsKey(n.id())) {
                problems.add("Function " + n.id() + " is detached from contract " + n.contractId());
            }
        }
        return problems;
    }

    public void addAnchor(AnchorOccurrence anchor) {
        if (!anchors.contains(anchor)) anchors.add(anchor);
    }

    public void addBoundary(SliceBoundary boundary) {
        if (!boundaries.contains(boundary)) boundaries.add(boundary);
    }

    public List<AnchorOccurrence> anchors() {
        return Collections.unmodifiableList(anchors);
    }

    public List<SliceBoundary> boundaries() {
        return Collections.unmodifiableList(boundaries);
    }

    public String getVocabularyVersion() {
        return vocabularyVersion;
    }

    public void setVocabularyVersion(String vocabularyVersion) {
        this.vocabularyVersion = vocabularyVersion == null ? "" : vocabularyVersion;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }
}
