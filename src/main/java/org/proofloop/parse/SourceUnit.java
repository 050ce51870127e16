package org.proofloop.parse;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 一个可编译的源码单元。解析完成后不可变，可被多个工作线程共享读取。
 */
public final class SourceUnit {

    private final String name;
    private final transient CompilationUnit compilationUnit;
    private final Map<Integer, AstNode> nodes;
    private final List<Integer> declarations;
    private final Map<Node, Integer> index;

    SourceUnit(String name, CompilationUnit compilationUnit, TreeMap<Integer, AstNode> nodes,
               List<Integer> declarations, IdentityHashMap<Node, Integer> index) {
        this.name = name;
        this.compilationUnit = compilationUnit;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.declarations = List.copyOf(declarations);
        this.index = Collections.unmodifiableMap(index);
    }

    public String getName() {
        return name;
    }

    public CompilationUnit getCompilationUnit() {
        return compilationUnit;
    }

    /**
     * 顶层声明（合约）编号，按源码顺序
     */
    public List<Integer> declarations() {
        return declarations;
    }

    public AstNode node(int id) {
        AstNode n = nodes.get(id);
        if (n == null) {
            throw new IllegalArgumentException("No node " + id + " in " + name);
        }
        return n;
    }

    public boolean contains(int id) {
        return nodes.containsKey(id);
    }

    public Optional<Integer> idOf(Node astNode) {
        return Optional.ofNullable(index.get(astNode));
    }

    /**
     * 所有节点，按编号升序
     */
    public Iterable<AstNode> nodes() {
        return nodes.values();
    }

    public List<AstNode> nodesWithRole(NodeRole role) {
        List<AstNode> out = new ArrayList<>();
        for (AstNode n : nodes.values()) {
            if (n.role == role) out.add(n);
        }
        return out;
    }

    /**
     * 函数内的全部语句（按编号升序，即源码前序顺序）
     */
    public List<AstNode> statementsOf(int functionId) {
        List<AstNode> out = new ArrayList<>();
        for (AstNode n : nodes.values()) {
            if (n.role == NodeRole.STATEMENT && n.functionId == functionId) out.add(n);
        }
        return out;
    }

    public int size() {
        return nodes.size();
    }
}
