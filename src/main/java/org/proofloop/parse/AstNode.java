package org.proofloop.parse;

import com.github.javaparser.ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 结构节点：合约（类型声明）、函数（方法/构造器）或一条语句
 */
public class AstNode {
    public final int id;            // 运行内唯一编号
    public final NodeRole role;
    public final String kind;       // JavaParser 节点类名
    public final String name;       // 合约/函数名；语句为头部源码
    public final int lineStart;     // 起始行号
    public final int lineEnd;       // 结束行号
    public final int parentId;      // 语法父节点，根声明为 -1
    public final int functionId;    // 所属函数，没有则为 -1
    public final int contractId;    // 所属合约

    // 只在构建 SourceUnit 时追加
    final List<Integer> children = new ArrayList<>();

    // AST 节点引用（不参与 JSON 序列化）
    public final transient Node astNode;

    AstNode(int id, NodeRole role, String kind, String name, int lineStart, int lineEnd,
            int parentId, int functionId, int contractId, Node astNode) {
        this.id = id;
        this.role = role;
        this.kind = kind;
        this.name = name;
        this.lineStart = lineStart;
        this.lineEnd = lineEnd;
        this.parentId = parentId;
        this.functionId = functionId;
        this.contractId = contractId;
        this.astNode = astNode;
    }

    public List<Integer> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isRoot() {
        return parentId < 0;
    }

    @Override
    public String toString() {
        return role + "#" + id + "(" + kind + " " + name + " @" + lineStart + ")";
    }
}
