package org.proofloop.parse;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 语句“自身”的表达式部分。控制结构只取头部（条件、初始化、更新等），
 * 它们的子语句是独立节点，不算在内。
 */
public final class StatementParts {

    private StatementParts() {
    }

    public static List<Node> ownParts(Statement stmt) {
        List<Node> parts = new ArrayList<>();

        if (stmt instanceof IfStmt ifStmt) {
            parts.add(ifStmt.getCondition());
        } else if (stmt instanceof ForStmt forStmt) {
            parts.addAll(forStmt.getInitialization());
            forStmt.getCompare().ifPresent(parts::add);
            parts.addAll(forStmt.getUpdate());
        } else if (stmt instanceof ForEachStmt forEach) {
            parts.add(forEach.getVariable());
            parts.add(forEach.getIterable());
        } else if (stmt instanceof WhileStmt whileStmt) {
            parts.add(whileStmt.getCondition());
        } else if (stmt instanceof DoStmt doStmt) {
            parts.add(doStmt.getCondition());
        } else if (stmt instanceof SwitchStmt switchStmt) {
            parts.add(switchStmt.getSelector());
        } else if (stmt instanceof TryStmt tryStmt) {
            parts.addAll(tryStmt.getResources());
        } else if (stmt instanceof SynchronizedStmt sync) {
            parts.add(sync.getExpression());
        } else if (!(stmt instanceof LabeledStmt)) {
            // 普通语句：整棵子树
            parts.add(stmt);
        }
        return parts;
    }
}
