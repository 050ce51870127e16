package org.proofloop.anchor;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.WhileStmt;
import org.proofloop.parse.AstNode;
import org.proofloop.parse.NodeRole;
import org.proofloop.parse.SourceUnit;
import org.proofloop.parse.StatementParts;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 用锚点词表扫描源码单元中的每条语句
 * <p>
 * 匹配只读词表和 AST，不修改任何状态，可以在多个线程上同时调用。
 */
public class AnchorMatcher {

    // 参数即守卫条件的调用
    private static final Set<String> GUARD_CALLS = Set.of("require", "assert", "assertTrue", "checkState");

    private final AnchorVocabulary vocabulary;

    public AnchorMatcher(AnchorVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * @return 命中列表，按节点编号升序，同一节点内按词表顺序
     */
    public List<AnchorOccurrence> match(SourceUnit unit) {
        List<AnchorOccurrence> out = new ArrayList<>();
        for (AstNode node : unit.nodesWithRole(NodeRole.STATEMENT)) {
            Statement stmt = (Statement) node.astNode;
            Set<AnchorPattern> hits = new LinkedHashSet<>();
            for (Node part : StatementParts.ownParts(stmt)) {
                part.walk(n -> hits.addAll(matchExpression(n, stmt)));
            }
            for (AnchorPattern p : vocabulary.getPatterns()) {
                if (hits.contains(p)) {
                    out.add(new AnchorOccurrence(p.getId(), p.getCategory(), node.id,
                            node.functionId, node.contractId, unit.getName(), node.lineStart));
                }
            }
        }
        return out;
    }

    private List<AnchorPattern> matchExpression(Node n, Statement stmt) {
        String identifier;
        String scope = null;
        if (n instanceof MethodCallExpr call) {
            identifier = call.getNameAsString();
            scope = call.getScope().map(Node::toString).orElse(null);
        } else if (n instanceof FieldAccessExpr access) {
            identifier = access.getNameAsString();
            scope = access.getScope().toString();
        } else if (n instanceof NameExpr name) {
            identifier = name.getNameAsString();
        } else if (n instanceof ObjectCreationExpr creation) {
            identifier = creation.getType().getNameAsString();
        } else {
            return List.of();
        }

        String kind = n.getClass().getSimpleName();
        boolean discarded = n.getParentNode().map(p -> p instanceof ExpressionStmt).orElse(false);
        boolean condition = inCondition(n, stmt);

        List<AnchorPattern> hits = new ArrayList<>();
        for (AnchorPattern p : vocabulary.getPatterns()) {
            if (p.matches(kind, identifier, scope, discarded, condition)) {
                hits.add(p);
            }
        }
        return hits;
    }

    static boolean inCondition(Node n, Statement stmt) {
        Node child = n;
        Node cur = n.getParentNode().orElse(null);
        while (cur != null) {
            if (cur instanceof IfStmt is && is.getCondition() == child) return true;
            if (cur instanceof WhileStmt ws && ws.getCondition() == child) return true;
            if (cur instanceof DoStmt ds && ds.getCondition() == child) return true;
            if (cur instanceof ForStmt fs && fs.getCompare().isPresent() && fs.getCompare().get() == child) return true;
            if (cur instanceof ConditionalExpr ce && ce.getCondition() == child) return true;
            if (cur instanceof AssertStmt as && as.getCheck() == child) return true;
            if (cur instanceof MethodCallExpr mc && GUARD_CALLS.contains(mc.getNameAsString())
                    && containsSame(mc.getArguments(), child)) return true;
            if (cur == stmt) return false;
            child = cur;
            cur = cur.getParentNode().orElse(null);
        }
        return false;
    }

    // NodeList.contains 用的是结构相等，这里需要同一个节点
    private static boolean containsSame(NodeList<?> list, Node target) {
        for (Node n : list) {
            if (n == target) return true;
        }
        return false;
    }
}
