package org.proofloop.flow;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.Statement;
import org.proofloop.parse.StatementParts;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 收集一条语句定义 (def) 和使用 (use) 的存储槽
 * <p>
 * 只处理访问链的最顶层表达式，例如 {@code a.b[k]} 只产生一个槽
 * {@code a.b[*]}（外加根变量 {@code a} 的读取），不会把中间的 {@code a.b} 也当成读取。
 */
public class DefUseCollector {

    // mapping / 集合的读写方法
    private static final Set<String> ELEMENT_READS =
            Set.of("get", "getOrDefault", "containsKey", "contains", "length", "size");
    private static final Set<String> ELEMENT_WRITES =
            Set.of("put", "putIfAbsent", "remove", "merge", "compute", "computeIfAbsent",
                    "replace", "push", "pop", "add", "addAll", "set", "clear", "delete");

    private final ContractIndex contracts;
    private final int functionId;
    private final int contractId;
    private final Map<String, String> localTypes = new HashMap<>();

    public DefUseCollector(ContractIndex contracts, int functionId, int contractId, CallableDeclaration<?> function) {
        this.contracts = contracts;
        this.functionId = functionId;
        this.contractId = contractId;
        // 函数内的参数、局部变量（不区分块作用域）
        for (Parameter p : function.findAll(Parameter.class)) {
            localTypes.put(p.getNameAsString(), ContractIndex.baseTypeName(p.getType().asString()));
        }
        for (VariableDeclarator vd : function.findAll(VariableDeclarator.class)) {
            localTypes.put(vd.getNameAsString(), ContractIndex.baseTypeName(vd.getType().asString()));
        }
    }

    public boolean isLocal(String name) {
        return localTypes.containsKey(name);
    }

    public String localType(String name) {
        return localTypes.get(name);
    }

    public void collect(Statement stmt, Set<SlotKey> defs, Set<SlotKey> uses) {
        for (Node part : StatementParts.ownParts(stmt)) {
            part.walk(n -> visit(n, defs, uses));
        }
    }

    private void visit(Node n, Set<SlotKey> defs, Set<SlotKey> uses) {
        // 变量声明：def
        if (n instanceof VariableDeclarator vd) {
            defs.add(SlotKey.local(functionId, vd.getNameAsString()));
            return;
        }
        if (!(n instanceof Expression e) || !isChainTop(e)) {
            return;
        }

        if (e instanceof MethodCallExpr call) {
            // 只有 mapping/集合访问才是槽访问；其它调用的接收者会作为独立的链顶被处理
            if (call.getScope().isEmpty()) return;
            SlotKey base = slotOf(call.getScope().get());
            if (base == null) return;
            String name = call.getNameAsString();
            if (ELEMENT_WRITES.contains(name)) {
                SlotKey element = base.member("[*]");
                defs.add(element);
                if (!name.startsWith("put") && !name.equals("set") && !name.equals("clear")) {
                    uses.add(element);
                }
                addRootUse(base, uses);
            } else if (ELEMENT_READS.contains(name)) {
                uses.add(base.member("[*]"));
                addRootUse(base, uses);
            }
            return;
        }

        SlotKey slot = slotOf(e);
        if (slot == null) return;

        Node parent = e.getParentNode().orElse(null);
        if (parent instanceof AssignExpr assign && assign.getTarget() == e) {
            // 赋值左值：def；复合赋值同时是 use
            defs.add(slot);
            if (assign.getOperator() != AssignExpr.Operator.ASSIGN) uses.add(slot);
            addRootUse(slot, uses);
            return;
        }
        if (parent instanceof UnaryExpr unary && isIncDec(unary.getOperator())) {
            defs.add(slot);
            uses.add(slot);
            return;
        }
        uses.add(slot);
        addRootUse(slot, uses);
    }

    /**
     * 成员/元素访问同时读取根变量引用
     */
    private void addRootUse(SlotKey slot, Set<SlotKey> uses) {
        String path = slot.path();
        int cut = indexOfAny(path, '.', '[');
        if (cut <= 0) return;
        String root = path.substring(0, cut);
        SlotKey rootKey;
        if (slot.owner().startsWith("fn:")) {
            rootKey = SlotKey.local(functionId, root);
        } else if (slot.kind() == SlotKind.UNRESOLVED) {
            rootKey = SlotKey.unresolved(root);
        } else {
            rootKey = SlotKey.state(slot.owner(), root);
        }
        uses.add(rootKey);
    }

    private static int indexOfAny(String s, char a, char b) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == a || c == b) return i;
        }
        return -1;
    }

    private static boolean isIncDec(UnaryExpr.Operator op) {
        return op == UnaryExpr.Operator.PREFIX_INCREMENT || op == UnaryExpr.Operator.PREFIX_DECREMENT
                || op == UnaryExpr.Operator.POSTFIX_INCREMENT || op == UnaryExpr.Operator.POSTFIX_DECREMENT;
    }

    /**
     * 表达式是否位于访问链的顶端（不是外层字段访问/元素访问/集合访问的接收者）
     */
    private static boolean isChainTop(Expression e) {
        Node parent = e.getParentNode().orElse(null);
        if (parent instanceof FieldAccessExpr fa && fa.getScope() == e) return false;
        if (parent instanceof ArrayAccessExpr aa && aa.getName() == e) return false;
        if (parent instanceof MethodCallExpr mc && mc.getScope().isPresent() && mc.getScope().get() == e) {
            String name = mc.getNameAsString();
            return !(ELEMENT_READS.contains(name) || ELEMENT_WRITES.contains(name));
        }
        if (parent instanceof EnclosedExpr || parent instanceof CastExpr) {
            return !(parent.getParentNode().orElse(null) instanceof FieldAccessExpr)
                    && !(parent.getParentNode().orElse(null) instanceof ArrayAccessExpr);
        }
        return true;
    }

    /**
     * 把访问路径表达式解析为符号槽；不是访问路径时返回 null
     */
    SlotKey slotOf(Expression e) {
        if (e instanceof NameExpr name) {
            return nameSlot(name.getNameAsString());
        }
        if (e instanceof FieldAccessExpr fa) {
            Expression scope = fa.getScope();
            if (scope.isThisExpr() || scope.isSuperExpr()) {
                // this.x 一定是状态变量，即使字段声明不在分析范围内
                SlotKey field = fieldSlot(fa.getNameAsString());
                return field.kind() == SlotKind.STATE
                        ? field : SlotKey.state(contracts.nameOf(contractId), fa.getNameAsString());
            }
            SlotKey base = slotOf(scope);
            return base == null ? null : base.member("." + fa.getNameAsString());
        }
        if (e instanceof ArrayAccessExpr aa) {
            SlotKey base = slotOf(aa.getName());
            return base == null ? null : base.member("[*]");
        }
        if (e instanceof MethodCallExpr mc && mc.getScope().isPresent()) {
            String name = mc.getNameAsString();
            if (ELEMENT_READS.contains(name) && !name.equals("contains") && !name.equals("containsKey")) {
                SlotKey base = slotOf(mc.getScope().get());
                return base == null ? null : base.member("[*]");
            }
            return null;
        }
        if (e instanceof EnclosedExpr enclosed) {
            return slotOf(enclosed.getInner());
        }
        if (e instanceof CastExpr cast) {
            return slotOf(cast.getExpression());
        }
        return null;
    }

    private SlotKey nameSlot(String name) {
        if (isLocal(name)) {
            return SlotKey.local(functionId, name);
        }
        return fieldSlot(name);
    }

    private SlotKey fieldSlot(String name) {
        return contracts.fieldOwner(contractId, name)
                .map(owner -> SlotKey.state(contracts.nameOf(owner), name))
                .orElse(SlotKey.unresolved(name));
    }
}
