package org.proofloop.flow;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import org.proofloop.parse.AstNode;
import org.proofloop.parse.NodeRole;
import org.proofloop.parse.SourceUnit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 跨源码单元的合约索引：字段、函数、继承关系。构建后只读。
 */
public class ContractIndex {

    static class ContractInfo {
        final int id;
        final String name;
        final Map<String, String> fieldTypes = new LinkedHashMap<>();
        final List<String> superNames = new ArrayList<>();
        final Map<String, List<AstNode>> functions = new HashMap<>();

        ContractInfo(int id, String name) {
            this.id = id;
            this.name = name;
        }
    }

    private final Map<Integer, ContractInfo> byId = new LinkedHashMap<>();
    private final Map<String, ContractInfo> byName = new HashMap<>();

    public ContractIndex(List<SourceUnit> units) {
        for (SourceUnit unit : units) {
            for (AstNode n : unit.nodes()) {
                if (n.role == NodeRole.CONTRACT) {
                    addContract(n);
                } else if (n.role == NodeRole.FUNCTION) {
                    ContractInfo owner = byId.get(n.contractId);
                    if (owner != null) {
                        owner.functions.computeIfAbsent(n.name, k -> new ArrayList<>()).add(n);
                    }
                }
            }
        }
    }

    private void addContract(AstNode n) {
        ContractInfo info = new ContractInfo(n.id, n.name);
        TypeDeclaration<?> td = (TypeDeclaration<?>) n.astNode;
        for (FieldDeclaration fd : td.getFields()) {
            for (VariableDeclarator vd : fd.getVariables()) {
                info.fieldTypes.put(vd.getNameAsString(), baseTypeName(vd.getType().asString()));
            }
        }
        if (td instanceof ClassOrInterfaceDeclaration cid) {
            for (ClassOrInterfaceType t : cid.getExtendedTypes()) info.superNames.add(t.getNameAsString());
            for (ClassOrInterfaceType t : cid.getImplementedTypes()) info.superNames.add(t.getNameAsString());
        }
        byId.put(n.id, info);
        // 重名时保留先出现的
        byName.putIfAbsent(n.name, info);
    }

    static String baseTypeName(String type) {
        String t = type;
        int lt = t.indexOf('<');
        if (lt >= 0) t = t.substring(0, lt);
        t = t.replace("[]", "").trim();
        int dot = t.lastIndexOf('.');
        return dot >= 0 ? t.substring(dot + 1) : t;
    }

    public Optional<Integer> contractByName(String name) {
        ContractInfo info = byName.get(baseTypeName(name));
        return info == null ? Optional.empty() : Optional.of(info.id);
    }

    public String nameOf(int contractId) {
        ContractInfo info = byId.get(contractId);
        return info == null ? "?" : info.name;
    }

    /**
     * 已分析的直接父类型
     */
    public List<Integer> superTypes(int contractId) {
        ContractInfo info = byId.get(contractId);
        if (info == null) return List.of();
        List<Integer> out = new ArrayList<>();
        for (String s : info.superNames) {
            ContractInfo sup = byName.get(s);
            if (sup != null && sup.id != contractId) out.add(sup.id);
        }
        return out;
    }

    /**
     * 沿继承链查找声明了字段的合约
     */
    public Optional<Integer> fieldOwner(int contractId, String field) {
        return findUp(contractId, new HashSet<>(), info -> info.fieldTypes.containsKey(field));
    }

    public Optional<String> fieldType(int contractId, String field) {
        return fieldOwner(contractId, field).map(id -> byId.get(id).fieldTypes.get(field));
    }

    /**
     * 按名称和参数个数解析函数（沿继承链向上）
     */
    public Optional<Integer> resolveFunction(int contractId, String name, int argc) {
        Optional<Integer> owner = findUp(contractId, new HashSet<>(), info -> match(info, name, argc) != null);
        return owner.map(id -> match(byId.get(id), name, argc).id);
    }

    private static AstNode match(ContractInfo info, String name, int argc) {
        List<AstNode> candidates = info.functions.get(name);
        if (candidates == null) return null;
        AstNode fallback = null;
        for (AstNode fn : candidates) {
            Node decl = fn.astNode;
            if (decl instanceof CallableDeclaration<?> cd && cd.getParameters().size() == argc) {
                return fn;
            }
            if (fallback == null) fallback = fn;
        }
        return fallback;
    }

    private Optional<Integer> findUp(int contractId, Set<Integer> visited, Predicate<ContractInfo> test) {
        if (!visited.add(contractId)) return Optional.empty();
        ContractInfo info = byId.get(contractId);
        if (info == null) return Optional.empty();
        if (test.test(info)) return Optional.of(contractId);
        for (int sup : superTypes(contractId)) {
            Optional<Integer> found = findUp(sup, visited, test);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }
}
