package org.proofloop.flow;

import org.proofloop.parse.AstNode;
import org.proofloop.parse.SourceUnit;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一次分析运行的只读结果：源码单元、每个函数的 CFG/DFG、调用点、继承关系
 * <p>
 * 构建完成后不再修改，切片和 HPG 组装可以在多个线程上共享。
 */
public class ProgramModel {

    private final List<SourceUnit> units;
    private final ContractIndex contracts;
    private final Map<Integer, SourceUnit> unitOfNode = new HashMap<>();
    private final Map<Integer, FunctionGraph> functions;
    private final Map<Integer, String> failedFunctions;
    private final List<CallSite> callSites;
    private final Map<Integer, String> unresolvedTargets;
    private final List<Inheritance> inheritance;
    private final List<UnresolvedReference> warnings;

    ProgramModel(List<SourceUnit> units, ContractIndex contracts, Map<Integer, FunctionGraph> functions,
                 Map<Integer, String> failedFunctions, List<CallSite> callSites,
                 Map<Integer, String> unresolvedTargets, List<Inheritance> inheritance,
                 List<UnresolvedReference> warnings) {
        this.units = List.copyOf(units);
        this.contracts = contracts;
        this.functions = Collections.unmodifiableMap(functions);
        this.failedFunctions = Collections.unmodifiableMap(failedFunctions);
        this.callSites = List.copyOf(callSites);
        this.unresolvedTargets = Collections.unmodifiableMap(unresolvedTargets);
        this.inheritance = List.copyOf(inheritance);
        this.warnings = List.copyOf(warnings);
        for (SourceUnit unit : units) {
            for (AstNode n : unit.nodes()) {
                unitOfNode.put(n.id, unit);
            }
        }
    }

    public List<SourceUnit> units() {
        return units;
    }

    public ContractIndex contracts() {
        return contracts;
    }

    public AstNode node(int id) {
        SourceUnit unit = unitOfNode.get(id);
        if (unit == null) {
            throw new IllegalArgumentException("Unknown node " + id);
        }
        return unit.node(id);
    }

    public boolean hasNode(int id) {
        return unitOfNode.containsKey(id);
    }

    public SourceUnit unitOf(int id) {
        return unitOfNode.get(id);
    }

    public Optional<FunctionGraph> function(int functionId) {
        return Optional.ofNullable(functions.get(functionId));
    }

    public Map<Integer, FunctionGraph> functions() {
        return functions;
    }

    /**
     * 依赖分析失败的函数（编号 -> 原因），其中的锚点无法切片
     */
    public Map<Integer, String> failedFunctions() {
        return failedFunctions;
    }

    public List<CallSite> callSites() {
        return callSites;
    }

    /**
     * 无法解析的调用目标：哨兵函数编号 -> 被调名称
     */
    public Map<Integer, String> unresolvedTargets() {
        return unresolvedTargets;
    }

    public List<Inheritance> inheritance() {
        return inheritance;
    }

    public List<UnresolvedReference> warnings() {
        return warnings;
    }
}
