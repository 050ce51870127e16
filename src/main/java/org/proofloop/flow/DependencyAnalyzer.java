package org.proofloop.flow;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.proofloop.parse.AstNode;
import org.proofloop.parse.IdAllocator;
import org.proofloop.parse.NodeRole;
import org.proofloop.parse.SourceUnit;
import org.proofloop.parse.StatementParts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 依赖分析：对每个函数构建 CFG + DFG，解析调用点和继承关系
 */
public class DependencyAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DependencyAnalyzer.class);

    private final IdAllocator ids;

    public DependencyAnalyzer(IdAllocator ids) {
        this.ids = ids;
    }

    /**
     * 调用点在哨兵编号分配之前的中间形式
     */
    private record PendingCall(int statementId, int callerId, String callee, Optional<Integer> target,
                               String unitName, int line) {
    }

    public ProgramModel analyze(List<SourceUnit> units) {
        ContractIndex contracts = new ContractIndex(units);
        CallResolver resolver = new CallResolver(contracts);

        Map<Integer, FunctionGraph> functions = new TreeMap<>();
        Map<Integer, String> failed = new TreeMap<>();
        List<PendingCall> pending = new ArrayList<>();
        List<Inheritance> inheritance = new ArrayList<>();

        for (SourceUnit unit : units) {
            for (AstNode contract : unit.nodesWithRole(NodeRole.CONTRACT)) {
                for (int sup : contracts.superTypes(contract.id)) {
                    inheritance.add(new Inheritance(contract.id, sup));
                }
            }
            for (AstNode fn : unit.nodesWithRole(NodeRole.FUNCTION)) {
                try {
                    List<PendingCall> calls = new ArrayList<>();
                    functions.put(fn.id, analyzeFunction(unit, fn, contracts, resolver, calls));
                    pending.addAll(calls);
                } catch (RuntimeException e) {
                    // 单个函数失败不影响整个运行
                    log.warn("Dependency analysis failed for {}.{} in {}: {}",
                            contracts.nameOf(fn.contractId), fn.name, unit.getName(), e.toString());
                    failed.put(fn.id, e.toString());
                }
            }
        }

        // 哨兵编号按被调名称排序分配，保证可复现
        Set<String> unresolvedNames = new TreeSet<>();
        for (PendingCall c : pending) {
            if (c.target().isEmpty()) unresolvedNames.add(c.callee());
        }
        Map<String, Integer> sentinelIds = new HashMap<>();
        Map<Integer, String> sentinels = new TreeMap<>();
        for (String name : unresolvedNames) {
            int id = ids.next();
            sentinelIds.put(name, id);
            sentinels.put(id, name);
        }

        List<CallSite> callSites = new ArrayList<>();
        List<UnresolvedReference> warnings = new ArrayList<>();
        for (PendingCall c : pending) {
            if (c.target().isPresent()) {
                callSites.add(new CallSite(c.statementId(), c.callerId(), c.callee(), c.target().get(), true));
            } else {
                callSites.add(new CallSite(c.statementId(), c.callerId(), c.callee(), sentinelIds.get(c.callee()), false));
                warnings.add(new UnresolvedReference(c.unitName(), c.line(), c.statementId(), c.callee(),
                        "target not found among analyzed contracts"));
            }
        }
        log.info("Dependency analysis: {} functions, {} call sites ({} unresolved), {} failed",
                functions.size(), callSites.size(), warnings.size(), failed.size());
        return new ProgramModel(units, contracts, functions, failed, callSites, sentinels, inheritance, warnings);
    }

    private FunctionGraph analyzeFunction(SourceUnit unit, AstNode fn, ContractIndex contracts,
                                          CallResolver resolver, List<PendingCall> calls) {
        CallableDeclaration<?> decl = (CallableDeclaration<?>) fn.astNode;
        BlockStmt body = null;
        if (decl instanceof MethodDeclaration md) {
            body = md.getBody().orElse(null);
        } else if (decl instanceof ConstructorDeclaration ctor) {
            body = ctor.getBody();
        }

        DefUseCollector collector = new DefUseCollector(contracts, fn.id, fn.contractId, decl);
        List<Integer> stmts = new ArrayList<>();
        Map<Integer, Set<SlotKey>> defs = new HashMap<>();
        Map<Integer, Set<SlotKey>> uses = new HashMap<>();

        for (AstNode s : unit.statementsOf(fn.id)) {
            Statement stmt = (Statement) s.astNode;
            Set<SlotKey> d = new LinkedHashSet<>();
            Set<SlotKey> u = new LinkedHashSet<>();
            collector.collect(stmt, d, u);
            stmts.add(s.id);
            defs.put(s.id, d);
            uses.put(s.id, u);
            collectCalls(unit, s, stmt, fn, resolver, collector, calls);
        }

        ControlFlowGraph cfg = new CfgBuilder(unit).build(fn.id, body);
        List<DfgEdge> dfg = ReachingDefinitions.compute(stmts, cfg, defs, uses);
        return new FunctionGraph(fn.id, stmts, defs, uses, cfg, dfg);
    }

    private void collectCalls(SourceUnit unit, AstNode s, Statement stmt, AstNode fn, CallResolver resolver,
                              DefUseCollector collector, List<PendingCall> calls) {
        for (Node part : StatementParts.ownParts(stmt)) {
            part.walk(n -> {
                if (n instanceof MethodCallExpr call && !CallResolver.isBuiltin(call)) {
                    calls.add(new PendingCall(s.id, fn.id, call.getNameAsString(),
                            resolver.resolve(call, fn.contractId, collector), unit.getName(), s.lineStart));
                } else if (n instanceof ObjectCreationExpr creation) {
                    Optional<Integer> ctor = resolver.resolve(creation);
                    // JDK 等外部类型的构造不记录
                    if (ctor.isPresent()) {
                        calls.add(new PendingCall(s.id, fn.id, creation.getType().getNameAsString(),
                                ctor, unit.getName(), s.lineStart));
                    }
                }
            });
        }
    }
}
