package org.proofloop.flow;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.*;
import org.proofloop.parse.SourceUnit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 构建控制流图 (CFG)
 * <p>
 * 基于 AST 递归：每次访问接收一组前驱“流”，返回执行完当前语句后仍可能继续的流，
 * 以正确处理嵌套、break/continue（含标签）以及 return/throw/revert 终止出口。
 */
public class CfgBuilder {

    private final SourceUnit unit;

    public CfgBuilder(SourceUnit unit) {
        this.unit = unit;
    }

    /**
     * 尚未连接的控制流：来自语句 from，连接到下一条语句时使用 kind
     */
    private record Flow(int from, CfgEdgeKind kind) {
    }

    /**
     * break 目标：循环或 switch。headId 为 continue 目标，switch 没有。
     */
    private static class Target {
        final int headId;
        final boolean loop;
        final String label;
        final Set<Flow> breaks = new LinkedHashSet<>();

        Target(int headId, boolean loop, String label) {
            this.headId = headId;
            this.loop = loop;
            this.label = label;
        }
    }

    // 单次构建的状态
    private final Map<Long, CfgEdge> edges = new LinkedHashMap<>();
    private final Map<Integer, ExitKind> exits = new HashMap<>();
    private final Deque<Target> targets = new ArrayDeque<>();
    private final Map<String, Set<Flow>> labelBreaks = new HashMap<>();
    private final Map<Integer, Set<Integer>> pads = new HashMap<>();
    private int nextPad = -2;
    private String pendingLabel;

    public ControlFlowGraph build(int functionId, BlockStmt body) {
        edges.clear();
        exits.clear();
        targets.clear();
        labelBreaks.clear();
        pads.clear();
        nextPad = -2;
        pendingLabel = null;

        if (body == null) {
            return new ControlFlowGraph(functionId, List.of(), Set.of(), Map.of());
        }

        // 虚拟入口：用占位点收集第一批语句
        int entryPad = newPad();
        Set<Flow> tail = visit(body, Set.of(new Flow(entryPad, CfgEdgeKind.SEQUENTIAL)));
        for (Flow f : tail) {
            if (f.from() >= 0) {
                exits.putIfAbsent(f.from(), ExitKind.FALLTHROUGH);
            }
        }
        return new ControlFlowGraph(functionId, new ArrayList<>(edges.values()), pads.get(entryPad), exits);
    }

    private int newPad() {
        int p = nextPad--;
        pads.put(p, new LinkedHashSet<>());
        return p;
    }

    private void addEdge(int from, int to, CfgEdgeKind kind) {
        if (from == -1 || to == -1) return;
        if (from < -1) {
            // 占位点：只记录目标
            pads.get(from).add(to);
            return;
        }
        edges.putIfAbsent(((long) from << 32) | (to & 0xffffffffL), new CfgEdge(from, to, kind));
    }

    private int idOf(Statement s) {
        return unit.idOf(s).orElse(-1);
    }

    private Set<Flow> visit(Statement stmt, Set<Flow> prev) {
        if (stmt instanceof BlockStmt block) {
            Set<Flow> current = prev;
            for (Statement s : block.getStatements()) {
                current = visit(s, current);
                // current 为空时后续语句是死代码，仍然遍历以便处理内部结构
            }
            return current;
        }

        int id = idOf(stmt);
        if (stmt instanceof DoStmt doStmt) {
            return visitDo(doStmt, id, prev);
        }

        for (Flow p : prev) {
            addEdge(p.from(), id, p.kind());
        }
        Set<Flow> self = Set.of(new Flow(id, CfgEdgeKind.SEQUENTIAL));
        Set<Flow> branch = Set.of(new Flow(id, CfgEdgeKind.BRANCH));

        if (stmt instanceof IfStmt ifStmt) {
            Set<Flow> out = new LinkedHashSet<>(visit(ifStmt.getThenStmt(), branch));
            out.addAll(ifStmt.getElseStmt().map(e -> visit(e, branch)).orElse(branch));
            return out;
        } else if (stmt instanceof ForStmt forStmt) {
            return visitLoop(id, forStmt.getBody());
        } else if (stmt instanceof ForEachStmt forEach) {
            return visitLoop(id, forEach.getBody());
        } else if (stmt instanceof WhileStmt whileStmt) {
            return visitLoop(id, whileStmt.getBody());
        } else if (stmt instanceof SwitchStmt switchStmt) {
            return visitSwitch(switchStmt, id);
        } else if (stmt instanceof TryStmt tryStmt) {
            return visitTry(tryStmt, id, self);
        } else if (stmt instanceof LabeledStmt labeled) {
            return visitLabeled(labeled, self);
        } else if (stmt instanceof SynchronizedStmt sync) {
            return visit(sync.getBody(), self);
        } else if (stmt instanceof BreakStmt breakStmt) {
            handleBreak(breakStmt, id);
            return Set.of();
        } else if (stmt instanceof ContinueStmt continueStmt) {
            handleContinue(continueStmt, id);
            return Set.of();
        } else if (stmt instanceof ReturnStmt) {
            exits.put(id, ExitKind.RETURN);
            return Set.of();
        } else if (stmt instanceof ThrowStmt) {
            exits.put(id, ExitKind.THROW);
            return Set.of();
        } else if (isCall(stmt, "revert")) {
            exits.put(id, ExitKind.REVERT);
            return Set.of();
        } else if (isCall(stmt, "require")) {
            // 条件不满足时回滚，满足时继续
            exits.put(id, ExitKind.REVERT);
            return self;
        }
        return self;
    }

    private static boolean isCall(Statement stmt, String name) {
        if (!stmt.isExpressionStmt()) return false;
        Expression e = stmt.asExpressionStmt().getExpression();
        if (!(e instanceof MethodCallExpr call)) return false;
        return call.getScope().isEmpty() && call.getNameAsString().equals(name);
    }

    private String takeLabel() {
        String l = pendingLabel;
        pendingLabel = null;
        return l;
    }

    private Set<Flow> visitLoop(int headId, Statement body) {
        Target loop = new Target(headId, true, takeLabel());
        targets.push(loop);
        Set<Flow> bodyExits = visit(body, Set.of(new Flow(headId, CfgEdgeKind.BRANCH)));
        // 循环体正常出口 -> 回到循环头
        for (Flow exit : bodyExits) {
            addEdge(exit.from(), headId, CfgEdgeKind.LOOP_BACK);
        }
        targets.pop();

        // 循环出口：条件为假 + break
        Set<Flow> out = new LinkedHashSet<>();
        out.add(new Flow(headId, CfgEdgeKind.BRANCH));
        out.addAll(loop.breaks);
        return out;
    }

    /**
     * do-while：prev -> 循环体 -> DoStmt(条件检查) -> 循环体入口 / 出口
     */
    private Set<Flow> visitDo(DoStmt stmt, int doId, Set<Flow> prev) {
        Target loop = new Target(doId, true, takeLabel());
        targets.push(loop);
        int pad = newPad();
        Set<Flow> bodyExits = visit(stmt.getBody(), Set.of(new Flow(pad, CfgEdgeKind.SEQUENTIAL)));
        targets.pop();

        Set<Integer> bodyEntries = pads.get(pad);
        for (int entry : bodyEntries) {
            for (Flow p : prev) {
                addEdge(p.from(), entry, p.kind());
            }
            addEdge(doId, entry, CfgEdgeKind.LOOP_BACK);
        }
        for (Flow exit : bodyExits) {
            if (exit.from() == pad) {
                // 空循环体：前驱直接到条件检查
                for (Flow p : prev) {
                    addEdge(p.from(), doId, p.kind());
                }
            } else {
                addEdge(exit.from(), doId, exit.kind());
            }
        }
        if (bodyEntries.isEmpty()) {
            addEdge(doId, doId, CfgEdgeKind.LOOP_BACK);
        }

        Set<Flow> out = new LinkedHashSet<>();
        out.add(new Flow(doId, CfgEdgeKind.BRANCH));
        out.addAll(loop.breaks);
        return out;
    }

    private Set<Flow> visitSwitch(SwitchStmt stmt, int switchId) {
        Target sw = new Target(switchId, false, takeLabel());
        targets.push(sw);

        Set<Flow> jump = Set.of(new Flow(switchId, CfgEdgeKind.BRANCH));
        Set<Flow> fallthrough = Set.of();
        // 箭头形式的 case 不会贯穿，执行完直接离开 switch
        Set<Flow> arrowExits = new LinkedHashSet<>();
        boolean hasDefault = false;
        for (SwitchEntry entry : stmt.getEntries()) {
            hasDefault |= entry.getLabels().isEmpty();
            // 入口 = switch 直接跳入 + 上一个 case 的 fallthrough
            Set<Flow> caseFlow = new LinkedHashSet<>(fallthrough);
            caseFlow.addAll(jump);
            for (Statement s : entry.getStatements()) {
                caseFlow = visit(s, caseFlow);
            }
            if (entry.getType() == SwitchEntry.Type.STATEMENT_GROUP) {
                fallthrough = caseFlow;
            } else {
                arrowExits.addAll(caseFlow);
                fallthrough = Set.of();
            }
        }
        targets.pop();

        Set<Flow> out = new LinkedHashSet<>(fallthrough);
        out.addAll(arrowExits);
        out.addAll(sw.breaks);
        if (!hasDefault) {
            out.addAll(jump);
        }
        return out;
    }

    /**
     * catch 入口近似为从 try 语句本身分支过去
     */
    private Set<Flow> visitTry(TryStmt stmt, int tryId, Set<Flow> self) {
        Set<Flow> out = new LinkedHashSet<>(visit(stmt.getTryBlock(), self));
        for (CatchClause c : stmt.getCatchClauses()) {
            out.addAll(visit(c.getBody(), Set.of(new Flow(tryId, CfgEdgeKind.BRANCH))));
        }
        if (stmt.getFinallyBlock().isPresent()) {
            return visit(stmt.getFinallyBlock().get(), out);
        }
        return out;
    }

    private Set<Flow> visitLabeled(LabeledStmt stmt, Set<Flow> self) {
        String label = stmt.getLabel().asString();
        labelBreaks.put(label, new LinkedHashSet<>());
        Statement inner = stmt.getStatement();
        // 标签只挂到紧跟着的循环或 switch 上
        if (inner.isForStmt() || inner.isForEachStmt() || inner.isWhileStmt()
                || inner.isDoStmt() || inner.isSwitchStmt()) {
            pendingLabel = label;
        }
        Set<Flow> out = new LinkedHashSet<>(visit(stmt.getStatement(), self));
        pendingLabel = null;
        out.addAll(labelBreaks.remove(label));
        return out;
    }

    private void handleBreak(BreakStmt stmt, int id) {
        Flow flow = new Flow(id, CfgEdgeKind.JUMP);
        if (stmt.getLabel().isPresent()) {
            Set<Flow> target = labelBreaks.get(stmt.getLabel().get().asString());
            if (target != null) target.add(flow);
            return;
        }
        // 最近的循环或 switch
        if (!targets.isEmpty()) {
            targets.peek().breaks.add(flow);
        }
    }

    private void handleContinue(ContinueStmt stmt, int id) {
        String label = stmt.getLabel().map(l -> l.asString()).orElse(null);
        for (Target t : targets) {
            if (t.loop && (label == null || label.equals(t.label))) {
                addEdge(id, t.headId, CfgEdgeKind.LOOP_BACK);
                return;
            }
        }
    }
}
