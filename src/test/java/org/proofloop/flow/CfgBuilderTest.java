package org.proofloop.flow;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.proofloop.Analyzed;
import org.proofloop.parse.AstNode;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CfgBuilderTest {

    private static Analyzed loops;
    private static Analyzed switches;

    @BeforeAll
    static void analyze() throws Exception {
        loops = Analyzed.of("Loops.java");
        switches = Analyzed.of("Switches.java");
    }

    private static void assertEdge(ControlFlowGraph cfg, int from, int to, CfgEdgeKind kind) {
        assertTrue(cfg.edges().contains(new CfgEdge(from, to, kind)),
                "missing " + kind + " " + from + " -> " + to + " in " + cfg.edges());
    }

    @Test
    void forLoopWithContinueAndBreak() {
        ControlFlowGraph cfg = loops.graph("sum").cfg();
        int init = loops.id("sum", "int s = 0;");
        int loop = loops.id("sum", "for (...)");
        int skip = loops.id("sum", "if (i == 3)");
        int cont = loops.id("sum", "continue;");
        int stop = loops.id("sum", "if (i > 10)");
        int brk = loops.id("sum", "break;");
        int add = loops.id("sum", "s += i;");
        int ret = loops.id("sum", "return s;");

        assertEquals(Set.of(init), cfg.entries());
        assertEdge(cfg, init, loop, CfgEdgeKind.SEQUENTIAL);
        assertEdge(cfg, loop, skip, CfgEdgeKind.BRANCH);
        assertEdge(cfg, skip, cont, CfgEdgeKind.BRANCH);
        assertEdge(cfg, cont, loop, CfgEdgeKind.LOOP_BACK);
        assertEdge(cfg, skip, stop, CfgEdgeKind.BRANCH);
        assertEdge(cfg, stop, brk, CfgEdgeKind.BRANCH);
        assertEdge(cfg, stop, add, CfgEdgeKind.BRANCH);
        assertEdge(cfg, add, loop, CfgEdgeKind.LOOP_BACK);
        assertEdge(cfg, loop, ret, CfgEdgeKind.BRANCH);
        assertEdge(cfg, brk, ret, CfgEdgeKind.JUMP);

        assertEquals(List.of(ret), cfg.successors(brk));
        assertEquals(List.of(loop), cfg.successors(cont));
        assertEquals(Map.of(ret, ExitKind.RETURN), cfg.exits());
    }

    @Test
    void doWhileRunsBodyBeforeCondition() {
        ControlFlowGraph cfg = loops.graph("spin").cfg();
        int init = loops.id("spin", "int k = 0;");
        int body = loops.id("spin", "k++;");
        int cond = loops.id("spin", "do-while (k < n)");
        int after = loops.id("spin", "total = k;");

        assertEquals(Set.of(init), cfg.entries());
        assertEdge(cfg, init, body, CfgEdgeKind.SEQUENTIAL);
        assertEdge(cfg, body, cond, CfgEdgeKind.SEQUENTIAL);
        assertEdge(cfg, cond, body, CfgEdgeKind.LOOP_BACK);
        assertEdge(cfg, cond, after, CfgEdgeKind.BRANCH);
        assertFalse(cfg.successors(init).contains(cond));
        assertEquals(ExitKind.FALLTHROUGH, cfg.exits().get(after));
    }

    @Test
    void revertIsTerminalAndRequireContinues() {
        ControlFlowGraph cfg = loops.graph("guard").cfg();
        int check = loops.id("guard", "if (x < 0)");
        int revert = loops.id("guard", "revert(");
        int require = loops.id("guard", "require(x < 100);");
        int write = loops.id("guard", "total = x;");

        assertEdge(cfg, check, revert, CfgEdgeKind.BRANCH);
        assertEdge(cfg, check, require, CfgEdgeKind.BRANCH);
        assertEdge(cfg, require, write, CfgEdgeKind.SEQUENTIAL);
        assertTrue(cfg.successors(revert).isEmpty());
        assertEquals(ExitKind.REVERT, cfg.exits().get(revert));
        assertEquals(ExitKind.REVERT, cfg.exits().get(require));
        assertEquals(ExitKind.FALLTHROUGH, cfg.exits().get(write));
    }

    @Test
    void labeledBreakLeavesBothLoops() {
        int fn = loops.function("nested").id;
        List<AstNode> stmts = loops.model.unitOf(fn).statementsOf(fn);
        List<Integer> fors = stmts.stream().filter(s -> s.kind.equals("ForStmt")).map(s -> s.id).toList();
        int label = loops.id("nested", "outer:");
        int outer = fors.get(0);
        int inner = fors.get(1);
        int test = loops.id("nested", "if (j == i)");
        int brk = loops.id("nested", "break outer;");
        int after = loops.id("nested", "total = 1;");
        ControlFlowGraph cfg = loops.graph("nested").cfg();

        assertEdge(cfg, label, outer, CfgEdgeKind.SEQUENTIAL);
        assertEdge(cfg, outer, inner, CfgEdgeKind.BRANCH);
        assertEdge(cfg, inner, test, CfgEdgeKind.BRANCH);
        assertEdge(cfg, test, brk, CfgEdgeKind.BRANCH);
        assertEdge(cfg, test, inner, CfgEdgeKind.LOOP_BACK);
        assertEdge(cfg, inner, outer, CfgEdgeKind.LOOP_BACK);
        assertEdge(cfg, outer, after, CfgEdgeKind.BRANCH);
        assertEdge(cfg, brk, after, CfgEdgeKind.JUMP);
        assertEquals(List.of(after), cfg.successors(brk));
    }

    @Test
    void arrowCasesLeaveTheSwitch() {
        ControlFlowGraph cfg = switches.graph("arrow").cfg();
        int sw = switches.id("arrow", "switch (x)");
        int ten = switches.id("arrow", "total = 10;");
        int twenty = switches.id("arrow", "total = 20;");
        int zero = switches.id("arrow", "total = 0;");
        int after = switches.id("arrow", "total += 1;");

        assertEdge(cfg, sw, ten, CfgEdgeKind.BRANCH);
        assertEdge(cfg, sw, twenty, CfgEdgeKind.BRANCH);
        assertEdge(cfg, sw, zero, CfgEdgeKind.BRANCH);
        assertEquals(List.of(after), cfg.successors(ten));
        assertEquals(List.of(after), cfg.successors(twenty));
        assertEquals(List.of(after), cfg.successors(zero));
        assertFalse(cfg.successors(sw).contains(after));
    }

    @Test
    void statementGroupsFallThrough() {
        ControlFlowGraph cfg = switches.graph("classic").cfg();
        int ten = switches.id("classic", "total = 10;");
        int twenty = switches.id("classic", "total = 20;");
        int brk = switches.id("classic", "break;");
        int after = switches.id("classic", "total += 1;");

        assertEquals(List.of(twenty), cfg.successors(ten));
        assertEquals(List.of(after), cfg.successors(brk));
    }
}
