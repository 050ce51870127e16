package org.proofloop.slice;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.proofloop.Analyzed;
import org.proofloop.anchor.AnchorOccurrence;
import org.proofloop.flow.FunctionGraph;
import org.proofloop.parse.AstNode;

import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class DependencySlicerTest {

    private static Analyzed analyzed;

    @BeforeAll
    static void analyze() throws Exception {
        analyzed = Analyzed.of("Loops.java", "Bank.java");
    }

    private static AnchorOccurrence anchorAt(Analyzed a, String function, String prefix) {
        AstNode n = a.stmt(function, prefix);
        return new AnchorOccurrence("T-01", "test", n.id, n.functionId, n.contractId, "Loops.java", n.lineStart);
    }

    @Test
    void unboundedSliceIsClosedUnderDependencies() {
        Slice slice = new DependencySlicer(analyzed.model, new SliceBounds(100, 1000))
                .slice(anchorAt(analyzed, "sum", "s += i;"));
        FunctionGraph g = analyzed.graph("sum");

        assertFalse(slice.boundaryReached());
        for (int id : slice.nodeIds()) {
            assertTrue(slice.nodeIds().containsAll(g.cfg().predecessors(id)), "preds of " + id);
            assertTrue(slice.nodeIds().containsAll(g.cfg().successors(id)), "succs of " + id);
            assertTrue(slice.nodeIds().containsAll(g.dataDefinitions(id)), "defs of " + id);
            assertTrue(slice.nodeIds().containsAll(g.dataUses(id)), "uses of " + id);
        }
        assertTrue(slice.contains(analyzed.id("sum", "return s;")));
        assertEquals(Set.of(analyzed.function("sum").id), slice.functionIds());
    }

    @Test
    void depthBoundRecordsWhereTheSliceStopped() {
        Slice slice = new DependencySlicer(analyzed.model, new SliceBounds(1, 100))
                .slice(anchorAt(analyzed, "chain", "int c = b + 1;"));
        int a = analyzed.id("chain", "int a = v;");
        int b = analyzed.id("chain", "int b = a + 1;");
        int c = analyzed.id("chain", "int c = b + 1;");
        int d = analyzed.id("chain", "int d = c + 1;");
        int e = analyzed.id("chain", "int e = d + 1;");

        assertEquals(new TreeSet<>(Set.of(b, c, d)), slice.nodeIds());
        assertEquals(1, slice.depth());
        assertTrue(slice.boundaryReached());
        assertTrue(slice.boundaries().contains(new SliceBoundary(b, a,
                DependencyRelation.CONTROL_PREDECESSOR, SliceBoundary.Reason.DEPTH)));
        assertTrue(slice.boundaries().contains(new SliceBoundary(d, e,
                DependencyRelation.DATA_USE, SliceBoundary.Reason.DEPTH)));
        assertTrue(slice.boundaries().stream().noneMatch(x -> slice.contains(x.outside())));
    }

    @Test
    void nodeCountBoundKeepsLowestIdsFirst() {
        Slice slice = new DependencySlicer(analyzed.model, new SliceBounds(100, 2))
                .slice(anchorAt(analyzed, "chain", "int c = b + 1;"));
        int b = analyzed.id("chain", "int b = a + 1;");
        int c = analyzed.id("chain", "int c = b + 1;");
        int d = analyzed.id("chain", "int d = c + 1;");

        assertEquals(new TreeSet<>(Set.of(b, c)), slice.nodeIds());
        assertTrue(slice.boundaries().stream()
                .anyMatch(x -> x.outside() == d && x.reason() == SliceBoundary.Reason.NODE_COUNT));
    }

    @Test
    void zeroDepthKeepsOnlyTheAnchor() {
        AnchorOccurrence anchor = anchorAt(analyzed, "chain", "int c = b + 1;");
        Slice slice = new DependencySlicer(analyzed.model, new SliceBounds(0, 100)).slice(anchor);
        assertEquals(Set.of(anchor.nodeId()), slice.nodeIds());
        assertTrue(slice.boundaryReached());
    }

    @Test
    void statementWithoutDependenciesIsASingleNodeSlice() {
        AnchorOccurrence anchor = anchorAt(analyzed, "payout", "to.transfer(v);");
        Slice slice = new DependencySlicer(analyzed.model, new SliceBounds(12, 400)).slice(anchor);
        assertEquals(Set.of(anchor.nodeId()), slice.nodeIds());
        assertFalse(slice.boundaryReached());
    }

    @Test
    void crossContractCalleesAreReported() {
        Slice slice = new DependencySlicer(analyzed.model, new SliceBounds(12, 400))
                .slice(anchorAt(analyzed, "pay", "token.mint(who, v);"));
        assertTrue(slice.functionIds().contains(analyzed.function("mint").id));
        assertTrue(slice.contractIds().contains(analyzed.contract("Token").id));
    }

    @Test
    void slicingIsDeterministic() throws Exception {
        SliceBounds bounds = new SliceBounds(3, 5);
        Slice first = new DependencySlicer(analyzed.model, bounds).slice(anchorAt(analyzed, "sum", "if (i > 10)"));
        Analyzed again = Analyzed.of("Loops.java", "Bank.java");
        Slice second = new DependencySlicer(again.model, bounds).slice(anchorAt(again, "sum", "if (i > 10)"));
        assertEquals(first.nodeIds(), second.nodeIds());
        assertEquals(first.boundaries(), second.boundaries());
    }

    @Test
    void anchorOutsideItsFunctionIsRejected() {
        AstNode n = analyzed.stmt("sum", "return s;");
        AnchorOccurrence wrong = new AnchorOccurrence("T-01", "test", n.id,
                analyzed.function("spin").id, n.contractId, "Loops.java", n.lineStart);
        DependencySlicer slicer = new DependencySlicer(analyzed.model, new SliceBounds(12, 400));
        assertThrows(IllegalArgumentException.class, () -> slicer.slice(wrong));
    }

    @Test
    void boundsAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> new SliceBounds(-1, 10));
        assertThrows(IllegalArgumentException.class, () -> new SliceBounds(3, 0));
    }
}
