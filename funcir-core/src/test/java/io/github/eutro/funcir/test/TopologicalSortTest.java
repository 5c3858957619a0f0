package io.github.eutro.funcir.test;

import io.github.eutro.funcir.ir.*;
import io.github.eutro.funcir.passes.meta.MetadataState;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class TopologicalSortTest {
    static void assertSorted(FunctionalIR ir) {
        for (Node node : ir) {
            for (int i = 0; i < node.argCount(); i++) {
                assertTrue(node.arg(i).id() < node.id(), () -> node.name() + " comes before its argument");
            }
        }
    }

    // p = buf(z), y = add(p, x), z = not(x), with p created first
    static FunctionalIR outOfOrder() {
        FunctionalIR ir = new FunctionalIR();
        FunctionalIR.Factory f = ir.factory();
        Node p = f.createPending(8);
        Node x = f.input("x", 8);
        Node y = f.add(p, x);
        Node z = f.bitwiseNot(x);
        f.updatePending(p, z);
        f.suggestName(z, "zed");
        f.declareOutput(y, "y", 8);
        return ir;
    }

    @Test
    void argumentsComeFirst() {
        FunctionalIR ir = outOfOrder();
        int size = ir.size();
        ir.topologicalSort();
        assertSorted(ir);
        assertEquals(size, ir.size());
        assertTrue(ir.metadata().isValid(MetadataState.Kind.TOPOLOGICALLY_SORTED));
    }

    @Test
    void keysAndNamesFollowTheirNodes() {
        FunctionalIR ir = outOfOrder();
        ir.topologicalSort();
        Node y = ir.getOutputNode("y");
        assertEquals(Fn.ADD, y.fn());
        Node p = y.arg(0);
        assertEquals(Fn.BUF, p.fn());
        assertEquals(Fn.INPUT, y.arg(1).fn());
        Node z = p.arg(0);
        assertEquals(Fn.BITWISE_NOT, z.fn());
        assertEquals("zed", z.name());
    }

    @Test
    void sortingTwiceChangesNothing() {
        FunctionalIR ir = outOfOrder();
        ir.topologicalSort();
        String once = ir.toString();
        ir.topologicalSort();
        assertEquals(once, ir.toString());
    }

    @Test
    void consingStillWorksAfterSorting() {
        FunctionalIR ir = outOfOrder();
        ir.topologicalSort();
        Node y = ir.getOutputNode("y");
        assertEquals(y, ir.factory().add(y.arg(0), y.arg(1)));
    }

    @Test
    void feedbackThroughPlaceholderIsALoop() {
        FunctionalIR ir = new FunctionalIR();
        FunctionalIR.Factory f = ir.factory();
        Node p = f.createPending(4);
        Node y = f.add(p, f.constant(Const.of(4, 1)));
        f.updatePending(p, y);
        f.declareOutput(y, "y", 4);
        InvariantViolationException e = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> assertThrows(InvariantViolationException.class, ir::topologicalSort));
        assertTrue(e.getMessage().contains("combinational loop"), e.getMessage());
        assertFalse(ir.metadata().isValid(MetadataState.Kind.TOPOLOGICALLY_SORTED));
    }

    @Test
    void placeholderResolvedToItselfIsALoop() {
        FunctionalIR ir = new FunctionalIR();
        FunctionalIR.Factory f = ir.factory();
        Node p = f.createPending(1);
        f.updatePending(p, p);
        assertThrows(InvariantViolationException.class, ir::topologicalSort);
    }

    @Test
    void feedbackThroughStateIsFine() {
        FunctionalIR ir = new FunctionalIR();
        FunctionalIR.Factory f = ir.factory();
        Node r = f.state("count", 4);
        Node next = f.add(r, f.constant(Const.of(4, 1)));
        f.declareState(next, "count", 4);
        f.declareOutput(r, "count", 4);
        ir.topologicalSort();
        assertSorted(ir);
        Node sortedNext = ir.getStateNextNode("count");
        assertEquals(Fn.ADD, sortedNext.fn());
        assertEquals(ir.getOutputNode("count"), sortedNext.arg(0));
    }

    @Test
    void unreferencedPlaceholdersSurvive() {
        FunctionalIR ir = new FunctionalIR();
        FunctionalIR.Factory f = ir.factory();
        f.createPending(8);
        Node x = f.input("x", 8);
        f.declareOutput(x, "x", 8);
        ir.topologicalSort();
        assertEquals(2, ir.size());
        int pending = 0;
        for (Node node : ir) {
            if (node.isPending()) pending++;
        }
        assertEquals(1, pending);
    }

    @Test
    void referencedPlaceholdersMustBeResolved() {
        FunctionalIR ir = new FunctionalIR();
        FunctionalIR.Factory f = ir.factory();
        Node p = f.createPending(8);
        f.declareOutput(f.bitwiseNot(p), "o", 8);
        assertThrows(InvariantViolationException.class, ir::topologicalSort);

        FunctionalIR ir2 = new FunctionalIR();
        FunctionalIR.Factory f2 = ir2.factory();
        f2.declareOutput(f2.createPending(8), "o", 8);
        assertThrows(InvariantViolationException.class, ir2::topologicalSort);
    }

    @Test
    void unrootedNodesAreKept() {
        FunctionalIR ir = new FunctionalIR();
        FunctionalIR.Factory f = ir.factory();
        Node x = f.input("x", 8);
        f.unaryMinus(x);
        f.reduceOr(x);
        ir.topologicalSort();
        assertEquals(3, ir.size());
        assertSorted(ir);
    }
}
