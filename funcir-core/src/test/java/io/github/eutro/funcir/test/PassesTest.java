package io.github.eutro.funcir.test;

import io.github.eutro.funcir.ir.*;
import io.github.eutro.funcir.passes.IRPass;
import io.github.eutro.funcir.passes.Passes;
import io.github.eutro.funcir.passes.form.TopologicalSort;
import io.github.eutro.funcir.passes.meta.CheckCanonical;
import io.github.eutro.funcir.passes.meta.MetadataState;
import io.github.eutro.funcir.util.GraphWalker;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    @Test
    void canonicalize() {
        FunctionalIR ir = TopologicalSortTest.outOfOrder();
        assertTrue(Passes.CANONICALIZE.isInPlace());
        assertSame(ir, Passes.CANONICALIZE.run(ir));
        TopologicalSortTest.assertSorted(ir);
        assertEquals(Fn.BITWISE_NOT, ir.getOutputNode("y").arg(0).fn());

        MetadataState ms = ir.metadata();
        assertTrue(ms.isValid(MetadataState.Kind.TOPOLOGICALLY_SORTED));
        assertTrue(ms.isValid(MetadataState.Kind.BUFS_FORWARDED));

        ir.factory().input("late", 8);
        assertFalse(ms.isValid(MetadataState.Kind.TOPOLOGICALLY_SORTED));
        assertFalse(ms.isValid(MetadataState.Kind.BUFS_FORWARDED));

        ms.ensureValid(ir, MetadataState.Kind.TOPOLOGICALLY_SORTED, MetadataState.Kind.BUFS_FORWARDED);
        assertTrue(ms.isValid(MetadataState.Kind.BUFS_FORWARDED));
    }

    @Test
    void sharingAnExistingNodeKeepsMetadata() {
        FunctionalIR ir = new FunctionalIR();
        FunctionalIR.Factory f = ir.factory();
        Node x = f.input("x", 8);
        f.declareOutput(f.bitwiseNot(x), "o", 8);
        Passes.CANONICALIZE.run(ir);
        f.bitwiseNot(ir.getOutputNode("o").arg(0));
        assertTrue(ir.metadata().isValid(MetadataState.Kind.TOPOLOGICALLY_SORTED));
    }

    @Test
    void checkRejectsUnsortedGraphs() {
        FunctionalIR ir = TopologicalSortTest.outOfOrder();
        assertThrows(InvariantViolationException.class, () -> CheckCanonical.INSTANCE.run(ir));
        TopologicalSort.INSTANCE.run(ir);
        // sorted, but the output still reads through a buf
        assertThrows(InvariantViolationException.class, () -> CheckCanonical.INSTANCE.run(ir));
    }

    @Test
    void failuresNameTheirPass() {
        IRPass<FunctionalIR, FunctionalIR> failing = ir -> {
            throw new IllegalStateException("broken");
        };
        IRPass<FunctionalIR, FunctionalIR> chain = TopologicalSort.INSTANCE.then(failing);
        assertFalse(chain.isInPlace());
        FunctionalIR ir = TopologicalSortTest.outOfOrder();
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> chain.run(ir));
        assertEquals("broken", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("running pass 1 in chain", e.getSuppressed()[0].getMessage());
    }

    @Test
    void liveNodes() {
        FunctionalIR ir = new FunctionalIR();
        FunctionalIR.Factory f = ir.factory();
        Node x = f.input("x", 8);
        Node y = f.input("y", 8);
        Node sum = f.add(x, y);
        f.unaryMinus(x);
        f.declareOutput(sum, "sum", 8);

        List<Node> pre = GraphWalker.nodeWalker(ir).preOrder().toList();
        assertEquals(3, pre.size());
        assertEquals(sum, pre.get(0));
        assertEquals(x, pre.get(1));

    }

    @Test
    void sharedArgumentsAreWalkedOnce() {
        FunctionalIR ir = new FunctionalIR();
        FunctionalIR.Factory f = ir.factory();
        Node x = f.input("x", 8);
        Node notX = f.bitwiseNot(x);
        Node o = f.add(notX, x);
        f.declareOutput(o, "o", 8);

        List<Node> pre = GraphWalker.nodeWalker(ir).preOrder().toList();
        assertEquals(3, pre.size());
        assertEquals(o, pre.get(0));
        assertTrue(pre.contains(notX));
        assertEquals(1, pre.stream().filter(x::equals).count());
    }
}
