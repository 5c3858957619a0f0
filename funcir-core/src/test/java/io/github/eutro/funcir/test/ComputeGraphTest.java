package io.github.eutro.funcir.test;

import io.github.eutro.funcir.ir.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ComputeGraphTest {
    @Test
    void addShares() {
        ComputeGraph graph = new FunctionalIR().graph();
        int a = graph.add(NodeData.named(Fn.INPUT, "a"), Sort.bits(4));
        int b = graph.add(NodeData.named(Fn.INPUT, "b"), Sort.bits(4));
        int sum = graph.add(NodeData.of(Fn.ADD), Sort.bits(4), a, b);
        assertEquals(sum, graph.add(NodeData.of(Fn.ADD), Sort.bits(4), a, b));
        assertEquals(3, graph.size());
        assertEquals(ComputeGraph.State.CONSED, graph.state(sum));
        assertThrows(InvariantViolationException.class, () -> graph.add(NodeData.of(Fn.BITWISE_NOT), Sort.bits(4), 7));
        assertThrows(InvariantViolationException.class, () -> graph.arg(sum, 2));
    }

    @Test
    void appendOnlyToOpenNodes() {
        ComputeGraph graph = new FunctionalIR().graph();
        int a = graph.add(NodeData.named(Fn.INPUT, "a"), Sort.bits(4));
        int p = graph.addUnique(NodeData.of(Fn.BUF), Sort.bits(4), ComputeGraph.State.PENDING);
        int m = graph.addUnique(NodeData.of(Fn.MULTIPLE), Sort.bits(4), ComputeGraph.State.VARIADIC);
        assertThrows(IllegalArgumentException.class,
                () -> graph.addUnique(NodeData.of(Fn.BUF), Sort.bits(4), ComputeGraph.State.FIXED));

        graph.appendArg(p, a);
        assertEquals(ComputeGraph.State.FIXED, graph.state(p));
        assertThrows(InvariantViolationException.class, () -> graph.appendArg(p, a));
        assertThrows(InvariantViolationException.class, () -> graph.appendArg(a, a));

        graph.appendArg(m, a);
        graph.appendArg(m, p);
        assertEquals(2, graph.argCount(m));
        graph.seal(m);
        assertThrows(InvariantViolationException.class, () -> graph.appendArg(m, a));
        assertThrows(InvariantViolationException.class, () -> graph.seal(m));
    }

    @Test
    void keys() {
        ComputeGraph graph = new FunctionalIR().graph();
        int a = graph.add(NodeData.named(Fn.INPUT, "a"), Sort.bits(4));
        int b = graph.add(NodeData.named(Fn.INPUT, "b"), Sort.bits(4));
        graph.assignKey(a, RoleKey.output("o"));
        graph.assignKey(a, RoleKey.output("o"));
        graph.assignKey(b, RoleKey.nextState("o"));
        assertEquals(a, graph.findKey(RoleKey.output("o")));
        assertEquals(b, graph.findKey(RoleKey.nextState("o")));
        assertEquals(-1, graph.findKey(RoleKey.output("p")));
        assertThrows(DuplicateKeyException.class, () -> graph.assignKey(b, RoleKey.output("o")));
        assertEquals(2, graph.keys().size());
    }

    @Test
    void permuteRenumbersEverything() {
        ComputeGraph graph = new FunctionalIR().graph();
        int a = graph.add(NodeData.named(Fn.INPUT, "a"), Sort.bits(4));
        int not = graph.add(NodeData.of(Fn.BITWISE_NOT), Sort.bits(4), a);
        graph.setName(a, "first");
        graph.assignKey(not, RoleKey.output("o"));

        graph.permute(new int[]{not, a});
        assertEquals(Fn.BITWISE_NOT, graph.data(0).fn);
        assertEquals(1, graph.arg(0, 0));
        assertEquals("first", graph.getName(1));
        assertFalse(graph.hasName(0));
        assertEquals(0, graph.findKey(RoleKey.output("o")));
        assertEquals(0, graph.add(NodeData.of(Fn.BITWISE_NOT), Sort.bits(4), 1));

        assertThrows(IllegalArgumentException.class, () -> graph.permute(new int[]{0, 0}));
        assertThrows(IllegalArgumentException.class, () -> graph.permute(new int[]{0}));
    }

    @Test
    void redirect() {
        ComputeGraph graph = new FunctionalIR().graph();
        int a = graph.add(NodeData.named(Fn.INPUT, "a"), Sort.bits(4));
        int b = graph.add(NodeData.named(Fn.INPUT, "b"), Sort.bits(4));
        int notA = graph.add(NodeData.of(Fn.BITWISE_NOT), Sort.bits(4), a);
        graph.assignKey(a, RoleKey.output("o"));
        graph.redirect(new int[]{b, b, notA});
        assertEquals(b, graph.arg(notA, 0));
        assertEquals(b, graph.findKey(RoleKey.output("o")));
        assertEquals(notA, graph.add(NodeData.of(Fn.BITWISE_NOT), Sort.bits(4), b));
    }
}
