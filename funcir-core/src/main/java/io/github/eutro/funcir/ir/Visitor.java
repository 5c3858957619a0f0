package io.github.eutro.funcir.ir;

/**
 * A consumer of nodes, with one method per operation, called by {@link Node#visit(Visitor)}.
 * <p>
 * Each method receives the visited node and its arguments: nodes for node arguments,
 * and the payload for everything else. There is no method for {@link Fn#INVALID} and
 * {@link Fn#MULTIPLE}, which cannot be visited.
 *
 * @param <T> The result type.
 * @see DefaultVisitor
 */
public interface Visitor<T> {
    T buf(Node self, Node a);

    T slice(Node self, Node a, int offset, int outWidth);

    T zeroExtend(Node self, Node a, int outWidth);

    T signExtend(Node self, Node a, int outWidth);

    T concat(Node self, Node a, Node b);

    T add(Node self, Node a, Node b);

    T sub(Node self, Node a, Node b);

    T mul(Node self, Node a, Node b);

    T unsignedDiv(Node self, Node a, Node b);

    T unsignedMod(Node self, Node a, Node b);

    T bitwiseAnd(Node self, Node a, Node b);

    T bitwiseOr(Node self, Node a, Node b);

    T bitwiseXor(Node self, Node a, Node b);

    T bitwiseNot(Node self, Node a);

    T unaryMinus(Node self, Node a);

    T reduceAnd(Node self, Node a);

    T reduceOr(Node self, Node a);

    T reduceXor(Node self, Node a);

    T equal(Node self, Node a, Node b);

    T notEqual(Node self, Node a, Node b);

    T signedGreaterThan(Node self, Node a, Node b);

    T signedGreaterEqual(Node self, Node a, Node b);

    T unsignedGreaterThan(Node self, Node a, Node b);

    T unsignedGreaterEqual(Node self, Node a, Node b);

    T logicalShiftLeft(Node self, Node a, Node b);

    T logicalShiftRight(Node self, Node a, Node b);

    T arithmeticShiftRight(Node self, Node a, Node b);

    /**
     * Visit a mux, which is {@code s ? b : a}.
     *
     * @param self The node.
     * @param a    The value when {@code s} is 0.
     * @param b    The value when {@code s} is 1.
     * @param s    The 1-bit select.
     * @return The result.
     */
    T mux(Node self, Node a, Node b, Node s);

    T constant(Node self, Const value);

    T input(Node self, String name);

    T state(Node self, String name);

    T memoryRead(Node self, Node mem, Node addr);

    T memoryWrite(Node self, Node mem, Node addr, Node data);

    T undriven(Node self, int width);
}
