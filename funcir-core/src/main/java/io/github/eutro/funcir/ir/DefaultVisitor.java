package io.github.eutro.funcir.ir;

/**
 * A {@link Visitor} whose methods all call {@link #defaultHandler(Node)},
 * for consumers that only treat a few operations specially.
 *
 * @param <T> The result type.
 */
public abstract class DefaultVisitor<T> implements Visitor<T> {
    /**
     * Handle any node whose method is not overridden.
     *
     * @param self The node.
     * @return The result.
     */
    public abstract T defaultHandler(Node self);

    @Override
    public T buf(Node self, Node a) {
        return defaultHandler(self);
    }

    @Override
    public T slice(Node self, Node a, int offset, int outWidth) {
        return defaultHandler(self);
    }

    @Override
    public T zeroExtend(Node self, Node a, int outWidth) {
        return defaultHandler(self);
    }

    @Override
    public T signExtend(Node self, Node a, int outWidth) {
        return defaultHandler(self);
    }

    @Override
    public T concat(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T add(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T sub(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T mul(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T unsignedDiv(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T unsignedMod(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T bitwiseAnd(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T bitwiseOr(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T bitwiseXor(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T bitwiseNot(Node self, Node a) {
        return defaultHandler(self);
    }

    @Override
    public T unaryMinus(Node self, Node a) {
        return defaultHandler(self);
    }

    @Override
    public T reduceAnd(Node self, Node a) {
        return defaultHandler(self);
    }

    @Override
    public T reduceOr(Node self, Node a) {
        return defaultHandler(self);
    }

    @Override
    public T reduceXor(Node self, Node a) {
        return defaultHandler(self);
    }

    @Override
    public T equal(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T notEqual(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T signedGreaterThan(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T signedGreaterEqual(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T unsignedGreaterThan(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T unsignedGreaterEqual(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T logicalShiftLeft(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T logicalShiftRight(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T arithmeticShiftRight(Node self, Node a, Node b) {
        return defaultHandler(self);
    }

    @Override
    public T mux(Node self, Node a, Node b, Node s) {
        return defaultHandler(self);
    }

    @Override
    public T constant(Node self, Const value) {
        return defaultHandler(self);
    }

    @Override
    public T input(Node self, String name) {
        return defaultHandler(self);
    }

    @Override
    public T state(Node self, String name) {
        return defaultHandler(self);
    }

    @Override
    public T memoryRead(Node self, Node mem, Node addr) {
        return defaultHandler(self);
    }

    @Override
    public T memoryWrite(Node self, Node mem, Node addr, Node data) {
        return defaultHandler(self);
    }

    @Override
    public T undriven(Node self, int width) {
        return defaultHandler(self);
    }
}
