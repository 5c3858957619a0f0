package io.github.eutro.funcir.ir;

import io.github.eutro.funcir.util.F;

/**
 * Renders a node as {@code fn(args..., payload...)}, naming node arguments with a naming function.
 * <p>
 * This is for debugging, and the format may change.
 */
public class PrintVisitor implements Visitor<String> {
    private final F<Node, String> namer;

    public PrintVisitor(F<Node, String> namer) {
        this.namer = namer;
    }

    private String call(Node self, Object... args) {
        StringBuilder sb = new StringBuilder(self.fn().mnemonic).append('(');
        for (int i = 0; i < args.length; i++) {
            if (i != 0) sb.append(", ");
            Object arg = args[i];
            sb.append(arg instanceof Node ? namer.apply((Node) arg) : String.valueOf(arg));
        }
        return sb.append(')').toString();
    }

    @Override
    public String buf(Node self, Node a) {
        return call(self, a);
    }

    @Override
    public String slice(Node self, Node a, int offset, int outWidth) {
        return call(self, a, offset, outWidth);
    }

    @Override
    public String zeroExtend(Node self, Node a, int outWidth) {
        return call(self, a, outWidth);
    }

    @Override
    public String signExtend(Node self, Node a, int outWidth) {
        return call(self, a, outWidth);
    }

    @Override
    public String concat(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String add(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String sub(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String mul(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String unsignedDiv(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String unsignedMod(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String bitwiseAnd(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String bitwiseOr(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String bitwiseXor(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String bitwiseNot(Node self, Node a) {
        return call(self, a);
    }

    @Override
    public String unaryMinus(Node self, Node a) {
        return call(self, a);
    }

    @Override
    public String reduceAnd(Node self, Node a) {
        return call(self, a);
    }

    @Override
    public String reduceOr(Node self, Node a) {
        return call(self, a);
    }

    @Override
    public String reduceXor(Node self, Node a) {
        return call(self, a);
    }

    @Override
    public String equal(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String notEqual(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String signedGreaterThan(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String signedGreaterEqual(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String unsignedGreaterThan(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String unsignedGreaterEqual(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String logicalShiftLeft(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String logicalShiftRight(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String arithmeticShiftRight(Node self, Node a, Node b) {
        return call(self, a, b);
    }

    @Override
    public String mux(Node self, Node a, Node b, Node s) {
        return call(self, a, b, s);
    }

    @Override
    public String constant(Node self, Const value) {
        return call(self, value);
    }

    @Override
    public String input(Node self, String name) {
        return call(self, name);
    }

    @Override
    public String state(Node self, String name) {
        return call(self, name);
    }

    @Override
    public String memoryRead(Node self, Node mem, Node addr) {
        return call(self, mem, addr);
    }

    @Override
    public String memoryWrite(Node self, Node mem, Node addr, Node data) {
        return call(self, mem, addr, data);
    }

    @Override
    public String undriven(Node self, int width) {
        return call(self, width);
    }
}
