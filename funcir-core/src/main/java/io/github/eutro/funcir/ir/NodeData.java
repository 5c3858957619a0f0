package io.github.eutro.funcir.ir;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The operation of a node together with its non-node arguments.
 * <p>
 * Along with the argument list, this is what nodes are deduplicated on.
 */
public final class NodeData {
    public final Fn fn;
    /**
     * The payload: {@code null}, a {@link Const}, a {@link String} name or an {@link Integer},
     * as given by {@link Fn#payload}.
     */
    @Nullable
    public final Object extra;
    /**
     * The result width, for operations that {@link Fn#hasExplicitWidth() need it}, otherwise 0.
     */
    public final int width;

    private NodeData(Fn fn, @Nullable Object extra, int width) {
        this.fn = fn;
        this.extra = extra;
        this.width = width;
    }

    public static NodeData of(Fn fn) {
        return new NodeData(fn, null, 0);
    }

    public static NodeData ofWidth(Fn fn, int width) {
        if (!fn.hasExplicitWidth()) throw new IllegalArgumentException(fn + " takes its width from its arguments");
        return new NodeData(fn, null, width);
    }

    public static NodeData constant(Const value) {
        return new NodeData(Fn.CONSTANT, value, 0);
    }

    public static NodeData named(Fn fn, String name) {
        return new NodeData(fn, name, 0);
    }

    public static NodeData slice(int offset, int width) {
        return new NodeData(Fn.SLICE, offset, width);
    }

    /**
     * Get the literal payload.
     *
     * @return The literal.
     * @throws SortException If this has no literal payload.
     */
    public Const asConst() {
        if (!(extra instanceof Const)) throw new SortException(fn + " has no literal payload");
        return (Const) extra;
    }

    /**
     * Get the name payload.
     *
     * @return The name.
     * @throws SortException If this has no name payload.
     */
    public String asName() {
        if (!(extra instanceof String)) throw new SortException(fn + " has no name payload");
        return (String) extra;
    }

    /**
     * Get the integer payload.
     *
     * @return The integer.
     * @throws SortException If this has no integer payload.
     */
    public int asInt() {
        if (!(extra instanceof Integer)) throw new SortException(fn + " has no integer payload");
        return (Integer) extra;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeData)) return false;
        NodeData that = (NodeData) o;
        return fn == that.fn && width == that.width && Objects.equals(extra, that.extra);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fn, extra, width);
    }

    @Override
    public String toString() {
        if (extra == null) return fn.mnemonic;
        return fn.mnemonic + " " + extra;
    }
}
