package io.github.eutro.funcir.passes.meta;

import io.github.eutro.funcir.ir.FunctionalIR;
import io.github.eutro.funcir.passes.InPlaceIRPass;
import io.github.eutro.funcir.passes.form.ForwardBuf;
import io.github.eutro.funcir.passes.form.TopologicalSort;

import java.util.EnumSet;

/**
 * Keeps track of which canonical-form properties currently hold for a {@link FunctionalIR}.
 * <p>
 * Passes {@link #validate(Kind...) validate} what they establish, and the factory
 * calls {@link #graphChanged()} whenever it changes the graph.
 */
public final class MetadataState {
    /**
     * A property of a graph, and the pass that establishes it.
     */
    public enum Kind {
        /**
         * Every argument of every node precedes it.
         */
        TOPOLOGICALLY_SORTED,
        /**
         * No argument or role key refers to a {@code buf} node.
         */
        BUFS_FORWARDED,
        ;

        InPlaceIRPass<FunctionalIR> pass() {
            switch (this) {
                case TOPOLOGICALLY_SORTED:
                    return TopologicalSort.INSTANCE;
                case BUFS_FORWARDED:
                    return ForwardBuf.INSTANCE;
                default:
                    throw new IllegalStateException("no pass for " + this);
            }
        }
    }

    private final EnumSet<Kind> valid = EnumSet.noneOf(Kind.class);

    public boolean isValid(Kind kind) {
        return valid.contains(kind);
    }

    /**
     * Run the passes for any of the given properties that do not hold yet, in order.
     *
     * @param ir    The graph this is the metadata of.
     * @param kinds The properties.
     */
    public void ensureValid(FunctionalIR ir, Kind... kinds) {
        for (Kind kind : kinds) {
            if (!isValid(kind)) {
                kind.pass().runInPlace(ir);
                validate(kind);
            }
        }
    }

    public void validate(Kind... kinds) {
        for (Kind kind : kinds) {
            valid.add(kind);
        }
    }

    public void invalidate(Kind... kinds) {
        for (Kind kind : kinds) {
            valid.remove(kind);
        }
    }

    /**
     * Forget every property, after a node was added or changed.
     */
    public void graphChanged() {
        valid.clear();
    }
}
