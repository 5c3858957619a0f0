package io.github.eutro.funcir.passes;

import io.github.eutro.funcir.ir.FunctionalIR;
import io.github.eutro.funcir.passes.form.ForwardBuf;
import io.github.eutro.funcir.passes.form.TopologicalSort;
import io.github.eutro.funcir.passes.meta.CheckCanonical;

/**
 * Common compositions of passes.
 */
public class Passes {
    /**
     * Bring a freshly built graph to canonical form, and check that it is.
     */
    public static final IRPass<FunctionalIR, FunctionalIR> CANONICALIZE = TopologicalSort.INSTANCE
            .then(ForwardBuf.INSTANCE)
            .then(CheckCanonical.INSTANCE);

    private Passes() {
    }
}
