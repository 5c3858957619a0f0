package io.github.eutro.funcir.passes.form;

import io.github.eutro.funcir.ir.ComputeGraph;
import io.github.eutro.funcir.ir.Fn;
import io.github.eutro.funcir.ir.FunctionalIR;
import io.github.eutro.funcir.passes.InPlaceIRPass;
import io.github.eutro.funcir.passes.meta.MetadataState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Makes every argument and role key that refers to a {@link Fn#BUF buf} node refer
 * to the non-{@code buf} node it forwards instead.
 * <p>
 * The graph is sorted first if it isn't already. The {@code buf} nodes themselves
 * are left in place, with nothing referring to them. A {@code buf} with a suggested name
 * gives it to its target if the target has none.
 * <p>
 * Running this twice is the same as running it once.
 */
public class ForwardBuf implements InPlaceIRPass<FunctionalIR> {
    private static final Logger LOGGER = LogManager.getLogger();

    public static final ForwardBuf INSTANCE = new ForwardBuf();

    @Override
    public void runInPlace(FunctionalIR ir) {
        MetadataState ms = ir.metadata();
        ms.ensureValid(ir, MetadataState.Kind.TOPOLOGICALLY_SORTED);

        ComputeGraph graph = ir.graph();
        int n = graph.size();
        int[] subst = new int[n];
        int forwarded = 0;
        for (int i = 0; i < n; i++) {
            if (graph.data(i).fn == Fn.BUF && graph.argCount(i) == 1) {
                // arguments precede their users, so this is already final
                int target = subst[graph.arg(i, 0)];
                subst[i] = target;
                if (graph.hasName(i) && !graph.hasName(target)) {
                    graph.setName(target, graph.getName(i));
                }
                forwarded++;
            } else {
                subst[i] = i;
            }
        }

        graph.redirect(subst);
        ms.validate(MetadataState.Kind.BUFS_FORWARDED);
        LOGGER.debug("Forwarded {} buf(s) in {} node(s)", forwarded, n);
    }

    @Override
    public String toString() {
        return "ForwardBuf";
    }
}
