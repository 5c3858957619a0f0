package io.github.eutro.funcir.passes.meta;

import io.github.eutro.funcir.ir.*;
import io.github.eutro.funcir.passes.InPlaceIRPass;
import io.github.eutro.funcir.util.GraphWalker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * Checks that a graph is in canonical form, throwing an {@link InvariantViolationException} if not.
 * <p>
 * A graph is canonical when every node comes after its arguments, no node or role key refers to a
 * {@link Fn#BUF buf} node, and every role key names a node of the sort its output or state
 * variable was declared with. Nodes that no role key reaches may be left over, but no live node may be
 * {@link Fn#INVALID invalid} or have the wrong number of arguments.
 * <p>
 * On success, the canonical-form metadata is marked valid.
 */
public class CheckCanonical implements InPlaceIRPass<FunctionalIR> {
    private static final Logger LOGGER = LogManager.getLogger();

    public static final CheckCanonical INSTANCE = new CheckCanonical();

    @Override
    public void runInPlace(FunctionalIR ir) {
        ComputeGraph graph = ir.graph();
        for (int i = 0; i < graph.size(); i++) {
            for (int j = 0; j < graph.argCount(i); j++) {
                int arg = graph.arg(i, j);
                if (arg >= i) {
                    throw new InvariantViolationException("argument n" + arg + " does not precede its user", ir.get(i));
                }
                if (graph.data(arg).fn == Fn.BUF) {
                    throw new InvariantViolationException("argument n" + arg + " is a buf", ir.get(i));
                }
            }
        }

        for (Map.Entry<RoleKey, Integer> entry : graph.keys().entrySet()) {
            RoleKey key = entry.getKey();
            Node node = ir.get(entry.getValue());
            if (node.fn() == Fn.BUF) {
                throw new InvariantViolationException(key + " names a buf", node);
            }
            Sort declared = key.nextState ? ir.state().get(key.name) : ir.outputs().get(key.name);
            if (!node.sort().equals(declared)) {
                throw new InvariantViolationException(key + " was declared as " + declared
                        + ", but names a node of " + node.sort(), node);
            }
        }

        int live = 0;
        for (Node node : GraphWalker.nodeWalker(ir).preOrder()) {
            if (node.fn() == Fn.INVALID) {
                throw new InvariantViolationException("live invalid node", node);
            }
            int arity = node.fn().arity;
            if (arity != -1 && node.argCount() != arity) {
                throw new InvariantViolationException(node.fn() + " with " + node.argCount() + " argument(s)", node);
            }
            live++;
        }

        ir.metadata()
                .validate(MetadataState.Kind.TOPOLOGICALLY_SORTED, MetadataState.Kind.BUFS_FORWARDED);
        LOGGER.debug("Graph is canonical, {} of {} node(s) live", live, graph.size());
    }

    @Override
    public String toString() {
        return "CheckCanonical";
    }
}
