package io.github.eutro.funcir.passes.form;

import io.github.eutro.funcir.ir.ComputeGraph;
import io.github.eutro.funcir.ir.FunctionalIR;
import io.github.eutro.funcir.ir.InvariantViolationException;
import io.github.eutro.funcir.ir.RoleKey;
import io.github.eutro.funcir.passes.InPlaceIRPass;
import io.github.eutro.funcir.passes.meta.MetadataState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Reorders the nodes of a graph so that every node comes after all of its arguments.
 * <p>
 * The order is found with Tarjan's strongly connected components algorithm, rooted at the nodes
 * named by role keys and then at every other node, so that no node is dropped. Any component with
 * more than one node, or a node that is its own argument, is a combinational loop: every loop is
 * logged, and the pass then fails with an {@link InvariantViolationException}.
 * Feedback from one cycle to the next must go through a {@link io.github.eutro.funcir.ir.Fn#STATE state}
 * node, with the next value bound by {@code declareState}.
 * <p>
 * No node may refer to a placeholder that was never given a value. Such placeholders
 * are kept if nothing refers to them.
 */
public class TopologicalSort implements InPlaceIRPass<FunctionalIR> {
    private static final Logger LOGGER = LogManager.getLogger();

    public static final TopologicalSort INSTANCE = new TopologicalSort();

    @Override
    public void runInPlace(FunctionalIR ir) {
        ComputeGraph graph = ir.graph();
        int n = graph.size();

        int deadPending = 0;
        for (int i = 0; i < n; i++) {
            if (graph.state(i) == ComputeGraph.State.PENDING) deadPending++;
            for (int j = 0; j < graph.argCount(i); j++) {
                int arg = graph.arg(i, j);
                if (graph.state(arg) == ComputeGraph.State.PENDING) {
                    throw new InvariantViolationException("node n" + i + " refers to an unresolved placeholder", ir.get(arg));
                }
            }
        }
        for (Map.Entry<RoleKey, Integer> entry : graph.keys().entrySet()) {
            if (graph.state(entry.getValue()) == ComputeGraph.State.PENDING) {
                throw new InvariantViolationException(entry.getKey() + " is an unresolved placeholder", ir.get(entry.getValue()));
            }
        }
        if (deadPending != 0) {
            LOGGER.debug("Keeping {} unreferenced placeholder(s) that were never resolved", deadPending);
        }

        class Runner {
            final int[] index = new int[n];
            final int[] low = new int[n];
            final boolean[] onStack = new boolean[n];
            final int[] sccStack = new int[n];
            int sccSp = 0;
            final int[] callNode = new int[n];
            final int[] callPos = new int[n];
            int callSp = 0;
            int counter = 0;

            final int[] order = new int[n];
            int emitted = 0;
            final List<int[]> loops = new ArrayList<>();

            {
                Arrays.fill(index, -1);
            }

            void enter(int v) {
                index[v] = low[v] = counter++;
                sccStack[sccSp++] = v;
                onStack[v] = true;
                callNode[callSp] = v;
                callPos[callSp] = 0;
                callSp++;
            }

            void run(int root) {
                if (index[root] != -1) return;
                enter(root);
                while (callSp > 0) {
                    int v = callNode[callSp - 1];
                    int pos = callPos[callSp - 1];
                    if (pos < graph.argCount(v)) {
                        callPos[callSp - 1]++;
                        int w = graph.arg(v, pos);
                        if (index[w] == -1) {
                            enter(w);
                        } else if (onStack[w]) {
                            low[v] = Math.min(low[v], index[w]);
                        }
                        continue;
                    }
                    callSp--;
                    if (callSp > 0) {
                        int u = callNode[callSp - 1];
                        low[u] = Math.min(low[u], low[v]);
                    }
                    if (low[v] == index[v]) emitComponent(v);
                }
            }

            void emitComponent(int v) {
                int start = sccSp;
                do {
                    start--;
                } while (sccStack[start] != v);
                int[] component = Arrays.copyOfRange(sccStack, start, sccSp);
                sccSp = start;
                for (int w : component) {
                    onStack[w] = false;
                    order[emitted++] = w;
                }
                if (component.length > 1 || isOwnArg(v)) {
                    loops.add(component);
                }
            }

            boolean isOwnArg(int v) {
                for (int j = 0; j < graph.argCount(v); j++) {
                    if (graph.arg(v, j) == v) return true;
                }
                return false;
            }
        }

        Runner runner = new Runner();
        for (int root : graph.keys().values()) {
            runner.run(root);
        }
        for (int i = 0; i < n; i++) {
            runner.run(i);
        }

        if (!runner.loops.isEmpty()) {
            for (int[] loop : runner.loops) {
                StringBuilder sb = new StringBuilder();
                for (int v : loop) {
                    sb.append("\n  n").append(v).append(" = ").append(ir.get(v).toString(node -> "n" + node.id()));
                }
                LOGGER.warn("Found combinational loop of {} node(s):{}", loop.length, sb);
            }
            throw new InvariantViolationException("found " + runner.loops.size() + " combinational loop(s)",
                    ir.get(runner.loops.get(0)[0]));
        }

        graph.permute(runner.order);
        ir.metadata().validate(MetadataState.Kind.TOPOLOGICALLY_SORTED);
        LOGGER.debug("Sorted {} node(s)", n);
    }

    @Override
    public String toString() {
        return "TopologicalSort";
    }
}
