package io.github.eutro.funcir.util;

import io.github.eutro.funcir.ir.FunctionalIR;
import io.github.eutro.funcir.ir.Node;

import java.util.*;

/**
 * Walks a graph depth-first from some roots.
 * <p>
 * Every node reachable from the roots is yielded exactly once.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    final List<T> roots;
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from its roots and a successor function.
     * <p>
     * Elements yielded later by the successor function will be visited first,
     * and so will later roots.
     *
     * @param roots       The roots of the walk.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(Collection<? extends T> roots, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.roots = new ArrayList<>(roots);
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the nodes of a {@link FunctionalIR} that are live, that is,
     * reachable from an output or the next value of a state variable.
     * <p>
     * Roots and arguments are visited in order.
     *
     * @param ir The graph.
     * @return The graph walker.
     */
    public static GraphWalker<Node> nodeWalker(FunctionalIR ir) {
        List<Node> roots = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (int index : ir.graph().keys().values()) {
            if (seen.add(index)) roots.add(ir.get(index));
        }
        Collections.reverse(roots);
        return new GraphWalker<Node>(roots, GraphWalker::reversedArgs);
    }

    private static List<Node> reversedArgs(Node node) {
        List<Node> args = new ArrayList<>(node.argCount());
        for (int i = node.argCount() - 1; i >= 0; i--) {
            args.add(node.arg(i));
        }
        return args;
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Get the nodes reachable from the roots, each before any of its successors that
     * it is the first to reach.
     *
     * @return The order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            for (T root : roots) {
                if (seen.add(root)) stack.add(root);
            }
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }
}
