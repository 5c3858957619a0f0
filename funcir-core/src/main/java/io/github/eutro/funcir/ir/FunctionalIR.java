package io.github.eutro.funcir.ir;

import io.github.eutro.funcir.passes.form.ForwardBuf;
import io.github.eutro.funcir.passes.form.TopologicalSort;
import io.github.eutro.funcir.passes.meta.MetadataState;
import io.github.eutro.funcir.support.Scope;
import io.github.eutro.funcir.support.Writer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A functional, strongly typed dataflow graph describing the combinational and sequential
 * logic of a circuit.
 * <p>
 * A graph is built with its {@link #factory() factory}, which may use placeholders for values
 * that are not known yet. It is then brought to canonical form by {@link #topologicalSort()}
 * followed by {@link #forwardBuf()}, after which it should only be read, for instance with
 * {@link Node#visit(Visitor) visitors}. A finished graph may be read from several threads,
 * as long as none of them modifies it.
 * <p>
 * Besides its nodes, a graph records the declared inputs, state variables and outputs,
 * each with its {@link Sort}. Outputs and the next values of state variables are found through
 * {@link #getOutputNode(String)} and {@link #getStateNextNode(String)}; the current value of a
 * state variable is a {@link Fn#STATE state} node.
 */
public class FunctionalIR implements Iterable<Node> {
    private static final Logger LOGGER = LogManager.getLogger();

    private final ComputeGraph graph = new ComputeGraph(this);
    private final Map<String, Sort> inputs = new LinkedHashMap<>();
    private final Map<String, Sort> outputs = new LinkedHashMap<>();
    private final Map<String, Sort> state = new LinkedHashMap<>();
    private final MetadataState metadata = new MetadataState();

    /**
     * Get the record of which canonical-form properties currently hold.
     *
     * @return The metadata of this graph.
     */
    public MetadataState metadata() {
        return metadata;
    }

    /**
     * Get the node store, for passes that restructure the graph.
     *
     * @return The node store.
     */
    public ComputeGraph graph() {
        return graph;
    }

    /**
     * Get a factory to add nodes to this graph with.
     *
     * @return The factory.
     */
    public Factory factory() {
        return new Factory();
    }

    public int size() {
        return graph.size();
    }

    /**
     * Get the node at an index.
     *
     * @param index The index.
     * @return The node.
     */
    public Node get(int index) {
        if (index < 0 || index >= graph.size()) {
            throw new IndexOutOfBoundsException("node " + index + " of " + graph.size());
        }
        return new Node(this, index);
    }

    @NotNull
    @Override
    public Iterator<Node> iterator() {
        return new Iterator<Node>() {
            int index = 0;

            @Override
            public boolean hasNext() {
                return index < graph.size();
            }

            @Override
            public Node next() {
                if (!hasNext()) throw new NoSuchElementException();
                return new Node(FunctionalIR.this, index++);
            }
        };
    }

    /**
     * Get the declared inputs and their sorts, in declaration order.
     *
     * @return An unmodifiable view of the inputs.
     */
    public Map<String, Sort> inputs() {
        return Collections.unmodifiableMap(inputs);
    }

    /**
     * Get the declared outputs and their sorts, in declaration order.
     *
     * @return An unmodifiable view of the outputs.
     */
    public Map<String, Sort> outputs() {
        return Collections.unmodifiableMap(outputs);
    }

    /**
     * Get the declared state variables and their sorts, in declaration order.
     *
     * @return An unmodifiable view of the state variables.
     */
    public Map<String, Sort> state() {
        return Collections.unmodifiableMap(state);
    }

    /**
     * Get the node that is the value of a declared output.
     *
     * @param name The name of the output.
     * @return The node.
     * @throws NoSuchElementException If no node was declared as that output.
     */
    public Node getOutputNode(String name) {
        return findKey(RoleKey.output(name));
    }

    /**
     * Get the node that is the next value of a state variable.
     *
     * @param name The name of the state variable.
     * @return The node.
     * @throws NoSuchElementException If no node was declared as the next value of that state variable.
     */
    public Node getStateNextNode(String name) {
        return findKey(RoleKey.nextState(name));
    }

    private Node findKey(RoleKey key) {
        int index = graph.findKey(key);
        if (index == -1) throw new NoSuchElementException("no node for " + key);
        return new Node(this, index);
    }

    /**
     * Reorder the nodes so that every node comes after its arguments.
     * <p>
     * Invalidates every existing {@link Node} handle.
     *
     * @see TopologicalSort
     */
    public void topologicalSort() {
        TopologicalSort.INSTANCE.runInPlace(this);
    }

    /**
     * Make every reference to a {@link Fn#BUF buf} node refer to what it forwards instead.
     *
     * @see ForwardBuf
     */
    public void forwardBuf() {
        ForwardBuf.INSTANCE.runInPlace(this);
    }

    private static void declare(Map<String, Sort> map, String kind, String name, Sort sort) {
        Sort previous = map.putIfAbsent(name, sort);
        if (previous != null && !previous.equals(sort)) {
            throw new InconsistentDeclarationException(kind, name, previous, sort);
        }
    }

    /**
     * Render the whole graph for debugging: the declarations, then every node, then the role keys.
     *
     * @return The rendering.
     */
    @Override
    public String toString() {
        Scope<Integer> scope = Scope.forPredicate(c -> Character.isLetterOrDigit(c) || c == '_' || c == '$');
        StringBuilder sb = new StringBuilder();
        Writer w = new Writer(sb);
        inputs.forEach((name, sort) -> w.print("input {} : {}\n", name, sort));
        state.forEach((name, sort) -> w.print("state {} : {}\n", name, sort));
        outputs.forEach((name, sort) -> w.print("output {} : {}\n", name, sort));
        for (Node node : this) {
            w.printWith(Node.class, n -> scope.apply(n.id(), n.name()),
                    "{} = {} : {}\n", node, node.toString(n -> scope.apply(n.id(), n.name())), node.sort());
        }
        graph.keys().forEach((key, index) -> w.print("{} = {}\n", key, scope.apply(index, get(index).name())));
        return sb.toString();
    }

    /**
     * The only way to add nodes to, or change nodes of, a {@link FunctionalIR}.
     * <p>
     * Every method checks the sorts of its arguments, and throws an
     * {@link InvariantViolationException} if they don't fit the operation.
     * Some methods return an existing node instead of a new one where
     * the operation would be the identity.
     */
    public final class Factory {
        private Factory() {
        }

        private int own(Node node) {
            if (node.ir() != FunctionalIR.this) {
                throw new InvariantViolationException("node belongs to a different graph", node);
            }
            return node.id();
        }

        private void changed() {
            metadata.graphChanged();
        }

        private Node add(NodeData data, Sort sort, Node... args) {
            int[] indices = new int[args.length];
            for (int i = 0; i < args.length; i++) {
                indices[i] = own(args[i]);
            }
            int sizeBefore = graph.size();
            int index = graph.add(data, sort, indices);
            if (graph.size() != sizeBefore) changed();
            return new Node(FunctionalIR.this, index);
        }

        private Sort signal(int width) {
            if (width <= 0) throw new InvariantViolationException("bit-vector width must be positive, got " + width);
            return Sort.bits(width);
        }

        private Sort memory(int addrWidth, int dataWidth) {
            if (addrWidth <= 0 || dataWidth <= 0) {
                throw new InvariantViolationException("memory widths must be positive, got " + addrWidth + ", " + dataWidth);
            }
            return Sort.memory(addrWidth, dataWidth);
        }

        private void checkUnary(Fn fn, Node a) {
            if (!a.sort().isSignal()) {
                throw new InvariantViolationException(fn + " of non-bit-vector " + a.sort(), a);
            }
        }

        private void checkBasicBinary(Fn fn, Node a, Node b) {
            if (!a.sort().isSignal() || !a.sort().equals(b.sort())) {
                throw new InvariantViolationException(fn + " needs operands of the same bit-vector sort, got "
                        + a.sort() + " and " + b.sort(), b);
            }
        }

        private void checkShift(Fn fn, Node a, Node b) {
            checkUnary(fn, a);
            checkUnary(fn, b);
            int expected = ceilLog2(a.width());
            if (b.width() != expected) {
                throw new InvariantViolationException(fn + " of " + a.sort() + " needs a " + expected
                        + "-bit shift amount, got " + b.sort(), b);
            }
        }

        private int ceilLog2(int n) {
            return n <= 1 ? 0 : 32 - Integer.numberOfLeadingZeros(n - 1);
        }

        /**
         * {@code a[offset +: outWidth]}
         *
         * @param a        The value to slice.
         * @param offset   The index of the lowest bit to keep.
         * @param outWidth The number of bits to keep.
         * @return The slice, or {@code a} itself if the slice is all of it.
         */
        public Node slice(Node a, int offset, int outWidth) {
            checkUnary(Fn.SLICE, a);
            if (offset < 0 || outWidth <= 0 || outWidth > a.width() - offset) {
                throw new InvariantViolationException("slice [" + offset + " +: " + outWidth + "] out of range for "
                        + a.sort(), a);
            }
            if (offset == 0 && outWidth == a.width()) return a;
            return add(NodeData.slice(offset, outWidth), signal(outWidth), a);
        }

        /**
         * Extend or truncate a value to a width.
         *
         * @param a        The value.
         * @param outWidth The width to extend or truncate to.
         * @param isSigned Whether to sign extend rather than zero extend.
         * @return The extended or truncated value, or {@code a} itself if it already has that width.
         */
        public Node extend(Node a, int outWidth, boolean isSigned) {
            checkUnary(isSigned ? Fn.SIGN_EXTEND : Fn.ZERO_EXTEND, a);
            int inWidth = a.width();
            if (inWidth == outWidth) return a;
            if (inWidth > outWidth) return slice(a, 0, outWidth);
            Fn fn = isSigned ? Fn.SIGN_EXTEND : Fn.ZERO_EXTEND;
            return add(NodeData.ofWidth(fn, outWidth), signal(outWidth), a);
        }

        /**
         * Concatenate two values, {@code a} in the least significant bits.
         *
         * @param a The low bits.
         * @param b The high bits.
         * @return The concatenation.
         */
        public Node concat(Node a, Node b) {
            checkUnary(Fn.CONCAT, a);
            checkUnary(Fn.CONCAT, b);
            return add(NodeData.of(Fn.CONCAT), signal(a.width() + b.width()), a, b);
        }

        private Node binary(Fn fn, Node a, Node b) {
            checkBasicBinary(fn, a, b);
            return add(NodeData.of(fn), a.sort(), a, b);
        }

        private Node compare(Fn fn, Node a, Node b) {
            checkBasicBinary(fn, a, b);
            return add(NodeData.of(fn), Sort.bits(1), a, b);
        }

        private Node reduce(Fn fn, Node a) {
            checkUnary(fn, a);
            if (a.width() == 1) return a;
            return add(NodeData.of(fn), Sort.bits(1), a);
        }

        private Node shift(Fn fn, Node a, Node b) {
            checkShift(fn, a, b);
            return add(NodeData.of(fn), a.sort(), a, b);
        }

        public Node add(Node a, Node b) {
            return binary(Fn.ADD, a, b);
        }

        public Node sub(Node a, Node b) {
            return binary(Fn.SUB, a, b);
        }

        public Node mul(Node a, Node b) {
            return binary(Fn.MUL, a, b);
        }

        public Node unsignedDiv(Node a, Node b) {
            return binary(Fn.UNSIGNED_DIV, a, b);
        }

        public Node unsignedMod(Node a, Node b) {
            return binary(Fn.UNSIGNED_MOD, a, b);
        }

        public Node bitwiseAnd(Node a, Node b) {
            return binary(Fn.BITWISE_AND, a, b);
        }

        public Node bitwiseOr(Node a, Node b) {
            return binary(Fn.BITWISE_OR, a, b);
        }

        public Node bitwiseXor(Node a, Node b) {
            return binary(Fn.BITWISE_XOR, a, b);
        }

        public Node bitwiseNot(Node a) {
            checkUnary(Fn.BITWISE_NOT, a);
            return add(NodeData.of(Fn.BITWISE_NOT), a.sort(), a);
        }

        public Node unaryMinus(Node a) {
            checkUnary(Fn.UNARY_MINUS, a);
            return add(NodeData.of(Fn.UNARY_MINUS), a.sort(), a);
        }

        public Node reduceAnd(Node a) {
            return reduce(Fn.REDUCE_AND, a);
        }

        public Node reduceOr(Node a) {
            return reduce(Fn.REDUCE_OR, a);
        }

        public Node reduceXor(Node a) {
            return reduce(Fn.REDUCE_XOR, a);
        }

        public Node equal(Node a, Node b) {
            return compare(Fn.EQUAL, a, b);
        }

        public Node notEqual(Node a, Node b) {
            return compare(Fn.NOT_EQUAL, a, b);
        }

        public Node signedGreaterThan(Node a, Node b) {
            return compare(Fn.SIGNED_GREATER_THAN, a, b);
        }

        public Node signedGreaterEqual(Node a, Node b) {
            return compare(Fn.SIGNED_GREATER_EQUAL, a, b);
        }

        public Node unsignedGreaterThan(Node a, Node b) {
            return compare(Fn.UNSIGNED_GREATER_THAN, a, b);
        }

        public Node unsignedGreaterEqual(Node a, Node b) {
            return compare(Fn.UNSIGNED_GREATER_EQUAL, a, b);
        }

        public Node logicalShiftLeft(Node a, Node b) {
            return shift(Fn.LOGICAL_SHIFT_LEFT, a, b);
        }

        public Node logicalShiftRight(Node a, Node b) {
            return shift(Fn.LOGICAL_SHIFT_RIGHT, a, b);
        }

        public Node arithmeticShiftRight(Node a, Node b) {
            return shift(Fn.ARITHMETIC_SHIFT_RIGHT, a, b);
        }

        /**
         * {@code s ? b : a}
         *
         * @param a The value when {@code s} is 0.
         * @param b The value when {@code s} is 1.
         * @param s The 1-bit select.
         * @return The mux.
         */
        public Node mux(Node a, Node b, Node s) {
            checkBasicBinary(Fn.MUX, a, b);
            if (!s.sort().equals(Sort.bits(1))) {
                throw new InvariantViolationException("mux select must be bit[1], got " + s.sort(), s);
            }
            return add(NodeData.of(Fn.MUX), a.sort(), a, b, s);
        }

        /**
         * Read a word of a memory.
         *
         * @param mem  The memory.
         * @param addr The address, as wide as the memory's addresses.
         * @return The word, as wide as the memory's data.
         */
        public Node memoryRead(Node mem, Node addr) {
            Sort memSort = mem.sort();
            if (!memSort.isMemory()) {
                throw new InvariantViolationException("memory_read of non-memory " + memSort, mem);
            }
            if (!addr.sort().equals(Sort.bits(memSort.addrWidth()))) {
                throw new InvariantViolationException("memory_read address of " + memSort + " must be bit["
                        + memSort.addrWidth() + "], got " + addr.sort(), addr);
            }
            return add(NodeData.of(Fn.MEMORY_READ), Sort.bits(memSort.dataWidth()), mem, addr);
        }

        /**
         * Write a word of a memory.
         *
         * @param mem  The memory.
         * @param addr The address, as wide as the memory's addresses.
         * @param data The word, as wide as the memory's data.
         * @return The memory after the write.
         */
        public Node memoryWrite(Node mem, Node addr, Node data) {
            Sort memSort = mem.sort();
            if (!memSort.isMemory()) {
                throw new InvariantViolationException("memory_write of non-memory " + memSort, mem);
            }
            if (!addr.sort().equals(Sort.bits(memSort.addrWidth()))) {
                throw new InvariantViolationException("memory_write address of " + memSort + " must be bit["
                        + memSort.addrWidth() + "], got " + addr.sort(), addr);
            }
            if (!data.sort().equals(Sort.bits(memSort.dataWidth()))) {
                throw new InvariantViolationException("memory_write data of " + memSort + " must be bit["
                        + memSort.dataWidth() + "], got " + data.sort(), data);
            }
            return add(NodeData.of(Fn.MEMORY_WRITE), memSort, mem, addr, data);
        }

        public Node constant(Const value) {
            return add(NodeData.constant(value), signal(value.width()));
        }

        /**
         * Create a placeholder, to be given its value later with {@link #updatePending(Node, Node)}.
         * <p>
         * Every call returns a new node.
         *
         * @param width The width of the value.
         * @return The placeholder.
         */
        public Node createPending(int width) {
            Sort sort = signal(width);
            int index = graph.addUnique(NodeData.of(Fn.BUF), sort, ComputeGraph.State.PENDING);
            changed();
            return new Node(FunctionalIR.this, index);
        }

        /**
         * Give a placeholder its value.
         *
         * @param node  The placeholder, which must not have been given a value already.
         * @param value The value, which must have the same sort.
         */
        public void updatePending(Node node, Node value) {
            own(node);
            own(value);
            if (node.fn() != Fn.BUF || !node.isPending()) {
                throw new InvariantViolationException("update of " + node.fn() + " node that is not a pending placeholder", node);
            }
            if (!node.sort().equals(value.sort())) {
                throw new InvariantViolationException("placeholder of " + node.sort() + " updated with "
                        + value.sort(), node);
            }
            graph.appendArg(node.id(), value.id());
            changed();
            LOGGER.trace("Resolved placeholder n{} to n{}", node.id(), value.id());
        }

        /**
         * Declare an input, and get its value.
         *
         * @param name  The name of the input.
         * @param width The width of the input, which must match any earlier declaration.
         * @return The value of the input.
         */
        public Node input(String name, int width) {
            Sort sort = signal(width);
            declare(inputs, "input", name, sort);
            return add(NodeData.named(Fn.INPUT, name), sort);
        }

        /**
         * Declare a bit-vector state variable, and get its current value.
         *
         * @param name  The name of the state variable.
         * @param width The width, which must match any earlier declaration.
         * @return The current value.
         */
        public Node state(String name, int width) {
            Sort sort = signal(width);
            declare(state, "state", name, sort);
            return add(NodeData.named(Fn.STATE, name), sort);
        }

        /**
         * Declare a memory state variable, and get its current contents.
         *
         * @param name      The name of the state variable.
         * @param addrWidth The address width, which must match any earlier declaration.
         * @param dataWidth The data width, which must match any earlier declaration.
         * @return The current contents.
         */
        public Node stateMemory(String name, int addrWidth, int dataWidth) {
            Sort sort = memory(addrWidth, dataWidth);
            declare(state, "state", name, sort);
            return add(NodeData.named(Fn.STATE, name), sort);
        }

        /**
         * Mark a value as driven by more than one source.
         * <p>
         * Every call returns a new node.
         *
         * @param args  The drivers.
         * @param width The width of the value.
         * @return The node.
         */
        public Node multiple(List<Node> args, int width) {
            Sort sort = signal(width);
            int index = graph.addUnique(NodeData.of(Fn.MULTIPLE), sort, ComputeGraph.State.VARIADIC);
            for (Node arg : args) {
                graph.appendArg(index, own(arg));
            }
            graph.seal(index);
            changed();
            return new Node(FunctionalIR.this, index);
        }

        /**
         * A value that has no driver.
         *
         * @param width The width of the value.
         * @return The node.
         */
        public Node undriven(int width) {
            return add(NodeData.ofWidth(Fn.UNDRIVEN, width), signal(width));
        }

        // nothing is recorded unless every check passes
        private void bind(Map<String, Sort> map, String kind, String name, Node node, Sort sort, RoleKey key) {
            own(node);
            if (!node.sort().equals(sort)) {
                throw new InvariantViolationException(key + " declared as " + sort + ", but bound to a node of "
                        + node.sort(), node);
            }
            int previous = graph.findKey(key);
            if (previous != -1 && previous != node.id()) {
                throw new DuplicateKeyException(key, node);
            }
            declare(map, kind, name, sort);
            graph.assignKey(node.id(), key);
            changed();
        }

        /**
         * Declare an output and its value.
         *
         * @param node  The value of the output.
         * @param name  The name of the output.
         * @param width The width of the output.
         */
        public void declareOutput(Node node, String name, int width) {
            Sort sort = signal(width);
            bind(outputs, "output", name, node, sort, RoleKey.output(name));
        }

        /**
         * Declare the next value of a bit-vector state variable.
         *
         * @param node  The next value.
         * @param name  The name of the state variable.
         * @param width The width of the state variable.
         */
        public void declareState(Node node, String name, int width) {
            Sort sort = signal(width);
            bind(state, "state", name, node, sort, RoleKey.nextState(name));
        }

        /**
         * Declare the next contents of a memory state variable.
         *
         * @param node      The next contents.
         * @param name      The name of the state variable.
         * @param addrWidth The address width of the memory.
         * @param dataWidth The data width of the memory.
         */
        public void declareStateMemory(Node node, String name, int addrWidth, int dataWidth) {
            Sort sort = memory(addrWidth, dataWidth);
            bind(state, "state", name, node, sort, RoleKey.nextState(name));
        }

        /**
         * Suggest a name for a node. This has no meaning, and need not be unique.
         *
         * @param node The node.
         * @param name The name.
         */
        public void suggestName(Node node, String name) {
            graph.setName(own(node), name);
        }
    }
}
