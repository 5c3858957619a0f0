package io.github.eutro.funcir.ir;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The node store of a {@link FunctionalIR}: a hash-consed arena of nodes addressed by index.
 * <p>
 * Every node has its {@link NodeData}, its {@link Sort}, and an ordered list of argument indices
 * into the same arena. Nodes may additionally have a name hint, and be named by any number of
 * {@link RoleKey}s.
 * <p>
 * Ordinary nodes are deduplicated: {@link #add(NodeData, Sort, int...) adding} a node with the
 * same data and arguments as an existing one returns the existing index. Placeholders and
 * {@link Fn#MULTIPLE multiple} nodes are allocated fresh, and are the only nodes whose arguments
 * can be appended to after creation.
 * <p>
 * Indices are stable until {@link #permute(int[])}, and this is not thread-safe.
 */
public final class ComputeGraph {
    static final boolean TRACK_NODE_CREATIONS = System.getenv("FUNCIR_TRACK_NODE_CREATIONS") != null;

    private static final int[] NO_ARGS = new int[0];

    /**
     * The mutability state of a node.
     */
    public enum State {
        /**
         * An ordinary node, deduplicated on its data and arguments.
         */
        CONSED,
        /**
         * A placeholder {@code buf} that has not received its argument yet.
         */
        PENDING,
        /**
         * A {@code multiple} node that is still accepting arguments.
         */
        VARIADIC,
        /**
         * A backfilled placeholder or a finished {@code multiple} node.
         */
        FIXED,
    }

    private static final class Entry {
        final NodeData data;
        final Sort sort;
        State state;
        int[] args;
        @Nullable
        final Throwable created = IRException.trackCreation();

        Entry(NodeData data, Sort sort, State state, int[] args) {
            this.data = data;
            this.sort = sort;
            this.state = state;
            this.args = args;
        }
    }

    private static final class Key {
        final NodeData data;
        final int[] args;
        final int hash;

        Key(NodeData data, int[] args) {
            this.data = data;
            this.args = args;
            this.hash = 31 * data.hashCode() + Arrays.hashCode(args);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key key = (Key) o;
            return hash == key.hash && data.equals(key.data) && Arrays.equals(args, key.args);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }

    private final FunctionalIR owner;
    private List<Entry> nodes = new ArrayList<>();
    private final Map<Key, Integer> consed = new HashMap<>();
    private Map<Integer, String> names = new HashMap<>();
    private final Map<RoleKey, Integer> keys = new LinkedHashMap<>();

    ComputeGraph(FunctionalIR owner) {
        this.owner = owner;
    }

    public int size() {
        return nodes.size();
    }

    private Entry entry(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IndexOutOfBoundsException("node " + index + " of " + nodes.size());
        }
        return nodes.get(index);
    }

    private Node node(int index) {
        return new Node(owner, index);
    }

    public NodeData data(int index) {
        return entry(index).data;
    }

    public Sort sort(int index) {
        return entry(index).sort;
    }

    public State state(int index) {
        return entry(index).state;
    }

    public int argCount(int index) {
        return entry(index).args.length;
    }

    public int arg(int index, int n) {
        int[] args = entry(index).args;
        if (n < 0 || n >= args.length) {
            throw new InvariantViolationException("argument " + n + " of a node with " + args.length + " arguments", node(index));
        }
        return args[n];
    }

    @Nullable
    Throwable creationTrace(int index) {
        return entry(index).created;
    }

    private void checkArgs(int[] args) {
        for (int arg : args) {
            if (arg < 0 || arg >= nodes.size()) {
                throw new InvariantViolationException("argument index " + arg + " out of range, graph has " + nodes.size() + " nodes");
            }
        }
    }

    private int push(Entry entry) {
        nodes.add(entry);
        return nodes.size() - 1;
    }

    /**
     * Add a node, or find an existing node with the same data and arguments.
     *
     * @param data The data of the node.
     * @param sort The sort of the node, which must be implied by the data and arguments.
     * @param args The indices of the arguments.
     * @return The index of the node.
     */
    public int add(NodeData data, Sort sort, int... args) {
        checkArgs(args);
        Key key = new Key(data, args.length == 0 ? NO_ARGS : args.clone());
        Integer existing = consed.get(key);
        if (existing != null) return existing;
        int index = push(new Entry(data, sort, State.CONSED, key.args));
        consed.put(key, index);
        return index;
    }

    /**
     * Add a node that is never deduplicated, and that will have its arguments appended later.
     *
     * @param data  The data of the node.
     * @param sort  The sort of the node.
     * @param state {@link State#PENDING} or {@link State#VARIADIC}.
     * @return The index of the new node.
     */
    public int addUnique(NodeData data, Sort sort, State state) {
        if (state != State.PENDING && state != State.VARIADIC) {
            throw new IllegalArgumentException("unique nodes start out PENDING or VARIADIC, not " + state);
        }
        return push(new Entry(data, sort, state, NO_ARGS));
    }

    /**
     * Append an argument to a placeholder or {@code multiple} node.
     * <p>
     * A {@link State#PENDING} placeholder becomes {@link State#FIXED} with its one argument.
     *
     * @param index The node to append to.
     * @param arg   The argument.
     * @throws InvariantViolationException If the node does not accept arguments.
     */
    public void appendArg(int index, int arg) {
        checkArgs(new int[]{arg});
        Entry entry = entry(index);
        switch (entry.state) {
            case PENDING:
                entry.args = new int[]{arg};
                entry.state = State.FIXED;
                break;
            case VARIADIC:
                int[] args = Arrays.copyOf(entry.args, entry.args.length + 1);
                args[entry.args.length] = arg;
                entry.args = args;
                break;
            default:
                throw new InvariantViolationException("cannot append an argument to a " + entry.state + " "
                        + entry.data.fn + " node", node(index));
        }
    }

    /**
     * Stop a {@link State#VARIADIC} node from accepting arguments.
     *
     * @param index The node.
     */
    public void seal(int index) {
        Entry entry = entry(index);
        if (entry.state != State.VARIADIC) {
            throw new InvariantViolationException("cannot seal a " + entry.state + " node", node(index));
        }
        entry.state = State.FIXED;
    }

    /**
     * Name a node with a role key.
     *
     * @param index The node.
     * @param key   The key.
     * @throws DuplicateKeyException If the key already names a different node.
     */
    public void assignKey(int index, RoleKey key) {
        entry(index);
        Integer previous = keys.get(key);
        if (previous != null && previous != index) {
            throw new DuplicateKeyException(key, node(index));
        }
        keys.put(key, index);
    }

    /**
     * Find the node named by a role key.
     *
     * @param key The key.
     * @return The index of the node, or -1.
     */
    public int findKey(RoleKey key) {
        Integer index = keys.get(key);
        return index == null ? -1 : index;
    }

    /**
     * Get all role keys and the nodes they name, in the order they were first assigned.
     *
     * @return An unmodifiable view of the keys.
     */
    public Map<RoleKey, Integer> keys() {
        return Collections.unmodifiableMap(keys);
    }

    public boolean hasName(int index) {
        return names.containsKey(index);
    }

    @Nullable
    public String getName(int index) {
        return names.get(index);
    }

    public void setName(int index, @NotNull String name) {
        entry(index);
        names.put(index, name);
    }

    /**
     * Reorder the nodes.
     * <p>
     * Arguments, keys and names are all renumbered to follow their nodes.
     *
     * @param order The old index of each node, by new index. Must be a permutation of all indices.
     */
    public void permute(int[] order) {
        int n = nodes.size();
        if (order.length != n) {
            throw new IllegalArgumentException("permutation of " + order.length + " nodes, graph has " + n);
        }
        int[] newIndex = new int[n];
        Arrays.fill(newIndex, -1);
        for (int i = 0; i < n; i++) {
            if (newIndex[order[i]] != -1) throw new IllegalArgumentException("node " + order[i] + " appears twice");
            newIndex[order[i]] = i;
        }

        List<Entry> newNodes = new ArrayList<>(n);
        for (int old : order) {
            Entry entry = nodes.get(old);
            for (int j = 0; j < entry.args.length; j++) {
                entry.args[j] = newIndex[entry.args[j]];
            }
            newNodes.add(entry);
        }
        nodes = newNodes;

        Map<Integer, String> newNames = new HashMap<>();
        names.forEach((index, name) -> newNames.put(newIndex[index], name));
        names = newNames;

        keys.replaceAll((key, index) -> newIndex[index]);
        rebuildConsTable();
    }

    /**
     * Rewrite every argument and key through a substitution.
     *
     * @param subst The index to use in place of each index.
     */
    public void redirect(int[] subst) {
        if (subst.length != nodes.size()) {
            throw new IllegalArgumentException("substitution of " + subst.length + " nodes, graph has " + nodes.size());
        }
        checkArgs(subst);
        for (Entry entry : nodes) {
            for (int j = 0; j < entry.args.length; j++) {
                entry.args[j] = subst[entry.args[j]];
            }
        }
        keys.replaceAll((key, index) -> subst[index]);
        rebuildConsTable();
    }

    private void rebuildConsTable() {
        consed.clear();
        for (int i = 0; i < nodes.size(); i++) {
            Entry entry = nodes.get(i);
            if (entry.state == State.CONSED) {
                consed.putIfAbsent(new Key(entry.data, entry.args), i);
            }
        }
    }
}
