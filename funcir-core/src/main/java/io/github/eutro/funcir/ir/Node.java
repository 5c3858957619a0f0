package io.github.eutro.funcir.ir;

import io.github.eutro.funcir.util.F;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A reference to a node of a {@link FunctionalIR}.
 * <p>
 * This is only an index into the graph: it is invalidated when the graph is
 * {@link FunctionalIR#topologicalSort() sorted}, and two handles are equal when
 * they refer to the same index of the same graph.
 */
public final class Node {
    private final FunctionalIR ir;
    private final int index;

    Node(FunctionalIR ir, int index) {
        this.ir = ir;
        this.index = index;
    }

    public FunctionalIR ir() {
        return ir;
    }

    /**
     * Get the index of this node in its graph.
     *
     * @return The index.
     */
    public int id() {
        return index;
    }

    /**
     * Get a name for this node, which need not be unique: the suggested name if there is one,
     * otherwise {@code n<id>}.
     *
     * @return The name.
     */
    public String name() {
        String name = ir.graph().getName(index);
        return name == null ? "n" + index : name;
    }

    public NodeData data() {
        return ir.graph().data(index);
    }

    public Fn fn() {
        return data().fn;
    }

    public Sort sort() {
        return ir.graph().sort(index);
    }

    /**
     * Get the width of a bit-vector node.
     *
     * @return The width.
     * @throws SortException If this is a memory node.
     */
    public int width() {
        Sort sort = sort();
        if (!sort.isSignal()) throw new SortException("width() of memory node", this);
        return sort.width();
    }

    public ComputeGraph.State state() {
        return ir.graph().state(index);
    }

    /**
     * Whether this is a placeholder that has not been backfilled yet.
     *
     * @return Whether this is pending.
     */
    public boolean isPending() {
        return state() == ComputeGraph.State.PENDING;
    }

    public int argCount() {
        return ir.graph().argCount(index);
    }

    public Node arg(int n) {
        return new Node(ir, ir.graph().arg(index, n));
    }

    /**
     * Get the literal of a {@link Fn#CONSTANT constant} node.
     *
     * @return The literal.
     * @throws SortException If this is not a constant.
     */
    public Const asConst() {
        NodeData data = data();
        if (data.fn != Fn.CONSTANT) throw new SortException("asConst() of " + data.fn + " node", this);
        return data.asConst();
    }

    /**
     * Get the name of an {@link Fn#INPUT input} or {@link Fn#STATE state} node.
     *
     * @return The name.
     * @throws SortException If this has no name payload.
     */
    public String asName() {
        NodeData data = data();
        if (data.fn.payload != Fn.Payload.NAME) throw new SortException("asName() of " + data.fn + " node", this);
        return data.asName();
    }

    /**
     * Get the integer payload of a node, the offset of a {@link Fn#SLICE slice}.
     *
     * @return The integer.
     * @throws SortException If this has no integer payload.
     */
    public int asInt() {
        NodeData data = data();
        if (data.fn.payload != Fn.Payload.INT) throw new SortException("asInt() of " + data.fn + " node", this);
        return data.asInt();
    }

    @Nullable
    Throwable creationTrace() {
        return ir.graph().creationTrace(index);
    }

    private void checkResolved() {
        if (isPending()) throw new InvariantViolationException("unresolved placeholder in visit", this);
    }

    /**
     * Call the method of {@code v} for the operation of this node.
     *
     * @param v   The visitor.
     * @param <T> The result type of the visitor.
     * @return The result of the visitor method.
     * @throws InvariantViolationException If this node is {@link Fn#INVALID invalid},
     *                                     {@link Fn#MULTIPLE multiple} or an unresolved placeholder.
     */
    public <T> T visit(@NotNull Visitor<T> v) {
        NodeData data = data();
        switch (data.fn) {
            case INVALID:
                throw new InvariantViolationException("invalid node in visit", this);
            case BUF:
                checkResolved();
                return v.buf(this, arg(0));
            case SLICE:
                return v.slice(this, arg(0), data.asInt(), data.width);
            case ZERO_EXTEND:
                return v.zeroExtend(this, arg(0), data.width);
            case SIGN_EXTEND:
                return v.signExtend(this, arg(0), data.width);
            case CONCAT:
                return v.concat(this, arg(0), arg(1));
            case ADD:
                return v.add(this, arg(0), arg(1));
            case SUB:
                return v.sub(this, arg(0), arg(1));
            case MUL:
                return v.mul(this, arg(0), arg(1));
            case UNSIGNED_DIV:
                return v.unsignedDiv(this, arg(0), arg(1));
            case UNSIGNED_MOD:
                return v.unsignedMod(this, arg(0), arg(1));
            case BITWISE_AND:
                return v.bitwiseAnd(this, arg(0), arg(1));
            case BITWISE_OR:
                return v.bitwiseOr(this, arg(0), arg(1));
            case BITWISE_XOR:
                return v.bitwiseXor(this, arg(0), arg(1));
            case BITWISE_NOT:
                return v.bitwiseNot(this, arg(0));
            case UNARY_MINUS:
                return v.unaryMinus(this, arg(0));
            case REDUCE_AND:
                return v.reduceAnd(this, arg(0));
            case REDUCE_OR:
                return v.reduceOr(this, arg(0));
            case REDUCE_XOR:
                return v.reduceXor(this, arg(0));
            case EQUAL:
                return v.equal(this, arg(0), arg(1));
            case NOT_EQUAL:
                return v.notEqual(this, arg(0), arg(1));
            case SIGNED_GREATER_THAN:
                return v.signedGreaterThan(this, arg(0), arg(1));
            case SIGNED_GREATER_EQUAL:
                return v.signedGreaterEqual(this, arg(0), arg(1));
            case UNSIGNED_GREATER_THAN:
                return v.unsignedGreaterThan(this, arg(0), arg(1));
            case UNSIGNED_GREATER_EQUAL:
                return v.unsignedGreaterEqual(this, arg(0), arg(1));
            case LOGICAL_SHIFT_LEFT:
                return v.logicalShiftLeft(this, arg(0), arg(1));
            case LOGICAL_SHIFT_RIGHT:
                return v.logicalShiftRight(this, arg(0), arg(1));
            case ARITHMETIC_SHIFT_RIGHT:
                return v.arithmeticShiftRight(this, arg(0), arg(1));
            case MUX:
                return v.mux(this, arg(0), arg(1), arg(2));
            case CONSTANT:
                return v.constant(this, data.asConst());
            case INPUT:
                return v.input(this, data.asName());
            case STATE:
                return v.state(this, data.asName());
            case MULTIPLE:
                throw new InvariantViolationException("multiple in visit", this);
            case UNDRIVEN:
                return v.undriven(this, data.width);
            case MEMORY_READ:
                return v.memoryRead(this, arg(0), arg(1));
            case MEMORY_WRITE:
                return v.memoryWrite(this, arg(0), arg(1), arg(2));
            default:
                throw new IllegalStateException("unhandled operation " + data.fn);
        }
    }

    /**
     * Render this node for debugging, naming arguments with {@link #name()}.
     *
     * @return The rendering.
     */
    @Override
    public String toString() {
        return toString(Node::name);
    }

    /**
     * Render this node for debugging.
     *
     * @param namer How to name the arguments.
     * @return The rendering, such as {@code add(a, b)}.
     */
    public String toString(F<Node, String> namer) {
        Fn fn = fn();
        if (fn == Fn.INVALID || fn == Fn.MULTIPLE || isPending()) {
            StringBuilder sb = new StringBuilder(isPending() ? "pending" : fn.mnemonic).append('(');
            for (int i = 0; i < argCount(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(namer.apply(arg(i)));
            }
            return sb.append(')').toString();
        }
        return visit(new PrintVisitor(namer));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node)) return false;
        Node node = (Node) o;
        return index == node.index && ir == node.ir;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(ir) + index;
    }
}
