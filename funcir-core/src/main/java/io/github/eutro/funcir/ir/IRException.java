package io.github.eutro.funcir.ir;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a caller breaks one of the invariants of the IR.
 * <p>
 * These are programming errors in the caller and are never recovered from by the IR itself.
 */
public class IRException extends RuntimeException {
    private final int nodeIndex;

    public IRException(String message) {
        super(message);
        this.nodeIndex = -1;
    }

    /**
     * Construct an exception about a particular node.
     * <p>
     * If node creation tracking is enabled, the node's creation trace is attached as suppressed.
     *
     * @param message The message.
     * @param node    The offending node.
     */
    public IRException(String message, Node node) {
        super(message + " (at n" + node.id() + ")");
        this.nodeIndex = node.id();
        Throwable created = node.creationTrace();
        if (created != null) addSuppressed(created);
    }

    /**
     * Get the index of the offending node.
     *
     * @return The index, or -1 if this exception is not about a particular node.
     */
    public int getNodeIndex() {
        return nodeIndex;
    }

    @Nullable
    static Throwable trackCreation() {
        return ComputeGraph.TRACK_NODE_CREATIONS ? new Throwable("node created") : null;
    }
}
