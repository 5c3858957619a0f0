package io.github.eutro.funcir.ir;

/**
 * Thrown when a graph is built or transformed in a way that breaks its structural invariants,
 * such as mismatched widths or backfilling a node that is not a placeholder.
 */
public class InvariantViolationException extends IRException {
    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Node node) {
        super(message, node);
    }
}
