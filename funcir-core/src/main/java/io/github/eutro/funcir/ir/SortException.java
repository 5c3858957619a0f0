package io.github.eutro.funcir.ir;

/**
 * Thrown when an accessor is used on a value of the wrong kind, such as the width of a memory sort.
 */
public class SortException extends IRException {
    public SortException(String message) {
        super(message);
    }

    public SortException(String message, Node node) {
        super(message, node);
    }
}
