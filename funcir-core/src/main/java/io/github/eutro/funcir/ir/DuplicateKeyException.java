package io.github.eutro.funcir.ir;

/**
 * Thrown when a {@link RoleKey} is bound to a node while it already names a different one.
 */
public class DuplicateKeyException extends IRException {
    public DuplicateKeyException(RoleKey key, Node node) {
        super("role key '" + key + "' is already bound to a different node", node);
    }
}
