package io.github.eutro.funcir.ir;

/**
 * Thrown when an input, state variable or output is declared again with a different {@link Sort}.
 */
public class InconsistentDeclarationException extends IRException {
    public InconsistentDeclarationException(String kind, String name, Sort previous, Sort sort) {
        super(kind + " '" + name + "' declared as " + sort + ", but was previously declared as " + previous);
    }
}
