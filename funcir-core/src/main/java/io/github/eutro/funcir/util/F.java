package io.github.eutro.funcir.util;

/**
 * A simple unary function, used for naming nodes and for the successors of graph walks.
 *
 * @param <A> The argument type.
 * @param <B> The return type.
 */
@FunctionalInterface
public interface F<A, B> {
    B apply(A a);

    /**
     * Compose this function with another.
     *
     * @param g   The function to apply after this.
     * @param <C> The result type.
     * @return The composed function.
     */
    default <C> F<A, C> andThen(F<B, C> g) {
        return a -> g.apply(apply(a));
    }
}
