package io.github.eutro.funcir.passes;

import io.github.eutro.funcir.passes.misc.ChainedPass;

/**
 * A transformation or analysis over some IR, usually a
 * {@link io.github.eutro.funcir.ir.FunctionalIR FunctionalIR}.
 *
 * @param <A> The type of IR this pass takes.
 * @param <B> The type of IR this pass returns.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run on.
     * @return The result.
     */
    B run(A a);

    /**
     * Whether this pass mutates its argument and returns it, rather than building something new.
     *
     * @return Whether this pass is in place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another, which receives the result of this one.
     * <p>
     * Exceptions thrown by either get a suppressed exception saying which pass of the chain failed.
     *
     * @param next The pass to run after this one.
     * @param <C>  The result type of {@code next}.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
