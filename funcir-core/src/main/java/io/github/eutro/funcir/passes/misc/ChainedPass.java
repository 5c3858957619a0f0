package io.github.eutro.funcir.passes.misc;

import io.github.eutro.funcir.passes.IRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs one pass, then another on its result.
 * <p>
 * Nested chains are flattened when run, so a failure is reported with its position in the whole chain.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 * @see IRPass#then(IRPass)
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private static final Logger LOGGER = LogManager.getLogger();

    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    /**
     * Get every pass of this chain, in the order they run.
     *
     * @return The passes.
     */
    public List<IRPass<?, ?>> passes() {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        IRPass<?, ?> pass = this;
        while (pass instanceof ChainedPass) {
            ChainedPass<?, ?, ?> chained = (ChainedPass<?, ?, ?>) pass;
            passes.add(chained.nextPass);
            pass = chained.firstPass;
        }
        passes.add(pass);
        Collections.reverse(passes);
        return passes;
    }

    @Override
    public boolean isInPlace() {
        return firstPass.isInPlace() && nextPass.isInPlace();
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        List<IRPass<?, ?>> passes = passes();
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = (IRPass<Object, Object>) passes.get(i);
            LOGGER.debug("Running pass {} of {}: {}", i, passes.size(), pass);
            try {
                acc = pass.run(acc);
            } catch (RuntimeException | Error t) {
                t.addSuppressed(new RuntimeException("running pass " + i + " in chain"));
                throw t;
            }
        }
        return (C) acc;
    }

    @Override
    public String toString() {
        return firstPass + " then " + nextPass;
    }
}
