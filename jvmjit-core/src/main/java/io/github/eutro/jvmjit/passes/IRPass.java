package io.github.eutro.jvmjit.passes;

import io.github.eutro.jvmjit.passes.misc.ChainedPass;

/**
 * One step of compilation, from one representation of a method to the next.
 *
 * @param <A> The type of the input.
 * @param <B> The type of the output.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Compose this pass with another, which is run on its result.
     *
     * @param next The pass to run after this one.
     * @param <C>  The output type of the next pass.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
