package io.github.eutro.varrec.passes;

import io.github.eutro.varrec.passes.misc.ChainedPass;

/**
 * A pass over some IR, or over the result of an earlier pass.
 * <p>
 * Passes in this project never mutate the {@link io.github.eutro.varrec.ir IR} they are given,
 * so one instance can be run on many functions at once.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    B run(A a);

    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
