package io.github.eutro.jvmjit.passes.misc;

import io.github.eutro.jvmjit.passes.IRPass;

/**
 * Two passes run back to back. Built by {@link IRPass#then(IRPass)}.
 */
public final class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> first;
    private final IRPass<B, C> second;

    public ChainedPass(IRPass<A, B> first, IRPass<B, C> second) {
        this.first = first;
        this.second = second;
    }

    @Override
    public C run(A a) {
        return second.run(first.run(a));
    }

    @Override
    public String toString() {
        return first + " -> " + second;
    }
}
