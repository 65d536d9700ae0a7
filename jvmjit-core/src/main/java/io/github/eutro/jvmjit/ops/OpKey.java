package io.github.eutro.jvmjit.ops;

/**
 * The kind of an {@link Op}, compared by identity.
 * Keys are declared as constants in {@link CommonOps}, {@link ArithOps} and {@link MemOps}.
 */
public abstract class OpKey {
    private final String mnemonic;

    OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
