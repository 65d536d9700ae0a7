package io.github.eutro.jvmjit.ops;

/**
 * A key for operations with no immediate. All uses share one {@link Op}.
 */
public final class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    SimpleOpKey(String mnemonic) {
        super(mnemonic);
    }

    public Op create() {
        return op;
    }
}
