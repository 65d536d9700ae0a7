package io.github.eutro.jvmjit.ops;

import java.util.Objects;
import java.util.function.Function;

/**
 * A key for operations with one immediate, such as a constant or a condition code.
 *
 * @param <T> The type of the immediate.
 */
public final class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    public final class UnaryOp extends Op {
        public final T arg;

        private UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    public UnaryOp create(T arg) {
        return new UnaryOp(Objects.requireNonNull(arg, "immediate"));
    }

    /**
     * Recover the immediate of an op with this key.
     *
     * @param op The op.
     * @return The op, typed.
     * @throws IllegalArgumentException If the op has a different key.
     */
    @SuppressWarnings("unchecked")
    public UnaryOp cast(Op op) {
        if (op.key != this) {
            throw new IllegalArgumentException("expected " + this + ", got " + op);
        }
        return (UnaryOp) op;
    }
}
