package io.github.eutro.jvmjit.ops;

import io.github.eutro.jvmjit.ssa.Insn;
import io.github.eutro.jvmjit.ssa.Var;

/**
 * An operation: its {@link OpKey key}, plus whatever immediate the key carries.
 * <p>
 * Passes dispatch on {@link #key}, so two ops with the same key are the same kind of instruction.
 */
public class Op {
    public final OpKey key;

    Op(OpKey key) {
        this.key = key;
    }

    /**
     * Apply this operation to some operands.
     *
     * @param operands The operands.
     * @return The instruction.
     */
    public Insn insn(Var... operands) {
        return new Insn(this, operands);
    }

    @Override
    public String toString() {
        return key.toString();
    }
}
