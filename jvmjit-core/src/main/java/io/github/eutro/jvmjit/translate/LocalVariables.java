package io.github.eutro.jvmjit.translate;

import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.cfg.StackType;
import io.github.eutro.jvmjit.ssa.Var;
import org.jetbrains.annotations.Nullable;

/**
 * The IR values held in local variable slots during translation.
 */
public final class LocalVariables {
    private final @Nullable Var[] values;
    private final @Nullable StackType[] types;

    public LocalVariables(int maxLocals) {
        values = new Var[maxLocals];
        types = new StackType[maxLocals];
    }

    /**
     * Get the value in a slot, which must hold a value of the expected type.
     *
     * @param index    The slot.
     * @param expected The expected type.
     * @return The value.
     * @throws JitException.InvalidLocalVariableIndex If the slot is out of range or holds no such value.
     */
    public Var get(int index, StackType expected) {
        if (index < 0 || index >= values.length || types[index] != expected) {
            throw new JitException.InvalidLocalVariableIndex(index);
        }
        return values[index];
    }

    /**
     * Store a value in a slot. A {@code long} or {@code double} also takes the next slot,
     * and overwriting either half of one makes it unusable.
     *
     * @param index The slot.
     * @param value The value.
     * @param type  The type of the value.
     */
    public void set(int index, Var value, StackType type) {
        if (index < 0 || index + type.category > values.length) {
            throw new JitException.InvalidLocalVariableIndex(index);
        }
        if (index > 0 && types[index - 1] != null && types[index - 1].isWide()) {
            clear(index - 1);
        }
        values[index] = value;
        types[index] = type;
        if (type.isWide()) {
            clear(index + 1);
        }
    }

    private void clear(int index) {
        values[index] = null;
        types[index] = null;
    }
}
