package io.github.eutro.jvmjit.translate;

import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.cfg.StackShuffles;
import io.github.eutro.jvmjit.cfg.StackType;
import io.github.eutro.jvmjit.classfile.code.Opcode;
import io.github.eutro.jvmjit.ssa.Var;

import java.util.ArrayList;
import java.util.List;

/**
 * The operand stack of a block during translation, holding the IR value of each entry.
 */
public final class OperandStack {
    private final List<Entry> entries = new ArrayList<>();

    public void push(Var value, StackType type) {
        if (value.kind != type.kind) {
            throw new JitException.Internal(String.format("pushed %s as %s", value.toDeclString(), type));
        }
        entries.add(new Entry(value, type));
    }

    /**
     * Pop the top entry, whatever its type.
     *
     * @return The entry.
     * @throws JitException.OperandStackUnderflow If the stack is empty.
     */
    public Entry pop() {
        if (entries.isEmpty()) throw new JitException.OperandStackUnderflow();
        return entries.remove(entries.size() - 1);
    }

    /**
     * Pop the value of the top entry, which must have the expected type.
     *
     * @param expected The expected type.
     * @return The value.
     * @throws JitException.OperandStackUnderflow If the stack is empty.
     * @throws JitException.InvalidValue         If the entry has a different type.
     */
    public Var pop(StackType expected) {
        Entry entry = pop();
        if (entry.type != expected) {
            throw new JitException.InvalidValue(expected.toString(), entry.type.toString());
        }
        return entry.value;
    }

    public Var popInt() {
        return pop(StackType.INT);
    }

    public Var popLong() {
        return pop(StackType.LONG);
    }

    public Var popReference() {
        return pop(StackType.REFERENCE);
    }

    /**
     * Apply one of the {@code pop}, {@code dup} or {@code swap} instructions.
     *
     * @param opcode The instruction.
     */
    public void shuffle(Opcode opcode) {
        StackShuffles.apply(opcode, entries, Entry::isWide);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Get the values on the stack, bottom first.
     *
     * @return The values.
     */
    public List<Var> values() {
        List<Var> values = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            values.add(entry.value);
        }
        return values;
    }

    public List<StackType> types() {
        List<StackType> types = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            types.add(entry.type);
        }
        return types;
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    public static final class Entry {
        public final Var value;
        public final StackType type;

        Entry(Var value, StackType type) {
            this.value = value;
            this.type = type;
        }

        public boolean isWide() {
            return type.isWide();
        }

        @Override
        public String toString() {
            return value + ": " + type;
        }
    }
}
