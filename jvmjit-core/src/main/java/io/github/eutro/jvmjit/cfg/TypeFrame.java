package io.github.eutro.jvmjit.cfg;

import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.classfile.code.Opcode;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * A mutable frame of types, used to simulate the effects of instructions on the operand stack
 * and local variables.
 */
public final class TypeFrame {
    private final List<StackType> stack;
    private final @Nullable StackType[] locals;

    TypeFrame(List<StackType> stack, @Nullable StackType[] locals) {
        this.stack = stack;
        this.locals = locals;
    }

    public void push(StackType type) {
        stack.add(type);
    }

    public StackType pop() {
        if (stack.isEmpty()) throw new JitException.OperandStackUnderflow();
        return stack.remove(stack.size() - 1);
    }

    /**
     * Pop a value of the expected type.
     *
     * @param expected The expected type.
     * @throws JitException.InvalidValue If the value has another type.
     */
    public void pop(StackType expected) {
        StackType actual = pop();
        if (actual != expected) {
            throw new JitException.InvalidValue(expected.toString(), actual.toString());
        }
    }

    /**
     * Apply a stack shuffling instruction.
     *
     * @param shuffle The instruction.
     */
    public void shuffle(Opcode shuffle) {
        StackShuffles.apply(shuffle, stack, StackType::isWide);
    }

    /**
     * Check that a local holds a value of the expected type.
     *
     * @param index    The slot.
     * @param expected The expected type.
     * @throws JitException.InvalidLocalVariableIndex If it does not.
     */
    public void checkLocal(int index, StackType expected) {
        if (index < 0 || index >= locals.length || locals[index] != expected) {
            throw new JitException.InvalidLocalVariableIndex(index);
        }
    }

    /**
     * Store a value of a type to a local, invalidating any wide value it overlaps.
     *
     * @param index The slot.
     * @param type  The type.
     */
    public void setLocal(int index, StackType type) {
        if (index < 0 || index + type.category > locals.length) {
            throw new JitException.InvalidLocalVariableIndex(index);
        }
        if (index > 0 && locals[index - 1] != null && locals[index - 1].isWide()) {
            locals[index - 1] = null;
        }
        locals[index] = type;
        if (type.isWide()) {
            locals[index + 1] = null;
        }
    }

    public FrameShape toShape() {
        return new FrameShape(stack, Arrays.asList(locals));
    }
}
