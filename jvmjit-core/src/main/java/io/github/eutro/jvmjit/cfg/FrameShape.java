package io.github.eutro.jvmjit.cfg;

import io.github.eutro.jvmjit.JitException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The types of the operand stack and local variables on entry to a block.
 * <p>
 * Local slots that hold no usable value, including the second slot of a {@code long}
 * or {@code double}, are null.
 */
public final class FrameShape {
    private final List<StackType> stack;
    private final List<@Nullable StackType> locals;

    FrameShape(List<StackType> stack, List<@Nullable StackType> locals) {
        this.stack = Collections.unmodifiableList(new ArrayList<>(stack));
        this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
    }

    /**
     * Get the stack types, bottom first.
     *
     * @return The stack types.
     */
    public List<StackType> getStack() {
        return stack;
    }

    public List<@Nullable StackType> getLocals() {
        return locals;
    }

    /**
     * Get the type of a local slot, null if it holds no usable value.
     *
     * @param index The slot.
     * @return The type.
     */
    public @Nullable StackType getLocal(int index) {
        return index < locals.size() ? locals.get(index) : null;
    }

    /**
     * Merge this shape with one reaching the same block along another edge.
     *
     * @param other The other shape.
     * @param start The start of the block, for diagnostics.
     * @return The merged shape, which is this shape if merging changed nothing.
     * @throws JitException.Internal If the stacks disagree.
     */
    public FrameShape merge(FrameShape other, int start) {
        if (!stack.equals(other.stack)) {
            throw new JitException.Internal(String.format(
                    "operand stacks disagree at %d: %s vs %s", start, stack, other.stack));
        }
        List<@Nullable StackType> merged = null;
        for (int i = 0; i < locals.size(); i++) {
            StackType mine = locals.get(i);
            if (mine != null && mine != other.getLocal(i)) {
                if (merged == null) merged = new ArrayList<>(locals);
                merged.set(i, null);
            }
        }
        return merged == null ? this : new FrameShape(stack, merged);
    }

    /**
     * Create a mutable frame starting with this shape.
     *
     * @return The frame.
     */
    public TypeFrame toFrame() {
        return new TypeFrame(new ArrayList<>(stack), locals.toArray(new StackType[0]));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrameShape)) return false;
        FrameShape that = (FrameShape) o;
        return stack.equals(that.stack) && locals.equals(that.locals);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stack, locals);
    }

    @Override
    public String toString() {
        return "stack=" + stack + " locals=" + Arrays.toString(locals.toArray());
    }
}
