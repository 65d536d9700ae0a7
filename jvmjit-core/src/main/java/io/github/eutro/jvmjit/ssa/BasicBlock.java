package io.github.eutro.jvmjit.ssa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block, encapsulating a list of parameters and {@link Effect} instructions,
 * followed by exactly one {@link Control} instruction at the end.
 * <p>
 * Parameters take the place of phi nodes: each jump to the block passes one argument per parameter.
 */
public final class BasicBlock {
    private final int id;
    private final List<Var> params = new ArrayList<>();
    private final List<Effect> effects = new ArrayList<>();
    private Control control;

    BasicBlock(int id) {
        this.id = id;
    }

    /**
     * Format this block as a jump target, for debugging.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        return "@" + id;
    }

    /**
     * Get the parameters of this block.
     *
     * @return The parameters, unmodifiable.
     */
    public List<Var> getParams() {
        return Collections.unmodifiableList(params);
    }

    public void addParam(Var param) {
        params.add(param);
    }

    /**
     * Get the list of {@link Effect effects} in this basic block.
     *
     * @return The list.
     */
    public List<Effect> getEffects() {
        return Collections.unmodifiableList(effects);
    }

    /**
     * Add an {@link Effect effect} to the end of this basic block.
     *
     * @param effect The effect to add.
     */
    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    /**
     * Get the control instruction of this block, null until the block is finished.
     *
     * @return The control instruction.
     */
    public Control getControl() {
        return control;
    }

    /**
     * Set the control instruction of this block.
     *
     * @param control The control instruction.
     */
    public void setControl(Control control) {
        if (this.control != null) {
            throw new IllegalStateException("block " + toTargetString() + " already has a control instruction");
        }
        this.control = control;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString());
        if (!params.isEmpty()) {
            sb.append('(');
            for (int i = 0; i < params.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(params.get(i).toDeclString());
            }
            sb.append(')');
        }
        sb.append("\n{\n");
        for (Effect effect : effects) {
            sb.append(' ').append(effect).append('\n');
        }
        sb.append(' ').append(control);
        sb.append("\n}");
        return sb.toString();
    }
}
