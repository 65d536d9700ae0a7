package io.github.eutro.jvmjit.ssa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An effect, encapsulating an {@link Insn instruction}, and the
 * variables its results are assigned to.
 */
public final class Effect {
    private final List<Var> assignsTo;
    private final Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        this.assignsTo = Collections.unmodifiableList(new ArrayList<>(assignsTo));
        this.insn = insn;
    }

    /**
     * Get the list of variables this effect assigns to.
     *
     * @return The list.
     */
    public List<Var> getAssignsTo() {
        return assignsTo;
    }

    /**
     * Get the {@link Insn underlying instruction} of this effect.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!assignsTo.isEmpty()) {
            sb.append(assignsTo.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "", " = ")));
        }
        sb.append(insn);
        return sb.toString();
    }
}
