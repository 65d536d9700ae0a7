package io.github.eutro.jvmjit.ssa;

import io.github.eutro.jvmjit.ops.CommonOps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A control instruction, encapsulating a raw {@link Insn instruction}
 * and the jump targets.
 */
public final class Control {
    private final Insn insn;
    /**
     * The jump targets of this instruction. The semantics of the order depend on the instruction.
     */
    public final List<BlockCall> targets;

    Control(Insn insn, List<BlockCall> targets) {
        this.insn = insn;
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
    }

    /**
     * Construct an unconditional jump to a block.
     *
     * @param target The jump target.
     * @param args   The arguments for the target's parameters.
     * @return The jump instruction.
     */
    public static Control br(BasicBlock target, List<Var> args) {
        return CommonOps.BR.create().insn().jumpsTo(new BlockCall(target, args));
    }

    /**
     * Get the {@link Insn underlying instruction} of this control instruction.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(insn);
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BlockCall target : targets) {
                sb.append(' ').append(target);
            }
        }
        return sb.toString();
    }
}
