package io.github.eutro.jvmjit.ssa;

import io.github.eutro.jvmjit.ops.Op;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An instruction, an {@link Op operation} applied to some arguments.
 */
public final class Insn {
    public final Op op;
    public final List<Var> args;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    public Effect assignTo(Var... vars) {
        return new Effect(Arrays.asList(vars), this);
    }

    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    public Control jumpsTo(BlockCall... targets) {
        return jumpsTo(Arrays.asList(targets));
    }

    public Control jumpsTo(List<BlockCall> targets) {
        return new Control(this, targets);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }
}
