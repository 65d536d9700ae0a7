package io.github.eutro.jvmjit.ssa;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A jump target of a {@link Control}: the block jumped to, and the arguments
 * passed for its {@link BasicBlock#getParams() parameters}.
 */
public final class BlockCall {
    public final BasicBlock target;
    public final List<Var> args;

    public BlockCall(BasicBlock target, List<Var> args) {
        this.target = target;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static BlockCall of(BasicBlock target, Var... args) {
        return new BlockCall(target, Arrays.asList(args));
    }

    @Override
    public String toString() {
        if (args.isEmpty()) return target.toTargetString();
        StringBuilder sb = new StringBuilder(target.toTargetString()).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(args.get(i));
        }
        return sb.append(')').toString();
    }
}
