package io.github.eutro.jvmjit.ssa;

import io.github.eutro.jvmjit.Kind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A function in the IR, a list of {@link BasicBlock basic blocks}, along with its signature.
 * <p>
 * The first block is the entry block, which must have no parameters.
 */
public final class FunctionBody {
    /**
     * The name of the function, for diagnostics and for naming generated code.
     */
    public final String name;
    private final List<Kind> paramKinds;
    private final @Nullable Kind returnKind;
    /**
     * The basic blocks in this function. The first block is the entry block.
     */
    public final List<BasicBlock> blocks = new ArrayList<>();
    private final Map<String, Integer> varCounts = new HashMap<>();

    public FunctionBody(String name, List<Kind> paramKinds, @Nullable Kind returnKind) {
        this.name = name;
        this.paramKinds = Collections.unmodifiableList(new ArrayList<>(paramKinds));
        this.returnKind = returnKind;
    }

    public List<Kind> getParamKinds() {
        return paramKinds;
    }

    /**
     * Get the kind this function returns, or null if it returns nothing.
     *
     * @return The return kind.
     */
    public @Nullable Kind getReturnKind() {
        return returnKind;
    }

    /**
     * Create a new variable in this function.
     *
     * @param name The name of the variable.
     * @param kind The kind of the variable.
     * @return The new variable.
     */
    public Var newVar(String name, Kind kind) {
        int index = varCounts.merge(name, 1, Integer::sum) - 1;
        return new Var(name, index, kind);
    }

    /**
     * Create a new basic block and add it to this function.
     *
     * @return The new block.
     */
    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock(blocks.size());
        blocks.add(bb);
        return bb;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name).append(paramKinds).append(" -> ")
                .append(returnKind == null ? "void" : returnKind).append('\n');
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        return sb.toString();
    }
}
