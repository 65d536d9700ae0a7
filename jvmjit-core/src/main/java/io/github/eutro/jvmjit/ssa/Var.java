package io.github.eutro.jvmjit.ssa;

import io.github.eutro.jvmjit.Kind;

/**
 * A variable, a virtual register holding a value of one {@link Kind}.
 * <p>
 * Variables are assigned exactly once, either by an {@link Effect} or as a block parameter.
 */
public final class Var {
    /**
     * The name of the variable.
     */
    public final String name;
    /**
     * The index of the variable, to distinguish it from others with the same name in the same function.
     */
    public final int index;
    /**
     * The kind of value this variable holds.
     */
    public final Kind kind;

    Var(String name, int index, Kind kind) {
        this.name = name;
        this.index = index;
        this.kind = kind;
    }

    @Override
    public String toString() {
        return name + index;
    }

    /**
     * Format this variable along with its kind, for declarations.
     *
     * @return The declaration string.
     */
    public String toDeclString() {
        return this + ": " + kind;
    }
}
