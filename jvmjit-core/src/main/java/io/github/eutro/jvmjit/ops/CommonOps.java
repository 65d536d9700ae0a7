package io.github.eutro.jvmjit.ops;

import io.github.eutro.jvmjit.Kind;

import java.util.Arrays;

/**
 * Operations common to all functions: arguments, constants, selection and control flow.
 */
public class CommonOps {
    /**
     * Read the nth argument of the function.
     */
    public static final UnaryOpKey<Integer> ARG = new UnaryOpKey<>("arg");
    /**
     * A constant, an {@link Integer}, {@link Long}, {@link Float} or {@link Double}.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const", CommonOps::printConst);
    /**
     * Check the third argument, an {@link Kind#I32}; if it is non-zero, yield the first argument, otherwise the second.
     */
    public static final SimpleOpKey SELECT = new SimpleOpKey("select");

    /**
     * Jump unconditionally to the single target.
     */
    public static final SimpleOpKey BR = new SimpleOpKey("br");
    /**
     * Jump to the first target if the {@link Kind#I32} argument is non-zero, otherwise the second.
     */
    public static final SimpleOpKey BR_IF = new SimpleOpKey("brif");
    /**
     * Jump to the target whose key equals the {@link Kind#I32} argument,
     * or to the last target, the default, if none does.
     */
    public static final UnaryOpKey<int[]> SWITCH = new UnaryOpKey<>("switch", Arrays::toString);
    /**
     * Return the arguments, if any, from the function.
     */
    public static final SimpleOpKey RETURN = new SimpleOpKey("return");
    /**
     * Abort execution, with a message.
     */
    public static final UnaryOpKey<String> TRAP = new UnaryOpKey<>("trap", s -> "\"" + s + "\"");

    private static String printConst(Object cst) {
        if (cst instanceof Long) return cst + "L";
        if (cst instanceof Float) return cst + "F";
        if (cst instanceof Double) return cst + "D";
        return String.valueOf(cst);
    }

    /**
     * Create a constant operation, checking the type of the constant.
     *
     * @param value The constant.
     * @return The operation.
     */
    public static UnaryOpKey<Object>.UnaryOp constant(Object value) {
        if (!(value instanceof Integer
                || value instanceof Long
                || value instanceof Float
                || value instanceof Double)) {
            throw new IllegalArgumentException("not a primitive constant: " + value);
        }
        return CONST.create(value);
    }

    /**
     * Get the kind of a constant created by {@link #constant(Object)}.
     *
     * @param value The constant.
     * @return Its kind.
     */
    public static Kind constantKind(Object value) {
        if (value instanceof Integer) return Kind.I32;
        if (value instanceof Long) return Kind.I64;
        if (value instanceof Float) return Kind.F32;
        if (value instanceof Double) return Kind.F64;
        throw new IllegalArgumentException("not a primitive constant: " + value);
    }
}
