package io.github.eutro.jvmjit;

import org.objectweb.asm.Type;

/**
 * The kinds of values compiled code works with, and their mapping to Java.
 * <p>
 * The Java types of each kind are:
 * <table>
 *     <tr><td>Kind</td><td>Java Class</td><td>Used for</td></tr>
 *     <tr><td>I32</td><td>{@code int}</td><td>{@code boolean}, {@code byte}, {@code char}, {@code short}, {@code int}</td></tr>
 *     <tr><td>I64</td><td>{@code long}</td><td>{@code long}, array references</td></tr>
 *     <tr><td>F32</td><td>{@code float}</td><td>{@code float}</td></tr>
 *     <tr><td>F64</td><td>{@code double}</td><td>{@code double}</td></tr>
 * </table>
 */
public enum Kind {
    I32(Type.INT_TYPE),
    I64(Type.LONG_TYPE),
    F32(Type.FLOAT_TYPE),
    F64(Type.DOUBLE_TYPE),
    ;

    private final Type asmType;

    Kind(Type asmType) {
        this.asmType = asmType;
    }

    public Type getAsmType() {
        return asmType;
    }

    public boolean isInteger() {
        return this == I32 || this == I64;
    }
}
