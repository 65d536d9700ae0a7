package io.github.eutro.jvmjit.classfile.code;

import org.jetbrains.annotations.Nullable;

/**
 * The element types of primitive arrays created by {@code newarray}, with their {@code atype} codes.
 */
public enum ArrayType {
    BOOLEAN(4, 1),
    CHAR(5, 2),
    FLOAT(6, 4),
    DOUBLE(7, 8),
    BYTE(8, 1),
    SHORT(9, 2),
    INT(10, 4),
    LONG(11, 8),
    ;

    /**
     * The {@code atype} operand of {@code newarray}.
     */
    public final int code;
    /**
     * The size of one element, in bytes.
     */
    public final int elementSize;

    ArrayType(int code, int elementSize) {
        this.code = code;
        this.elementSize = elementSize;
    }

    public static @Nullable ArrayType fromCode(int code) {
        for (ArrayType value : values()) {
            if (value.code == code) return value;
        }
        return null;
    }

    @Override
    public String toString() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
