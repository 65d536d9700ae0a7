package io.github.eutro.jvmjit.cfg;

import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.Kind;
import io.github.eutro.jvmjit.classfile.FieldType;

/**
 * The verification type of an operand stack entry or local variable slot.
 * <p>
 * References are 64-bit heap addresses, so they have {@link Kind#I64}, but unlike {@code long}s they
 * take one slot.
 */
public enum StackType {
    INT(Kind.I32, 1),
    LONG(Kind.I64, 2),
    FLOAT(Kind.F32, 1),
    DOUBLE(Kind.F64, 2),
    REFERENCE(Kind.I64, 1),
    ;

    public final Kind kind;
    /**
     * The computational type category, the number of local variable slots taken.
     */
    public final int category;

    StackType(Kind kind, int category) {
        this.kind = kind;
        this.category = category;
    }

    public boolean isWide() {
        return category == 2;
    }

    /**
     * Get the stack type of values of a field type.
     *
     * @param type The field type.
     * @return The stack type.
     * @throws JitException.UnsupportedType If the type is a class type.
     */
    public static StackType forFieldType(FieldType type) {
        if (type.isArray()) {
            FieldType component = type.getComponentType();
            if (component == null || component.getBaseType() == null) {
                throw new JitException.UnsupportedType("arrays of references are not supported: " + type);
            }
            return REFERENCE;
        }
        FieldType.BaseType base = type.getBaseType();
        if (base == null) {
            throw new JitException.UnsupportedType("unsupported type: " + type);
        }
        switch (base) {
            case LONG:
                return LONG;
            case FLOAT:
                return FLOAT;
            case DOUBLE:
                return DOUBLE;
            default:
                return INT;
        }
    }
}
