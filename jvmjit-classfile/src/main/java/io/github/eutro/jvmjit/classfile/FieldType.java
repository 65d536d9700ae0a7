package io.github.eutro.jvmjit.classfile;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A field type, as it appears in descriptors: a base type, a class type or an array type.
 */
public final class FieldType {
    /**
     * The primitive types of the JVM.
     */
    public enum BaseType {
        BYTE('B'),
        CHAR('C'),
        DOUBLE('D'),
        FLOAT('F'),
        INT('I'),
        LONG('J'),
        SHORT('S'),
        BOOLEAN('Z'),
        ;

        public final char descriptor;

        BaseType(char descriptor) {
            this.descriptor = descriptor;
        }

        public static @Nullable BaseType fromDescriptor(char c) {
            for (BaseType value : values()) {
                if (value.descriptor == c) return value;
            }
            return null;
        }

        /**
         * Whether values of this type take two local variable slots.
         *
         * @return Whether this is {@code long} or {@code double}.
         */
        public boolean isWide() {
            return this == LONG || this == DOUBLE;
        }
    }

    private final @Nullable BaseType baseType;
    private final @Nullable String className;
    private final @Nullable FieldType componentType;

    private FieldType(@Nullable BaseType baseType, @Nullable String className, @Nullable FieldType componentType) {
        this.baseType = baseType;
        this.className = className;
        this.componentType = componentType;
    }

    public static FieldType base(BaseType type) {
        return new FieldType(type, null, null);
    }

    public static FieldType object(String internalName) {
        return new FieldType(null, internalName, null);
    }

    public static FieldType array(FieldType component) {
        return new FieldType(null, null, component);
    }

    /**
     * Parse a complete field descriptor.
     *
     * @param descriptor The descriptor, such as {@code [J}.
     * @return The field type.
     * @throws ClassFileException If the descriptor is malformed.
     */
    public static FieldType parse(String descriptor) {
        int[] pos = {0};
        FieldType type = parse(descriptor, pos);
        if (pos[0] != descriptor.length()) {
            throw new ClassFileException("trailing characters in field descriptor: " + descriptor);
        }
        return type;
    }

    static FieldType parse(String descriptor, int[] pos) {
        if (pos[0] >= descriptor.length()) {
            throw new ClassFileException("unexpected end of descriptor: " + descriptor);
        }
        char c = descriptor.charAt(pos[0]++);
        switch (c) {
            case 'L': {
                int end = descriptor.indexOf(';', pos[0]);
                if (end < 0 || end == pos[0]) {
                    throw new ClassFileException("malformed class type in descriptor: " + descriptor);
                }
                String name = descriptor.substring(pos[0], end);
                pos[0] = end + 1;
                return object(name);
            }
            case '[': {
                return array(parse(descriptor, pos));
            }
            default: {
                BaseType base = BaseType.fromDescriptor(c);
                if (base == null) {
                    throw new ClassFileException(String.format(
                            "invalid character '%c' in descriptor: %s", c, descriptor));
                }
                return base(base);
            }
        }
    }

    public @Nullable BaseType getBaseType() {
        return baseType;
    }

    public @Nullable String getClassName() {
        return className;
    }

    public @Nullable FieldType getComponentType() {
        return componentType;
    }

    public boolean isArray() {
        return componentType != null;
    }

    /**
     * Get the number of local variable slots a value of this type takes.
     *
     * @return 1 or 2.
     */
    public int getSize() {
        return baseType != null && baseType.isWide() ? 2 : 1;
    }

    public String getDescriptor() {
        if (baseType != null) return String.valueOf(baseType.descriptor);
        if (className != null) return "L" + className + ";";
        return "[" + Objects.requireNonNull(componentType).getDescriptor();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldType && getDescriptor().equals(((FieldType) o).getDescriptor());
    }

    @Override
    public int hashCode() {
        return getDescriptor().hashCode();
    }

    @Override
    public String toString() {
        return getDescriptor();
    }
}
