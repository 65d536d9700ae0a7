package io.github.eutro.jvmjit.classfile;

import java.util.Objects;

/**
 * An entry in a {@link ConstantPool}.
 * <p>
 * References between entries are kept as pool indices for {@link Class} and {@link StringConst},
 * as in the class file format, while member references are kept already resolved.
 */
public abstract class Constant {
    Constant() {
    }

    /**
     * Get a short name for the kind of this constant, for diagnostics.
     *
     * @return The name.
     */
    public abstract String kindName();

    /**
     * Whether this constant takes two slots in the pool.
     *
     * @return Whether the constant is wide.
     */
    public boolean isWide() {
        return false;
    }

    public static final class Utf8 extends Constant {
        public final String value;

        public Utf8(String value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public String kindName() {
            return "Utf8";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Utf8 && value.equals(((Utf8) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "Utf8 " + value;
        }
    }

    public static final class Integer extends Constant {
        public final int value;

        public Integer(int value) {
            this.value = value;
        }

        @Override
        public String kindName() {
            return "Integer";
        }

        @Override
        public String toString() {
            return "Integer " + value;
        }
    }

    public static final class Float extends Constant {
        public final float value;

        public Float(float value) {
            this.value = value;
        }

        @Override
        public String kindName() {
            return "Float";
        }

        @Override
        public String toString() {
            return "Float " + value;
        }
    }

    public static final class Long extends Constant {
        public final long value;

        public Long(long value) {
            this.value = value;
        }

        @Override
        public String kindName() {
            return "Long";
        }

        @Override
        public boolean isWide() {
            return true;
        }

        @Override
        public String toString() {
            return "Long " + value;
        }
    }

    public static final class Double extends Constant {
        public final double value;

        public Double(double value) {
            this.value = value;
        }

        @Override
        public String kindName() {
            return "Double";
        }

        @Override
        public boolean isWide() {
            return true;
        }

        @Override
        public String toString() {
            return "Double " + value;
        }
    }

    public static final class Class extends Constant {
        public final int nameIndex;

        public Class(int nameIndex) {
            this.nameIndex = nameIndex;
        }

        @Override
        public String kindName() {
            return "Class";
        }

        @Override
        public String toString() {
            return "Class #" + nameIndex;
        }
    }

    public static final class StringConst extends Constant {
        public final int valueIndex;

        public StringConst(int valueIndex) {
            this.valueIndex = valueIndex;
        }

        @Override
        public String kindName() {
            return "String";
        }

        @Override
        public String toString() {
            return "String #" + valueIndex;
        }
    }

    /**
     * A field, method, interface method or dynamic call site reference.
     */
    public static final class MemberRef extends Constant {
        public enum Tag {
            FIELD,
            METHOD,
            INTERFACE_METHOD,
            INVOKE_DYNAMIC,
        }

        public final Tag tag;
        public final String owner;
        public final String name;
        public final String descriptor;

        public MemberRef(Tag tag, String owner, String name, String descriptor) {
            this.tag = tag;
            this.owner = owner;
            this.name = name;
            this.descriptor = descriptor;
        }

        @Override
        public String kindName() {
            return "MemberRef";
        }

        @Override
        public String toString() {
            return String.format("%s %s.%s:%s", tag, owner, name, descriptor);
        }
    }

    /**
     * Any other constant, such as method handles, method types and dynamic constants,
     * kept only as a description.
     */
    public static final class Opaque extends Constant {
        public final String kind;
        public final String description;

        public Opaque(String kind, String description) {
            this.kind = kind;
            this.description = description;
        }

        @Override
        public String kindName() {
            return kind;
        }

        @Override
        public String toString() {
            return kind + " " + description;
        }
    }
}
