package io.github.eutro.jvmjit.ops;

import io.github.eutro.jvmjit.Kind;
import org.objectweb.asm.Type;

import java.util.Locale;

/**
 * Operations on the heap.
 */
public class MemOps {
    /**
     * Allocate a zero-filled region of the {@link Kind#I64} size in bytes, yielding its {@link Kind#I64} address.
     */
    public static final SimpleOpKey ALLOC = new SimpleOpKey("alloc");
    /**
     * Load a value from the {@link Kind#I64} address plus the offset.
     */
    public static final UnaryOpKey<MemArg> LOAD = new UnaryOpKey<>("load");
    /**
     * Store the second argument at the {@link Kind#I64} address in the first argument, plus the offset.
     */
    public static final UnaryOpKey<MemArg> STORE = new UnaryOpKey<>("store");

    /**
     * The types of values in memory.
     */
    public enum MemType {
        I8(Kind.I32, "Byte", Type.BYTE_TYPE),
        I16(Kind.I32, "Short", Type.SHORT_TYPE),
        U16(Kind.I32, "Char", Type.CHAR_TYPE),
        I32(Kind.I32, "Int", Type.INT_TYPE),
        I64(Kind.I64, "Long", Type.LONG_TYPE),
        F32(Kind.F32, "Float", Type.FLOAT_TYPE),
        F64(Kind.F64, "Double", Type.DOUBLE_TYPE),
        ;

        /**
         * The kind of value loaded or stored.
         */
        public final Kind kind;
        /**
         * The suffix of the heap accessor names.
         */
        public final String accessor;
        /**
         * The type of value in memory.
         */
        public final Type type;

        MemType(Kind kind, String accessor, Type type) {
            this.kind = kind;
            this.accessor = accessor;
            this.type = type;
        }

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static final class MemArg {
        public final MemType type;
        public final int offset;

        public MemArg(MemType type, int offset) {
            this.type = type;
            this.offset = offset;
        }

        @Override
        public String toString() {
            return offset == 0 ? type.toString() : type + " +" + offset;
        }
    }
}
