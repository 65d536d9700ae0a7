package io.github.eutro.jvmjit.ops;

import io.github.eutro.jvmjit.Kind;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;

import java.util.Locale;

/**
 * Arithmetic, conversion and comparison operations.
 * <p>
 * Integer arithmetic wraps, and shifts use the shift amount modulo the width of the value,
 * as on the JVM.
 */
public class ArithOps {
    /**
     * A binary operation on two values of the same kind, except for shifts,
     * whose second argument is always {@link Kind#I32}.
     */
    public static final UnaryOpKey<BinaryOp> BINARY = new UnaryOpKey<>("binary", BinaryOp::toString);
    /**
     * Negate the single argument.
     */
    public static final SimpleOpKey NEG = new SimpleOpKey("neg");
    /**
     * Convert the single argument to another kind, or narrow it.
     */
    public static final UnaryOpKey<Conversion> CONVERT = new UnaryOpKey<>("convert");
    /**
     * Compare two integers of the same kind, yielding an {@link Kind#I32} 1 or 0.
     */
    public static final UnaryOpKey<IntCC> ICMP = new UnaryOpKey<>("icmp");
    /**
     * Compare two floats of the same kind, yielding an {@link Kind#I32} 1 or 0.
     */
    public static final UnaryOpKey<FloatCC> FCMP = new UnaryOpKey<>("fcmp");

    public enum BinaryOp {
        ADD(GeneratorAdapter.ADD, false),
        SUB(GeneratorAdapter.SUB, false),
        MUL(GeneratorAdapter.MUL, false),
        DIV(GeneratorAdapter.DIV, false),
        REM(GeneratorAdapter.REM, false),
        AND(GeneratorAdapter.AND, true),
        OR(GeneratorAdapter.OR, true),
        XOR(GeneratorAdapter.XOR, true),
        SHL(GeneratorAdapter.SHL, true),
        SHR(GeneratorAdapter.SHR, true),
        USHR(GeneratorAdapter.USHR, true),
        ;

        /**
         * The {@link GeneratorAdapter#math(int, Type)} operation.
         */
        public final int mathOp;
        /**
         * Whether this operation only applies to integers.
         */
        public final boolean integerOnly;

        BinaryOp(int mathOp, boolean integerOnly) {
            this.mathOp = mathOp;
            this.integerOnly = integerOnly;
        }

        public boolean isShift() {
            return this == SHL || this == SHR || this == USHR;
        }

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Conversions between kinds, with JVM semantics. Float to integer conversions saturate, and
     * map NaN to 0.
     */
    public enum Conversion {
        SEXTEND_I32_I64(Kind.I32, Kind.I64, Type.INT_TYPE, Type.LONG_TYPE),
        IREDUCE_I64_I32(Kind.I64, Kind.I32, Type.LONG_TYPE, Type.INT_TYPE),
        SINT_I32_F32(Kind.I32, Kind.F32, Type.INT_TYPE, Type.FLOAT_TYPE),
        SINT_I32_F64(Kind.I32, Kind.F64, Type.INT_TYPE, Type.DOUBLE_TYPE),
        SINT_I64_F32(Kind.I64, Kind.F32, Type.LONG_TYPE, Type.FLOAT_TYPE),
        SINT_I64_F64(Kind.I64, Kind.F64, Type.LONG_TYPE, Type.DOUBLE_TYPE),
        SAT_F32_I32(Kind.F32, Kind.I32, Type.FLOAT_TYPE, Type.INT_TYPE),
        SAT_F32_I64(Kind.F32, Kind.I64, Type.FLOAT_TYPE, Type.LONG_TYPE),
        SAT_F64_I32(Kind.F64, Kind.I32, Type.DOUBLE_TYPE, Type.INT_TYPE),
        SAT_F64_I64(Kind.F64, Kind.I64, Type.DOUBLE_TYPE, Type.LONG_TYPE),
        PROMOTE_F32_F64(Kind.F32, Kind.F64, Type.FLOAT_TYPE, Type.DOUBLE_TYPE),
        DEMOTE_F64_F32(Kind.F64, Kind.F32, Type.DOUBLE_TYPE, Type.FLOAT_TYPE),
        /**
         * Sign extend the low 8 bits.
         */
        SEXT8(Kind.I32, Kind.I32, Type.INT_TYPE, Type.BYTE_TYPE),
        /**
         * Sign extend the low 16 bits.
         */
        SEXT16(Kind.I32, Kind.I32, Type.INT_TYPE, Type.SHORT_TYPE),
        /**
         * Zero extend the low 16 bits.
         */
        UEXT16(Kind.I32, Kind.I32, Type.INT_TYPE, Type.CHAR_TYPE),
        ;

        public final Kind from;
        public final Kind to;
        /**
         * The types to pass to {@link GeneratorAdapter#cast(Type, Type)}.
         */
        public final Type castFrom, castTo;

        Conversion(Kind from, Kind to, Type castFrom, Type castTo) {
            this.from = from;
            this.to = to;
            this.castFrom = castFrom;
            this.castTo = castTo;
        }

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Integer condition codes.
     */
    public enum IntCC {
        EQ(GeneratorAdapter.EQ, false),
        NE(GeneratorAdapter.NE, false),
        SLT(GeneratorAdapter.LT, false),
        SGE(GeneratorAdapter.GE, false),
        SGT(GeneratorAdapter.GT, false),
        SLE(GeneratorAdapter.LE, false),
        ULT(GeneratorAdapter.LT, true),
        UGE(GeneratorAdapter.GE, true),
        ;

        /**
         * The comparison mode, as accepted by {@link GeneratorAdapter#ifCmp(Type, int, org.objectweb.asm.Label)}.
         */
        public final int mode;
        public final boolean unsigned;

        IntCC(int mode, boolean unsigned) {
            this.mode = mode;
            this.unsigned = unsigned;
        }

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Float condition codes. All are false if either operand is NaN, except {@link #NE}, which is true.
     */
    public enum FloatCC {
        EQ(GeneratorAdapter.EQ),
        NE(GeneratorAdapter.NE),
        LT(GeneratorAdapter.LT),
        GE(GeneratorAdapter.GE),
        GT(GeneratorAdapter.GT),
        LE(GeneratorAdapter.LE),
        ;

        public final int mode;

        FloatCC(int mode) {
            this.mode = mode;
        }

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
