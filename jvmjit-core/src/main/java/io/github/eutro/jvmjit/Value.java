package io.github.eutro.jvmjit;

import org.jetbrains.annotations.Nullable;

/**
 * A value passed to or returned from compiled code.
 * <p>
 * Values are equal if they have the same kind and the same bits, so a NaN is equal to
 * a NaN with the same bit pattern, and {@code -0.0} is not equal to {@code 0.0}.
 */
public final class Value {
    private final Kind kind;
    private final long bits;

    private Value(Kind kind, long bits) {
        this.kind = kind;
        this.bits = bits;
    }

    public static Value i32(int value) {
        return new Value(Kind.I32, value);
    }

    public static Value i64(long value) {
        return new Value(Kind.I64, value);
    }

    public static Value f32(float value) {
        return new Value(Kind.F32, Float.floatToRawIntBits(value));
    }

    public static Value f64(double value) {
        return new Value(Kind.F64, Double.doubleToRawLongBits(value));
    }

    /**
     * Box a Java value of one of the kinds' classes.
     *
     * @param kind  The kind of the value.
     * @param boxed The boxed Java value.
     * @return The value.
     */
    static Value fromJava(Kind kind, Object boxed) {
        switch (kind) {
            case I32:
                return i32((Integer) boxed);
            case I64:
                return i64((Long) boxed);
            case F32:
                return f32((Float) boxed);
            case F64:
                return f64((Double) boxed);
            default:
                throw new IllegalArgumentException("unknown kind: " + kind);
        }
    }

    /**
     * Get this value as a boxed Java object of its kind's class.
     *
     * @return The Java value.
     */
    Object toJava() {
        switch (kind) {
            case I32:
                return (int) bits;
            case I64:
                return bits;
            case F32:
                return Float.intBitsToFloat((int) bits);
            case F64:
                return Double.longBitsToDouble(bits);
            default:
                throw new IllegalStateException();
        }
    }

    public Kind getKind() {
        return kind;
    }

    private void expect(Kind expected) {
        if (kind != expected) {
            throw new JitException.InvalidValue(expected.toString(), kind.toString());
        }
    }

    public int asInt() {
        expect(Kind.I32);
        return (int) bits;
    }

    public long asLong() {
        expect(Kind.I64);
        return bits;
    }

    public float asFloat() {
        expect(Kind.F32);
        return Float.intBitsToFloat((int) bits);
    }

    public double asDouble() {
        expect(Kind.F64);
        return Double.longBitsToDouble(bits);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value value = (Value) o;
        return kind == value.kind && bits == value.bits;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Long.hashCode(bits);
    }

    @Override
    public String toString() {
        return kind + "(" + toJava() + ")";
    }
}
