package io.github.eutro.jvmjit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ValueTest {
    @Test
    void kinds() {
        assertEquals(Kind.I32, Value.i32(1).getKind());
        assertEquals(Kind.I64, Value.i64(1).getKind());
        assertEquals(Kind.F32, Value.f32(1).getKind());
        assertEquals(Kind.F64, Value.f64(1).getKind());
    }

    @Test
    void equalityIsBitwise() {
        assertEquals(Value.f64(Double.NaN), Value.f64(Double.NaN));
        assertNotEquals(Value.f64(0.0), Value.f64(-0.0));
        assertNotEquals(Value.i32(1), Value.i64(1));
        assertEquals(Value.i64(-5).hashCode(), Value.i64(-5).hashCode());
    }

    @Test
    void accessorsCheckTheKind() {
        assertEquals(-7, Value.i32(-7).asInt());
        assertEquals(1.5F, Value.f32(1.5F).asFloat());
        JitException.InvalidValue e = assertThrows(JitException.InvalidValue.class, () -> Value.i32(1).asLong());
        assertEquals("I64", e.getExpected());
        assertEquals("I32", e.getActual());
    }

    @Test
    void javaConversion() {
        for (Value value : new Value[]{Value.i32(-1), Value.i64(Long.MIN_VALUE), Value.f32(-0.0F), Value.f64(1e300)}) {
            assertEquals(value, Value.fromJava(value.getKind(), value.toJava()));
        }
    }
}
