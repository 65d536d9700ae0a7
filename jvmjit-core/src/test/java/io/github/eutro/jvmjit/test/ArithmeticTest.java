package io.github.eutro.jvmjit.test;

import io.github.eutro.jvmjit.Function;
import io.github.eutro.jvmjit.Value;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.objectweb.asm.Opcodes.*;

public class ArithmeticTest {
    private static Function binary(String desc, int load, int op, int ret) {
        int second = desc.charAt(1) == 'J' || desc.charAt(1) == 'D' ? 2 : 1;
        return Utils.compile(desc, mv -> {
            mv.visitVarInsn(load, 0);
            mv.visitVarInsn(desc.charAt(2) == 'I' ? ILOAD : load, second);
            mv.visitInsn(op);
            mv.visitInsn(ret);
        });
    }

    private static Function unary(String desc, int load, int op, int ret) {
        return Utils.compile(desc, mv -> {
            mv.visitVarInsn(load, 0);
            mv.visitInsn(op);
            mv.visitInsn(ret);
        });
    }

    private static int intOp(Function f, int a, int b) {
        return f.execute(Value.i32(a), Value.i32(b)).orElseThrow(AssertionError::new).asInt();
    }

    @Test
    void intArithmeticWraps() {
        Function add = binary("(II)I", ILOAD, IADD, IRETURN);
        Function mul = binary("(II)I", ILOAD, IMUL, IRETURN);
        Function rem = binary("(II)I", ILOAD, IREM, IRETURN);
        assertEquals(Integer.MIN_VALUE, intOp(add, Integer.MAX_VALUE, 1));
        assertEquals(Integer.MAX_VALUE * 3, intOp(mul, Integer.MAX_VALUE, 3));
        assertEquals(-1, intOp(rem, -7, 2));
        assertEquals(1, intOp(rem, 7, -2));
    }

    @Test
    void bitwise() {
        assertEquals(0x0F00, intOp(binary("(II)I", ILOAD, IAND, IRETURN), 0xFF00, 0x0FF0));
        assertEquals(0xFFF0, intOp(binary("(II)I", ILOAD, IOR, IRETURN), 0xFF00, 0x0FF0));
        assertEquals(0xF0F0, intOp(binary("(II)I", ILOAD, IXOR, IRETURN), 0xFF00, 0x0FF0));
        Function lxor = binary("(JJ)J", LLOAD, LXOR, LRETURN);
        assertEquals(Optional.of(Value.i64(-1L ^ 0x5555L)), lxor.execute(Value.i64(-1L), Value.i64(0x5555L)));
    }

    @Test
    void shiftsUseTheLowBits() {
        Function shl = binary("(II)I", ILOAD, ISHL, IRETURN);
        Function shr = binary("(II)I", ILOAD, ISHR, IRETURN);
        Function ushr = binary("(II)I", ILOAD, IUSHR, IRETURN);
        assertEquals(2, intOp(shl, 1, 33));
        assertEquals(Integer.MIN_VALUE, intOp(shl, 1, -1));
        assertEquals(-4, intOp(shr, -8, 1));
        assertEquals(-8 >>> 1, intOp(ushr, -8, 1));
        assertEquals(-8 >>> 33, intOp(ushr, -8, 33));

        Function lshl = binary("(JI)J", LLOAD, LSHL, LRETURN);
        Function lushr = binary("(JI)J", LLOAD, LUSHR, LRETURN);
        assertEquals(Optional.of(Value.i64(2)), lshl.execute(Value.i64(1), Value.i32(65)));
        assertEquals(Optional.of(Value.i64(-1L >>> 63)), lushr.execute(Value.i64(-1L), Value.i32(-1)));
    }

    @Test
    void negation() {
        Function ineg = unary("(I)I", ILOAD, INEG, IRETURN);
        assertEquals(Optional.of(Value.i32(Integer.MIN_VALUE)), ineg.execute(Value.i32(Integer.MIN_VALUE)));
        Function dneg = unary("(D)D", DLOAD, DNEG, DRETURN);
        assertEquals(Optional.of(Value.f64(-0.0)), dneg.execute(Value.f64(0.0)));
    }

    @Test
    void floatArithmetic() {
        Function fdiv = binary("(FF)F", FLOAD, FDIV, FRETURN);
        assertEquals(Optional.of(Value.f32(Float.POSITIVE_INFINITY)), fdiv.execute(Value.f32(1), Value.f32(0)));
        assertTrue(Float.isNaN(fdiv.execute(Value.f32(0), Value.f32(0)).orElseThrow(AssertionError::new).asFloat()));
        Function drem = binary("(DD)D", DLOAD, DREM, DRETURN);
        assertEquals(Optional.of(Value.f64(5.5 % 2.0)), drem.execute(Value.f64(5.5), Value.f64(2.0)));
    }

    @Test
    void longCompare() {
        Function lcmp = binary("(JJ)I", LLOAD, LCMP, IRETURN);
        assertEquals(Optional.of(Value.i32(-1)), lcmp.execute(Value.i64(Long.MIN_VALUE), Value.i64(0)));
        assertEquals(Optional.of(Value.i32(0)), lcmp.execute(Value.i64(5), Value.i64(5)));
        assertEquals(Optional.of(Value.i32(1)), lcmp.execute(Value.i64(-1), Value.i64(-2)));
    }

    @Test
    void floatCompareHandlesNaN() {
        Function fcmpl = binary("(FF)I", FLOAD, FCMPL, IRETURN);
        Function fcmpg = binary("(FF)I", FLOAD, FCMPG, IRETURN);
        assertEquals(Optional.of(Value.i32(-1)), fcmpl.execute(Value.f32(Float.NaN), Value.f32(1)));
        assertEquals(Optional.of(Value.i32(1)), fcmpg.execute(Value.f32(1), Value.f32(Float.NaN)));
        assertEquals(Optional.of(Value.i32(0)), fcmpl.execute(Value.f32(0.0F), Value.f32(-0.0F)));
        assertEquals(Optional.of(Value.i32(1)), fcmpl.execute(Value.f32(2), Value.f32(1)));
        assertEquals(Optional.of(Value.i32(-1)), fcmpg.execute(Value.f32(1), Value.f32(2)));

        Function dcmpl = binary("(DD)I", DLOAD, DCMPL, IRETURN);
        Function dcmpg = binary("(DD)I", DLOAD, DCMPG, IRETURN);
        assertEquals(Optional.of(Value.i32(-1)), dcmpl.execute(Value.f64(Double.NaN), Value.f64(Double.NaN)));
        assertEquals(Optional.of(Value.i32(1)), dcmpg.execute(Value.f64(Double.NaN), Value.f64(Double.NaN)));
        assertEquals(Optional.of(Value.i32(0)), dcmpg.execute(Value.f64(3), Value.f64(3)));
    }

    @Test
    void conversions() {
        Function f2i = unary("(F)I", FLOAD, F2I, IRETURN);
        assertEquals(Optional.of(Value.i32(0)), f2i.execute(Value.f32(Float.NaN)));
        assertEquals(Optional.of(Value.i32(Integer.MAX_VALUE)), f2i.execute(Value.f32(1e20F)));
        assertEquals(Optional.of(Value.i32(-3)), f2i.execute(Value.f32(-3.9F)));

        Function d2l = unary("(D)J", DLOAD, D2L, LRETURN);
        assertEquals(Optional.of(Value.i64(Long.MIN_VALUE)), d2l.execute(Value.f64(Double.NEGATIVE_INFINITY)));

        Function l2i = unary("(J)I", LLOAD, L2I, IRETURN);
        assertEquals(Optional.of(Value.i32(0x89ABCDEF)), l2i.execute(Value.i64(0x1234567_89ABCDEFL)));

        Function i2l = unary("(I)J", ILOAD, I2L, LRETURN);
        assertEquals(Optional.of(Value.i64(-1)), i2l.execute(Value.i32(-1)));

        Function d2f = unary("(D)F", DLOAD, D2F, FRETURN);
        assertEquals(Optional.of(Value.f32((float) 0.1)), d2f.execute(Value.f64(0.1)));

        Function i2b = unary("(I)I", ILOAD, I2B, IRETURN);
        Function i2c = unary("(I)I", ILOAD, I2C, IRETURN);
        Function i2s = unary("(I)I", ILOAD, I2S, IRETURN);
        assertEquals(Optional.of(Value.i32(-56)), i2b.execute(Value.i32(200)));
        assertEquals(Optional.of(Value.i32(65535)), i2c.execute(Value.i32(-1)));
        assertEquals(Optional.of(Value.i32(-25536)), i2s.execute(Value.i32(40000)));
    }

    @Test
    void iinc() {
        Function f = Utils.compile("(I)I", mv -> {
            mv.visitIincInsn(0, -300);
            mv.visitVarInsn(ILOAD, 0);
            mv.visitInsn(IRETURN);
        });
        assertEquals(Optional.of(Value.i32(-200)), f.execute(Value.i32(100)));
    }
}
