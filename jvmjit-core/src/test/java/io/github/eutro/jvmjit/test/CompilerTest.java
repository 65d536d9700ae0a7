package io.github.eutro.jvmjit.test;

import io.github.eutro.jvmjit.Compiler;
import io.github.eutro.jvmjit.Function;
import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.Kind;
import io.github.eutro.jvmjit.Value;
import io.github.eutro.jvmjit.classfile.ClassFile;
import io.github.eutro.jvmjit.classfile.code.Opcode;
import io.github.eutro.jvmjit.runtime.ByteBufferHeap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.objectweb.asm.Label;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.objectweb.asm.Opcodes.*;

public class CompilerTest {
    @Test
    void identityInt() {
        Function f = Utils.compile("(I)I", mv -> {
            mv.visitVarInsn(ILOAD, 0);
            mv.visitInsn(IRETURN);
        });
        assertEquals(Optional.of(Value.i32(42)), f.execute(Value.i32(42)));
        assertEquals(Optional.of(Value.i32(-1)), f.execute(Value.i32(-1)));
        assertEquals(Arrays.asList(Kind.I32), f.getSignature().getParameterKinds());
        assertEquals(Kind.I32, f.getSignature().getReturnKind());
    }

    @Test
    void identityLong() {
        Function f = Utils.compile("(J)J", mv -> {
            mv.visitVarInsn(LLOAD, 0);
            mv.visitInsn(LRETURN);
        });
        assertEquals(Optional.of(Value.i64(Long.MIN_VALUE)), f.execute(Value.i64(Long.MIN_VALUE)));
    }

    @Test
    void constants() {
        Function f = Utils.compile("()I", mv -> {
            mv.visitIntInsn(SIPUSH, 1000);
            mv.visitLdcInsn(123456);
            mv.visitInsn(IADD);
            mv.visitInsn(IRETURN);
        });
        assertEquals(Optional.of(Value.i32(124456)), f.execute());

        Function d = Utils.compile("()D", mv -> {
            mv.visitLdcInsn(2.5);
            mv.visitInsn(DCONST_1);
            mv.visitInsn(DADD);
            mv.visitInsn(DRETURN);
        });
        assertEquals(Optional.of(Value.f64(3.5)), d.execute());
    }

    @Test
    void maxOfTwo() {
        Function f = Utils.compile("(II)I", mv -> {
            Label second = new Label();
            Label end = new Label();
            mv.visitVarInsn(ILOAD, 0);
            mv.visitVarInsn(ILOAD, 1);
            mv.visitJumpInsn(IF_ICMPLE, second);
            mv.visitVarInsn(ILOAD, 0);
            mv.visitJumpInsn(GOTO, end);
            mv.visitLabel(second);
            mv.visitVarInsn(ILOAD, 1);
            mv.visitLabel(end);
            mv.visitInsn(IRETURN);
        });
        assertEquals(Optional.of(Value.i32(7)), f.execute(Value.i32(7), Value.i32(3)));
        assertEquals(Optional.of(Value.i32(7)), f.execute(Value.i32(3), Value.i32(7)));
        assertEquals(Optional.of(Value.i32(-2)), f.execute(Value.i32(-2), Value.i32(-2)));
    }

    @Test
    void longHashCode() {
        Function f = Utils.compile("(J)I", mv -> {
            mv.visitVarInsn(LLOAD, 0);
            mv.visitVarInsn(LLOAD, 0);
            mv.visitIntInsn(BIPUSH, 32);
            mv.visitInsn(LUSHR);
            mv.visitInsn(LXOR);
            mv.visitInsn(L2I);
            mv.visitInsn(IRETURN);
        });
        for (long value : new long[]{0, 1, -1, Long.MAX_VALUE, Long.MIN_VALUE, 0x123456789ABCDEFL}) {
            assertEquals(Optional.of(Value.i32(Long.hashCode(value))), f.execute(Value.i64(value)));
        }
        assertEquals(Optional.of(Value.i32(Integer.MIN_VALUE)), f.execute(Value.i64(Long.MAX_VALUE)));
    }

    private static Function identity(String desc) {
        return Utils.compile(desc, mv -> {
            mv.visitVarInsn(ILOAD, 0);
            mv.visitInsn(IRETURN);
        });
    }

    @Test
    void booleanReturnKeepsLowBit() {
        Function f = identity("(I)Z");
        assertEquals(Optional.of(Value.i32(0)), f.execute(Value.i32(2)));
        assertEquals(Optional.of(Value.i32(1)), f.execute(Value.i32(3)));
        assertEquals(Optional.of(Value.i32(1)), f.execute(Value.i32(-1)));
    }

    @Test
    void byteReturnSignExtends() {
        Function f = identity("(I)B");
        assertEquals(Optional.of(Value.i32(44)), f.execute(Value.i32(300)));
        assertEquals(Optional.of(Value.i32(-1)), f.execute(Value.i32(255)));
        assertEquals(Optional.of(Value.i32(-128)), f.execute(Value.i32(128)));
    }

    @Test
    void charReturnZeroExtends() {
        Function f = identity("(I)C");
        assertEquals(Optional.of(Value.i32(0xFFFF)), f.execute(Value.i32(-1)));
        assertEquals(Optional.of(Value.i32(0x2345)), f.execute(Value.i32(0x12345)));
    }

    @Test
    void shortReturnSignExtends() {
        Function f = identity("(I)S");
        assertEquals(Optional.of(Value.i32(-1)), f.execute(Value.i32(0xFFFF)));
        assertEquals(Optional.of(Value.i32(0x2345)), f.execute(Value.i32(0x12345)));
        assertEquals(Optional.of(Value.i32(-32768)), f.execute(Value.i32(32768)));
    }

    @Test
    void intReturnIsUnchanged() {
        assertEquals(Optional.of(Value.i32(0x12345)), identity("(I)I").execute(Value.i32(0x12345)));
    }

    @Test
    void voidReturnsNothing() {
        Function f = Utils.compile("()V", mv -> mv.visitInsn(RETURN));
        assertEquals(Optional.empty(), f.execute());
        assertTrue(f.getSignature().isVoid());
    }

    @Test
    void unsupportedInstruction() {
        JitException.UnsupportedInstruction e = assertThrows(JitException.UnsupportedInstruction.class, () -> Utils.compile("()V", mv -> {
            mv.visitFieldInsn(GETSTATIC, "java/lang/System", "out", "Ljava/io/PrintStream;");
            mv.visitInsn(POP);
            mv.visitInsn(RETURN);
        }));
        assertTrue(e.isUnsupported());
        assertEquals(Opcode.GETSTATIC, e.getInstruction().opcode);
    }

    @Test
    void unsupportedInstructionInDeadCode() {
        assertThrows(JitException.UnsupportedInstruction.class, () -> Utils.compile("()I", mv -> {
            mv.visitInsn(ICONST_0);
            mv.visitInsn(IRETURN);
            mv.visitInsn(ATHROW);
        }));
    }

    @Test
    void instanceMethodsAreUnsupported() {
        ClassFile cf = Utils.singleMethod(ACC_PUBLIC, "()V", 1, mv -> mv.visitInsn(RETURN));
        JitException e = assertThrows(JitException.UnsupportedMethod.class,
                () -> Utils.compile(Utils.newCompiler(), cf));
        assertTrue(e.isUnsupported());
    }

    @Test
    void methodsWithoutCodeAreUnsupported() {
        ClassFile cf = Utils.singleMethod(ACC_PUBLIC | ACC_STATIC | ACC_NATIVE, "()V", 0, mv -> {
        });
        assertThrows(JitException.UnsupportedMethod.class, () -> Utils.compile(Utils.newCompiler(), cf));
    }

    @Test
    void classTypesAreUnsupported() {
        JitException e = assertThrows(JitException.UnsupportedType.class, () -> Utils.compile("(Ljava/lang/String;)I", mv -> {
            mv.visitInsn(ICONST_0);
            mv.visitInsn(IRETURN);
        }));
        assertTrue(e.isUnsupported());
    }

    @Test
    void exceptionHandlersAreUnsupported() {
        assertThrows(JitException.UnsupportedMethod.class, () -> Utils.compile("()I", mv -> {
            Label start = new Label();
            Label end = new Label();
            Label handler = new Label();
            mv.visitTryCatchBlock(start, end, handler, null);
            mv.visitLabel(start);
            mv.visitInsn(ICONST_0);
            mv.visitInsn(IRETURN);
            mv.visitLabel(end);
            mv.visitLabel(handler);
            mv.visitInsn(ICONST_1);
            mv.visitInsn(IRETURN);
        }));
    }

    @Test
    void stackUnderflow() {
        assertThrows(JitException.OperandStackUnderflow.class, () -> Utils.compile("()I", mv -> {
            mv.visitInsn(ICONST_1);
            mv.visitInsn(IADD);
            mv.visitInsn(IRETURN);
        }));
    }

    @Test
    void wrongLocalType() {
        JitException.InvalidLocalVariableIndex e = assertThrows(JitException.InvalidLocalVariableIndex.class,
                () -> Utils.compile("(J)I", mv -> {
                    mv.visitVarInsn(ILOAD, 0);
                    mv.visitInsn(IRETURN);
                }));
        assertEquals(0, e.getIndex());
    }

    @Test
    void wrongOperandType() {
        assertThrows(JitException.InvalidValue.class, () -> Utils.compile("(J)I", mv -> {
            mv.visitVarInsn(LLOAD, 0);
            mv.visitInsn(ICONST_1);
            mv.visitInsn(IADD);
            mv.visitInsn(IRETURN);
        }));
    }

    @Test
    void wrongReturnInstruction() {
        assertThrows(JitException.Internal.class, () -> Utils.compile("()I", mv -> {
            mv.visitInsn(LCONST_0);
            mv.visitInsn(LRETURN);
        }));
    }

    @Test
    void fallingOffTheEnd() {
        assertThrows(JitException.Internal.class, () -> Utils.compile("()V", mv -> mv.visitInsn(ICONST_0)));
    }

    @Test
    void stringConstantsAreInvalid() {
        JitException.InvalidConstant e = assertThrows(JitException.InvalidConstant.class,
                () -> Utils.compile("()I", mv -> {
                    mv.visitLdcInsn("hello");
                    mv.visitInsn(POP);
                    mv.visitInsn(ICONST_0);
                    mv.visitInsn(IRETURN);
                }));
        assertEquals("Integer or Float", e.getExpected());
    }

    @Test
    void divisionByZeroTraps() {
        Function f = Utils.compile("(II)I", mv -> {
            mv.visitVarInsn(ILOAD, 0);
            mv.visitVarInsn(ILOAD, 1);
            mv.visitInsn(IDIV);
            mv.visitInsn(IRETURN);
        });
        assertEquals(Optional.of(Value.i32(-3)), f.execute(Value.i32(-7), Value.i32(2)));
        JitException.Trap trap = assertThrows(JitException.Trap.class, () -> f.execute(Value.i32(1), Value.i32(0)));
        assertInstanceOf(ArithmeticException.class, trap.getCause());
        assertEquals(Optional.of(Value.i32(Integer.MIN_VALUE)),
                f.execute(Value.i32(Integer.MIN_VALUE), Value.i32(-1)));
    }

    @Test
    void argumentsAreChecked() {
        Function f = Utils.compile("(IJ)J", mv -> {
            mv.visitVarInsn(ILOAD, 0);
            mv.visitInsn(I2L);
            mv.visitVarInsn(LLOAD, 1);
            mv.visitInsn(LADD);
            mv.visitInsn(LRETURN);
        });
        JitException.InvalidArgumentCount count = assertThrows(JitException.InvalidArgumentCount.class,
                () -> f.execute(Value.i32(1)));
        assertEquals(2, count.getExpected());
        assertEquals(1, count.getActual());
        JitException.InvalidValue value = assertThrows(JitException.InvalidValue.class,
                () -> f.execute(Value.i64(1), Value.i64(2)));
        assertEquals("I32", value.getExpected());
        assertEquals("I64", value.getActual());
        assertEquals(Optional.of(Value.i64(3)), f.execute(Value.i32(1), Value.i64(2)));
    }

    @Test
    void targetRelease() {
        int host = Runtime.version().feature();
        ByteBufferHeap heap = new ByteBufferHeap(Utils.HEAP_SIZE);
        assertThrows(JitException.UnsupportedTargetIsa.class, () -> new Compiler(heap, 7));
        assertThrows(JitException.UnsupportedTargetIsa.class, () -> new Compiler(heap, host + 1));

        Compiler compiler = new Compiler(heap, Compiler.MIN_TARGET_RELEASE);
        assertEquals(Compiler.MIN_TARGET_RELEASE, compiler.getTargetRelease());
        ClassFile cf = Utils.staticMethod("(I)I", mv -> {
            mv.visitVarInsn(ILOAD, 0);
            mv.visitInsn(ICONST_1);
            mv.visitInsn(IADD);
            mv.visitInsn(IRETURN);
        });
        assertEquals(Optional.of(Value.i32(2)), Utils.compile(compiler, cf).execute(Value.i32(1)));
    }

    @Test
    void compilingTwiceGivesIndependentFunctions() {
        Compiler compiler = Utils.newCompiler();
        ClassFile cf = Utils.staticMethod("()I", mv -> {
            mv.visitIntInsn(BIPUSH, 5);
            mv.visitInsn(IRETURN);
        });
        Function a = Utils.compile(compiler, cf);
        Function b = Utils.compile(compiler, cf);
        assertNotSame(a, b);
        assertEquals(a.execute(), b.execute());
        assertEquals("Test.test()I", a.getName());
    }

    @Test
    void debugOutput(@TempDir File dir) {
        Compiler compiler = Utils.newCompiler();
        compiler.setDebugOutput(dir);
        Utils.compile(compiler, Utils.staticMethod("()V", mv -> mv.visitInsn(RETURN)));
        File[] files = dir.listFiles();
        assertNotNull(files);
        assertEquals(1, files.length);
        assertTrue(files[0].getName().endsWith(".class"));
    }

    @Test
    void withoutChecks() {
        Compiler compiler = Utils.newCompiler();
        compiler.setVerify(false);
        compiler.setCheckClasses(false);
        Function f = Utils.compile(compiler, Utils.staticMethod("(F)F", mv -> {
            mv.visitVarInsn(FLOAD, 0);
            mv.visitInsn(FNEG);
            mv.visitInsn(FRETURN);
        }));
        assertEquals(Optional.of(Value.f32(-1.5F)), f.execute(Value.f32(1.5F)));
    }

    @Test
    void concurrentUse() throws Exception {
        Compiler compiler = Utils.newCompiler();
        ClassFile cf = Utils.staticMethod("(I)I", mv -> {
            mv.visitVarInsn(ILOAD, 0);
            mv.visitVarInsn(ILOAD, 0);
            mv.visitInsn(IMUL);
            mv.visitInsn(IRETURN);
        });
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Function>> compiled = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                compiled.add(executor.submit(() -> Utils.compile(compiler, cf)));
            }
            List<Future<Optional<Value>>> results = new ArrayList<>();
            for (int i = 0; i < compiled.size(); i++) {
                Function f = compiled.get(i).get();
                int arg = i;
                results.add(executor.submit(() -> f.execute(Value.i32(arg))));
            }
            for (int i = 0; i < results.size(); i++) {
                assertEquals(Optional.of(Value.i32(i * i)), results.get(i).get());
            }
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void stackShuffles() {
        // (a, b) -> b - a
        Function f = Utils.compile("(II)I", mv -> {
            mv.visitVarInsn(ILOAD, 1);
            mv.visitVarInsn(ILOAD, 0);
            mv.visitInsn(SWAP);
            mv.visitInsn(DUP_X1);
            mv.visitInsn(POP);
            mv.visitInsn(ISUB);
            mv.visitInsn(IRETURN);
        });
        assertEquals(Optional.of(Value.i32(-7)), f.execute(Value.i32(10), Value.i32(3)));

        Function wide = Utils.compile("(JI)J", mv -> {
            mv.visitVarInsn(ILOAD, 2);
            mv.visitVarInsn(LLOAD, 0);
            mv.visitInsn(DUP2_X1);
            mv.visitInsn(POP2);
            mv.visitInsn(I2L);
            mv.visitInsn(LSUB);
            mv.visitInsn(LRETURN);
        });
        assertEquals(Optional.of(Value.i64(97)), wide.execute(Value.i64(100), Value.i32(3)));

        assertThrows(JitException.Internal.class, () -> Utils.compile("(J)V", mv -> {
            mv.visitVarInsn(LLOAD, 0);
            mv.visitInsn(POP);
            mv.visitInsn(RETURN);
        }));
    }

    @Test
    void leftoverStackAtReturn() {
        Function f = Utils.compile("()I", mv -> {
            mv.visitInsn(ICONST_1);
            mv.visitInsn(ICONST_2);
            mv.visitInsn(IRETURN);
        });
        assertEquals(Optional.of(Value.i32(2)), f.execute());
    }

    @Test
    void localsSurviveWideOverwrites() {
        // storing a long at slot 0 kills the int at slot 1
        assertThrows(JitException.InvalidLocalVariableIndex.class, () -> Utils.compile("(II)I", mv -> {
            mv.visitInsn(LCONST_1);
            mv.visitVarInsn(LSTORE, 0);
            mv.visitVarInsn(ILOAD, 1);
            mv.visitInsn(IRETURN);
        }));
        Function f = Utils.compile("(II)I", mv -> {
            mv.visitInsn(LCONST_1);
            mv.visitVarInsn(LSTORE, 2);
            mv.visitVarInsn(ILOAD, 1);
            mv.visitVarInsn(LLOAD, 2);
            mv.visitInsn(L2I);
            mv.visitInsn(IADD);
            mv.visitInsn(IRETURN);
        });
        assertEquals(Optional.of(Value.i32(6)), f.execute(Value.i32(0), Value.i32(5)));
    }
}
