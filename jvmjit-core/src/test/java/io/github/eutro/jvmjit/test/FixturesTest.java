package io.github.eutro.jvmjit.test;

import io.github.eutro.jvmjit.Compiler;
import io.github.eutro.jvmjit.Function;
import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.Value;
import io.github.eutro.jvmjit.classfile.ClassFile;
import io.github.eutro.jvmjit.classfile.Method;
import io.github.eutro.jvmjit.runtime.Heap;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class FixturesTest {
    static ClassFile classFile;
    static Compiler compiler;

    @BeforeAll
    static void readFixtures() throws IOException {
        classFile = Utils.readClass(Fixtures.class);
        compiler = Utils.newCompiler();
    }

    private static Method method(String name, String desc) {
        return classFile.findMethod(name, desc).orElseThrow(AssertionError::new);
    }

    private static Function compile(String name, String desc) {
        return compiler.compile(classFile, method(name, desc));
    }

    private static Value result(Function f, Value... args) {
        return f.execute(args).orElseThrow(AssertionError::new);
    }

    @Test
    void fib() {
        Function f = compile("fib", "(I)I");
        for (int n = 0; n < 50; n++) {
            assertEquals(Fixtures.fib(n), result(f, Value.i32(n)).asInt());
        }
    }

    @Test
    void gcd() {
        Function f = compile("gcd", "(JJ)J");
        assertEquals(Fixtures.gcd(1071, 462), result(f, Value.i64(1071), Value.i64(462)).asLong());
        assertEquals(Fixtures.gcd(-48, 18), result(f, Value.i64(-48), Value.i64(18)).asLong());
        assertEquals(7, result(f, Value.i64(7), Value.i64(0)).asLong());
    }

    @Test
    void collatz() {
        Function f = compile("collatz", "(I)I");
        for (int n = 1; n < 100; n++) {
            assertEquals(Fixtures.collatz(n), result(f, Value.i32(n)).asInt());
        }
    }

    @Test
    void isPrime() {
        Function f = compile("isPrime", "(I)Z");
        for (int n = -2; n < 200; n++) {
            assertEquals(Fixtures.isPrime(n) ? 1 : 0, result(f, Value.i32(n)).asInt());
        }
    }

    @Test
    void factorial() {
        Function f = compile("factorial", "(I)J");
        for (int n = 0; n < 25; n++) {
            assertEquals(Fixtures.factorial(n), result(f, Value.i32(n)).asLong());
        }
    }

    @Test
    void switches() {
        Function classify = compile("classify", "(I)I");
        Function dense = compile("dense", "(I)I");
        for (int x = -3; x < 110; x++) {
            assertEquals(Fixtures.classify(x), result(classify, Value.i32(x)).asInt());
            assertEquals(Fixtures.dense(x), result(dense, Value.i32(x)).asInt());
        }
    }

    @Test
    void floatComparisons() {
        Function clamp = compile("clamp", "(FFF)F");
        float[] inputs = {Float.NaN, -1, 0, 0.5F, 1, 2, Float.NEGATIVE_INFINITY};
        for (float x : inputs) {
            Value expected = Value.f32(Fixtures.clamp(x, 0, 1));
            assertEquals(expected, result(clamp, Value.f32(x), Value.f32(0), Value.f32(1)));
        }

        Function compare = compile("compare", "(DD)I");
        double[] values = {Double.NaN, -0.0, 0.0, 1, Double.POSITIVE_INFINITY};
        for (double a : values) {
            for (double b : values) {
                assertEquals(Fixtures.compare(a, b), result(compare, Value.f64(a), Value.f64(b)).asInt());
            }
        }
    }

    @Test
    void localArrays() {
        Function f = compile("sumOfSquares", "(I)I");
        for (int n = 0; n < 30; n++) {
            assertEquals(Fixtures.sumOfSquares(n), result(f, Value.i32(n)).asInt());
        }
        assertThrows(JitException.Trap.class, () -> f.execute(Value.i32(-1)));
    }

    @Test
    void arrayArguments() {
        Heap heap = compiler.getHeap();
        int[] ints = {5, -3, 12, 40};
        long intArray = heap.allocate(8 + 4L * ints.length);
        heap.putLong(intArray, ints.length);
        for (int i = 0; i < ints.length; i++) {
            heap.putInt(intArray + 8 + 4L * i, ints[i]);
        }
        assertEquals(Fixtures.sum(ints), result(compile("sum", "([I)I"), Value.i64(intArray)).asInt());

        double[] doubles = {1.5, 2.5, 8};
        long doubleArray = heap.allocate(8 + 8L * doubles.length);
        heap.putLong(doubleArray, doubles.length);
        for (int i = 0; i < doubles.length; i++) {
            heap.putDouble(doubleArray + 8 + 8L * i, doubles[i]);
        }
        Function mean = compile("mean", "([D)D");
        assertEquals(Fixtures.mean(doubles), result(mean, Value.i64(doubleArray)).asDouble());
        assertThrows(JitException.Trap.class, () -> mean.execute(Value.i64(0)));
    }

    @Test
    void chars() {
        Function f = compile("upper", "(C)C");
        for (char c : "azAZ09{`".toCharArray()) {
            assertEquals(Fixtures.upper(c), result(f, Value.i32(c)).asInt());
        }
    }

    @Test
    void longMixing() {
        Function f = compile("mix", "(JI)J");
        for (long x : new long[]{0, 1, -1, 0x0123456789ABCDEFL}) {
            for (int shift : new int[]{0, 7, 33, 64, -1}) {
                assertEquals(Fixtures.mix(x, shift), result(f, Value.i64(x), Value.i32(shift)).asLong());
            }
        }
    }

    @Test
    void voidMethod() {
        assertEquals(Optional.empty(), compile("nothing", "()V").execute());
    }

    @Test
    void unsupportedMethods() {
        assertThrows(JitException.UnsupportedType.class, () -> compile("length", "(Ljava/lang/String;)I"));
        assertThrows(JitException.UnsupportedInstruction.class, () -> compile("callsOther", "(I)I"));
        assertThrows(JitException.UnsupportedMethod.class, () -> compile("guarded", "(I)I"));
        assertThrows(JitException.UnsupportedMethod.class, () -> compile("instance", "()I"));
        assertThrows(JitException.UnsupportedMethod.class, () -> compile("<init>", "()V"));
    }
}
