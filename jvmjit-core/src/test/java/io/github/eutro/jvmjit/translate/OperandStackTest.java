package io.github.eutro.jvmjit.translate;

import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.Kind;
import io.github.eutro.jvmjit.cfg.StackType;
import io.github.eutro.jvmjit.classfile.code.Opcode;
import io.github.eutro.jvmjit.ssa.FunctionBody;
import io.github.eutro.jvmjit.ssa.Var;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class OperandStackTest {
    FunctionBody func;
    OperandStack stack;

    @BeforeEach
    void setUp() {
        func = new FunctionBody("test", Collections.emptyList(), null);
        stack = new OperandStack();
    }

    @Test
    void pushAndPop() {
        Var a = func.newVar("a", Kind.I32);
        Var b = func.newVar("b", Kind.I64);
        stack.push(a, StackType.INT);
        stack.push(b, StackType.REFERENCE);
        assertEquals(Arrays.asList(StackType.INT, StackType.REFERENCE), stack.types());
        assertSame(b, stack.popReference());
        assertSame(a, stack.popInt());
        assertEquals(0, stack.size());
        assertThrows(JitException.OperandStackUnderflow.class, stack::pop);
    }

    @Test
    void typesAreChecked() {
        stack.push(func.newVar("l", Kind.I64), StackType.LONG);
        JitException.InvalidValue e = assertThrows(JitException.InvalidValue.class, stack::popReference);
        assertEquals("REFERENCE", e.getExpected());
        assertEquals("LONG", e.getActual());
        assertThrows(JitException.Internal.class, () -> stack.push(func.newVar("f", Kind.F32), StackType.INT));
    }

    @Test
    void dup2OfTwoInts() {
        Var a = func.newVar("a", Kind.I32);
        Var b = func.newVar("b", Kind.I32);
        stack.push(a, StackType.INT);
        stack.push(b, StackType.INT);
        stack.shuffle(Opcode.DUP2);
        assertEquals(Arrays.asList(a, b, a, b), stack.values());
    }

    @Test
    void dup2X2OfWideValues() {
        Var x = func.newVar("x", Kind.F64);
        Var y = func.newVar("y", Kind.I64);
        stack.push(x, StackType.DOUBLE);
        stack.push(y, StackType.LONG);
        stack.shuffle(Opcode.DUP2_X2);
        assertEquals(Arrays.asList(y, x, y), stack.values());
    }

    @Test
    void categoryViolations() {
        stack.push(func.newVar("l", Kind.I64), StackType.LONG);
        assertThrows(JitException.Internal.class, () -> stack.shuffle(Opcode.DUP));
        assertThrows(JitException.Internal.class, () -> stack.shuffle(Opcode.SWAP));
    }
}
