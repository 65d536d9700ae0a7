package io.github.eutro.jvmjit.passes.meta;

import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.Kind;
import io.github.eutro.jvmjit.ops.ArithOps;
import io.github.eutro.jvmjit.ops.CommonOps;
import io.github.eutro.jvmjit.ssa.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class VerifyIntegrityTest {
    FunctionBody func;
    BasicBlock entry;
    BasicBlock exit;
    Var param;
    IRBuilder ib;

    @BeforeEach
    void setUp() {
        func = new FunctionBody("test", Arrays.asList(Kind.I32, Kind.I32), Kind.I32);
        entry = func.newBb();
        exit = func.newBb();
        param = func.newVar("p", Kind.I32);
        exit.addParam(param);
        exit.setControl(CommonOps.RETURN.create().insn(param).jumpsTo());
        ib = new IRBuilder(func, entry);
    }

    private JitException.Internal fails() {
        return assertThrows(JitException.Internal.class, () -> VerifyIntegrity.INSTANCE.run(func));
    }

    @Test
    void wellFormed() {
        Var a = ib.insert(CommonOps.ARG.create(0).insn(), "a", Kind.I32);
        Var b = ib.insert(CommonOps.ARG.create(1).insn(), "b", Kind.I32);
        Var sum = ib.insert(ArithOps.BINARY.create(ArithOps.BinaryOp.ADD).insn(a, b), "sum", Kind.I32);
        ib.insertCtrl(CommonOps.BR.create().insn().jumpsTo(BlockCall.of(exit, sum)));
        assertSame(func, VerifyIntegrity.INSTANCE.run(func));
    }

    @Test
    void missingControl() {
        ib.insert(CommonOps.ARG.create(0).insn(), "a", Kind.I32);
        assertTrue(fails().getMessage().contains("no control instruction"));
    }

    @Test
    void doubleAssignment() {
        Var a = ib.insert(CommonOps.ARG.create(0).insn(), "a", Kind.I32);
        ib.insert(CommonOps.ARG.create(1).insn().assignTo(a));
        ib.insertCtrl(CommonOps.BR.create().insn().jumpsTo(BlockCall.of(exit, a)));
        fails();
    }

    @Test
    void unassignedVariable() {
        Var ghost = func.newVar("ghost", Kind.I32);
        ib.insertCtrl(CommonOps.BR.create().insn().jumpsTo(BlockCall.of(exit, ghost)));
        fails();
    }

    @Test
    void wrongArgumentCount() {
        ib.insertCtrl(CommonOps.BR.create().insn().jumpsTo(BlockCall.of(exit)));
        fails();
    }

    @Test
    void wrongKinds() {
        Var a = ib.insert(CommonOps.ARG.create(0).insn(), "a", Kind.I32);
        Var l = ib.insert(CommonOps.constant(1L).insn(), "l", Kind.I64);
        ib.insertCtrl(CommonOps.BR_IF.create().insn(l).jumpsTo(
                BlockCall.of(exit, a), BlockCall.of(exit, a)));
        assertTrue(fails().getMessage().contains("expected I32"));
    }

    @Test
    void shiftsTakeAnIntAmount() {
        Var l = ib.insert(CommonOps.constant(1L).insn(), "l", Kind.I64);
        Var bad = ib.insert(ArithOps.BINARY.create(ArithOps.BinaryOp.SHL).insn(l, l), "bad", Kind.I64);
        Var narrow = ib.insert(ArithOps.CONVERT.create(ArithOps.Conversion.IREDUCE_I64_I32).insn(bad), "n", Kind.I32);
        ib.insertCtrl(CommonOps.BR.create().insn().jumpsTo(BlockCall.of(exit, narrow)));
        fails();
    }

    @Test
    void argumentOutOfRange() {
        Var a = ib.insert(CommonOps.ARG.create(2).insn(), "a", Kind.I32);
        ib.insertCtrl(CommonOps.BR.create().insn().jumpsTo(BlockCall.of(exit, a)));
        fails();
    }

    @Test
    void entryWithParameters() {
        FunctionBody other = new FunctionBody("other", Arrays.asList(), null);
        BasicBlock bb = other.newBb();
        bb.addParam(other.newVar("x", Kind.I32));
        bb.setControl(CommonOps.RETURN.create().insn().jumpsTo());
        assertThrows(JitException.Internal.class, () -> VerifyIntegrity.INSTANCE.run(other));
    }

    @Test
    void switchTargets() {
        Var a = ib.insert(CommonOps.ARG.create(0).insn(), "a", Kind.I32);
        ib.insertCtrl(CommonOps.SWITCH.create(new int[]{1, 2}).insn(a).jumpsTo(
                BlockCall.of(exit, a), BlockCall.of(exit, a)));
        assertTrue(fails().getMessage().contains("expected 3"));
    }
}
