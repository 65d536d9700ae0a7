package io.github.eutro.jvmjit.ops;

import io.github.eutro.jvmjit.ssa.Insn;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OpKeyTest {
    @Test
    void castRecoversTheImmediate() {
        Op op = ArithOps.ICMP.create(ArithOps.IntCC.ULT);
        assertSame(ArithOps.ICMP, op.key);
        assertEquals(ArithOps.IntCC.ULT, ArithOps.ICMP.cast(op).arg);
        assertThrows(IllegalArgumentException.class, () -> ArithOps.FCMP.cast(op));
        assertThrows(IllegalArgumentException.class, () -> CommonOps.TRAP.cast(CommonOps.BR.create()));
    }

    @Test
    void simpleOpsAreShared() {
        assertSame(CommonOps.SELECT.create(), CommonOps.SELECT.create());
        Insn insn = CommonOps.RETURN.create().insn();
        assertTrue(insn.args.isEmpty());
        assertEquals("return", CommonOps.RETURN.toString());
    }

    @Test
    void immediatesAreRequired() {
        assertThrows(NullPointerException.class, () -> CommonOps.TRAP.create(null));
        assertEquals("trap \"NullPointerException\"", CommonOps.TRAP.create("NullPointerException").toString());
    }
}
