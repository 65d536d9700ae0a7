package io.github.eutro.jvmjit.passes.meta;

import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.Kind;
import io.github.eutro.jvmjit.ops.ArithOps;
import io.github.eutro.jvmjit.ops.CommonOps;
import io.github.eutro.jvmjit.ops.MemOps;
import io.github.eutro.jvmjit.ops.OpKey;
import io.github.eutro.jvmjit.passes.InPlaceIRPass;
import io.github.eutro.jvmjit.ssa.*;

import java.util.*;

/**
 * A pass which checks that a function is well-formed: every block ends in a control instruction,
 * every variable is assigned exactly once before the function uses it,
 * and every instruction and block call is given arguments of the kinds it expects.
 * <p>
 * Violations are reported as {@link JitException.Internal}.
 */
public class VerifyIntegrity implements InPlaceIRPass<FunctionBody> {
    /**
     * A singleton instance of this class.
     */
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    private interface Checker {
        void check(Insn insn, List<Var> results, FunctionBody func);
    }

    private static final Map<OpKey, Checker> CHECKERS = new HashMap<>();

    @Override
    public void runInPlace(FunctionBody func) {
        if (func.blocks.isEmpty()) {
            throw fail("function %s has no blocks", func.name);
        }
        if (!func.blocks.get(0).getParams().isEmpty()) {
            throw fail("entry block of %s has parameters", func.name);
        }

        Set<Var> defined = new HashSet<>();
        for (BasicBlock block : func.blocks) {
            for (Var param : block.getParams()) {
                define(defined, param);
            }
            for (Effect effect : block.getEffects()) {
                for (Var var : effect.getAssignsTo()) {
                    define(defined, var);
                }
            }
        }

        for (BasicBlock block : func.blocks) {
            try {
                for (Effect effect : block.getEffects()) {
                    checkInsn(effect.insn(), effect.getAssignsTo(), func, defined);
                }
                Control ctrl = block.getControl();
                if (ctrl == null) {
                    throw fail("no control instruction");
                }
                checkInsn(ctrl.insn(), Collections.emptyList(), func, defined);
                checkTargets(ctrl);
                for (BlockCall call : ctrl.targets) {
                    checkCall(call, defined);
                }
            } catch (JitException.Internal e) {
                throw fail("in block %s of %s: %s", block.toTargetString(), func.name, e.getMessage());
            }
        }
    }

    private static void define(Set<Var> defined, Var var) {
        if (!defined.add(var)) {
            throw fail("variable %s is assigned more than once", var);
        }
    }

    private static void checkInsn(Insn insn, List<Var> results, FunctionBody func, Set<Var> defined) {
        for (Var arg : insn.args) {
            if (!defined.contains(arg)) {
                throw fail("%s uses unassigned variable %s", insn, arg);
            }
        }
        Checker checker = CHECKERS.get(insn.op.key);
        if (checker == null) {
            throw fail("unknown instruction %s", insn);
        }
        checker.check(insn, results, func);
    }

    private static void checkCall(BlockCall call, Set<Var> defined) {
        List<Var> params = call.target.getParams();
        if (params.size() != call.args.size()) {
            throw fail("%s passes %d arguments, expected %d", call, call.args.size(), params.size());
        }
        for (int i = 0; i < params.size(); i++) {
            Var arg = call.args.get(i);
            if (!defined.contains(arg)) {
                throw fail("%s passes unassigned variable %s", call, arg);
            }
            if (arg.kind != params.get(i).kind) {
                throw fail("%s passes %s for parameter %s", call, arg.toDeclString(), params.get(i).toDeclString());
            }
        }
    }

    private static JitException.Internal fail(String format, Object... args) {
        return new JitException.Internal(String.format(format, args));
    }

    private static void arity(Insn insn, int args, List<Var> results, int resultCount) {
        if (insn.args.size() != args || results.size() != resultCount) {
            throw fail("%s takes %d arguments and assigns %d values", insn, args, resultCount);
        }
    }

    private static void kind(Insn insn, Var var, Kind expected) {
        if (var.kind != expected) {
            throw fail("%s expected %s, got %s", insn, expected, var.toDeclString());
        }
    }

    private static void checkTargets(Control ctrl) {
        OpKey key = ctrl.insn().op.key;
        int expected;
        if (key == CommonOps.BR) {
            expected = 1;
        } else if (key == CommonOps.BR_IF) {
            expected = 2;
        } else if (key == CommonOps.SWITCH) {
            expected = CommonOps.SWITCH.cast(ctrl.insn().op).arg.length + 1;
        } else {
            expected = 0;
        }
        if (ctrl.targets.size() != expected) {
            throw fail("%s has %d targets, expected %d", ctrl.insn(), ctrl.targets.size(), expected);
        }
    }

    static {
        CHECKERS.put(CommonOps.ARG, (insn, results, func) -> {
            arity(insn, 0, results, 1);
            int index = CommonOps.ARG.cast(insn.op).arg;
            if (index < 0 || index >= func.getParamKinds().size()) {
                throw fail("%s is out of range", insn);
            }
            kind(insn, results.get(0), func.getParamKinds().get(index));
        });
        CHECKERS.put(CommonOps.CONST, (insn, results, func) -> {
            arity(insn, 0, results, 1);
            kind(insn, results.get(0), CommonOps.constantKind(CommonOps.CONST.cast(insn.op).arg));
        });
        CHECKERS.put(CommonOps.SELECT, (insn, results, func) -> {
            arity(insn, 3, results, 1);
            Kind kind = insn.args.get(0).kind;
            kind(insn, insn.args.get(1), kind);
            kind(insn, insn.args.get(2), Kind.I32);
            kind(insn, results.get(0), kind);
        });

        CHECKERS.put(ArithOps.BINARY, (insn, results, func) -> {
            arity(insn, 2, results, 1);
            ArithOps.BinaryOp op = ArithOps.BINARY.cast(insn.op).arg;
            Kind kind = insn.args.get(0).kind;
            if (op.integerOnly && !kind.isInteger()) {
                throw fail("%s on %s", insn, kind);
            }
            kind(insn, insn.args.get(1), op.isShift() ? Kind.I32 : kind);
            kind(insn, results.get(0), kind);
        });
        CHECKERS.put(ArithOps.NEG, (insn, results, func) -> {
            arity(insn, 1, results, 1);
            kind(insn, results.get(0), insn.args.get(0).kind);
        });
        CHECKERS.put(ArithOps.CONVERT, (insn, results, func) -> {
            arity(insn, 1, results, 1);
            ArithOps.Conversion conversion = ArithOps.CONVERT.cast(insn.op).arg;
            kind(insn, insn.args.get(0), conversion.from);
            kind(insn, results.get(0), conversion.to);
        });
        CHECKERS.put(ArithOps.ICMP, (insn, results, func) -> {
            arity(insn, 2, results, 1);
            Kind kind = insn.args.get(0).kind;
            if (!kind.isInteger()) {
                throw fail("%s on %s", insn, kind);
            }
            kind(insn, insn.args.get(1), kind);
            kind(insn, results.get(0), Kind.I32);
        });
        CHECKERS.put(ArithOps.FCMP, (insn, results, func) -> {
            arity(insn, 2, results, 1);
            Kind kind = insn.args.get(0).kind;
            if (kind.isInteger()) {
                throw fail("%s on %s", insn, kind);
            }
            kind(insn, insn.args.get(1), kind);
            kind(insn, results.get(0), Kind.I32);
        });

        CHECKERS.put(MemOps.ALLOC, (insn, results, func) -> {
            arity(insn, 1, results, 1);
            kind(insn, insn.args.get(0), Kind.I64);
            kind(insn, results.get(0), Kind.I64);
        });
        CHECKERS.put(MemOps.LOAD, (insn, results, func) -> {
            arity(insn, 1, results, 1);
            kind(insn, insn.args.get(0), Kind.I64);
            kind(insn, results.get(0), MemOps.LOAD.cast(insn.op).arg.type.kind);
        });
        CHECKERS.put(MemOps.STORE, (insn, results, func) -> {
            arity(insn, 2, results, 0);
            kind(insn, insn.args.get(0), Kind.I64);
            kind(insn, insn.args.get(1), MemOps.STORE.cast(insn.op).arg.type.kind);
        });
    }

    static {
        CHECKERS.put(CommonOps.BR, (insn, results, func) -> arity(insn, 0, results, 0));
        CHECKERS.put(CommonOps.BR_IF, (insn, results, func) -> {
            arity(insn, 1, results, 0);
            kind(insn, insn.args.get(0), Kind.I32);
        });
        CHECKERS.put(CommonOps.SWITCH, (insn, results, func) -> {
            arity(insn, 1, results, 0);
            kind(insn, insn.args.get(0), Kind.I32);
        });
        CHECKERS.put(CommonOps.RETURN, (insn, results, func) -> {
            Kind returnKind = func.getReturnKind();
            arity(insn, returnKind == null ? 0 : 1, results, 0);
            if (returnKind != null) {
                kind(insn, insn.args.get(0), returnKind);
            }
        });
        CHECKERS.put(CommonOps.TRAP, (insn, results, func) -> arity(insn, 0, results, 0));
    }
}
