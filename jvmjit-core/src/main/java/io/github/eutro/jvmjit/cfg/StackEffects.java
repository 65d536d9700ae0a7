package io.github.eutro.jvmjit.cfg;

import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.classfile.ClassFileException;
import io.github.eutro.jvmjit.classfile.Constant;
import io.github.eutro.jvmjit.classfile.ConstantPool;
import io.github.eutro.jvmjit.classfile.code.Instruction;
import io.github.eutro.jvmjit.classfile.code.Opcode;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static io.github.eutro.jvmjit.cfg.StackType.*;

/**
 * The effects of supported instructions on the types of the operand stack and local variables.
 * <p>
 * Most instructions pop and push a fixed list of types, which are kept in a table.
 * Local variable accesses, constant loads and stack shuffles depend on their operands.
 */
public final class StackEffects {
    private static final Map<Opcode, Fixed> FIXED = new EnumMap<>(Opcode.class);

    static {
        StackType[] none = {};
        fixed(none, none, Opcode.NOP, Opcode.GOTO, Opcode.GOTO_W, Opcode.RETURN);
        fixed(none, types(REFERENCE), Opcode.ACONST_NULL);
        fixed(none, types(INT), Opcode.ICONST_M1, Opcode.ICONST_0, Opcode.ICONST_1, Opcode.ICONST_2,
                Opcode.ICONST_3, Opcode.ICONST_4, Opcode.ICONST_5, Opcode.BIPUSH, Opcode.SIPUSH);
        fixed(none, types(LONG), Opcode.LCONST_0, Opcode.LCONST_1);
        fixed(none, types(FLOAT), Opcode.FCONST_0, Opcode.FCONST_1, Opcode.FCONST_2);
        fixed(none, types(DOUBLE), Opcode.DCONST_0, Opcode.DCONST_1);

        fixed(types(REFERENCE, INT), types(INT), Opcode.IALOAD, Opcode.BALOAD, Opcode.CALOAD, Opcode.SALOAD);
        fixed(types(REFERENCE, INT), types(LONG), Opcode.LALOAD);
        fixed(types(REFERENCE, INT), types(FLOAT), Opcode.FALOAD);
        fixed(types(REFERENCE, INT), types(DOUBLE), Opcode.DALOAD);
        fixed(types(REFERENCE, INT, INT), none, Opcode.IASTORE, Opcode.BASTORE, Opcode.CASTORE, Opcode.SASTORE);
        fixed(types(REFERENCE, INT, LONG), none, Opcode.LASTORE);
        fixed(types(REFERENCE, INT, FLOAT), none, Opcode.FASTORE);
        fixed(types(REFERENCE, INT, DOUBLE), none, Opcode.DASTORE);

        fixed(types(INT, INT), types(INT), Opcode.IADD, Opcode.ISUB, Opcode.IMUL, Opcode.IDIV, Opcode.IREM,
                Opcode.ISHL, Opcode.ISHR, Opcode.IUSHR, Opcode.IAND, Opcode.IOR, Opcode.IXOR);
        fixed(types(LONG, LONG), types(LONG), Opcode.LADD, Opcode.LSUB, Opcode.LMUL, Opcode.LDIV, Opcode.LREM,
                Opcode.LAND, Opcode.LOR, Opcode.LXOR);
        fixed(types(LONG, INT), types(LONG), Opcode.LSHL, Opcode.LSHR, Opcode.LUSHR);
        fixed(types(FLOAT, FLOAT), types(FLOAT), Opcode.FADD, Opcode.FSUB, Opcode.FMUL, Opcode.FDIV, Opcode.FREM);
        fixed(types(DOUBLE, DOUBLE), types(DOUBLE), Opcode.DADD, Opcode.DSUB, Opcode.DMUL, Opcode.DDIV, Opcode.DREM);
        fixed(types(INT), types(INT), Opcode.INEG, Opcode.I2B, Opcode.I2C, Opcode.I2S);
        fixed(types(LONG), types(LONG), Opcode.LNEG);
        fixed(types(FLOAT), types(FLOAT), Opcode.FNEG);
        fixed(types(DOUBLE), types(DOUBLE), Opcode.DNEG);

        fixed(types(INT), types(LONG), Opcode.I2L);
        fixed(types(INT), types(FLOAT), Opcode.I2F);
        fixed(types(INT), types(DOUBLE), Opcode.I2D);
        fixed(types(LONG), types(INT), Opcode.L2I);
        fixed(types(LONG), types(FLOAT), Opcode.L2F);
        fixed(types(LONG), types(DOUBLE), Opcode.L2D);
        fixed(types(FLOAT), types(INT), Opcode.F2I);
        fixed(types(FLOAT), types(LONG), Opcode.F2L);
        fixed(types(FLOAT), types(DOUBLE), Opcode.F2D);
        fixed(types(DOUBLE), types(INT), Opcode.D2I);
        fixed(types(DOUBLE), types(LONG), Opcode.D2L);
        fixed(types(DOUBLE), types(FLOAT), Opcode.D2F);

        fixed(types(LONG, LONG), types(INT), Opcode.LCMP);
        fixed(types(FLOAT, FLOAT), types(INT), Opcode.FCMPL, Opcode.FCMPG);
        fixed(types(DOUBLE, DOUBLE), types(INT), Opcode.DCMPL, Opcode.DCMPG);

        fixed(types(INT), none, Opcode.IFEQ, Opcode.IFNE, Opcode.IFLT, Opcode.IFGE, Opcode.IFGT, Opcode.IFLE,
                Opcode.TABLESWITCH, Opcode.LOOKUPSWITCH, Opcode.IRETURN);
        fixed(types(INT, INT), none, Opcode.IF_ICMPEQ, Opcode.IF_ICMPNE, Opcode.IF_ICMPLT, Opcode.IF_ICMPGE,
                Opcode.IF_ICMPGT, Opcode.IF_ICMPLE);
        fixed(types(REFERENCE, REFERENCE), none, Opcode.IF_ACMPEQ, Opcode.IF_ACMPNE);
        fixed(types(REFERENCE), none, Opcode.IFNULL, Opcode.IFNONNULL, Opcode.ARETURN);
        fixed(types(LONG), none, Opcode.LRETURN);
        fixed(types(FLOAT), none, Opcode.FRETURN);
        fixed(types(DOUBLE), none, Opcode.DRETURN);

        fixed(types(INT), types(REFERENCE), Opcode.NEWARRAY);
        fixed(types(REFERENCE), types(INT), Opcode.ARRAYLENGTH);
    }

    private static final StackType[] BY_PREFIX = {INT, LONG, FLOAT, DOUBLE, REFERENCE};

    private StackEffects() {
    }

    private static StackType[] types(StackType... types) {
        return types;
    }

    private static void fixed(StackType[] pops, StackType[] pushes, Opcode... opcodes) {
        Fixed effect = new Fixed(pops, pushes);
        for (Opcode opcode : opcodes) {
            FIXED.put(opcode, effect);
        }
    }

    /**
     * Whether the JIT can compile an opcode.
     *
     * @param opcode The opcode.
     * @return Whether it is supported.
     */
    public static boolean isSupported(Opcode opcode) {
        switch (opcode) {
            case LDC:
            case LDC_W:
            case LDC2_W:
            case IINC:
                return true;
            default:
                return FIXED.containsKey(opcode)
                        || StackShuffles.isShuffle(opcode)
                        || isLocalAccess(opcode);
        }
    }

    private static boolean isLocalAccess(Opcode opcode) {
        return (opcode.code >= Opcode.ILOAD.code && opcode.code <= Opcode.ALOAD_3.code)
                || (opcode.code >= Opcode.ISTORE.code && opcode.code <= Opcode.ASTORE_3.code);
    }

    /**
     * Decode an instruction that loads or stores a local variable, including the
     * {@code _n} forms with an implicit index.
     *
     * @param insn The instruction.
     * @return The access, or null if the instruction is not a load or store.
     */
    public static @Nullable LocalAccess getLocalAccess(Instruction insn) {
        int code = insn.opcode.code;
        if (code >= Opcode.ILOAD.code && code <= Opcode.ALOAD.code) {
            return new LocalAccess(BY_PREFIX[code - Opcode.ILOAD.code], ((Instruction.Local) insn).index, false);
        } else if (code >= Opcode.ILOAD_0.code && code <= Opcode.ALOAD_3.code) {
            int n = code - Opcode.ILOAD_0.code;
            return new LocalAccess(BY_PREFIX[n / 4], n % 4, false);
        } else if (code >= Opcode.ISTORE.code && code <= Opcode.ASTORE.code) {
            return new LocalAccess(BY_PREFIX[code - Opcode.ISTORE.code], ((Instruction.Local) insn).index, true);
        } else if (code >= Opcode.ISTORE_0.code && code <= Opcode.ASTORE_3.code) {
            int n = code - Opcode.ISTORE_0.code;
            return new LocalAccess(BY_PREFIX[n / 4], n % 4, true);
        }
        return null;
    }

    /**
     * Resolve the constant loaded by an {@code ldc}, {@code ldc_w} or {@code ldc2_w}.
     *
     * @param pool The constant pool.
     * @param insn The instruction.
     * @return The boxed {@link Integer}, {@link Long}, {@link Float} or {@link Double} value.
     * @throws JitException.InvalidConstantIndex If the index does not name a pool entry.
     * @throws JitException.InvalidConstant      If the entry is of a kind the instruction cannot load.
     */
    public static Object resolveConstant(ConstantPool pool, Instruction.Constant insn) {
        Constant constant;
        try {
            constant = pool.get(insn.index);
        } catch (ClassFileException e) {
            throw new JitException.InvalidConstantIndex(insn.index, e);
        }
        boolean wide = insn.opcode == Opcode.LDC2_W;
        if (wide) {
            if (constant instanceof Constant.Long) return ((Constant.Long) constant).value;
            if (constant instanceof Constant.Double) return ((Constant.Double) constant).value;
            throw new JitException.InvalidConstant("Long or Double", constant.kindName());
        } else {
            if (constant instanceof Constant.Integer) return ((Constant.Integer) constant).value;
            if (constant instanceof Constant.Float) return ((Constant.Float) constant).value;
            throw new JitException.InvalidConstant("Integer or Float", constant.kindName());
        }
    }

    /**
     * Get the stack type of a resolved constant.
     *
     * @param value A value from {@link #resolveConstant(ConstantPool, Instruction.Constant)}.
     * @return Its type.
     */
    public static StackType constantType(Object value) {
        if (value instanceof Integer) return INT;
        if (value instanceof Long) return LONG;
        if (value instanceof Float) return FLOAT;
        if (value instanceof Double) return DOUBLE;
        throw new IllegalArgumentException("not a loadable constant: " + value);
    }

    /**
     * Simulate the effect of a supported instruction on a frame.
     *
     * @param frame The frame.
     * @param insn  The instruction.
     * @param pool  The constant pool, for constant loads.
     */
    public static void simulate(TypeFrame frame, Instruction insn, ConstantPool pool) {
        Fixed fixed = FIXED.get(insn.opcode);
        if (fixed != null) {
            List<StackType> pops = fixed.getPops();
            for (int i = pops.size() - 1; i >= 0; i--) {
                frame.pop(pops.get(i));
            }
            for (StackType push : fixed.getPushes()) {
                frame.push(push);
            }
            return;
        }
        LocalAccess access = getLocalAccess(insn);
        if (access != null) {
            if (access.isStore()) {
                frame.pop(access.getType());
                frame.setLocal(access.getIndex(), access.getType());
            } else {
                frame.checkLocal(access.getIndex(), access.getType());
                frame.push(access.getType());
            }
        } else if (insn instanceof Instruction.Iinc) {
            frame.checkLocal(((Instruction.Iinc) insn).index, INT);
        } else if (insn instanceof Instruction.Constant) {
            frame.push(constantType(resolveConstant(pool, (Instruction.Constant) insn)));
        } else if (StackShuffles.isShuffle(insn.opcode)) {
            frame.shuffle(insn.opcode);
        } else {
            throw new JitException.UnsupportedInstruction(insn);
        }
    }

    /**
     * A fixed list of popped and pushed types, bottom of the stack first.
     */
    private static final class Fixed {
        private final List<StackType> pops;
        private final List<StackType> pushes;

        Fixed(StackType[] pops, StackType[] pushes) {
            this.pops = Collections.unmodifiableList(Arrays.asList(pops));
            this.pushes = Collections.unmodifiableList(Arrays.asList(pushes));
        }

        List<StackType> getPops() {
            return pops;
        }

        List<StackType> getPushes() {
            return pushes;
        }
    }

    /**
     * A load or store of a local variable.
     */
    public static final class LocalAccess {
        private final StackType type;
        private final int index;
        private final boolean store;

        LocalAccess(StackType type, int index, boolean store) {
            this.type = type;
            this.index = index;
            this.store = store;
        }

        public StackType getType() {
            return type;
        }

        public int getIndex() {
            return index;
        }

        public boolean isStore() {
            return store;
        }
    }
}
