package io.github.eutro.jvmjit.translate;

import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.Kind;
import io.github.eutro.jvmjit.cfg.StackEffects;
import io.github.eutro.jvmjit.cfg.StackType;
import io.github.eutro.jvmjit.classfile.FieldType;
import io.github.eutro.jvmjit.classfile.code.ArrayType;
import io.github.eutro.jvmjit.classfile.code.Instruction;
import io.github.eutro.jvmjit.classfile.code.Opcode;
import io.github.eutro.jvmjit.ops.ArithOps;
import io.github.eutro.jvmjit.ops.ArithOps.BinaryOp;
import io.github.eutro.jvmjit.ops.ArithOps.Conversion;
import io.github.eutro.jvmjit.ops.ArithOps.FloatCC;
import io.github.eutro.jvmjit.ops.ArithOps.IntCC;
import io.github.eutro.jvmjit.ops.CommonOps;
import io.github.eutro.jvmjit.ops.MemOps;
import io.github.eutro.jvmjit.ops.MemOps.MemArg;
import io.github.eutro.jvmjit.ops.MemOps.MemType;
import io.github.eutro.jvmjit.ssa.*;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers single instructions to IR, against the operand stack and local variables of the block being translated.
 * <p>
 * Array references are heap addresses of an 8-byte header followed by the elements. The low 32 bits of the
 * header hold the length; bit 32 marks {@code boolean} arrays, whose stores keep only the lowest bit.
 * Array accesses check for null and out of bounds indices, and trap by jumping to a block that throws.
 */
final class InstructionTranslator {
    /**
     * The offset of the first element of an array from its address.
     */
    static final int ARRAY_HEADER = 8;
    private static final long BOOLEAN_ARRAY_FLAG = 1L << 32;
    private static final long LENGTH_MASK = 0xFFFF_FFFFL;

    interface Converter {
        void convert(InstructionTranslator t, Instruction insn, int index);
    }

    private static final Map<Opcode, Converter> CONVERTERS = new EnumMap<>(Opcode.class);

    private static void put(Converter converter, Opcode... opcodes) {
        for (Opcode opcode : opcodes) {
            CONVERTERS.put(opcode, converter);
        }
    }

    private final MethodTranslator method;
    private final IRBuilder ib;
    private final OperandStack stack;
    private final LocalVariables locals;

    InstructionTranslator(MethodTranslator method, IRBuilder ib, OperandStack stack, LocalVariables locals) {
        this.method = method;
        this.ib = ib;
        this.stack = stack;
        this.locals = locals;
    }

    IRBuilder getBuilder() {
        return ib;
    }

    /**
     * Translate an instruction.
     *
     * @param insn  The instruction.
     * @param index The index of the instruction in the method.
     * @throws JitException.UnsupportedInstruction If the instruction is not supported.
     */
    void translate(Instruction insn, int index) {
        Converter converter = CONVERTERS.get(insn.opcode);
        if (converter == null) {
            throw new JitException.UnsupportedInstruction(insn);
        }
        converter.convert(this, insn, index);
    }

    // helpers

    private Var emit(Insn insn, Kind kind) {
        return ib.insert(insn, "v", kind);
    }

    private void push(Var value, StackType type) {
        stack.push(value, type);
    }

    private Var constant(Object value) {
        return emit(CommonOps.constant(value).insn(), CommonOps.constantKind(value));
    }

    private Var binary(BinaryOp op, Var lhs, Var rhs) {
        return emit(ArithOps.BINARY.create(op).insn(lhs, rhs), lhs.kind);
    }

    private Var convert(Conversion conversion, Var value) {
        return emit(ArithOps.CONVERT.create(conversion).insn(value), conversion.to);
    }

    private Var icmp(IntCC cc, Var lhs, Var rhs) {
        return emit(ArithOps.ICMP.create(cc).insn(lhs, rhs), Kind.I32);
    }

    private Var fcmp(FloatCC cc, Var lhs, Var rhs) {
        return emit(ArithOps.FCMP.create(cc).insn(lhs, rhs), Kind.I32);
    }

    private Var load(MemType type, int offset, Var address) {
        return emit(MemOps.LOAD.create(new MemArg(type, offset)).insn(address), type.kind);
    }

    private void store(MemType type, int offset, Var address, Var value) {
        ib.insert(MemOps.STORE.create(new MemArg(type, offset)).insn(address, value).assignTo());
    }

    private BlockCall jumpTo(int target) {
        return method.jumpTo(target, stack, locals);
    }

    /**
     * End the current IR block with a branch to a new block that traps if the condition is non-zero,
     * continuing in another new block otherwise.
     */
    private void trapIf(Var cond, String exception) {
        BasicBlock trapBb = ib.func.newBb();
        BasicBlock contBb = ib.func.newBb();
        ib.insertCtrl(CommonOps.BR_IF.create().insn(cond).jumpsTo(BlockCall.of(trapBb), BlockCall.of(contBb)));
        trapBb.setControl(CommonOps.TRAP.create(exception).insn().jumpsTo());
        ib.setBlock(contBb);
    }

    private void nullCheck(Var ref) {
        trapIf(icmp(IntCC.EQ, ref, constant(0L)), "NullPointerException");
    }

    /**
     * Check an array access and compute the address of the element, less the header.
     */
    private Var elementAddress(Var ref, Var index, int elementSize) {
        nullCheck(ref);
        Var length = binary(BinaryOp.AND, load(MemType.I64, 0, ref), constant(LENGTH_MASK));
        Var wideIndex = convert(Conversion.SEXTEND_I32_I64, index);
        trapIf(icmp(IntCC.UGE, wideIndex, length), "ArrayIndexOutOfBoundsException");
        return binary(BinaryOp.ADD, ref, binary(BinaryOp.MUL, wideIndex, constant((long) elementSize)));
    }

    // constants

    static {
        put((t, insn, i) -> {
        }, Opcode.NOP);
        put((t, insn, i) -> t.push(t.constant(0L), StackType.REFERENCE), Opcode.ACONST_NULL);
        put((t, insn, i) -> t.push(t.constant(insn.opcode.code - Opcode.ICONST_0.code), StackType.INT),
                Opcode.ICONST_M1, Opcode.ICONST_0, Opcode.ICONST_1, Opcode.ICONST_2,
                Opcode.ICONST_3, Opcode.ICONST_4, Opcode.ICONST_5);
        put((t, insn, i) -> t.push(t.constant((long) (insn.opcode.code - Opcode.LCONST_0.code)), StackType.LONG),
                Opcode.LCONST_0, Opcode.LCONST_1);
        put((t, insn, i) -> t.push(t.constant((float) (insn.opcode.code - Opcode.FCONST_0.code)), StackType.FLOAT),
                Opcode.FCONST_0, Opcode.FCONST_1, Opcode.FCONST_2);
        put((t, insn, i) -> t.push(t.constant((double) (insn.opcode.code - Opcode.DCONST_0.code)), StackType.DOUBLE),
                Opcode.DCONST_0, Opcode.DCONST_1);
        put((t, insn, i) -> t.push(t.constant(((Instruction.Push) insn).value), StackType.INT),
                Opcode.BIPUSH, Opcode.SIPUSH);
        put((t, insn, i) -> {
            Object value = StackEffects.resolveConstant(t.method.getPool(), (Instruction.Constant) insn);
            t.push(t.constant(value), StackEffects.constantType(value));
        }, Opcode.LDC, Opcode.LDC_W, Opcode.LDC2_W);
    }

    // locals and the stack

    static {
        Converter local = (t, insn, i) -> {
            StackEffects.LocalAccess access = StackEffects.getLocalAccess(insn);
            assert access != null;
            if (access.isStore()) {
                t.locals.set(access.getIndex(), t.stack.pop(access.getType()), access.getType());
            } else {
                t.push(t.locals.get(access.getIndex(), access.getType()), access.getType());
            }
        };
        for (int code = Opcode.ILOAD.code; code <= Opcode.ALOAD_3.code; code++) {
            put(local, Opcode.fromCode(code));
        }
        for (int code = Opcode.ISTORE.code; code <= Opcode.ASTORE_3.code; code++) {
            put(local, Opcode.fromCode(code));
        }
        put((t, insn, i) -> {
            Instruction.Iinc iinc = (Instruction.Iinc) insn;
            Var value = t.locals.get(iinc.index, StackType.INT);
            t.locals.set(iinc.index, t.binary(BinaryOp.ADD, value, t.constant(iinc.increment)), StackType.INT);
        }, Opcode.IINC);
        put((t, insn, i) -> t.stack.shuffle(insn.opcode),
                Opcode.POP, Opcode.POP2, Opcode.DUP, Opcode.DUP_X1, Opcode.DUP_X2,
                Opcode.DUP2, Opcode.DUP2_X1, Opcode.DUP2_X2, Opcode.SWAP);
    }

    // arithmetic

    private static void binaryOp(BinaryOp op, StackType type, Opcode opcode) {
        put((t, insn, i) -> {
            Var rhs = t.stack.pop(type);
            Var lhs = t.stack.pop(type);
            t.push(t.binary(op, lhs, rhs), type);
        }, opcode);
    }

    private static void shiftOp(BinaryOp op, StackType type, Opcode opcode) {
        int mask = type == StackType.LONG ? 63 : 31;
        put((t, insn, i) -> {
            Var amount = t.stack.popInt();
            Var value = t.stack.pop(type);
            Var masked = t.binary(BinaryOp.AND, amount, t.constant(mask));
            t.push(t.binary(op, value, masked), type);
        }, opcode);
    }

    private static void negOp(StackType type, Opcode opcode) {
        put((t, insn, i) -> t.push(t.emit(ArithOps.NEG.create().insn(t.stack.pop(type)), type.kind), type), opcode);
    }

    private static void conversion(Conversion conversion, StackType from, StackType to, Opcode opcode) {
        put((t, insn, i) -> t.push(t.convert(conversion, t.stack.pop(from)), to), opcode);
    }

    static {
        binaryOp(BinaryOp.ADD, StackType.INT, Opcode.IADD);
        binaryOp(BinaryOp.ADD, StackType.LONG, Opcode.LADD);
        binaryOp(BinaryOp.ADD, StackType.FLOAT, Opcode.FADD);
        binaryOp(BinaryOp.ADD, StackType.DOUBLE, Opcode.DADD);
        binaryOp(BinaryOp.SUB, StackType.INT, Opcode.ISUB);
        binaryOp(BinaryOp.SUB, StackType.LONG, Opcode.LSUB);
        binaryOp(BinaryOp.SUB, StackType.FLOAT, Opcode.FSUB);
        binaryOp(BinaryOp.SUB, StackType.DOUBLE, Opcode.DSUB);
        binaryOp(BinaryOp.MUL, StackType.INT, Opcode.IMUL);
        binaryOp(BinaryOp.MUL, StackType.LONG, Opcode.LMUL);
        binaryOp(BinaryOp.MUL, StackType.FLOAT, Opcode.FMUL);
        binaryOp(BinaryOp.MUL, StackType.DOUBLE, Opcode.DMUL);
        binaryOp(BinaryOp.DIV, StackType.INT, Opcode.IDIV);
        binaryOp(BinaryOp.DIV, StackType.LONG, Opcode.LDIV);
        binaryOp(BinaryOp.DIV, StackType.FLOAT, Opcode.FDIV);
        binaryOp(BinaryOp.DIV, StackType.DOUBLE, Opcode.DDIV);
        binaryOp(BinaryOp.REM, StackType.INT, Opcode.IREM);
        binaryOp(BinaryOp.REM, StackType.LONG, Opcode.LREM);
        binaryOp(BinaryOp.REM, StackType.FLOAT, Opcode.FREM);
        binaryOp(BinaryOp.REM, StackType.DOUBLE, Opcode.DREM);
        binaryOp(BinaryOp.AND, StackType.INT, Opcode.IAND);
        binaryOp(BinaryOp.AND, StackType.LONG, Opcode.LAND);
        binaryOp(BinaryOp.OR, StackType.INT, Opcode.IOR);
        binaryOp(BinaryOp.OR, StackType.LONG, Opcode.LOR);
        binaryOp(BinaryOp.XOR, StackType.INT, Opcode.IXOR);
        binaryOp(BinaryOp.XOR, StackType.LONG, Opcode.LXOR);

        shiftOp(BinaryOp.SHL, StackType.INT, Opcode.ISHL);
        shiftOp(BinaryOp.SHL, StackType.LONG, Opcode.LSHL);
        shiftOp(BinaryOp.SHR, StackType.INT, Opcode.ISHR);
        shiftOp(BinaryOp.SHR, StackType.LONG, Opcode.LSHR);
        shiftOp(BinaryOp.USHR, StackType.INT, Opcode.IUSHR);
        shiftOp(BinaryOp.USHR, StackType.LONG, Opcode.LUSHR);

        negOp(StackType.INT, Opcode.INEG);
        negOp(StackType.LONG, Opcode.LNEG);
        negOp(StackType.FLOAT, Opcode.FNEG);
        negOp(StackType.DOUBLE, Opcode.DNEG);

        conversion(Conversion.SEXTEND_I32_I64, StackType.INT, StackType.LONG, Opcode.I2L);
        conversion(Conversion.SINT_I32_F32, StackType.INT, StackType.FLOAT, Opcode.I2F);
        conversion(Conversion.SINT_I32_F64, StackType.INT, StackType.DOUBLE, Opcode.I2D);
        conversion(Conversion.IREDUCE_I64_I32, StackType.LONG, StackType.INT, Opcode.L2I);
        conversion(Conversion.SINT_I64_F32, StackType.LONG, StackType.FLOAT, Opcode.L2F);
        conversion(Conversion.SINT_I64_F64, StackType.LONG, StackType.DOUBLE, Opcode.L2D);
        conversion(Conversion.SAT_F32_I32, StackType.FLOAT, StackType.INT, Opcode.F2I);
        conversion(Conversion.SAT_F32_I64, StackType.FLOAT, StackType.LONG, Opcode.F2L);
        conversion(Conversion.PROMOTE_F32_F64, StackType.FLOAT, StackType.DOUBLE, Opcode.F2D);
        conversion(Conversion.SAT_F64_I32, StackType.DOUBLE, StackType.INT, Opcode.D2I);
        conversion(Conversion.SAT_F64_I64, StackType.DOUBLE, StackType.LONG, Opcode.D2L);
        conversion(Conversion.DEMOTE_F64_F32, StackType.DOUBLE, StackType.FLOAT, Opcode.D2F);
        conversion(Conversion.SEXT8, StackType.INT, StackType.INT, Opcode.I2B);
        conversion(Conversion.UEXT16, StackType.INT, StackType.INT, Opcode.I2C);
        conversion(Conversion.SEXT16, StackType.INT, StackType.INT, Opcode.I2S);
    }

    // comparisons

    private static void floatCompare(StackType type, int nanResult, Opcode opcode) {
        put((t, insn, i) -> {
            Var rhs = t.stack.pop(type);
            Var lhs = t.stack.pop(type);
            Var ordered = t.binary(BinaryOp.SUB,
                    t.fcmp(FloatCC.GT, lhs, rhs),
                    t.fcmp(FloatCC.LT, lhs, rhs));
            Var unordered = t.binary(BinaryOp.OR,
                    t.fcmp(FloatCC.NE, lhs, lhs),
                    t.fcmp(FloatCC.NE, rhs, rhs));
            t.push(t.emit(CommonOps.SELECT.create().insn(t.constant(nanResult), ordered, unordered), Kind.I32),
                    StackType.INT);
        }, opcode);
    }

    static {
        put((t, insn, i) -> {
            Var rhs = t.stack.popLong();
            Var lhs = t.stack.popLong();
            t.push(t.binary(BinaryOp.SUB,
                    t.icmp(IntCC.SGT, lhs, rhs),
                    t.icmp(IntCC.SLT, lhs, rhs)), StackType.INT);
        }, Opcode.LCMP);
        floatCompare(StackType.FLOAT, -1, Opcode.FCMPL);
        floatCompare(StackType.FLOAT, 1, Opcode.FCMPG);
        floatCompare(StackType.DOUBLE, -1, Opcode.DCMPL);
        floatCompare(StackType.DOUBLE, 1, Opcode.DCMPG);
    }

    // control flow

    private void branchIf(Var cond, Instruction insn, int index) {
        BlockCall taken = jumpTo(((Instruction.Jump) insn).target);
        BlockCall fallThrough = jumpTo(index + 1);
        ib.insertCtrl(CommonOps.BR_IF.create().insn(cond).jumpsTo(taken, fallThrough));
    }

    private static void ifZero(IntCC cc, Opcode opcode) {
        put((t, insn, i) -> {
            Var value = t.stack.popInt();
            t.branchIf(t.icmp(cc, value, t.constant(0)), insn, i);
        }, opcode);
    }

    private static void ifCompare(IntCC cc, StackType type, Opcode opcode) {
        put((t, insn, i) -> {
            Var rhs = t.stack.pop(type);
            Var lhs = t.stack.pop(type);
            t.branchIf(t.icmp(cc, lhs, rhs), insn, i);
        }, opcode);
    }

    private static void ifNull(IntCC cc, Opcode opcode) {
        put((t, insn, i) -> {
            Var ref = t.stack.popReference();
            t.branchIf(t.icmp(cc, ref, t.constant(0L)), insn, i);
        }, opcode);
    }

    /**
     * Narrow an int to the declared return type, as {@code ireturn} does for
     * {@code boolean}, {@code byte}, {@code char} and {@code short} methods.
     */
    private Var narrowReturn(Var value) {
        FieldType declared = method.getSignature().getDeclaredReturnType();
        FieldType.BaseType base = declared == null ? null : declared.getBaseType();
        if (base == null) return value;
        switch (base) {
            case BOOLEAN:
                return binary(BinaryOp.AND, value, constant(1));
            case BYTE:
                return convert(Conversion.SEXT8, value);
            case CHAR:
                return convert(Conversion.UEXT16, value);
            case SHORT:
                return convert(Conversion.SEXT16, value);
            default:
                return value;
        }
    }

    private static void returnOp(StackType type, Opcode opcode) {
        put((t, insn, i) -> {
            StackType expected = t.method.getSignature().getReturnType();
            if (expected != type) {
                throw new JitException.Internal(String.format("%s in a method returning %s",
                        insn.opcode.mnemonic(),
                        expected == null ? "void" : expected));
            }
            Insn ret;
            if (type == null) {
                ret = CommonOps.RETURN.create().insn();
            } else if (type == StackType.INT) {
                ret = CommonOps.RETURN.create().insn(t.narrowReturn(t.stack.popInt()));
            } else {
                ret = CommonOps.RETURN.create().insn(t.stack.pop(type));
            }
            t.ib.insertCtrl(ret.jumpsTo());
        }, opcode);
    }

    static {
        ifZero(IntCC.EQ, Opcode.IFEQ);
        ifZero(IntCC.NE, Opcode.IFNE);
        ifZero(IntCC.SLT, Opcode.IFLT);
        ifZero(IntCC.SGE, Opcode.IFGE);
        ifZero(IntCC.SGT, Opcode.IFGT);
        ifZero(IntCC.SLE, Opcode.IFLE);
        ifCompare(IntCC.EQ, StackType.INT, Opcode.IF_ICMPEQ);
        ifCompare(IntCC.NE, StackType.INT, Opcode.IF_ICMPNE);
        ifCompare(IntCC.SLT, StackType.INT, Opcode.IF_ICMPLT);
        ifCompare(IntCC.SGE, StackType.INT, Opcode.IF_ICMPGE);
        ifCompare(IntCC.SGT, StackType.INT, Opcode.IF_ICMPGT);
        ifCompare(IntCC.SLE, StackType.INT, Opcode.IF_ICMPLE);
        ifCompare(IntCC.EQ, StackType.REFERENCE, Opcode.IF_ACMPEQ);
        ifCompare(IntCC.NE, StackType.REFERENCE, Opcode.IF_ACMPNE);
        ifNull(IntCC.EQ, Opcode.IFNULL);
        ifNull(IntCC.NE, Opcode.IFNONNULL);

        put((t, insn, i) -> t.ib.insertCtrl(CommonOps.BR.create().insn()
                        .jumpsTo(t.jumpTo(((Instruction.Jump) insn).target))),
                Opcode.GOTO, Opcode.GOTO_W);
        put((t, insn, i) -> {
            Instruction.Switch sw = (Instruction.Switch) insn;
            Var key = t.stack.popInt();
            List<BlockCall> targets = new ArrayList<>();
            for (int target : sw.getTargets()) {
                targets.add(t.jumpTo(target));
            }
            targets.add(t.jumpTo(sw.defaultTarget));
            t.ib.insertCtrl(CommonOps.SWITCH.create(sw.getKeys()).insn(key).jumpsTo(targets));
        }, Opcode.TABLESWITCH, Opcode.LOOKUPSWITCH);

        returnOp(StackType.INT, Opcode.IRETURN);
        returnOp(StackType.LONG, Opcode.LRETURN);
        returnOp(StackType.FLOAT, Opcode.FRETURN);
        returnOp(StackType.DOUBLE, Opcode.DRETURN);
        returnOp(StackType.REFERENCE, Opcode.ARETURN);
        returnOp(null, Opcode.RETURN);
    }

    // arrays

    private static void arrayLoad(MemType memType, StackType type, ArrayType arrayType, Opcode opcode) {
        put((t, insn, i) -> {
            Var index = t.stack.popInt();
            Var ref = t.stack.popReference();
            Var address = t.elementAddress(ref, index, arrayType.elementSize);
            t.push(t.load(memType, ARRAY_HEADER, address), type);
        }, opcode);
    }

    private static void arrayStore(MemType memType, StackType type, ArrayType arrayType, Opcode opcode) {
        put((t, insn, i) -> {
            Var value = t.stack.pop(type);
            Var index = t.stack.popInt();
            Var ref = t.stack.popReference();
            Var address = t.elementAddress(ref, index, arrayType.elementSize);
            t.store(memType, ARRAY_HEADER, address, value);
        }, opcode);
    }

    static {
        arrayLoad(MemType.I32, StackType.INT, ArrayType.INT, Opcode.IALOAD);
        arrayLoad(MemType.I64, StackType.LONG, ArrayType.LONG, Opcode.LALOAD);
        arrayLoad(MemType.F32, StackType.FLOAT, ArrayType.FLOAT, Opcode.FALOAD);
        arrayLoad(MemType.F64, StackType.DOUBLE, ArrayType.DOUBLE, Opcode.DALOAD);
        arrayLoad(MemType.I8, StackType.INT, ArrayType.BYTE, Opcode.BALOAD);
        arrayLoad(MemType.U16, StackType.INT, ArrayType.CHAR, Opcode.CALOAD);
        arrayLoad(MemType.I16, StackType.INT, ArrayType.SHORT, Opcode.SALOAD);
        arrayStore(MemType.I32, StackType.INT, ArrayType.INT, Opcode.IASTORE);
        arrayStore(MemType.I64, StackType.LONG, ArrayType.LONG, Opcode.LASTORE);
        arrayStore(MemType.F32, StackType.FLOAT, ArrayType.FLOAT, Opcode.FASTORE);
        arrayStore(MemType.F64, StackType.DOUBLE, ArrayType.DOUBLE, Opcode.DASTORE);
        put((t, insn, i) -> {
            Var value = t.stack.popInt();
            Var index = t.stack.popInt();
            Var ref = t.stack.popReference();
            Var address = t.elementAddress(ref, index, ArrayType.BYTE.elementSize);
            Var isBoolean = t.convert(Conversion.IREDUCE_I64_I32,
                    t.binary(BinaryOp.USHR, t.load(MemType.I64, 0, ref), t.constant(32)));
            Var bit = t.binary(BinaryOp.AND, value, t.constant(1));
            Var stored = t.emit(CommonOps.SELECT.create().insn(bit, value, isBoolean), Kind.I32);
            t.store(MemType.I8, ARRAY_HEADER, address, stored);
        }, Opcode.BASTORE);
        arrayStore(MemType.U16, StackType.INT, ArrayType.CHAR, Opcode.CASTORE);
        arrayStore(MemType.I16, StackType.INT, ArrayType.SHORT, Opcode.SASTORE);

        put((t, insn, i) -> {
            ArrayType type = ((Instruction.NewArray) insn).type;
            Var count = t.stack.popInt();
            t.trapIf(t.icmp(IntCC.SLT, count, t.constant(0)), "NegativeArraySizeException");
            Var length = t.convert(Conversion.SEXTEND_I32_I64, count);
            Var size = t.binary(BinaryOp.ADD,
                    t.constant((long) ARRAY_HEADER),
                    t.binary(BinaryOp.MUL, length, t.constant((long) type.elementSize)));
            Var ref = t.emit(MemOps.ALLOC.create().insn(size), Kind.I64);
            t.store(MemType.I64, 0, ref, type == ArrayType.BOOLEAN
                    ? t.binary(BinaryOp.OR, length, t.constant(BOOLEAN_ARRAY_FLAG))
                    : length);
            t.push(ref, StackType.REFERENCE);
        }, Opcode.NEWARRAY);
        put((t, insn, i) -> {
            Var ref = t.stack.popReference();
            t.nullCheck(ref);
            t.push(t.convert(Conversion.IREDUCE_I64_I32, t.load(MemType.I64, 0, ref)), StackType.INT);
        }, Opcode.ARRAYLENGTH);
    }
}
