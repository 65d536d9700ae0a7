package io.github.eutro.jvmjit.classfile;

import io.github.eutro.jvmjit.classfile.code.ArrayType;
import io.github.eutro.jvmjit.classfile.code.Code;
import io.github.eutro.jvmjit.classfile.code.ExceptionTableEntry;
import io.github.eutro.jvmjit.classfile.code.Instruction;
import io.github.eutro.jvmjit.classfile.code.Opcode;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.*;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reading {@link ClassFile}s from class file bytes.
 * <p>
 * Debug information and stack map frames are dropped. Branch targets are
 * converted to instruction indices.
 */
public final class ClassFiles {
    private ClassFiles() {
    }

    /**
     * Read a class file.
     *
     * @param bytes The bytes of the class file.
     * @return The class file model.
     * @throws ClassFileException If the bytes are not a valid class file.
     */
    public static ClassFile read(byte[] bytes) {
        ClassNode node = new ClassNode();
        try {
            new ClassReader(bytes).accept(node, ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
        } catch (RuntimeException e) {
            throw new ClassFileException("failed to read class file", e);
        }
        return fromNode(node);
    }

    /**
     * Read a class file from a stream, which is not closed.
     *
     * @param in The stream.
     * @return The class file model.
     * @throws IOException        If reading from the stream fails.
     * @throws ClassFileException If the bytes are not a valid class file.
     */
    public static ClassFile read(InputStream in) throws IOException {
        return read(in.readAllBytes());
    }

    /**
     * Convert an ASM class node to a class file model.
     *
     * @param node The class node.
     * @return The class file model.
     */
    public static ClassFile fromNode(ClassNode node) {
        ConstantPool pool = new ConstantPool();
        int thisClass = pool.addClass(node.name);
        int superClass = node.superName == null ? 0 : pool.addClass(node.superName);
        List<Method> methods = new ArrayList<>();
        for (MethodNode mn : node.methods) {
            methods.add(new Method(
                    MethodAccessFlag.fromMask(mn.access),
                    pool.addUtf8(mn.name),
                    pool.addUtf8(mn.desc),
                    mn.instructions.size() == 0 ? null : readCode(pool, mn)
            ));
        }
        return new ClassFile(
                node.version >>> 16,
                node.version & 0xFFFF,
                node.access,
                pool,
                thisClass,
                superClass,
                methods
        );
    }

    private static Code readCode(ConstantPool pool, MethodNode mn) {
        Map<LabelNode, Integer> labels = new HashMap<>();
        int count = 0;
        for (AbstractInsnNode insn : mn.instructions) {
            if (insn instanceof LabelNode) {
                labels.put((LabelNode) insn, count);
            } else if (insn.getOpcode() >= 0) {
                count++;
            }
        }

        List<Instruction> instructions = new ArrayList<>(count);
        for (AbstractInsnNode insn : mn.instructions) {
            if (insn.getOpcode() < 0) continue;
            instructions.add(convert(pool, labels, insn));
        }

        List<ExceptionTableEntry> exceptionTable = new ArrayList<>();
        for (TryCatchBlockNode tcb : mn.tryCatchBlocks) {
            exceptionTable.add(new ExceptionTableEntry(
                    labels.get(tcb.start),
                    labels.get(tcb.end),
                    labels.get(tcb.handler),
                    tcb.type == null ? 0 : pool.addClass(tcb.type)
            ));
        }
        return new Code(mn.maxStack, mn.maxLocals, instructions, exceptionTable);
    }

    private static Instruction convert(ConstantPool pool, Map<LabelNode, Integer> labels, AbstractInsnNode insn) {
        Opcode opcode = Opcode.fromCode(insn.getOpcode());
        if (opcode == null) {
            throw new ClassFileException("unknown opcode: " + insn.getOpcode());
        }
        switch (insn.getType()) {
            case AbstractInsnNode.INSN:
                return Instruction.of(opcode);
            case AbstractInsnNode.INT_INSN: {
                int operand = ((IntInsnNode) insn).operand;
                if (opcode == Opcode.NEWARRAY) {
                    ArrayType type = ArrayType.fromCode(operand);
                    if (type == null) {
                        throw new ClassFileException("invalid newarray type: " + operand);
                    }
                    return Instruction.newArray(type);
                }
                return Instruction.push(opcode, operand);
            }
            case AbstractInsnNode.VAR_INSN:
                return Instruction.local(opcode, ((VarInsnNode) insn).var);
            case AbstractInsnNode.IINC_INSN: {
                IincInsnNode iinc = (IincInsnNode) insn;
                return Instruction.iinc(iinc.var, iinc.incr);
            }
            case AbstractInsnNode.JUMP_INSN:
                return Instruction.jump(opcode, labels.get(((JumpInsnNode) insn).label));
            case AbstractInsnNode.TABLESWITCH_INSN: {
                TableSwitchInsnNode ts = (TableSwitchInsnNode) insn;
                return Instruction.tableSwitch(labels.get(ts.dflt), ts.min, ts.max, targets(labels, ts.labels));
            }
            case AbstractInsnNode.LOOKUPSWITCH_INSN: {
                LookupSwitchInsnNode ls = (LookupSwitchInsnNode) insn;
                int[] keys = new int[ls.keys.size()];
                for (int i = 0; i < keys.length; i++) {
                    keys[i] = ls.keys.get(i);
                }
                return Instruction.lookupSwitch(labels.get(ls.dflt), keys, targets(labels, ls.labels));
            }
            case AbstractInsnNode.LDC_INSN:
                return convertLdc(pool, ((LdcInsnNode) insn).cst);
            case AbstractInsnNode.TYPE_INSN:
                return Instruction.reference(opcode, pool.addClass(((TypeInsnNode) insn).desc), 0);
            case AbstractInsnNode.FIELD_INSN: {
                FieldInsnNode fin = (FieldInsnNode) insn;
                return Instruction.reference(opcode, pool.add(new Constant.MemberRef(
                        Constant.MemberRef.Tag.FIELD, fin.owner, fin.name, fin.desc)), 0);
            }
            case AbstractInsnNode.METHOD_INSN: {
                MethodInsnNode min = (MethodInsnNode) insn;
                int index = pool.add(new Constant.MemberRef(
                        min.itf ? Constant.MemberRef.Tag.INTERFACE_METHOD : Constant.MemberRef.Tag.METHOD,
                        min.owner, min.name, min.desc));
                int argCount = opcode == Opcode.INVOKEINTERFACE
                        ? (Type.getArgumentsAndReturnSizes(min.desc) >> 2)
                        : 0;
                return Instruction.reference(opcode, index, argCount);
            }
            case AbstractInsnNode.INVOKE_DYNAMIC_INSN: {
                InvokeDynamicInsnNode indy = (InvokeDynamicInsnNode) insn;
                return Instruction.reference(opcode, pool.add(new Constant.MemberRef(
                        Constant.MemberRef.Tag.INVOKE_DYNAMIC, "", indy.name, indy.desc)), 0);
            }
            case AbstractInsnNode.MULTIANEWARRAY_INSN: {
                MultiANewArrayInsnNode mana = (MultiANewArrayInsnNode) insn;
                return Instruction.reference(opcode, pool.addClass(mana.desc), mana.dims);
            }
            default:
                throw new ClassFileException("unexpected instruction node type: " + insn.getType());
        }
    }

    private static int[] targets(Map<LabelNode, Integer> labels, List<LabelNode> nodes) {
        int[] targets = new int[nodes.size()];
        for (int i = 0; i < targets.length; i++) {
            targets[i] = labels.get(nodes.get(i));
        }
        return targets;
    }

    private static Instruction convertLdc(ConstantPool pool, Object cst) {
        int index;
        boolean wide = false;
        if (cst instanceof Integer) {
            index = pool.add(new Constant.Integer((Integer) cst));
        } else if (cst instanceof Float) {
            index = pool.add(new Constant.Float((Float) cst));
        } else if (cst instanceof Long) {
            index = pool.add(new Constant.Long((Long) cst));
            wide = true;
        } else if (cst instanceof Double) {
            index = pool.add(new Constant.Double((Double) cst));
            wide = true;
        } else if (cst instanceof String) {
            index = pool.addString((String) cst);
        } else if (cst instanceof Type && ((Type) cst).getSort() != Type.METHOD) {
            index = pool.addClass(((Type) cst).getInternalName());
        } else if (cst instanceof Type) {
            index = pool.add(new Constant.Opaque("MethodType", ((Type) cst).getDescriptor()));
        } else if (cst instanceof Handle) {
            index = pool.add(new Constant.Opaque("MethodHandle", cst.toString()));
        } else {
            index = pool.add(new Constant.Opaque("Dynamic", String.valueOf(cst)));
        }
        Opcode opcode = wide ? Opcode.LDC2_W : index > 0xFF ? Opcode.LDC_W : Opcode.LDC;
        return Instruction.constant(opcode, index);
    }
}
