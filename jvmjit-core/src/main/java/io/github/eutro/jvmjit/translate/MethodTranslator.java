package io.github.eutro.jvmjit.translate;

import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.Signature;
import io.github.eutro.jvmjit.cfg.BytecodeBlock;
import io.github.eutro.jvmjit.cfg.ControlFlowGraph;
import io.github.eutro.jvmjit.cfg.FrameShape;
import io.github.eutro.jvmjit.cfg.StackType;
import io.github.eutro.jvmjit.classfile.ConstantPool;
import io.github.eutro.jvmjit.classfile.code.Instruction;
import io.github.eutro.jvmjit.ops.CommonOps;
import io.github.eutro.jvmjit.ssa.*;

import java.util.*;

/**
 * Translates the blocks of a method into a {@link FunctionBody}.
 * <p>
 * Every bytecode block becomes an IR block whose parameters are the entries of its entry stack, bottom first,
 * followed by its usable local variables, in ascending slot order. Jumps pass arguments in the same order.
 * <p>
 * The first IR block reads the method's arguments and jumps to the block at index 0, so that
 * it may be the target of back edges like any other block.
 */
public final class MethodTranslator {
    private final Signature signature;
    private final ControlFlowGraph cfg;
    private final ConstantPool pool;
    private final int maxLocals;
    private final FunctionBody func;
    private final Map<Integer, BasicBlock> blocks = new HashMap<>();

    private MethodTranslator(String name, Signature signature, ControlFlowGraph cfg, ConstantPool pool, int maxLocals) {
        this.signature = signature;
        this.cfg = cfg;
        this.pool = pool;
        this.maxLocals = maxLocals;
        this.func = new FunctionBody(name, signature.getParameterKinds(), signature.getReturnKind());
    }

    /**
     * Translate a method.
     *
     * @param name      The name of the method, for diagnostics.
     * @param signature The method's signature.
     * @param cfg       The method's control flow graph.
     * @param pool      The constant pool of the method's class.
     * @param maxLocals The number of local variable slots of the method.
     * @return The function.
     */
    public static FunctionBody translate(String name,
                                         Signature signature,
                                         ControlFlowGraph cfg,
                                         ConstantPool pool,
                                         int maxLocals) {
        return new MethodTranslator(name, signature, cfg, pool, maxLocals).translate();
    }

    private FunctionBody translate() {
        BasicBlock entry = func.newBb();
        for (BytecodeBlock block : cfg.getBlocks()) {
            BasicBlock bb = func.newBb();
            FrameShape shape = block.getEntryShape();
            for (StackType type : shape.getStack()) {
                bb.addParam(func.newVar("stack", type.kind));
            }
            for (StackType type : shape.getLocals()) {
                if (type != null) {
                    bb.addParam(func.newVar("local", type.kind));
                }
            }
            blocks.put(block.getStart(), bb);
        }

        IRBuilder ib = new IRBuilder(func, entry);
        LocalVariables locals = new LocalVariables(maxLocals);
        List<StackType> paramTypes = signature.getParameterTypes();
        int slot = 0;
        for (int i = 0; i < paramTypes.size(); i++) {
            StackType type = paramTypes.get(i);
            locals.set(slot, ib.insert(CommonOps.ARG.create(i).insn(), "arg", type.kind), type);
            slot += type.category;
        }
        ib.insertCtrl(CommonOps.BR.create().insn().jumpsTo(jumpTo(0, new OperandStack(), locals)));

        for (BytecodeBlock block : cfg.getBlocks()) {
            translateBlock(block);
        }
        return func;
    }

    private void translateBlock(BytecodeBlock block) {
        BasicBlock bb = blocks.get(block.getStart());
        FrameShape shape = block.getEntryShape();
        OperandStack stack = new OperandStack();
        LocalVariables locals = new LocalVariables(maxLocals);
        Iterator<Var> params = bb.getParams().iterator();
        for (StackType type : shape.getStack()) {
            stack.push(params.next(), type);
        }
        List<StackType> localTypes = shape.getLocals();
        for (int i = 0; i < localTypes.size(); i++) {
            StackType type = localTypes.get(i);
            if (type != null) {
                locals.set(i, params.next(), type);
            }
        }

        InstructionTranslator translator = new InstructionTranslator(
                this,
                new IRBuilder(func, bb),
                stack,
                locals);
        int index = block.getStart();
        for (Instruction insn : block.getInstructions()) {
            translator.translate(insn, index++);
        }
        Instruction last = block.getInstructions().get(block.getInstructions().size() - 1);
        if (!last.changesControlFlow()) {
            translator.getBuilder().insertCtrl(CommonOps.BR.create().insn()
                    .jumpsTo(jumpTo(block.getEnd(), stack, locals)));
        }
    }

    /**
     * Create a call to the block starting at an instruction index, passing the current stack and locals.
     *
     * @param start  The start of the target block.
     * @param stack  The operand stack.
     * @param locals The local variables.
     * @return The block call.
     */
    BlockCall jumpTo(int start, OperandStack stack, LocalVariables locals) {
        BytecodeBlock target = cfg.getBlock(start);
        FrameShape shape = target.getEntryShape();
        if (!stack.types().equals(shape.getStack())) {
            throw new JitException.Internal(String.format("stack %s does not match %s expected at %d",
                    stack.types(), shape.getStack(), start));
        }
        List<Var> args = stack.values();
        List<StackType> localTypes = shape.getLocals();
        for (int i = 0; i < localTypes.size(); i++) {
            StackType type = localTypes.get(i);
            if (type != null) {
                args.add(locals.get(i, type));
            }
        }
        return new BlockCall(blocks.get(start), args);
    }

    Signature getSignature() {
        return signature;
    }

    ConstantPool getPool() {
        return pool;
    }
}
