package io.github.eutro.jvmjit.backend;

import io.github.eutro.jvmjit.Kind;
import io.github.eutro.jvmjit.ops.ArithOps;
import io.github.eutro.jvmjit.ops.CommonOps;
import io.github.eutro.jvmjit.ops.MemOps;
import io.github.eutro.jvmjit.ops.OpKey;
import io.github.eutro.jvmjit.passes.IRPass;
import io.github.eutro.jvmjit.runtime.Heap;
import io.github.eutro.jvmjit.runtime.TrapException;
import io.github.eutro.jvmjit.ssa.*;
import io.github.eutro.jvmjit.util.GraphWalker;
import org.objectweb.asm.Label;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;
import org.objectweb.asm.commons.Method;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

import java.util.*;

/**
 * Lowers a {@link FunctionBody} to a class with a single static method, {@value #METHOD_NAME}.
 * <p>
 * The method takes the {@link Heap} as its first argument, followed by the function's parameters.
 * Every IR variable gets its own local variable slot, and arguments to blocks are moved into the
 * target's parameters on each edge. Frames are left for the class writer to compute.
 */
public class IrToJava implements IRPass<FunctionBody, ClassNode> {
    /**
     * The name of the generated method.
     */
    public static final String METHOD_NAME = "invoke";

    private static final Type HEAP_TYPE = Type.getType(Heap.class);
    private static final Type TRAP_TYPE = Type.getType(TrapException.class);
    private static final Method ALLOCATE = new Method("allocate", Type.LONG_TYPE, new Type[]{Type.LONG_TYPE});

    private final String className;
    private final int classVersion;

    /**
     * Create a pass that generates classes with a given name and version.
     *
     * @param className    The internal name of the class.
     * @param classVersion The class file major version.
     */
    public IrToJava(String className, int classVersion) {
        this.className = className;
        this.classVersion = classVersion;
    }

    /**
     * Get the descriptor of the generated method for a function.
     *
     * @param func The function.
     * @return The descriptor.
     */
    public static String getMethodDescriptor(FunctionBody func) {
        List<Kind> paramKinds = func.getParamKinds();
        Type[] args = new Type[paramKinds.size() + 1];
        args[0] = HEAP_TYPE;
        for (int i = 0; i < paramKinds.size(); i++) {
            args[i + 1] = paramKinds.get(i).getAsmType();
        }
        Kind returnKind = func.getReturnKind();
        return Type.getMethodDescriptor(returnKind == null ? Type.VOID_TYPE : returnKind.getAsmType(), args);
    }

    @Override
    public ClassNode run(FunctionBody func) {
        ClassNode cn = new ClassNode();
        cn.visit(
                classVersion,
                Opcodes.ACC_SUPER | Opcodes.ACC_PUBLIC | Opcodes.ACC_FINAL,
                className,
                null,
                Type.getInternalName(Object.class),
                null
        );
        MethodNode mn = new MethodNode(
                Opcodes.ACC_PUBLIC | Opcodes.ACC_STATIC,
                METHOD_NAME,
                getMethodDescriptor(func),
                null,
                null
        );
        new FunctionLowering(func, new JavaBuilder(mn)).lower();
        cn.methods.add(mn);
        return cn;
    }

    private static class JavaBuilder extends GeneratorAdapter {
        protected JavaBuilder(MethodNode node) {
            super(Opcodes.ASM9, node, node.access, node.name, node.desc);
        }
    }

    private static final class FunctionLowering {
        final FunctionBody func;
        final JavaBuilder jb;
        final Map<Var, Integer> locals = new HashMap<>();
        final Map<BasicBlock, Label> labels = new HashMap<>();
        final List<Map.Entry<Label, BlockCall>> trampolines = new ArrayList<>();
        BasicBlock nextBlock;

        FunctionLowering(FunctionBody func, JavaBuilder jb) {
            this.func = func;
            this.jb = jb;
        }

        void lower() {
            // 1. order the blocks so that fall-throughs come right after their jumps where possible
            List<BasicBlock> blockOrder = GraphWalker.blockWalker(func).reversePostOrder();

            // 2. allocate labels and locals
            for (BasicBlock block : blockOrder) {
                labels.put(block, jb.newLabel());
                for (Var param : block.getParams()) {
                    allocate(param);
                }
                for (Effect effect : block.getEffects()) {
                    for (Var var : effect.getAssignsTo()) {
                        allocate(var);
                    }
                }
            }

            // 3. emit each block
            jb.visitCode();
            Iterator<BasicBlock> it = blockOrder.iterator();
            BasicBlock block = it.next();
            while (block != null) {
                nextBlock = it.hasNext() ? it.next() : null;
                jb.mark(labels.get(block));
                for (Effect effect : block.getEffects()) {
                    Converter<Effect> converter = FX_CONVERTERS.get(effect.insn().op.key);
                    if (converter == null) {
                        throw missingConverter(effect.insn());
                    }
                    if (!SELF_LOADING.contains(effect.insn().op.key)) {
                        emitLoads(effect.insn());
                    }
                    converter.convert(this, effect);
                    emitStores(effect);
                }
                Control ctrl = block.getControl();
                if (ctrl == null) {
                    throw new IllegalStateException("block " + block.toTargetString() + " has no control instruction");
                }
                Converter<Control> converter = CTRL_CONVERTERS.get(ctrl.insn().op.key);
                if (converter == null) {
                    throw missingConverter(ctrl.insn());
                }
                emitLoads(ctrl.insn());
                converter.convert(this, ctrl);
                emitTrampolines();
                block = nextBlock;
            }
            jb.endMethod();
        }

        void allocate(Var var) {
            if (!locals.containsKey(var)) {
                locals.put(var, jb.newLocal(var.kind.getAsmType()));
            }
        }

        void load(Var var) {
            jb.loadLocal(local(var), var.kind.getAsmType());
        }

        int local(Var var) {
            Integer local = locals.get(var);
            if (local == null) {
                throw new IllegalStateException("variable " + var + " is never assigned");
            }
            return local;
        }

        void emitLoads(Insn insn) {
            for (Var arg : insn.args) {
                load(arg);
            }
        }

        void emitStores(Effect fx) {
            ListIterator<Var> it = fx.getAssignsTo().listIterator(fx.getAssignsTo().size());
            while (it.hasPrevious()) {
                Var var = it.previous();
                jb.storeLocal(local(var), var.kind.getAsmType());
            }
        }

        /**
         * Get a label to jump to for a block call, which moves the arguments if there are any.
         */
        Label labelFor(BlockCall call) {
            if (call.args.isEmpty()) {
                return labels.get(call.target);
            }
            Label trampoline = jb.newLabel();
            trampolines.add(new AbstractMap.SimpleImmutableEntry<>(trampoline, call));
            return trampoline;
        }

        /**
         * Move the arguments of a block call into its target's parameters, and jump there
         * unless it is the next block.
         */
        void emitJump(BlockCall call, boolean canFallThrough) {
            List<Var> params = call.target.getParams();
            if (params.size() != call.args.size()) {
                throw new IllegalStateException(String.format("%s passes %d arguments to a block with %d parameters",
                        call, call.args.size(), params.size()));
            }
            for (Var arg : call.args) {
                load(arg);
            }
            ListIterator<Var> it = params.listIterator(params.size());
            while (it.hasPrevious()) {
                Var param = it.previous();
                jb.storeLocal(local(param), param.kind.getAsmType());
            }
            if (!canFallThrough || call.target != nextBlock) {
                jb.goTo(labels.get(call.target));
            }
        }

        void emitTrampolines() {
            for (Map.Entry<Label, BlockCall> trampoline : trampolines) {
                jb.mark(trampoline.getKey());
                emitJump(trampoline.getValue(), false);
            }
            trampolines.clear();
        }

        void heapAccess(String name, Type returnType, Type... args) {
            jb.invokeInterface(HEAP_TYPE, new Method(name, returnType, args));
        }

        void loadAddress(Var address, int offset) {
            jb.loadArg(0);
            load(address);
            if (offset != 0) {
                jb.push((long) offset);
                jb.math(GeneratorAdapter.ADD, Type.LONG_TYPE);
            }
        }

        void boolSelect(Label trueLabel) {
            Label endLabel = jb.newLabel();
            jb.push(false);
            jb.goTo(endLabel);
            jb.mark(trueLabel);
            jb.push(true);
            jb.mark(endLabel);
        }
    }

    private static RuntimeException missingConverter(Insn insn) {
        return new IllegalStateException("converter missing for key: " + insn.op.key);
    }

    private interface Converter<T> {
        void convert(FunctionLowering fl, T t);
    }

    private static final Map<OpKey, Converter<Effect>> FX_CONVERTERS = new HashMap<>();
    private static final Map<OpKey, Converter<Control>> CTRL_CONVERTERS = new HashMap<>();
    private static final Set<OpKey> SELF_LOADING = new HashSet<>();

    static {
        FX_CONVERTERS.put(CommonOps.ARG, (fl, fx) ->
                fl.jb.loadArg(CommonOps.ARG.cast(fx.insn().op).arg + 1));
        FX_CONVERTERS.put(CommonOps.CONST, (fl, fx) -> {
            Object cst = CommonOps.CONST.cast(fx.insn().op).arg;
            if (cst instanceof Integer) fl.jb.push((int) cst);
            else if (cst instanceof Long) fl.jb.push((long) cst);
            else if (cst instanceof Float) fl.jb.push((float) cst);
            else if (cst instanceof Double) fl.jb.push((double) cst);
            else throw new IllegalStateException("not a primitive constant: " + cst);
        });
        FX_CONVERTERS.put(CommonOps.SELECT, (fl, fx) -> {
            // stack: ifTrue, ifFalse, cond
            Type ty = fx.insn().args.get(0).kind.getAsmType();
            Label trueLabel = fl.jb.newLabel();
            fl.jb.ifZCmp(GeneratorAdapter.NE, trueLabel);
            fl.jb.swap(ty, ty);
            fl.jb.mark(trueLabel);
            if (ty.getSize() == 2) fl.jb.pop2();
            else fl.jb.pop();
        });
    }

    static {
        FX_CONVERTERS.put(ArithOps.BINARY, (fl, fx) -> fl.jb.math(
                ArithOps.BINARY.cast(fx.insn().op).arg.mathOp,
                fx.insn().args.get(0).kind.getAsmType()));
        FX_CONVERTERS.put(ArithOps.NEG, (fl, fx) -> fl.jb.math(
                GeneratorAdapter.NEG,
                fx.insn().args.get(0).kind.getAsmType()));
        FX_CONVERTERS.put(ArithOps.CONVERT, (fl, fx) -> {
            ArithOps.Conversion conversion = ArithOps.CONVERT.cast(fx.insn().op).arg;
            fl.jb.cast(conversion.castFrom, conversion.castTo);
        });
        FX_CONVERTERS.put(ArithOps.ICMP, (fl, fx) -> {
            ArithOps.IntCC cc = ArithOps.ICMP.cast(fx.insn().op).arg;
            Kind kind = fx.insn().args.get(0).kind;
            Label trueLabel = fl.jb.newLabel();
            if (cc.unsigned) {
                Type boxed = kind == Kind.I64 ? Type.getType(Long.class) : Type.getType(Integer.class);
                fl.jb.invokeStatic(boxed, new Method("compareUnsigned", Type.INT_TYPE,
                        new Type[]{kind.getAsmType(), kind.getAsmType()}));
                fl.jb.ifZCmp(cc.mode, trueLabel);
            } else {
                fl.jb.ifCmp(kind.getAsmType(), cc.mode, trueLabel);
            }
            fl.boolSelect(trueLabel);
        });
        FX_CONVERTERS.put(ArithOps.FCMP, (fl, fx) -> {
            ArithOps.FloatCC cc = ArithOps.FCMP.cast(fx.insn().op).arg;
            Label trueLabel = fl.jb.newLabel();
            fl.jb.ifCmp(fx.insn().args.get(0).kind.getAsmType(), cc.mode, trueLabel);
            fl.boolSelect(trueLabel);
        });
    }

    static {
        SELF_LOADING.add(MemOps.LOAD);
        SELF_LOADING.add(MemOps.STORE);
        SELF_LOADING.add(MemOps.ALLOC);
        FX_CONVERTERS.put(MemOps.LOAD, (fl, fx) -> {
            MemOps.MemArg memArg = MemOps.LOAD.cast(fx.insn().op).arg;
            fl.loadAddress(fx.insn().args.get(0), memArg.offset);
            fl.heapAccess("get" + memArg.type.accessor, memArg.type.type, Type.LONG_TYPE);
        });
        FX_CONVERTERS.put(MemOps.STORE, (fl, fx) -> {
            MemOps.MemArg memArg = MemOps.STORE.cast(fx.insn().op).arg;
            Var value = fx.insn().args.get(1);
            fl.loadAddress(fx.insn().args.get(0), memArg.offset);
            fl.load(value);
            fl.jb.cast(value.kind.getAsmType(), memArg.type.type);
            fl.heapAccess("put" + memArg.type.accessor, Type.VOID_TYPE, Type.LONG_TYPE, memArg.type.type);
        });
        FX_CONVERTERS.put(MemOps.ALLOC, (fl, fx) -> {
            fl.jb.loadArg(0);
            fl.load(fx.insn().args.get(0));
            fl.jb.invokeInterface(HEAP_TYPE, ALLOCATE);
        });
    }

    static {
        CTRL_CONVERTERS.put(CommonOps.BR, (fl, ct) ->
                fl.emitJump(ct.targets.get(0), true));
        CTRL_CONVERTERS.put(CommonOps.BR_IF, (fl, ct) -> {
            fl.jb.ifZCmp(GeneratorAdapter.NE, fl.labelFor(ct.targets.get(0)));
            // a trampoline, if any, follows directly
            fl.emitJump(ct.targets.get(1), fl.trampolines.isEmpty());
        });
        CTRL_CONVERTERS.put(CommonOps.SWITCH, (fl, ct) -> {
            int[] keys = CommonOps.SWITCH.cast(ct.insn().op).arg;
            Integer[] order = new Integer[keys.length];
            for (int i = 0; i < order.length; i++) {
                order[i] = i;
            }
            Arrays.sort(order, Comparator.comparingInt(i -> keys[i]));
            int[] sortedKeys = new int[keys.length];
            Label[] labels = new Label[keys.length];
            for (int i = 0; i < order.length; i++) {
                sortedKeys[i] = keys[order[i]];
                labels[i] = fl.labelFor(ct.targets.get(order[i]));
            }
            Label dflt = fl.labelFor(ct.targets.get(ct.targets.size() - 1));
            fl.jb.visitLookupSwitchInsn(dflt, sortedKeys, labels);
        });
        CTRL_CONVERTERS.put(CommonOps.RETURN, (fl, ct) ->
                fl.jb.returnValue());
        CTRL_CONVERTERS.put(CommonOps.TRAP, (fl, ct) ->
                fl.jb.throwException(TRAP_TYPE, CommonOps.TRAP.cast(ct.insn().op).arg));
    }
}
