package io.github.eutro.jvmjit;

import io.github.eutro.jvmjit.backend.ClassDefiner;
import io.github.eutro.jvmjit.backend.IrToJava;
import io.github.eutro.jvmjit.cfg.ControlFlowBuilder;
import io.github.eutro.jvmjit.cfg.ControlFlowGraph;
import io.github.eutro.jvmjit.cfg.StackEffects;
import io.github.eutro.jvmjit.classfile.ClassFile;
import io.github.eutro.jvmjit.classfile.ClassFileException;
import io.github.eutro.jvmjit.classfile.ConstantPool;
import io.github.eutro.jvmjit.classfile.Method;
import io.github.eutro.jvmjit.classfile.code.Code;
import io.github.eutro.jvmjit.classfile.code.Instruction;
import io.github.eutro.jvmjit.passes.IRPass;
import io.github.eutro.jvmjit.passes.meta.CheckJava;
import io.github.eutro.jvmjit.passes.meta.VerifyIntegrity;
import io.github.eutro.jvmjit.runtime.ByteBufferHeap;
import io.github.eutro.jvmjit.runtime.Heap;
import io.github.eutro.jvmjit.ssa.FunctionBody;
import io.github.eutro.jvmjit.translate.MethodTranslator;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.tree.ClassNode;

import java.io.File;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles static methods of class files to {@link Function}s.
 * <p>
 * A method is split into blocks, translated to IR and lowered to a hidden class on the host JVM.
 * Arrays allocated by compiled code live on the compiler's {@link Heap}, which all of its functions share.
 * <p>
 * Compilation does not touch any state shared between calls, so a compiler may be used from many threads at once.
 */
public final class Compiler {
    private static final Logger LOGGER = Logger.getLogger(Compiler.class.getName());

    /**
     * Whether compilers check the IR they generate by default.
     */
    public static boolean VERIFY = !"false".equalsIgnoreCase(System.getenv("JVMJIT_VERIFY"));
    /**
     * Whether compilers check generated classes with ASM by default.
     */
    public static boolean CHECK_CLASSES = System.getenv("JVMJIT_CHECK_CLASSES") != null;
    /**
     * The directory compilers write generated classes to by default, if any.
     */
    public static @Nullable String DEBUG_OUTPUT = System.getenv("JVMJIT_DEBUG_OUTPUT");
    /**
     * The size in bytes of the heap compilers create if they are not given one.
     */
    public static int HEAP_SIZE = parseHeapSize(System.getenv("JVMJIT_HEAP_SIZE"));

    /**
     * The earliest Java release the compiler can target.
     */
    public static final int MIN_TARGET_RELEASE = 8;

    private final Heap heap;
    private final int targetRelease;
    private final ClassDefiner definer;
    private boolean verify = VERIFY;
    private boolean checkClasses = CHECK_CLASSES;
    private @Nullable File debugOutput = DEBUG_OUTPUT == null ? null : new File(DEBUG_OUTPUT);

    /**
     * Create a compiler with its own heap, targeting the host's Java release.
     */
    public Compiler() {
        this(new ByteBufferHeap(HEAP_SIZE));
    }

    /**
     * Create a compiler targeting the host's Java release.
     *
     * @param heap The heap compiled code allocates on.
     */
    public Compiler(Heap heap) {
        this(heap, hostRelease());
    }

    /**
     * Create a compiler.
     *
     * @param heap          The heap compiled code allocates on.
     * @param targetRelease The Java release whose class file version to generate.
     * @throws JitException.UnsupportedTargetIsa If the host cannot run the generated code.
     */
    public Compiler(Heap heap, int targetRelease) {
        if (targetRelease < MIN_TARGET_RELEASE || targetRelease > hostRelease()) {
            throw new JitException.UnsupportedTargetIsa(String.format(
                    "cannot target Java %d on a Java %d host", targetRelease, hostRelease()));
        }
        ClassDefiner definer = ClassDefiner.tryGet();
        if (definer == null) {
            throw new JitException.UnsupportedTargetIsa("the host does not support hidden classes");
        }
        this.heap = heap;
        this.targetRelease = targetRelease;
        this.definer = definer;
    }

    private static int hostRelease() {
        return Runtime.version().feature();
    }

    private static int parseHeapSize(@Nullable String value) {
        if (value == null) return 64 << 20;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("JVMJIT_HEAP_SIZE is not a number of bytes: " + value, e);
        }
    }

    public Heap getHeap() {
        return heap;
    }

    public int getTargetRelease() {
        return targetRelease;
    }

    public void setVerify(boolean verify) {
        this.verify = verify;
    }

    public void setCheckClasses(boolean checkClasses) {
        this.checkClasses = checkClasses;
    }

    /**
     * Set the directory generated classes are written to, for debugging.
     *
     * @param debugOutput The directory, or null to not write classes.
     */
    public void setDebugOutput(@Nullable File debugOutput) {
        this.debugOutput = debugOutput;
    }

    /**
     * Compile a method.
     *
     * @param classFile The class file declaring the method.
     * @param method    The method.
     * @return The compiled function.
     * @throws JitException If the method cannot be compiled.
     */
    public Function compile(ClassFile classFile, Method method) {
        ConstantPool pool = classFile.getConstantPool();
        String className;
        String methodName;
        String descriptor;
        try {
            className = classFile.getClassName();
            methodName = method.getName(pool);
            descriptor = method.getDescriptor(pool);
        } catch (ClassFileException e) {
            throw new JitException.ClassFileFailure(e);
        }
        String fullName = className + "." + methodName + descriptor;

        if (!method.isStatic()) {
            throw new JitException.UnsupportedMethod(fullName + " is not static");
        }
        Code code = method.getCode()
                .orElseThrow(() -> new JitException.UnsupportedMethod(fullName + " has no code"));
        if (!code.getExceptionTable().isEmpty()) {
            throw new JitException.UnsupportedMethod(fullName + " has exception handlers");
        }
        Signature signature = Signature.parse(descriptor);
        for (Instruction insn : code.getInstructions()) {
            if (!StackEffects.isSupported(insn.opcode)) {
                throw new JitException.UnsupportedInstruction(insn);
            }
        }

        ControlFlowGraph cfg = ControlFlowBuilder.build(code, signature, pool);
        FunctionBody func = MethodTranslator.translate(fullName, signature, cfg, pool, code.maxLocals);

        IRPass<FunctionBody, ClassNode> pass = new IrToJava(
                ClassDefiner.className("Jit$" + sanitize(className + "$" + methodName)),
                44 + targetRelease);
        if (verify) pass = VerifyIntegrity.INSTANCE.then(pass);
        if (checkClasses) pass = pass.then(CheckJava.INSTANCE);
        ClassNode node;
        try {
            node = pass.run(func);
        } catch (JitException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new JitException.CodegenFailure("failed to generate code for " + fullName, e);
        }
        byte[] bytes = ClassDefiner.toBytes(node);
        if (debugOutput != null) {
            ClassDefiner.dump(debugOutput, fullName, bytes);
        }

        MethodHandles.Lookup lookup = definer.define(bytes);
        MethodHandle handle;
        try {
            handle = lookup.findStatic(
                    lookup.lookupClass(),
                    IrToJava.METHOD_NAME,
                    MethodType.fromMethodDescriptorString(
                            IrToJava.getMethodDescriptor(func),
                            Compiler.class.getClassLoader()));
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new JitException.ModuleFailure("failed to link " + fullName, e);
        }
        LOGGER.log(Level.FINE, "compiled {0} ({1} blocks, {2} bytes)",
                new Object[]{fullName, cfg.getBlocks().size(), bytes.length});
        return new Function(fullName, signature, MethodHandles.insertArguments(handle, 0, heap));
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9_$]", "_");
    }
}
