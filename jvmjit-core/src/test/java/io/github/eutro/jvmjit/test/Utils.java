package io.github.eutro.jvmjit.test;

import io.github.eutro.jvmjit.Compiler;
import io.github.eutro.jvmjit.Function;
import io.github.eutro.jvmjit.classfile.ClassFile;
import io.github.eutro.jvmjit.classfile.ClassFiles;
import io.github.eutro.jvmjit.runtime.ByteBufferHeap;
import org.jetbrains.annotations.NotNull;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

import java.io.IOException;
import java.io.InputStream;
import java.util.function.Consumer;

public class Utils {
    public static final int HEAP_SIZE = 1 << 16;

    @NotNull
    public static Compiler newCompiler() {
        Compiler compiler = new Compiler(new ByteBufferHeap(HEAP_SIZE));
        compiler.setVerify(true);
        compiler.setCheckClasses(true);
        return compiler;
    }

    /**
     * Make a class file with a single method, {@code Test.test}.
     */
    @NotNull
    public static ClassFile singleMethod(int access, String desc, int maxLocals, Consumer<MethodVisitor> body) {
        ClassNode cn = new ClassNode();
        cn.visit(Opcodes.V1_8, Opcodes.ACC_PUBLIC | Opcodes.ACC_SUPER, "Test", null, "java/lang/Object", null);
        MethodNode mn = (MethodNode) cn.visitMethod(access, "test", desc, null, null);
        mn.visitCode();
        body.accept(mn);
        mn.visitMaxs(16, maxLocals);
        mn.visitEnd();
        cn.visitEnd();
        return ClassFiles.fromNode(cn);
    }

    @NotNull
    public static ClassFile staticMethod(String desc, Consumer<MethodVisitor> body) {
        return singleMethod(Opcodes.ACC_PUBLIC | Opcodes.ACC_STATIC, desc, 16, body);
    }

    @NotNull
    public static Function compile(Compiler compiler, ClassFile classFile) {
        return compiler.compile(classFile, classFile.getMethods().get(0));
    }

    @NotNull
    public static Function compile(String desc, Consumer<MethodVisitor> body) {
        return compile(newCompiler(), staticMethod(desc, body));
    }

    @NotNull
    public static ClassFile readClass(Class<?> clazz) throws IOException {
        String resource = clazz.getName().substring(clazz.getName().lastIndexOf('.') + 1) + ".class";
        try (InputStream in = clazz.getResourceAsStream(resource)) {
            if (in == null) throw new IOException("missing class file for " + clazz);
            return ClassFiles.read(in);
        }
    }
}
