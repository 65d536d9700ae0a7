package io.github.eutro.jvmjit.classfile;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A parsed class file, as much of one as the JIT needs.
 */
public final class ClassFile {
    public final int minorVersion;
    public final int majorVersion;
    public final int accessFlags;
    private final ConstantPool constantPool;
    public final int thisClass;
    public final int superClass;
    private final List<Method> methods;

    public ClassFile(
            int minorVersion,
            int majorVersion,
            int accessFlags,
            ConstantPool constantPool,
            int thisClass,
            int superClass,
            List<Method> methods
    ) {
        this.minorVersion = minorVersion;
        this.majorVersion = majorVersion;
        this.accessFlags = accessFlags;
        this.constantPool = constantPool;
        this.thisClass = thisClass;
        this.superClass = superClass;
        this.methods = Collections.unmodifiableList(new ArrayList<>(methods));
    }

    public ConstantPool getConstantPool() {
        return constantPool;
    }

    public List<Method> getMethods() {
        return methods;
    }

    /**
     * Get the internal name of this class, such as {@code java/lang/Math}.
     *
     * @return The class name.
     * @throws ClassFileException If {@code this_class} does not resolve to a class name.
     */
    public String getClassName() {
        return constantPool.getClassName(thisClass);
    }

    public @Nullable String getSuperClassName() {
        return superClass == 0 ? null : constantPool.getClassName(superClass);
    }

    /**
     * Find a method by name and descriptor.
     *
     * @param name       The method name.
     * @param descriptor The method descriptor.
     * @return The method, if there is one.
     */
    public Optional<Method> findMethod(String name, String descriptor) {
        for (Method method : methods) {
            if (method.getName(constantPool).equals(name)
                    && method.getDescriptor(constantPool).equals(descriptor)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
