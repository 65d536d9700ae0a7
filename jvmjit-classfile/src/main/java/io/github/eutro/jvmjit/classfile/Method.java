package io.github.eutro.jvmjit.classfile;

import io.github.eutro.jvmjit.classfile.code.Code;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * A method of a class file.
 */
public final class Method {
    private final Set<MethodAccessFlag> accessFlags;
    public final int nameIndex;
    public final int descriptorIndex;
    private final @Nullable Code code;

    public Method(Set<MethodAccessFlag> accessFlags, int nameIndex, int descriptorIndex, @Nullable Code code) {
        this.accessFlags = accessFlags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(accessFlags));
        this.nameIndex = nameIndex;
        this.descriptorIndex = descriptorIndex;
        this.code = code;
    }

    public Set<MethodAccessFlag> getAccessFlags() {
        return accessFlags;
    }

    public boolean isStatic() {
        return accessFlags.contains(MethodAccessFlag.STATIC);
    }

    /**
     * Get the {@code Code} attribute of this method, absent for abstract and native methods.
     *
     * @return The code.
     */
    public Optional<Code> getCode() {
        return Optional.ofNullable(code);
    }

    public String getName(ConstantPool pool) {
        return pool.getUtf8(nameIndex);
    }

    public String getDescriptor(ConstantPool pool) {
        return pool.getUtf8(descriptorIndex);
    }
}
