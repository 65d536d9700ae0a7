package io.github.eutro.jvmjit;

import io.github.eutro.jvmjit.cfg.StackType;
import io.github.eutro.jvmjit.classfile.ClassFileException;
import io.github.eutro.jvmjit.classfile.FieldType;
import io.github.eutro.jvmjit.classfile.MethodDescriptor;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The parameter and return kinds of a compiled method, derived from its descriptor.
 * <p>
 * {@code boolean}, {@code byte}, {@code char}, {@code short} and {@code int} map to {@link Kind#I32},
 * {@code long} and primitive arrays to {@link Kind#I64}, {@code float} to {@link Kind#F32},
 * and {@code double} to {@link Kind#F64}. Class types are not supported.
 */
public final class Signature {
    private final String descriptor;
    private final List<StackType> parameterTypes;
    private final List<Kind> parameterKinds;
    private final @Nullable StackType returnType;
    private final @Nullable FieldType declaredReturnType;

    private Signature(String descriptor, List<StackType> parameterTypes, @Nullable FieldType declaredReturnType) {
        this.descriptor = descriptor;
        this.parameterTypes = Collections.unmodifiableList(parameterTypes);
        List<Kind> kinds = new ArrayList<>(parameterTypes.size());
        for (StackType type : parameterTypes) {
            kinds.add(type.kind);
        }
        this.parameterKinds = Collections.unmodifiableList(kinds);
        this.declaredReturnType = declaredReturnType;
        this.returnType = declaredReturnType == null ? null : StackType.forFieldType(declaredReturnType);
    }

    /**
     * Parse a signature from a method descriptor.
     *
     * @param descriptor The method descriptor.
     * @return The signature.
     * @throws JitException.UnsupportedType  If the descriptor mentions a class type.
     * @throws JitException.ClassFileFailure If the descriptor is malformed.
     */
    public static Signature parse(String descriptor) {
        MethodDescriptor md;
        try {
            md = MethodDescriptor.parse(descriptor);
        } catch (ClassFileException e) {
            throw new JitException.ClassFileFailure(e);
        }
        List<StackType> params = new ArrayList<>();
        for (FieldType type : md.getParameterTypes()) {
            params.add(StackType.forFieldType(type));
        }
        return new Signature(descriptor, params, md.getReturnType());
    }

    public String getDescriptor() {
        return descriptor;
    }

    public List<Kind> getParameterKinds() {
        return parameterKinds;
    }

    public List<StackType> getParameterTypes() {
        return parameterTypes;
    }

    /**
     * Get the return kind, or null if the method returns {@code void}.
     *
     * @return The return kind.
     */
    public @Nullable Kind getReturnKind() {
        return returnType == null ? null : returnType.kind;
    }

    public @Nullable StackType getReturnType() {
        return returnType;
    }

    /**
     * Get the return type as written in the descriptor, before {@code boolean}, {@code byte},
     * {@code char} and {@code short} are widened to {@code int}.
     *
     * @return The declared return type, or null if the method returns {@code void}.
     */
    public @Nullable FieldType getDeclaredReturnType() {
        return declaredReturnType;
    }

    public boolean isVoid() {
        return returnType == null;
    }

    /**
     * Get the number of local variable slots the parameters take.
     *
     * @return The number of slots.
     */
    public int getParameterSlots() {
        int slots = 0;
        for (StackType type : parameterTypes) {
            slots += type.category;
        }
        return slots;
    }

    @Override
    public String toString() {
        return parameterKinds + " -> " + (returnType == null ? "void" : returnType.kind);
    }
}
