package io.github.eutro.jvmjit.classfile;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed method descriptor.
 */
public final class MethodDescriptor {
    private final List<FieldType> parameterTypes;
    private final @Nullable FieldType returnType;

    public MethodDescriptor(List<FieldType> parameterTypes, @Nullable FieldType returnType) {
        this.parameterTypes = Collections.unmodifiableList(new ArrayList<>(parameterTypes));
        this.returnType = returnType;
    }

    /**
     * Parse a method descriptor such as {@code (IJ[D)V}.
     *
     * @param descriptor The descriptor.
     * @return The parsed descriptor.
     * @throws ClassFileException If the descriptor is malformed.
     */
    public static MethodDescriptor parse(String descriptor) {
        if (descriptor.isEmpty() || descriptor.charAt(0) != '(') {
            throw new ClassFileException("method descriptor must start with '(': " + descriptor);
        }
        int[] pos = {1};
        List<FieldType> params = new ArrayList<>();
        while (true) {
            if (pos[0] >= descriptor.length()) {
                throw new ClassFileException("unterminated parameter list: " + descriptor);
            }
            if (descriptor.charAt(pos[0]) == ')') break;
            params.add(FieldType.parse(descriptor, pos));
        }
        pos[0]++;
        FieldType returnType;
        if (pos[0] < descriptor.length() && descriptor.charAt(pos[0]) == 'V') {
            pos[0]++;
            returnType = null;
        } else {
            returnType = FieldType.parse(descriptor, pos);
        }
        if (pos[0] != descriptor.length()) {
            throw new ClassFileException("trailing characters in method descriptor: " + descriptor);
        }
        return new MethodDescriptor(params, returnType);
    }

    public List<FieldType> getParameterTypes() {
        return parameterTypes;
    }

    /**
     * Get the return type, or null for {@code void}.
     *
     * @return The return type.
     */
    public @Nullable FieldType getReturnType() {
        return returnType;
    }

    /**
     * Get the number of local variable slots the parameters take.
     *
     * @return The number of slots.
     */
    public int getParameterSlots() {
        int slots = 0;
        for (FieldType type : parameterTypes) {
            slots += type.getSize();
        }
        return slots;
    }

    public String getDescriptor() {
        StringBuilder sb = new StringBuilder("(");
        for (FieldType type : parameterTypes) {
            sb.append(type.getDescriptor());
        }
        return sb.append(')').append(returnType == null ? "V" : returnType.getDescriptor()).toString();
    }

    @Override
    public String toString() {
        return getDescriptor();
    }
}
