package io.github.eutro.jvmjit.classfile.code;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The {@code Code} attribute of a method.
 */
public final class Code {
    public final int maxStack;
    public final int maxLocals;
    private final List<Instruction> instructions;
    private final List<ExceptionTableEntry> exceptionTable;

    public Code(int maxStack, int maxLocals, List<Instruction> instructions, List<ExceptionTableEntry> exceptionTable) {
        this.maxStack = maxStack;
        this.maxLocals = maxLocals;
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.exceptionTable = Collections.unmodifiableList(new ArrayList<>(exceptionTable));
    }

    public Code(int maxStack, int maxLocals, List<Instruction> instructions) {
        this(maxStack, maxLocals, instructions, Collections.emptyList());
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public List<ExceptionTableEntry> getExceptionTable() {
        return exceptionTable;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Code(stack=").append(maxStack).append(", locals=").append(maxLocals).append(")\n");
        for (int i = 0; i < instructions.size(); i++) {
            sb.append(String.format("%4d: %s%n", i, instructions.get(i)));
        }
        for (ExceptionTableEntry entry : exceptionTable) {
            sb.append("  ").append(entry).append('\n');
        }
        return sb.toString();
    }
}
