package io.github.eutro.jvmjit.classfile.code;

/**
 * An entry of a method's exception table. Positions are instruction indices.
 */
public final class ExceptionTableEntry {
    public final int start;
    public final int end;
    public final int handler;
    /**
     * The constant pool index of the caught class, or 0 to catch anything.
     */
    public final int catchType;

    public ExceptionTableEntry(int start, int end, int handler, int catchType) {
        this.start = start;
        this.end = end;
        this.handler = handler;
        this.catchType = catchType;
    }

    @Override
    public String toString() {
        return String.format("[%d, %d) -> %d catch #%d", start, end, handler, catchType);
    }
}
