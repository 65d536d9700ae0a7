package io.github.eutro.jvmjit.classfile;

/**
 * Thrown when class file data is malformed or does not hold what it is expected to.
 */
public class ClassFileException extends RuntimeException {
    public ClassFileException(String message) {
        super(message);
    }

    public ClassFileException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when a constant pool index is out of range, or refers to the unusable
     * second slot of a {@code long} or {@code double} entry.
     */
    public static class InvalidConstantPoolIndex extends ClassFileException {
        private final int index;

        public InvalidConstantPoolIndex(int index) {
            super("invalid constant pool index: " + index);
            this.index = index;
        }

        public int getIndex() {
            return index;
        }
    }
}
