package io.github.eutro.jvmjit;

import io.github.eutro.jvmjit.classfile.ClassFileException;
import io.github.eutro.jvmjit.classfile.code.Instruction;

/**
 * The exceptions thrown by the JIT, when a method cannot be compiled or compiled code fails.
 * <p>
 * The subclasses nested here are the only ones.
 */
public abstract class JitException extends RuntimeException {
    private JitException(String message) {
        super(message);
    }

    private JitException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether this exception signals that the method is outside what the JIT supports,
     * rather than a malformed method or a defect. Callers can fall back to interpreting such methods.
     *
     * @return Whether the method is unsupported.
     */
    public boolean isUnsupported() {
        return false;
    }

    /**
     * An instruction that the JIT does not compile.
     */
    public static final class UnsupportedInstruction extends JitException {
        private final Instruction instruction;

        public UnsupportedInstruction(Instruction instruction) {
            super("unsupported instruction: " + instruction);
            this.instruction = instruction;
        }

        public Instruction getInstruction() {
            return instruction;
        }

        @Override
        public boolean isUnsupported() {
            return true;
        }
    }

    /**
     * A method the JIT does not compile, such as an instance method.
     */
    public static final class UnsupportedMethod extends JitException {
        public UnsupportedMethod(String message) {
            super(message);
        }

        @Override
        public boolean isUnsupported() {
            return true;
        }
    }

    /**
     * A type that has no {@link Kind}, such as an object type in a method descriptor.
     */
    public static final class UnsupportedType extends JitException {
        public UnsupportedType(String message) {
            super(message);
        }

        @Override
        public boolean isUnsupported() {
            return true;
        }
    }

    /**
     * The host cannot run the code the backend would generate.
     */
    public static final class UnsupportedTargetIsa extends JitException {
        public UnsupportedTargetIsa(String message) {
            super(message);
        }

        @Override
        public boolean isUnsupported() {
            return true;
        }
    }

    public static final class OperandStackUnderflow extends JitException {
        public OperandStackUnderflow() {
            super("operand stack underflow");
        }
    }

    /**
     * A local variable index that is out of range, or whose slot does not hold a usable value of the right type.
     */
    public static final class InvalidLocalVariableIndex extends JitException {
        private final int index;

        public InvalidLocalVariableIndex(int index) {
            super("invalid local variable index: " + index);
            this.index = index;
        }

        public int getIndex() {
            return index;
        }
    }

    public static final class InvalidConstantIndex extends JitException {
        private final int index;

        public InvalidConstantIndex(int index, Throwable cause) {
            super("invalid constant index: " + index, cause);
            this.index = index;
        }

        public int getIndex() {
            return index;
        }
    }

    /**
     * A constant of the wrong type, such as a string loaded with {@code ldc}.
     */
    public static final class InvalidConstant extends JitException {
        private final String expected;
        private final String actual;

        public InvalidConstant(String expected, String actual) {
            super(String.format("invalid constant, expected %s, got %s", expected, actual));
            this.expected = expected;
            this.actual = actual;
        }

        public String getExpected() {
            return expected;
        }

        public String getActual() {
            return actual;
        }
    }

    /**
     * A value of the wrong type, on the operand stack or passed to a compiled function.
     */
    public static final class InvalidValue extends JitException {
        private final String expected;
        private final String actual;

        public InvalidValue(String expected, String actual) {
            super(String.format("invalid value, expected %s, got %s", expected, actual));
            this.expected = expected;
            this.actual = actual;
        }

        public String getExpected() {
            return expected;
        }

        public String getActual() {
            return actual;
        }
    }

    public static final class InvalidArgumentCount extends JitException {
        private final int expected;
        private final int actual;

        public InvalidArgumentCount(int expected, int actual) {
            super(String.format("expected %d arguments, got %d", expected, actual));
            this.expected = expected;
            this.actual = actual;
        }

        public int getExpected() {
            return expected;
        }

        public int getActual() {
            return actual;
        }
    }

    /**
     * The class file could not be resolved as needed, see the cause.
     */
    public static final class ClassFileFailure extends JitException {
        public ClassFileFailure(ClassFileException cause) {
            super("class file error: " + cause.getMessage(), cause);
        }

        @Override
        public synchronized ClassFileException getCause() {
            return (ClassFileException) super.getCause();
        }
    }

    /**
     * The backend failed to generate code, see the cause.
     */
    public static final class CodegenFailure extends JitException {
        public CodegenFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The generated code could not be defined or linked, see the cause.
     */
    public static final class ModuleFailure extends JitException {
        public ModuleFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * An inconsistency that verified bytecode should never produce, or a defect in the JIT.
     */
    public static final class Internal extends JitException {
        public Internal(String message) {
            super(message);
        }
    }

    /**
     * Compiled code trapped while executing, see the cause.
     */
    public static final class Trap extends JitException {
        public Trap(Throwable cause) {
            super("trap: " + cause, cause);
        }
    }
}
