package io.github.eutro.jvmjit.runtime;

/**
 * Thrown when compiled code traps, for example on an out of bounds array index.
 */
public class TrapException extends RuntimeException {
    public TrapException(String message) {
        super(message);
    }
}
