package io.github.eutro.jvmjit.runtime;

/**
 * The memory compiled code allocates from and accesses, addressed by 64-bit addresses.
 * <p>
 * Address 0 is the null reference, and is never returned by {@link #allocate(long)}.
 * Multi-byte values are little endian.
 * <p>
 * Compiled code calls these methods directly, so their names and descriptors are part of
 * the contract between the compiler and the runtime.
 */
public interface Heap {
    /**
     * Allocate a zero-filled, 8-byte aligned region of memory.
     *
     * @param size The size of the region, in bytes.
     * @return The address of the region.
     * @throws TrapException If the heap is exhausted, or the size is negative.
     */
    long allocate(long size);

    byte getByte(long address);

    short getShort(long address);

    char getChar(long address);

    int getInt(long address);

    long getLong(long address);

    float getFloat(long address);

    double getDouble(long address);

    void putByte(long address, byte value);

    void putShort(long address, short value);

    void putChar(long address, char value);

    void putInt(long address, int value);

    void putLong(long address, long value);

    void putFloat(long address, float value);

    void putDouble(long address, double value);
}
