package io.github.eutro.jvmjit.runtime;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link Heap} backed by a single little endian {@link ByteBuffer}, allocating by bumping a pointer.
 * <p>
 * Memory is never freed. Allocation is thread-safe; accesses to distinct addresses from
 * different threads do not interfere.
 */
public final class ByteBufferHeap implements Heap {
    /**
     * The number of bytes reserved at the start of the heap, so that no allocation is at address 0.
     */
    public static final int RESERVED = 8;

    private final ByteBuffer buffer;
    private final AtomicLong top = new AtomicLong(RESERVED);

    /**
     * Create a heap with the given capacity.
     *
     * @param capacity The capacity, in bytes.
     */
    public ByteBufferHeap(int capacity) {
        if (capacity < RESERVED) {
            throw new IllegalArgumentException("heap capacity must be at least " + RESERVED + ", got " + capacity);
        }
        buffer = ByteBuffer.allocate(capacity).order(ByteOrder.LITTLE_ENDIAN);
    }

    public int getCapacity() {
        return buffer.capacity();
    }

    /**
     * Get the number of bytes allocated so far, including the reserved prefix and alignment padding.
     *
     * @return The number of bytes used.
     */
    public long getUsed() {
        return top.get();
    }

    @Override
    public long allocate(long size) {
        if (size < 0) {
            throw new TrapException("negative allocation size: " + size);
        }
        long aligned = (size + 7) & ~7L;
        if (aligned < size) {
            throw new TrapException("heap exhausted allocating " + size + " bytes");
        }
        while (true) {
            long start = top.get();
            long end = start + aligned;
            if (end > buffer.capacity()) {
                throw new TrapException("heap exhausted allocating " + size + " bytes");
            }
            if (top.compareAndSet(start, end)) {
                return start;
            }
        }
    }

    private int index(long address, int width) {
        if (address < RESERVED || address > buffer.capacity() - width) {
            throw new TrapException(String.format("invalid heap access of %d bytes at 0x%x", width, address));
        }
        return (int) address;
    }

    @Override
    public byte getByte(long address) {
        return buffer.get(index(address, Byte.BYTES));
    }

    @Override
    public short getShort(long address) {
        return buffer.getShort(index(address, Short.BYTES));
    }

    @Override
    public char getChar(long address) {
        return buffer.getChar(index(address, Character.BYTES));
    }

    @Override
    public int getInt(long address) {
        return buffer.getInt(index(address, Integer.BYTES));
    }

    @Override
    public long getLong(long address) {
        return buffer.getLong(index(address, Long.BYTES));
    }

    @Override
    public float getFloat(long address) {
        return buffer.getFloat(index(address, Float.BYTES));
    }

    @Override
    public double getDouble(long address) {
        return buffer.getDouble(index(address, Double.BYTES));
    }

    @Override
    public void putByte(long address, byte value) {
        buffer.put(index(address, Byte.BYTES), value);
    }

    @Override
    public void putShort(long address, short value) {
        buffer.putShort(index(address, Short.BYTES), value);
    }

    @Override
    public void putChar(long address, char value) {
        buffer.putChar(index(address, Character.BYTES), value);
    }

    @Override
    public void putInt(long address, int value) {
        buffer.putInt(index(address, Integer.BYTES), value);
    }

    @Override
    public void putLong(long address, long value) {
        buffer.putLong(index(address, Long.BYTES), value);
    }

    @Override
    public void putFloat(long address, float value) {
        buffer.putFloat(index(address, Float.BYTES), value);
    }

    @Override
    public void putDouble(long address, double value) {
        buffer.putDouble(index(address, Double.BYTES), value);
    }
}
