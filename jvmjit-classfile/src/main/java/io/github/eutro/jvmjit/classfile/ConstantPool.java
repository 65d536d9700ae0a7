package io.github.eutro.jvmjit.classfile;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A class file's constant pool.
 * <p>
 * Indices start at 1, and {@code long} and {@code double} entries occupy two indices,
 * the second of which is unusable.
 */
public final class ConstantPool {
    // index 0 and the second halves of wide entries are null
    private final List<@Nullable Constant> entries = new ArrayList<>();
    private final Map<String, Integer> utf8s = new HashMap<>();

    public ConstantPool() {
        entries.add(null);
    }

    /**
     * Append an entry to the pool.
     *
     * @param constant The entry.
     * @return The index of the entry.
     */
    public int add(Constant constant) {
        int index = entries.size();
        entries.add(constant);
        if (constant.isWide()) entries.add(null);
        if (constant instanceof Constant.Utf8) {
            utf8s.putIfAbsent(((Constant.Utf8) constant).value, index);
        }
        return index;
    }

    /**
     * Get the index of a {@code Utf8} entry with the given value, adding it if there is none.
     *
     * @param value The string.
     * @return The index.
     */
    public int addUtf8(String value) {
        Integer existing = utf8s.get(value);
        if (existing != null) return existing;
        return add(new Constant.Utf8(value));
    }

    /**
     * Add a {@code Class} entry, and the {@code Utf8} entry for its name.
     *
     * @param internalName The internal name of the class.
     * @return The index of the class entry.
     */
    public int addClass(String internalName) {
        return add(new Constant.Class(addUtf8(internalName)));
    }

    /**
     * Add a {@code String} entry, and the {@code Utf8} entry for its value.
     *
     * @param value The string.
     * @return The index of the string entry.
     */
    public int addString(String value) {
        return add(new Constant.StringConst(addUtf8(value)));
    }

    /**
     * Get the entry at an index.
     *
     * @param index The index.
     * @return The entry.
     * @throws ClassFileException.InvalidConstantPoolIndex If there is no usable entry at the index.
     */
    public Constant get(int index) {
        Constant constant = index > 0 && index < entries.size() ? entries.get(index) : null;
        if (constant == null) {
            throw new ClassFileException.InvalidConstantPoolIndex(index);
        }
        return constant;
    }

    /**
     * Get an entry, checking its type.
     *
     * @param index The index.
     * @param type  The expected type of entry.
     * @param <T>   The expected type of entry.
     * @return The entry.
     * @throws ClassFileException If the entry is missing, or of a different type.
     */
    public <T extends Constant> T get(int index, Class<T> type) {
        Constant constant = get(index);
        if (!type.isInstance(constant)) {
            throw new ClassFileException(String.format(
                    "constant #%d is %s, expected %s", index, constant.kindName(), type.getSimpleName()));
        }
        return type.cast(constant);
    }

    public String getUtf8(int index) {
        return get(index, Constant.Utf8.class).value;
    }

    /**
     * Resolve a {@code Class} entry to the internal name of the class.
     *
     * @param index The index of the class entry.
     * @return The class name.
     */
    public String getClassName(int index) {
        return getUtf8(get(index, Constant.Class.class).nameIndex);
    }

    /**
     * Get the number of indices in the pool, including the unused index 0.
     *
     * @return The size of the pool.
     */
    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < entries.size(); i++) {
            Constant constant = entries.get(i);
            if (constant != null) {
                sb.append(String.format("#%d = %s%n", i, constant));
            }
        }
        return sb.toString();
    }
}
