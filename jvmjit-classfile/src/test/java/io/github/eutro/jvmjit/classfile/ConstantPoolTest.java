package io.github.eutro.jvmjit.classfile;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConstantPoolTest {
    @Test
    void wideEntriesTakeTwoSlots() {
        ConstantPool pool = new ConstantPool();
        int l = pool.add(new Constant.Long(5));
        int i = pool.add(new Constant.Integer(6));
        assertEquals(1, l);
        assertEquals(3, i);
        ClassFileException.InvalidConstantPoolIndex e = assertThrows(
                ClassFileException.InvalidConstantPoolIndex.class,
                () -> pool.get(2));
        assertEquals(2, e.getIndex());
    }

    @Test
    void indexZeroAndOutOfRangeAreInvalid() {
        ConstantPool pool = new ConstantPool();
        pool.addUtf8("x");
        assertThrows(ClassFileException.InvalidConstantPoolIndex.class, () -> pool.get(0));
        assertThrows(ClassFileException.InvalidConstantPoolIndex.class, () -> pool.get(2));
        assertThrows(ClassFileException.InvalidConstantPoolIndex.class, () -> pool.get(-1));
    }

    @Test
    void utf8EntriesAreShared() {
        ConstantPool pool = new ConstantPool();
        int a = pool.addClass("a/B");
        int b = pool.addClass("a/B");
        assertNotEquals(a, b);
        assertEquals(pool.get(a, Constant.Class.class).nameIndex, pool.get(b, Constant.Class.class).nameIndex);
        assertEquals("a/B", pool.getClassName(b));
    }

    @Test
    void typedAccessChecksTag() {
        ConstantPool pool = new ConstantPool();
        int idx = pool.add(new Constant.Integer(1));
        ClassFileException e = assertThrows(ClassFileException.class, () -> pool.getUtf8(idx));
        assertFalse(e instanceof ClassFileException.InvalidConstantPoolIndex);
    }
}
