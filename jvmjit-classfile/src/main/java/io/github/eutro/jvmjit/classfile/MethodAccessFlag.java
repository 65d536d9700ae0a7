package io.github.eutro.jvmjit.classfile;

import java.util.EnumSet;
import java.util.Set;

/**
 * The access flags of a method.
 */
public enum MethodAccessFlag {
    PUBLIC(0x0001),
    PRIVATE(0x0002),
    PROTECTED(0x0004),
    STATIC(0x0008),
    FINAL(0x0010),
    SYNCHRONIZED(0x0020),
    BRIDGE(0x0040),
    VARARGS(0x0080),
    NATIVE(0x0100),
    ABSTRACT(0x0400),
    STRICT(0x0800),
    SYNTHETIC(0x1000),
    ;

    public final int mask;

    MethodAccessFlag(int mask) {
        this.mask = mask;
    }

    public static Set<MethodAccessFlag> fromMask(int access) {
        Set<MethodAccessFlag> flags = EnumSet.noneOf(MethodAccessFlag.class);
        for (MethodAccessFlag flag : values()) {
            if ((access & flag.mask) != 0) flags.add(flag);
        }
        return flags;
    }
}
