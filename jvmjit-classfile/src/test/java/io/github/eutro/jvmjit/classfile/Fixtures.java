package io.github.eutro.jvmjit.classfile;

@SuppressWarnings("unused")
public class Fixtures {
    static int max(int a, int b) {
        return a > b ? a : b;
    }

    static long big() {
        return 1234567890123L;
    }

    static int pick(int key) {
        switch (key) {
            case 1:
                return 10;
            case 2:
                return 20;
            case 3:
                return 30;
            default:
                return -1;
        }
    }

    static String greeting() {
        return "hello";
    }

    native void nothing();
}
