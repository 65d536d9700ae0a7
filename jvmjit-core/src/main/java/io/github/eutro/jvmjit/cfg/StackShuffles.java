package io.github.eutro.jvmjit.cfg;

import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.classfile.code.Opcode;

import java.util.List;
import java.util.function.Predicate;

/**
 * The {@code pop}, {@code dup} and {@code swap} families of instructions, which rearrange stack entries
 * according to their computational type categories rather than their types.
 */
public final class StackShuffles {
    private StackShuffles() {
    }

    /**
     * Whether an opcode is one of the stack shuffling instructions.
     *
     * @param opcode The opcode.
     * @return Whether {@link #apply(Opcode, List, Predicate)} accepts it.
     */
    public static boolean isShuffle(Opcode opcode) {
        switch (opcode) {
            case POP:
            case POP2:
            case DUP:
            case DUP_X1:
            case DUP_X2:
            case DUP2:
            case DUP2_X1:
            case DUP2_X2:
            case SWAP:
                return true;
            default:
                return false;
        }
    }

    /**
     * Apply a stack shuffling instruction to a stack, whose top is the end of the list.
     *
     * @param opcode The opcode.
     * @param stack  The stack.
     * @param isWide Whether an entry is of category 2.
     * @param <T>    The type of stack entries.
     */
    public static <T> void apply(Opcode opcode, List<T> stack, Predicate<? super T> isWide) {
        Popper<T> p = new Popper<>(stack, isWide, opcode);
        switch (opcode) {
            case POP:
                p.cat1();
                break;
            case POP2:
                if (!p.isWide(p.any())) p.cat1();
                break;
            case DUP: {
                T v1 = p.cat1();
                push(stack, v1, v1);
                break;
            }
            case DUP_X1: {
                T v1 = p.cat1();
                T v2 = p.cat1();
                push(stack, v1, v2, v1);
                break;
            }
            case DUP_X2: {
                T v1 = p.cat1();
                T v2 = p.any();
                if (p.isWide(v2)) {
                    push(stack, v1, v2, v1);
                } else {
                    T v3 = p.cat1();
                    push(stack, v1, v3, v2, v1);
                }
                break;
            }
            case DUP2: {
                T v1 = p.any();
                if (p.isWide(v1)) {
                    push(stack, v1, v1);
                } else {
                    T v2 = p.cat1();
                    push(stack, v2, v1, v2, v1);
                }
                break;
            }
            case DUP2_X1: {
                T v1 = p.any();
                if (p.isWide(v1)) {
                    T v2 = p.cat1();
                    push(stack, v1, v2, v1);
                } else {
                    T v2 = p.cat1();
                    T v3 = p.cat1();
                    push(stack, v2, v1, v3, v2, v1);
                }
                break;
            }
            case DUP2_X2: {
                T v1 = p.any();
                if (p.isWide(v1)) {
                    T v2 = p.any();
                    if (p.isWide(v2)) {
                        push(stack, v1, v2, v1);
                    } else {
                        T v3 = p.cat1();
                        push(stack, v1, v3, v2, v1);
                    }
                } else {
                    T v2 = p.cat1();
                    T v3 = p.any();
                    if (p.isWide(v3)) {
                        push(stack, v2, v1, v3, v2, v1);
                    } else {
                        T v4 = p.cat1();
                        push(stack, v2, v1, v4, v3, v2, v1);
                    }
                }
                break;
            }
            case SWAP: {
                T v1 = p.cat1();
                T v2 = p.cat1();
                push(stack, v1, v2);
                break;
            }
            default:
                throw new IllegalArgumentException("not a stack shuffle: " + opcode);
        }
    }

    @SafeVarargs
    private static <T> void push(List<T> stack, T... values) {
        for (T value : values) {
            stack.add(value);
        }
    }

    private static final class Popper<T> {
        private final List<T> stack;
        private final Predicate<? super T> isWide;
        private final Opcode opcode;

        Popper(List<T> stack, Predicate<? super T> isWide, Opcode opcode) {
            this.stack = stack;
            this.isWide = isWide;
            this.opcode = opcode;
        }

        boolean isWide(T value) {
            return isWide.test(value);
        }

        T any() {
            if (stack.isEmpty()) throw new JitException.OperandStackUnderflow();
            return stack.remove(stack.size() - 1);
        }

        T cat1() {
            T value = any();
            if (isWide(value)) {
                throw new JitException.Internal(opcode + " applied to a category 2 value");
            }
            return value;
        }
    }
}
