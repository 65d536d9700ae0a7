package io.github.eutro.jvmjit.classfile.code;

import org.jetbrains.annotations.Contract;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A single instruction of a method's code.
 * <p>
 * Instructions are addressed by their index in the method's instruction list, so
 * branch targets are instruction indices rather than byte offsets.
 * The {@link Opcode#WIDE wide} prefix never appears, it is folded into the
 * operands of the instruction it widens.
 * <p>
 * Instructions are immutable.
 */
public class Instruction {
    private static final Map<Opcode, Instruction> SIMPLE = new EnumMap<>(Opcode.class);

    static {
        for (Opcode opcode : Opcode.values()) {
            if (opcode.form == Opcode.Form.NONE && opcode != Opcode.WIDE) {
                SIMPLE.put(opcode, new Instruction(opcode));
            }
        }
    }

    /**
     * The opcode of this instruction.
     */
    public final Opcode opcode;

    Instruction(Opcode opcode) {
        this.opcode = opcode;
    }

    private static Opcode checkForm(Opcode opcode, Opcode.Form form) {
        if (opcode.form != form) {
            throw new IllegalArgumentException(String.format("%s does not take %s operands", opcode, form));
        }
        return opcode;
    }

    /**
     * Get an instruction that has no operands.
     *
     * @param opcode The opcode.
     * @return The instruction.
     */
    public static Instruction of(Opcode opcode) {
        Instruction insn = SIMPLE.get(opcode);
        if (insn == null) {
            throw new IllegalArgumentException(opcode + " requires operands");
        }
        return insn;
    }

    @Contract("_, _ -> new")
    public static Local local(Opcode opcode, int index) {
        return new Local(checkForm(opcode, Opcode.Form.LOCAL), index);
    }

    @Contract("_, _ -> new")
    public static Iinc iinc(int index, int increment) {
        return new Iinc(index, increment);
    }

    @Contract("_, _ -> new")
    public static Push push(Opcode opcode, int value) {
        return new Push(checkForm(opcode, Opcode.Form.PUSH), value);
    }

    @Contract("_, _ -> new")
    public static Constant constant(Opcode opcode, int index) {
        return new Constant(checkForm(opcode, Opcode.Form.CONSTANT), index);
    }

    @Contract("_, _ -> new")
    public static Jump jump(Opcode opcode, int target) {
        return new Jump(checkForm(opcode, Opcode.Form.JUMP), target);
    }

    @Contract("_ -> new")
    public static NewArray newArray(ArrayType type) {
        return new NewArray(type);
    }

    @Contract("_, _, _, _ -> new")
    public static TableSwitch tableSwitch(int defaultTarget, int low, int high, int... targets) {
        return new TableSwitch(defaultTarget, low, high, targets);
    }

    @Contract("_, _, _ -> new")
    public static LookupSwitch lookupSwitch(int defaultTarget, int[] keys, int[] targets) {
        return new LookupSwitch(defaultTarget, keys, targets);
    }

    @Contract("_, _, _ -> new")
    public static Reference reference(Opcode opcode, int index, int count) {
        return new Reference(checkForm(opcode, Opcode.Form.REFERENCE), index, count);
    }

    /**
     * Whether this instruction may transfer control somewhere other than the next instruction,
     * or end the method.
     *
     * @return Whether this instruction ends a basic block.
     */
    public boolean changesControlFlow() {
        switch (opcode) {
            case IRETURN:
            case LRETURN:
            case FRETURN:
            case DRETURN:
            case ARETURN:
            case RETURN:
            case ATHROW:
                return true;
            default:
                return false;
        }
    }

    /**
     * Whether execution can continue with the next instruction after this one.
     *
     * @return Whether this instruction can fall through.
     */
    public boolean canFallThrough() {
        return !changesControlFlow();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return opcode == ((Instruction) o).opcode;
    }

    @Override
    public int hashCode() {
        return opcode.hashCode();
    }

    @Override
    public String toString() {
        return opcode.mnemonic();
    }

    /**
     * A local variable instruction, {@code xload}, {@code xstore} or {@code ret}.
     */
    public static final class Local extends Instruction {
        public final int index;

        Local(Opcode opcode, int index) {
            super(opcode);
            this.index = index;
        }

        @Override
        public boolean changesControlFlow() {
            return opcode == Opcode.RET;
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && index == ((Local) o).index;
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + index;
        }

        @Override
        public String toString() {
            return opcode + " " + index;
        }
    }

    /**
     * An {@code iinc} instruction.
     */
    public static final class Iinc extends Instruction {
        public final int index;
        public final int increment;

        Iinc(int index, int increment) {
            super(Opcode.IINC);
            this.index = index;
            this.increment = increment;
        }

        @Override
        public boolean equals(Object o) {
            if (!super.equals(o)) return false;
            Iinc iinc = (Iinc) o;
            return index == iinc.index && increment == iinc.increment;
        }

        @Override
        public int hashCode() {
            return 31 * (31 * super.hashCode() + index) + increment;
        }

        @Override
        public String toString() {
            return opcode + " " + index + " " + increment;
        }
    }

    /**
     * A {@code bipush} or {@code sipush} instruction, with its immediate already sign extended.
     */
    public static final class Push extends Instruction {
        public final int value;

        Push(Opcode opcode, int value) {
            super(opcode);
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && value == ((Push) o).value;
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + value;
        }

        @Override
        public String toString() {
            return opcode + " " + value;
        }
    }

    /**
     * An {@code ldc}, {@code ldc_w} or {@code ldc2_w} instruction, referring to the constant pool.
     */
    public static final class Constant extends Instruction {
        public final int index;

        Constant(Opcode opcode, int index) {
            super(opcode);
            this.index = index;
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && index == ((Constant) o).index;
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + index;
        }

        @Override
        public String toString() {
            return opcode + " #" + index;
        }
    }

    /**
     * A branch instruction, conditional or not.
     */
    public static final class Jump extends Instruction {
        /**
         * The index of the instruction this jumps to.
         */
        public final int target;

        Jump(Opcode opcode, int target) {
            super(opcode);
            this.target = target;
        }

        /**
         * Whether this jump is conditional, and so may also fall through.
         *
         * @return Whether the jump is conditional.
         */
        public boolean isConditional() {
            switch (opcode) {
                case GOTO:
                case GOTO_W:
                case JSR:
                case JSR_W:
                    return false;
                default:
                    return true;
            }
        }

        @Override
        public boolean changesControlFlow() {
            return true;
        }

        @Override
        public boolean canFallThrough() {
            return isConditional();
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && target == ((Jump) o).target;
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + target;
        }

        @Override
        public String toString() {
            return opcode + " " + target;
        }
    }

    /**
     * A {@code newarray} instruction.
     */
    public static final class NewArray extends Instruction {
        public final ArrayType type;

        NewArray(ArrayType type) {
            super(Opcode.NEWARRAY);
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && type == ((NewArray) o).type;
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + type.hashCode();
        }

        @Override
        public String toString() {
            return opcode + " " + type;
        }
    }

    /**
     * The switch instructions, which jump to one of several targets based on an {@code int} key.
     */
    public abstract static class Switch extends Instruction {
        public final int defaultTarget;

        Switch(Opcode opcode, int defaultTarget) {
            super(opcode);
            this.defaultTarget = defaultTarget;
        }

        /**
         * Get the keys matched by this switch, in the same order as {@link #getTargets()}.
         *
         * @return The keys.
         */
        public abstract int[] getKeys();

        /**
         * Get the targets of each key, in the same order as {@link #getKeys()}.
         *
         * @return The targets.
         */
        public abstract int[] getTargets();

        @Override
        public boolean changesControlFlow() {
            return true;
        }

        @Override
        public boolean canFallThrough() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            if (!super.equals(o)) return false;
            Switch sw = (Switch) o;
            return defaultTarget == sw.defaultTarget
                    && Arrays.equals(getKeys(), sw.getKeys())
                    && Arrays.equals(getTargets(), sw.getTargets());
        }

        @Override
        public int hashCode() {
            return 31 * (31 * (31 * super.hashCode() + defaultTarget)
                    + Arrays.hashCode(getKeys())) + Arrays.hashCode(getTargets());
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder().append(opcode).append(" {");
            int[] keys = getKeys();
            int[] targets = getTargets();
            for (int i = 0; i < keys.length; i++) {
                sb.append(' ').append(keys[i]).append(": ").append(targets[i]).append(',');
            }
            return sb.append(" default: ").append(defaultTarget).append(" }").toString();
        }
    }

    /**
     * A {@code tableswitch} instruction.
     */
    public static final class TableSwitch extends Switch {
        public final int low;
        public final int high;
        private final int[] targets;

        TableSwitch(int defaultTarget, int low, int high, int[] targets) {
            super(Opcode.TABLESWITCH, defaultTarget);
            if (high < low || (long) high - low + 1 != targets.length) {
                throw new IllegalArgumentException(String.format(
                        "tableswitch range [%d, %d] does not match %d targets", low, high, targets.length));
            }
            this.low = low;
            this.high = high;
            this.targets = targets.clone();
        }

        @Override
        public int[] getKeys() {
            int[] keys = new int[targets.length];
            for (int i = 0; i < keys.length; i++) {
                keys[i] = low + i;
            }
            return keys;
        }

        @Override
        public int[] getTargets() {
            return targets.clone();
        }
    }

    /**
     * A {@code lookupswitch} instruction.
     */
    public static final class LookupSwitch extends Switch {
        private final int[] keys;
        private final int[] targets;

        LookupSwitch(int defaultTarget, int[] keys, int[] targets) {
            super(Opcode.LOOKUPSWITCH, defaultTarget);
            if (keys.length != targets.length) {
                throw new IllegalArgumentException("lookupswitch keys and targets differ in length");
            }
            this.keys = keys.clone();
            this.targets = targets.clone();
        }

        @Override
        public int[] getKeys() {
            return keys.clone();
        }

        @Override
        public int[] getTargets() {
            return targets.clone();
        }
    }

    /**
     * An instruction referring to a member or type in the constant pool.
     */
    public static final class Reference extends Instruction {
        public final int index;
        /**
         * The dimension count of {@code multianewarray}, the argument count of {@code invokeinterface},
         * and zero otherwise.
         */
        public final int count;

        Reference(Opcode opcode, int index, int count) {
            super(opcode);
            this.index = index;
            this.count = count;
        }

        @Override
        public boolean changesControlFlow() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            if (!super.equals(o)) return false;
            Reference ref = (Reference) o;
            return index == ref.index && count == ref.count;
        }

        @Override
        public int hashCode() {
            return 31 * (31 * super.hashCode() + index) + count;
        }

        @Override
        public String toString() {
            return count == 0 ? opcode + " #" + index : opcode + " #" + index + " " + count;
        }
    }

    /**
     * Collect the possible successors of the instruction at {@code index}, in order.
     * <p>
     * Conditional jumps yield their target first, then the fall-through.
     * Switches yield their case targets, then the default.
     *
     * @param index The index of the instruction in its list.
     * @param into  The list to add successors to.
     */
    public void successors(int index, List<Integer> into) {
        if (this instanceof Jump) {
            into.add(((Jump) this).target);
        } else if (this instanceof Switch) {
            for (int target : ((Switch) this).getTargets()) {
                into.add(target);
            }
            into.add(((Switch) this).defaultTarget);
        }
        if (canFallThrough()) {
            into.add(index + 1);
        }
    }
}
