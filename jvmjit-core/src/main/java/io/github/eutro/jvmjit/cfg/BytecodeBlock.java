package io.github.eutro.jvmjit.cfg;

import io.github.eutro.jvmjit.classfile.code.Instruction;

import java.util.Collections;
import java.util.List;

/**
 * A maximal run of instructions with a single entry at its first instruction and a single exit at its last.
 * <p>
 * Blocks are identified by the index of their first instruction.
 */
public final class BytecodeBlock {
    private final int start;
    private final int end;
    private final List<Instruction> instructions;
    private final List<Integer> successors;
    private final List<Integer> predecessors;
    private final FrameShape entryShape;
    private final boolean loopHeader;

    BytecodeBlock(int start,
                  int end,
                  List<Instruction> instructions,
                  List<Integer> successors,
                  List<Integer> predecessors,
                  FrameShape entryShape,
                  boolean loopHeader) {
        this.start = start;
        this.end = end;
        this.instructions = Collections.unmodifiableList(instructions);
        this.successors = Collections.unmodifiableList(successors);
        this.predecessors = Collections.unmodifiableList(predecessors);
        this.entryShape = entryShape;
        this.loopHeader = loopHeader;
    }

    public int getStart() {
        return start;
    }

    /**
     * Get the index after the last instruction of this block.
     *
     * @return The exclusive end index.
     */
    public int getEnd() {
        return end;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    /**
     * Get the starts of the blocks control can pass to from this one.
     * <p>
     * For a conditional jump this is the target and then the fall-through,
     * for a switch the distinct case targets and then the default, if it is distinct.
     *
     * @return The successors.
     */
    public List<Integer> getSuccessors() {
        return successors;
    }

    /**
     * Get the starts of the reachable blocks that can pass control to this one, in ascending order.
     *
     * @return The predecessors.
     */
    public List<Integer> getPredecessors() {
        return predecessors;
    }

    public FrameShape getEntryShape() {
        return entryShape;
    }

    /**
     * Whether this block is the target of a back edge.
     *
     * @return Whether this is a loop header.
     */
    public boolean isLoopHeader() {
        return loopHeader;
    }

    @Override
    public String toString() {
        return String.format("block[%d, %d) -> %s", start, end, successors);
    }
}
