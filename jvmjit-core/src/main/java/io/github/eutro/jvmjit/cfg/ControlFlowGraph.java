package io.github.eutro.jvmjit.cfg;

import io.github.eutro.jvmjit.JitException;

import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * The reachable blocks of a method, in reverse post-order from the entry block.
 */
public final class ControlFlowGraph {
    private final List<BytecodeBlock> blocks;
    private final NavigableMap<Integer, BytecodeBlock> byStart = new TreeMap<>();

    ControlFlowGraph(List<BytecodeBlock> blocks) {
        this.blocks = Collections.unmodifiableList(blocks);
        for (BytecodeBlock block : blocks) {
            byStart.put(block.getStart(), block);
        }
    }

    /**
     * Get the blocks in reverse post-order. Every block comes after all of its predecessors
     * except those that reach it along a back edge.
     *
     * @return The blocks.
     */
    public List<BytecodeBlock> getBlocks() {
        return blocks;
    }

    public BytecodeBlock getEntry() {
        return blocks.get(0);
    }

    /**
     * Get the block that starts at an instruction index.
     *
     * @param start The index.
     * @return The block.
     * @throws JitException.Internal If no reachable block starts there.
     */
    public BytecodeBlock getBlock(int start) {
        BytecodeBlock block = byStart.get(start);
        if (block == null) {
            throw new JitException.Internal("no block starts at " + start);
        }
        return block;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (BytecodeBlock block : byStart.values()) {
            sb.append(block).append(' ').append(block.getEntryShape()).append('\n');
        }
        return sb.toString();
    }
}
