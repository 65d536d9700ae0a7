package io.github.eutro.jvmjit.cfg;

import io.github.eutro.jvmjit.JitException;
import io.github.eutro.jvmjit.Signature;
import io.github.eutro.jvmjit.classfile.ConstantPool;
import io.github.eutro.jvmjit.classfile.code.Code;
import io.github.eutro.jvmjit.classfile.code.Instruction;
import io.github.eutro.jvmjit.util.GraphWalker;

import java.util.*;

/**
 * Splits a method's code into basic blocks and computes the frame shape on entry to each.
 * <p>
 * Entry shapes are computed to a fixed point over the whole graph before any block is translated,
 * so loop headers get their final shape before any of their predecessors are visited.
 */
public final class ControlFlowBuilder {
    private final Code code;
    private final Signature signature;
    private final ConstantPool pool;
    private final List<Instruction> insns;

    private ControlFlowBuilder(Code code, Signature signature, ConstantPool pool) {
        this.code = code;
        this.signature = signature;
        this.pool = pool;
        this.insns = code.getInstructions();
    }

    /**
     * Build the control flow graph of a method.
     *
     * @param code      The method's code.
     * @param signature The method's signature, which gives the types of the initial locals.
     * @param pool      The constant pool of the method's class.
     * @return The graph.
     */
    public static ControlFlowGraph build(Code code, Signature signature, ConstantPool pool) {
        return new ControlFlowBuilder(code, signature, pool).build();
    }

    private ControlFlowGraph build() {
        if (insns.isEmpty()) {
            throw new JitException.Internal("method has no instructions");
        }
        NavigableSet<Integer> leaders = findLeaders();
        Map<Integer, List<Integer>> successors = new HashMap<>();
        for (int start : leaders) {
            successors.put(start, blockSuccessors(blockEnd(leaders, start)));
        }

        List<Integer> order = new GraphWalker<>(0, successors::get).reversePostOrder();
        Map<Integer, Integer> position = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            position.put(order.get(i), i);
        }

        Map<Integer, List<Integer>> predecessors = new HashMap<>();
        Set<Integer> loopHeaders = new HashSet<>();
        for (int start : order) {
            predecessors.put(start, new ArrayList<>());
        }
        for (int start : order) {
            for (int succ : successors.get(start)) {
                predecessors.get(succ).add(start);
                if (position.get(succ) <= position.get(start)) {
                    loopHeaders.add(succ);
                }
            }
        }

        Map<Integer, FrameShape> shapes = computeShapes(leaders, successors, order);

        List<BytecodeBlock> blocks = new ArrayList<>();
        for (int start : order) {
            int end = blockEnd(leaders, start);
            List<Integer> preds = predecessors.get(start);
            Collections.sort(preds);
            blocks.add(new BytecodeBlock(
                    start,
                    end,
                    new ArrayList<>(insns.subList(start, end)),
                    successors.get(start),
                    preds,
                    shapes.get(start),
                    loopHeaders.contains(start)));
        }
        return new ControlFlowGraph(blocks);
    }

    private NavigableSet<Integer> findLeaders() {
        NavigableSet<Integer> leaders = new TreeSet<>();
        leaders.add(0);
        List<Integer> targets = new ArrayList<>();
        for (int i = 0; i < insns.size(); i++) {
            Instruction insn = insns.get(i);
            if (!insn.changesControlFlow()) continue;
            targets.clear();
            insn.successors(i, targets);
            for (int target : targets) {
                checkTarget(i, target);
                leaders.add(target);
            }
            if (i + 1 < insns.size()) {
                leaders.add(i + 1);
            }
        }
        return leaders;
    }

    private void checkTarget(int from, int target) {
        if (target == insns.size()) {
            throw new JitException.Internal("control falls off the end of the code at " + from);
        }
        if (target < 0 || target > insns.size()) {
            throw new JitException.Internal(String.format("jump from %d to %d is outside the code", from, target));
        }
    }

    private int blockEnd(NavigableSet<Integer> leaders, int start) {
        Integer next = leaders.higher(start);
        return next == null ? insns.size() : next;
    }

    private List<Integer> blockSuccessors(int end) {
        int last = end - 1;
        List<Integer> targets = new ArrayList<>();
        insns.get(last).successors(last, targets);
        for (int target : targets) {
            checkTarget(last, target);
        }
        return new ArrayList<>(new LinkedHashSet<>(targets));
    }

    private FrameShape initialShape() {
        int maxLocals = code.maxLocals;
        if (signature.getParameterSlots() > maxLocals) {
            throw new JitException.InvalidLocalVariableIndex(signature.getParameterSlots() - 1);
        }
        List<StackType> locals = new ArrayList<>(Collections.nCopies(maxLocals, (StackType) null));
        int slot = 0;
        for (StackType type : signature.getParameterTypes()) {
            locals.set(slot, type);
            slot += type.category;
        }
        return new FrameShape(Collections.emptyList(), locals);
    }

    private Map<Integer, FrameShape> computeShapes(NavigableSet<Integer> leaders,
                                                   Map<Integer, List<Integer>> successors,
                                                   List<Integer> order) {
        Map<Integer, FrameShape> shapes = new HashMap<>();
        shapes.put(0, initialShape());
        Deque<Integer> worklist = new ArrayDeque<>();
        Set<Integer> queued = new HashSet<>();
        worklist.add(0);
        queued.add(0);
        while (!worklist.isEmpty()) {
            int start = worklist.removeFirst();
            queued.remove(start);
            TypeFrame frame = shapes.get(start).toFrame();
            int end = blockEnd(leaders, start);
            for (int i = start; i < end; i++) {
                StackEffects.simulate(frame, insns.get(i), pool);
            }
            FrameShape exit = frame.toShape();
            for (int succ : successors.get(start)) {
                FrameShape old = shapes.get(succ);
                FrameShape merged = old == null ? exit : old.merge(exit, succ);
                if (merged != old) {
                    shapes.put(succ, merged);
                    if (queued.add(succ)) {
                        worklist.addLast(succ);
                    }
                }
            }
        }
        if (shapes.size() != order.size()) {
            throw new JitException.Internal("entry shapes do not cover the reachable blocks");
        }
        return shapes;
    }
}
