package io.github.eutro.jvmjit.util;

import io.github.eutro.jvmjit.ssa.BasicBlock;
import io.github.eutro.jvmjit.ssa.BlockCall;
import io.github.eutro.jvmjit.ssa.FunctionBody;

import java.util.*;
import java.util.function.Function;

/**
 * A class for walking a graph depth-first, in post-order.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    final T root;
    final Function<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     * <p>
     * Children are visited in the order the successor function yields them.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, Function<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the basic blocks in a {@link FunctionBody}.
     * <p>
     * In the {@link #reversePostOrder() reverse post-order}, the last target of a jump comes directly
     * after the jumping block unless it was reached earlier.
     *
     * @param func The function whose blocks should be iterated over.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(FunctionBody func) {
        return new GraphWalker<>(func.blocks.get(0), $ -> {
            List<BasicBlock> targets = new ArrayList<>();
            for (BlockCall call : $.getControl().targets) {
                targets.add(call.target);
            }
            return targets;
        });
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The elements of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    public Order<T> postOrder() {
        return PostIter::new;
    }

    /**
     * Get the reverse post-order of the graph, in which every node comes before its successors,
     * except along back edges.
     *
     * @return The nodes in reverse post-order.
     */
    public List<T> reversePostOrder() {
        List<T> order = postOrder().toList();
        Collections.reverse(order);
        return order;
    }

    private class PostIter implements Iterator<T> {
        private final Deque<T> nodes = new ArrayDeque<>();
        private final Deque<Iterator<? extends T>> children = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            push(root);
        }

        private void push(T node) {
            seen.add(node);
            nodes.addLast(node);
            children.addLast(getChildren.apply(node).iterator());
        }

        @Override
        public boolean hasNext() {
            return !nodes.isEmpty();
        }

        @Override
        public T next() {
            if (nodes.isEmpty()) throw new NoSuchElementException();
            while (true) {
                Iterator<? extends T> it = children.getLast();
                if (it.hasNext()) {
                    T child = it.next();
                    if (!seen.contains(child)) {
                        push(child);
                    }
                } else {
                    children.removeLast();
                    return nodes.removeLast();
                }
            }
        }
    }
}
