package io.github.eutro.varrec.util;

import io.github.eutro.varrec.ir.BasicBlock;
import io.github.eutro.varrec.ir.Function;

import java.util.*;

/**
 * A class for walking a graph depth-first, in post-order.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    final T root;
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     * <p>
     * Successors are descended into in the order the successor function yields them.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the blocks of a function, starting at the entry.
     *
     * @param func The function.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(Function func) {
        return new GraphWalker<>(func.getEntry(), $ -> $.successors);
    }

    public interface Order<T> extends Iterable<T> {
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
     * Get the reverse post-order of the graph, which visits every node before
     * its successors, except along back edges.
     *
     * @return The nodes in reverse post-order.
     */
    public List<T> reversePostOrder() {
        List<T> ls = postOrder().toList();
        Collections.reverse(ls);
        return ls;
    }

    private class PostIter implements Iterator<T> {
        private final Deque<Iterator<? extends T>> children = new ArrayDeque<>();
        private final Deque<T> path = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            enter(root);
        }

        private void enter(T node) {
            seen.add(node);
            path.addLast(node);
            children.addLast(getChildren.apply(node).iterator());
        }

        @Override
        public boolean hasNext() {
            return !path.isEmpty();
        }

        @Override
        public T next() {
            if (path.isEmpty()) throw new NoSuchElementException();
            while (true) {
                Iterator<? extends T> it = children.getLast();
                if (it.hasNext()) {
                    T child = it.next();
                    if (!seen.contains(child)) {
                        enter(child);
                    }
                } else {
                    children.removeLast();
                    return path.removeLast();
                }
            }
        }
    }
}
