package io.github.eutro.varrec.unify;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A union-find forest over elements with path compression and union by rank.
 *
 * @param <T> The type of elements.
 */
public final class DisjointSet<T> {
    private final Map<T, T> parent = new LinkedHashMap<>();
    private final Map<T, Integer> rank = new HashMap<>();

    public void add(T elt) {
        if (!parent.containsKey(elt)) {
            parent.put(elt, elt);
            rank.put(elt, 0);
        }
    }

    public T find(T elt) {
        T p = parent.get(elt);
        if (p == null) {
            throw new IllegalArgumentException("not an element: " + elt);
        }
        if (p.equals(elt)) return p;
        T root = find(p);
        parent.put(elt, root);
        return root;
    }

    /**
     * Merge the sets containing two elements, adding them if necessary.
     *
     * @param a The first element.
     * @param b The second element.
     * @return The root of the merged set.
     */
    public T union(T a, T b) {
        add(a);
        add(b);
        T ra = find(a);
        T rb = find(b);
        if (ra.equals(rb)) return ra;
        int rankA = rank.get(ra);
        int rankB = rank.get(rb);
        if (rankA < rankB) {
            parent.put(ra, rb);
            return rb;
        }
        parent.put(rb, ra);
        if (rankA == rankB) rank.put(ra, rankA + 1);
        return ra;
    }

    public boolean sameSet(T a, T b) {
        return find(a).equals(find(b));
    }

    /**
     * Get the sets, each in insertion order, ordered by their first inserted element.
     *
     * @return The sets.
     */
    public List<List<T>> sets() {
        Map<T, List<T>> byRoot = new LinkedHashMap<>();
        for (T elt : new ArrayList<>(parent.keySet())) {
            byRoot.computeIfAbsent(find(elt), $ -> new ArrayList<>()).add(elt);
        }
        return new ArrayList<>(byRoot.values());
    }
}
