package io.github.eutro.varrec.unify;

import com.google.common.collect.Range;
import io.github.eutro.varrec.analysis.SSAVariable;
import io.github.eutro.varrec.analysis.StorageLocation;
import io.github.eutro.varrec.analysis.VariableKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partitions the SSA variables of one function into unified variables.
 * <p>
 * Register variables unify by register name, and temporaries by block and id. Stack variables unify
 * when their windows share at least one byte, transitively; windows that merely touch stay apart.
 * <p>
 * The result depends only on the set of variables, so unifying the same variables twice gives the
 * same partition.
 */
public final class Unifier {
    private static final Comparator<SSAVariable> BY_SITE = Comparator
            .comparing((SSAVariable v) -> v.site)
            .thenComparingInt(v -> v.id);
    private static final Comparator<SSAVariable> BY_WINDOW = Comparator
            .comparingLong((SSAVariable v) -> ((StorageLocation.Stack) v.location).offset)
            .thenComparingInt(v -> ((StorageLocation.Stack) v.location).size)
            .thenComparingInt(v -> v.id);

    private Unifier() {
    }

    public static UnificationResult unify(Collection<SSAVariable> variables) {
        DisjointSet<SSAVariable> sets = new DisjointSet<>();
        Map<StorageLocation, SSAVariable> firstAt = new LinkedHashMap<>();
        List<SSAVariable> stack = new ArrayList<>();
        List<SSAVariable> sorted = new ArrayList<>(variables);
        sorted.sort(Comparator.comparingInt(v -> v.id));

        for (SSAVariable var : sorted) {
            sets.add(var);
            if (var.kind() == VariableKind.STACK) {
                stack.add(var);
            } else {
                SSAVariable first = firstAt.putIfAbsent(var.location, var);
                if (first != null) sets.union(first, var);
            }
        }

        // sweep by start offset; a window joins the open cluster if it starts before the cluster ends
        stack.sort(BY_WINDOW);
        SSAVariable clusterHead = null;
        long clusterEnd = Long.MIN_VALUE;
        for (SSAVariable var : stack) {
            StorageLocation.Stack loc = (StorageLocation.Stack) var.location;
            if (clusterHead != null && loc.offset < clusterEnd) {
                sets.union(clusterHead, var);
                clusterEnd = Math.max(clusterEnd, loc.end());
            } else {
                clusterHead = var;
                clusterEnd = loc.end();
            }
        }

        List<List<SSAVariable>> classes = sets.sets();
        classes.sort(Comparator.comparing(Unifier::representativeOf, BY_SITE));
        List<UnifiedVariable> unified = new ArrayList<>(classes.size());
        for (List<SSAVariable> members : classes) {
            members.sort(Comparator.comparingInt(v -> v.id));
            SSAVariable rep = representativeOf(members);
            StorageLocation location;
            List<OverlapConflict> conflicts;
            if (rep.kind() == VariableKind.STACK) {
                location = span(members);
                conflicts = conflicts(members);
            } else {
                location = rep.location;
                conflicts = new ArrayList<>();
            }
            unified.add(new UnifiedVariable(unified.size(), location, rep, members, conflicts));
        }
        return new UnificationResult(unified);
    }

    private static SSAVariable representativeOf(List<SSAVariable> members) {
        SSAVariable best = members.get(0);
        for (SSAVariable v : members) {
            if (BY_SITE.compare(v, best) < 0) best = v;
        }
        return best;
    }

    private static StorageLocation.Stack span(List<SSAVariable> members) {
        Range<Long> span = null;
        for (SSAVariable v : members) {
            Range<Long> window = ((StorageLocation.Stack) v.location).window();
            span = span == null ? window : span.span(window);
        }
        return StorageLocation.Stack.ofWindow(span);
    }

    private static List<OverlapConflict> conflicts(List<SSAVariable> members) {
        Set<StorageLocation.Stack> windowSet = new LinkedHashSet<>();
        List<SSAVariable> byWindow = new ArrayList<>(members);
        byWindow.sort(BY_WINDOW);
        for (SSAVariable v : byWindow) {
            windowSet.add((StorageLocation.Stack) v.location);
        }
        List<StorageLocation.Stack> windows = new ArrayList<>(windowSet);
        List<OverlapConflict> conflicts = new ArrayList<>();
        for (int i = 0; i < windows.size(); i++) {
            for (int j = i + 1; j < windows.size(); j++) {
                StorageLocation.Stack a = windows.get(i);
                StorageLocation.Stack b = windows.get(j);
                if (overlaps(a.window(), b.window())) {
                    conflicts.add(OverlapConflict.between(a, b));
                }
            }
        }
        return conflicts;
    }

    static boolean overlaps(Range<Long> a, Range<Long> b) {
        return a.isConnected(b) && !a.intersection(b).isEmpty();
    }
}
