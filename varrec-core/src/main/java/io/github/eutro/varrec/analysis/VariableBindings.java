package io.github.eutro.varrec.analysis;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The binding table of one function: code location to {@link Binding}.
 * <p>
 * Entries are only ever added or overwritten, never removed. A node with no entry simply
 * couldn't be resolved.
 */
public final class VariableBindings {
    private final SortedMap<CodeLocation, Binding> table = new TreeMap<>();

    void bind(CodeLocation location, Binding binding) {
        table.put(location, binding);
    }

    @Nullable
    public Binding get(CodeLocation location) {
        return table.get(location);
    }

    /**
     * Get the binding table, ordered by code location.
     *
     * @return An unmodifiable view of the table.
     */
    public Map<CodeLocation, Binding> asMap() {
        return Collections.unmodifiableSortedMap(table);
    }

    public int size() {
        return table.size();
    }

    public boolean isEmpty() {
        return table.isEmpty();
    }
}
