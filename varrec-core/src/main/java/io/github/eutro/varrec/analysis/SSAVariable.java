package io.github.eutro.varrec.analysis;

import org.jetbrains.annotations.NotNull;

/**
 * An SSA variable: one definition of one storage location.
 * <p>
 * Variables have identity semantics. Two variables are equal only if they are the same
 * allocation from the same {@link VariableAllocator}.
 */
public final class SSAVariable implements Comparable<SSAVariable> {
    /**
     * Allocation order within the owning function's analysis.
     */
    public final int id;
    @NotNull
    public final StorageLocation location;
    /**
     * The statement that defines this variable, or for an {@link #input} variable, the node that first read it.
     */
    @NotNull
    public final CodeLocation site;
    public final int size;
    /**
     * Whether this variable stands for a value the location held before any definition the analysis saw.
     */
    public final boolean input;

    SSAVariable(int id, @NotNull StorageLocation location, @NotNull CodeLocation site, int size, boolean input) {
        this.id = id;
        this.location = location;
        this.site = site;
        this.size = size;
        this.input = input;
    }

    public VariableKind kind() {
        return location.kind();
    }

    @Override
    public int compareTo(@NotNull SSAVariable o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public String toString() {
        return "v" + id + "(" + location + (input ? " in@" : " @") + site + ")";
    }
}
