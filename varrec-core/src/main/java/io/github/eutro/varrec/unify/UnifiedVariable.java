package io.github.eutro.varrec.unify;

import io.github.eutro.varrec.analysis.SSAVariable;
import io.github.eutro.varrec.analysis.StorageLocation;
import io.github.eutro.varrec.analysis.VariableKind;

import java.util.Collections;
import java.util.List;

/**
 * An equivalence class of SSA variables that denote one source-level variable.
 * <p>
 * For stack variables {@link #location} is the span of every member's window.
 */
public final class UnifiedVariable {
    public final int id;
    public final StorageLocation location;
    /**
     * The member with the earliest defining site, ties broken by id.
     */
    public final SSAVariable representative;
    private final List<SSAVariable> members;
    private final List<OverlapConflict> conflicts;

    UnifiedVariable(
            int id,
            StorageLocation location,
            SSAVariable representative,
            List<SSAVariable> members,
            List<OverlapConflict> conflicts
    ) {
        this.id = id;
        this.location = location;
        this.representative = representative;
        this.members = Collections.unmodifiableList(members);
        this.conflicts = Collections.unmodifiableList(conflicts);
    }

    public VariableKind kind() {
        return location.kind();
    }

    /**
     * Get the members, ordered by id.
     *
     * @return The members.
     */
    public List<SSAVariable> getMembers() {
        return members;
    }

    public List<OverlapConflict> getConflicts() {
        return conflicts;
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    /**
     * Get a display name for this variable, derived from its location.
     * <p>
     * Registers are {@code r_<name>}, temporaries {@code t<block>_<id>}. Stack variables below the
     * frame base are {@code var_<hex distance>}, and those at or above it {@code arg_<hex offset>}.
     *
     * @return The name.
     */
    public String name() {
        if (location instanceof StorageLocation.Register) {
            return "r_" + ((StorageLocation.Register) location).name;
        }
        if (location instanceof StorageLocation.Temp) {
            StorageLocation.Temp temp = (StorageLocation.Temp) location;
            return "t" + temp.block + "_" + temp.id;
        }
        long offset = ((StorageLocation.Stack) location).offset;
        return offset < 0
                ? "var_" + Long.toHexString(-offset)
                : "arg_" + Long.toHexString(offset);
    }

    @Override
    public String toString() {
        return name() + "#" + id + members;
    }
}
