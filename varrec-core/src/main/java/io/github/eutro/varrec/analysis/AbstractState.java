package io.github.eutro.varrec.analysis;

import io.github.eutro.varrec.conf.FrameLayout;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The abstract state at a block boundary.
 * <p>
 * Maps each storage location to the SSA variables that may hold its current value, and tracks
 * which locations hold a known frame-relative address. The stack pointer delta is the frame
 * offset of the stack pointer register.
 * <p>
 * {@link #join} unions the variable sets and keeps only frame offsets both sides agree on, which
 * makes it commutative, associative, idempotent and monotonic.
 */
public final class AbstractState {
    private final Map<StorageLocation, Set<SSAVariable>> vars;
    private final Map<StorageLocation, Long> frameOffsets;

    private AbstractState(Map<StorageLocation, Set<SSAVariable>> vars, Map<StorageLocation, Long> frameOffsets) {
        this.vars = vars;
        this.frameOffsets = frameOffsets;
    }

    public static AbstractState empty() {
        return new AbstractState(new HashMap<>(), new HashMap<>());
    }

    /**
     * Create the state at function entry: nothing bound, and a stack pointer delta of 0.
     *
     * @param layout The frame layout.
     * @return The entry state.
     */
    public static AbstractState entry(FrameLayout layout) {
        AbstractState state = empty();
        state.frameOffsets.put(StorageLocation.register(layout.stackPointer), 0L);
        return state;
    }

    public AbstractState copy() {
        Map<StorageLocation, Set<SSAVariable>> varsCopy = new HashMap<>();
        for (Map.Entry<StorageLocation, Set<SSAVariable>> entry : vars.entrySet()) {
            varsCopy.put(entry.getKey(), new TreeSet<>(entry.getValue()));
        }
        return new AbstractState(varsCopy, new HashMap<>(frameOffsets));
    }

    /**
     * Get the variables that may hold the value of {@code location}.
     *
     * @param location The location.
     * @return The variables, ordered by id; empty if the location is unbound.
     */
    public Set<SSAVariable> lookup(StorageLocation location) {
        Set<SSAVariable> set = vars.get(location);
        return set == null ? Collections.emptySet() : Collections.unmodifiableSet(set);
    }

    public boolean isBound(StorageLocation location) {
        return vars.containsKey(location);
    }

    /**
     * Record a definition, replacing whatever the location held.
     *
     * @param location The location.
     * @param var      The defining variable.
     */
    public void define(StorageLocation location, SSAVariable var) {
        Set<SSAVariable> set = new TreeSet<>();
        set.add(var);
        vars.put(location, set);
    }

    /**
     * Add a variable to the set a location may hold, without removing any.
     *
     * @param location The location.
     * @param var      The variable.
     */
    public void include(StorageLocation location, SSAVariable var) {
        vars.computeIfAbsent(location, $ -> new TreeSet<>()).add(var);
    }

    /**
     * Forget everything about a location.
     *
     * @param location The location.
     */
    public void kill(StorageLocation location) {
        vars.remove(location);
        frameOffsets.remove(location);
    }

    @Nullable
    public Long frameOffset(StorageLocation location) {
        return frameOffsets.get(location);
    }

    public void setFrameOffset(StorageLocation location, @Nullable Long offset) {
        if (offset == null) {
            frameOffsets.remove(location);
        } else {
            frameOffsets.put(location, offset);
        }
    }

    @Nullable
    public Long stackPointerDelta(FrameLayout layout) {
        return frameOffset(StorageLocation.register(layout.stackPointer));
    }

    /**
     * Drop every temporary. Temporaries don't outlive their block.
     */
    public void dropTemporaries() {
        vars.keySet().removeIf(loc -> loc.kind() == VariableKind.TEMPORARY);
        frameOffsets.keySet().removeIf(loc -> loc.kind() == VariableKind.TEMPORARY);
    }

    public Set<StorageLocation> locations() {
        return Collections.unmodifiableSet(vars.keySet());
    }

    /**
     * Join two states into a new one, leaving both untouched.
     *
     * @param other The other state.
     * @return The join.
     */
    public AbstractState join(AbstractState other) {
        AbstractState joined = copy();
        for (Map.Entry<StorageLocation, Set<SSAVariable>> entry : other.vars.entrySet()) {
            joined.vars.computeIfAbsent(entry.getKey(), $ -> new TreeSet<>()).addAll(entry.getValue());
        }
        joined.frameOffsets.entrySet().removeIf(entry ->
                !entry.getValue().equals(other.frameOffsets.get(entry.getKey())));
        return joined;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AbstractState)) return false;
        AbstractState that = (AbstractState) o;
        return vars.equals(that.vars) && frameOffsets.equals(that.frameOffsets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vars, frameOffsets);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        List<StorageLocation> locs = new ArrayList<>(vars.keySet());
        locs.sort(Comparator.comparing(StorageLocation::toString));
        for (StorageLocation loc : locs) {
            sb.append("\n  ").append(loc).append(" -> ").append(vars.get(loc));
        }
        for (Map.Entry<StorageLocation, Long> entry : frameOffsets.entrySet()) {
            sb.append("\n  ").append(entry.getKey()).append(" = frame").append(entry.getValue() >= 0 ? "+" : "").append(entry.getValue());
        }
        return sb.append(vars.isEmpty() && frameOffsets.isEmpty() ? "}" : "\n}").toString();
    }
}
