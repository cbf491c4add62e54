package io.github.eutro.varrec.unify;

import io.github.eutro.varrec.analysis.Binding;
import io.github.eutro.varrec.analysis.SSAVariable;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The partition of one function's SSA variables into {@link UnifiedVariable}s.
 */
public final class UnificationResult {
    private final List<UnifiedVariable> unified;
    private final Map<SSAVariable, UnifiedVariable> byMember = new IdentityHashMap<>();

    UnificationResult(List<UnifiedVariable> unified) {
        this.unified = Collections.unmodifiableList(unified);
        for (UnifiedVariable uv : unified) {
            for (SSAVariable member : uv.getMembers()) {
                byMember.put(member, uv);
            }
        }
    }

    /**
     * Get the unified variables, ordered by id.
     *
     * @return The unified variables.
     */
    public List<UnifiedVariable> getUnified() {
        return unified;
    }

    /**
     * Find the unified variable an SSA variable belongs to.
     *
     * @param var The SSA variable.
     * @return The unified variable.
     * @throws IllegalArgumentException If the variable was not part of the unified function.
     */
    public UnifiedVariable lookup(SSAVariable var) {
        UnifiedVariable uv = byMember.get(var);
        if (uv == null) {
            throw new IllegalArgumentException(String.format("%s was not unified here", var));
        }
        return uv;
    }

    /**
     * Map the variables of a binding to their unified variables.
     *
     * @param binding The binding.
     * @return The unified variables, which is empty for an unresolved binding.
     */
    public Set<UnifiedVariable> resolve(Binding binding) {
        Set<UnifiedVariable> set = new LinkedHashSet<>();
        for (SSAVariable var : binding.getVariables()) {
            set.add(lookup(var));
        }
        return set;
    }

    public int size() {
        return unified.size();
    }
}
