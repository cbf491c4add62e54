package io.github.eutro.varrec.analysis;

import io.github.eutro.varrec.constraints.ConstraintEmitter;
import io.github.eutro.varrec.constraints.TypeConstraint;
import io.github.eutro.varrec.ir.BasicBlock;
import io.github.eutro.varrec.unify.UnificationResult;
import io.github.eutro.varrec.unify.UnifiedVariable;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything recovered from one function: its status, variables, bindings, type constraints,
 * block boundary states and, once unified, its unified variables.
 * <p>
 * Instances are built by {@link VariableRecovery} and are not modified afterwards, except for
 * having a {@link UnificationResult} attached.
 */
public final class FunctionRecovery {
    public final String functionName;

    private AnalysisStatus status = AnalysisStatus.RUNNING;
    @Nullable
    private BasicBlock degradedBlock;
    @Nullable
    private RuntimeException failure;
    @Nullable
    private UnificationResult unification;

    final VariableAllocator allocator = new VariableAllocator();
    final VariableBindings bindings = new VariableBindings();
    final ConstraintEmitter emitter = new ConstraintEmitter();
    final Map<BasicBlock, AbstractState> inStates = new IdentityHashMap<>();
    final Map<BasicBlock, AbstractState> outStates = new IdentityHashMap<>();

    public FunctionRecovery(String functionName) {
        this.functionName = functionName;
    }

    void converge() {
        transition(AnalysisStatus.CONVERGED);
    }

    void degrade(BasicBlock block) {
        transition(AnalysisStatus.DEGRADED);
        degradedBlock = block;
    }

    /**
     * Mark this recovery as failed, discarding everything computed so far.
     *
     * @param cause The reason.
     */
    public void fail(RuntimeException cause) {
        transition(AnalysisStatus.FAILED);
        failure = cause;
        inStates.clear();
        outStates.clear();
    }

    private void transition(AnalysisStatus to) {
        if (status != AnalysisStatus.RUNNING) {
            throw new IllegalStateException(String.format("%s: cannot move from %s to %s", functionName, status, to));
        }
        status = to;
    }

    public AnalysisStatus getStatus() {
        return status;
    }

    /**
     * Get the block that exceeded the visit ceiling, if this recovery is {@link AnalysisStatus#DEGRADED}.
     *
     * @return The block, or null.
     */
    @Nullable
    public BasicBlock getDegradedBlock() {
        return degradedBlock;
    }

    @Nullable
    public RuntimeException getFailure() {
        return failure;
    }

    public List<SSAVariable> getVariables() {
        return status == AnalysisStatus.FAILED ? Collections.emptyList() : allocator.getAllocated();
    }

    public VariableBindings getBindings() {
        return status == AnalysisStatus.FAILED ? new VariableBindings() : bindings;
    }

    public List<TypeConstraint<?>> getConstraints() {
        return status == AnalysisStatus.FAILED ? Collections.emptyList() : emitter.getConstraints();
    }

    /**
     * Get the state at entry to a block.
     *
     * @param block The block.
     * @return The state, or null if the block was never evaluated.
     */
    @Nullable
    public AbstractState getInState(BasicBlock block) {
        return inStates.get(block);
    }

    @Nullable
    public AbstractState getOutState(BasicBlock block) {
        return outStates.get(block);
    }

    public void setUnification(UnificationResult unification) {
        if (!status.hasResults()) {
            throw new IllegalStateException(String.format("%s: cannot unify a %s recovery", functionName, status));
        }
        this.unification = unification;
    }

    @Nullable
    public UnificationResult getUnification() {
        return unification;
    }

    /**
     * Get the unification result, which must already have been computed.
     *
     * @return The unification result.
     * @throws IllegalStateException If this recovery was not unified.
     */
    public UnificationResult getUnificationOrThrow() {
        if (unification == null) {
            throw new IllegalStateException(String.format("%s (%s) has not been unified", functionName, status));
        }
        return unification;
    }

    /**
     * Get the unified variables bound at a code location.
     *
     * @param location The location.
     * @return The unified variables, empty if nothing is bound there.
     */
    public Set<UnifiedVariable> unifiedAt(CodeLocation location) {
        Binding binding = getBindings().get(location);
        if (binding == null) return Collections.emptySet();
        return getUnificationOrThrow().resolve(binding);
    }

    /**
     * Render this recovery as human-readable text, for debugging.
     *
     * @return The text.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("function ").append(functionName).append(": ").append(status);
        if (degradedBlock != null) {
            sb.append(" at ").append(degradedBlock.toTargetString());
        }
        if (failure != null) {
            sb.append(" (").append(failure.getMessage()).append(")");
        }
        sb.append('\n');
        if (status == AnalysisStatus.FAILED) return sb.toString();

        sb.append("variables:\n");
        for (SSAVariable var : getVariables()) {
            sb.append("  ").append(var).append('\n');
        }
        sb.append("bindings:\n");
        for (Map.Entry<CodeLocation, Binding> entry : bindings.asMap().entrySet()) {
            sb.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        if (unification != null) {
            sb.append("unified:\n");
            for (UnifiedVariable uv : unification.getUnified()) {
                sb.append("  ").append(uv.name()).append(" = ").append(uv.getMembers());
                if (uv.hasConflicts()) {
                    sb.append(" !").append(uv.getConflicts());
                }
                sb.append('\n');
            }
        }
        sb.append("constraints:\n");
        for (TypeConstraint<?> constraint : getConstraints()) {
            sb.append("  ").append(constraint).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "FunctionRecovery(" + functionName + ", " + status + ")";
    }
}
