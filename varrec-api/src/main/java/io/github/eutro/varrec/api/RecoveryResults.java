package io.github.eutro.varrec.api;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import io.github.eutro.varrec.analysis.AnalysisStatus;
import io.github.eutro.varrec.analysis.Binding;
import io.github.eutro.varrec.analysis.CodeLocation;
import io.github.eutro.varrec.analysis.FunctionRecovery;
import io.github.eutro.varrec.analysis.SSAVariable;
import io.github.eutro.varrec.constraints.TypeConstraint;
import io.github.eutro.varrec.unify.UnificationResult;
import io.github.eutro.varrec.unify.UnifiedVariable;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The aggregated results of a batch.
 * <p>
 * Per-function data is keyed by function name, and variables by function name and their
 * id within that function.
 */
public final class RecoveryResults {
    private final ImmutableMap<String, FunctionRecovery> recoveries;
    private final ImmutableTable<String, Integer, SSAVariable> variables;
    private final ImmutableTable<String, Integer, UnifiedVariable> unified;
    private final ImmutableTable<String, CodeLocation, Binding> bindings;
    private final ImmutableListMultimap<String, TypeConstraint<?>> constraints;

    private RecoveryResults(
            ImmutableMap<String, FunctionRecovery> recoveries,
            ImmutableTable<String, Integer, SSAVariable> variables,
            ImmutableTable<String, Integer, UnifiedVariable> unified,
            ImmutableTable<String, CodeLocation, Binding> bindings,
            ImmutableListMultimap<String, TypeConstraint<?>> constraints
    ) {
        this.recoveries = recoveries;
        this.variables = variables;
        this.unified = unified;
        this.bindings = bindings;
        this.constraints = constraints;
    }

    /**
     * Merge finished recoveries, which must have distinct function names.
     *
     * @param recoveries The recoveries, in submission order.
     * @return The aggregated results.
     */
    public static RecoveryResults aggregate(List<FunctionRecovery> recoveries) {
        ImmutableMap.Builder<String, FunctionRecovery> byName = ImmutableMap.builder();
        ImmutableTable.Builder<String, Integer, SSAVariable> variables = ImmutableTable.builder();
        ImmutableTable.Builder<String, Integer, UnifiedVariable> unified = ImmutableTable.builder();
        ImmutableTable.Builder<String, CodeLocation, Binding> bindings = ImmutableTable.builder();
        ImmutableListMultimap.Builder<String, TypeConstraint<?>> constraints = ImmutableListMultimap.builder();

        for (FunctionRecovery recovery : recoveries) {
            String name = recovery.functionName;
            byName.put(name, recovery);
            for (SSAVariable var : recovery.getVariables()) {
                variables.put(name, var.id, var);
            }
            UnificationResult unification = recovery.getUnification();
            if (unification != null) {
                for (UnifiedVariable uv : unification.getUnified()) {
                    unified.put(name, uv.id, uv);
                }
            }
            for (Map.Entry<CodeLocation, Binding> entry : recovery.getBindings().asMap().entrySet()) {
                bindings.put(name, entry.getKey(), entry.getValue());
            }
            constraints.putAll(name, recovery.getConstraints());
        }
        return new RecoveryResults(
                byName.build(),
                variables.build(),
                unified.build(),
                bindings.build(),
                constraints.build()
        );
    }

    public ImmutableMap<String, FunctionRecovery> getRecoveries() {
        return recoveries;
    }

    @Nullable
    public FunctionRecovery get(String functionName) {
        return recoveries.get(functionName);
    }

    public List<String> functionsWithStatus(AnalysisStatus status) {
        return recoveries.values().stream()
                .filter(r -> r.getStatus() == status)
                .map(r -> r.functionName)
                .collect(Collectors.toList());
    }

    @Nullable
    public SSAVariable variable(String functionName, int id) {
        return variables.get(functionName, id);
    }

    @Nullable
    public UnifiedVariable unifiedVariable(String functionName, int id) {
        return unified.get(functionName, id);
    }

    public ImmutableMap<Integer, UnifiedVariable> unifiedVariables(String functionName) {
        return unified.row(functionName);
    }

    public ImmutableMap<CodeLocation, Binding> bindings(String functionName) {
        return bindings.row(functionName);
    }

    public ImmutableTable<String, CodeLocation, Binding> getBindings() {
        return bindings;
    }

    public List<TypeConstraint<?>> constraints(String functionName) {
        return constraints.get(functionName);
    }

    public ImmutableListMultimap<String, TypeConstraint<?>> getConstraints() {
        return constraints;
    }

    public int totalVariables() {
        return variables.size();
    }

    @Override
    public String toString() {
        return "RecoveryResults(" + recoveries.size() + " functions, "
                + variables.size() + " variables, "
                + unified.size() + " unified, "
                + constraints.size() + " constraints)";
    }
}
