package io.github.eutro.varrec.unify;

import io.github.eutro.varrec.analysis.FunctionRecovery;
import io.github.eutro.varrec.passes.IRPass;

/**
 * A pass that attaches a {@link UnificationResult} to a finished recovery.
 * <p>
 * Failed recoveries have nothing to unify and are passed through unchanged.
 */
public class Unify implements IRPass<FunctionRecovery, FunctionRecovery> {
    public static final Unify INSTANCE = new Unify();

    @Override
    public FunctionRecovery run(FunctionRecovery recovery) {
        if (recovery.getStatus().hasResults()) {
            recovery.setUnification(Unifier.unify(recovery.getVariables()));
        }
        return recovery;
    }
}
