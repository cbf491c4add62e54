package io.github.eutro.varrec.passes;

import io.github.eutro.varrec.analysis.FunctionRecovery;
import io.github.eutro.varrec.analysis.RecoveryContext;
import io.github.eutro.varrec.analysis.VariableRecovery;
import io.github.eutro.varrec.ir.Function;
import io.github.eutro.varrec.unify.Unify;

/**
 * Some pre-composed passes. This should not be considered stable.
 */
public class Passes {
    /**
     * Recover a function's variables and unify them.
     *
     * @param ctx The shared recovery context.
     * @return The pass.
     */
    public static IRPass<Function, FunctionRecovery> recoverAndUnify(RecoveryContext ctx) {
        return new VariableRecovery(ctx)
                .then(Unify.INSTANCE);
    }
}
