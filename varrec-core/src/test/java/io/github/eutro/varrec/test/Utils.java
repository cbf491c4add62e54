package io.github.eutro.varrec.test;

import io.github.eutro.varrec.analysis.FunctionRecovery;
import io.github.eutro.varrec.analysis.RecoveryContext;
import io.github.eutro.varrec.conf.AnalysisOptions;
import io.github.eutro.varrec.conf.Conventions;
import io.github.eutro.varrec.conf.FrameLayout;
import io.github.eutro.varrec.conf.FunctionSignature;
import io.github.eutro.varrec.constraints.Relation;
import io.github.eutro.varrec.constraints.TypeConstraint;
import io.github.eutro.varrec.ir.Expr;
import io.github.eutro.varrec.ir.Function;
import io.github.eutro.varrec.passes.Passes;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public class Utils {
    private static final Logger LOGGER = Logger.getLogger(Utils.class.getName());

    public static Expr.Register reg(String name) {
        return Expr.reg(name, 8);
    }

    public static Expr.Const imm(long value) {
        return Expr.constant(value, 8);
    }

    /**
     * {@code rsp + offset}, as a lifter would emit for {@code [rsp + offset]}.
     */
    public static Expr rspPlus(long offset) {
        return offset < 0
                ? Expr.sub(reg("rsp"), imm(-offset))
                : Expr.add(reg("rsp"), imm(offset));
    }

    public static RecoveryContext context(int maxBlockVisits, Map<String, FunctionSignature> signatures) {
        return new RecoveryContext(
                Conventions.SYSV_AMD64,
                signatures,
                AnalysisOptions.defaults().maxBlockVisits(maxBlockVisits));
    }

    public static RecoveryContext context(FrameLayout layout) {
        return new RecoveryContext(layout);
    }

    public static RecoveryContext context() {
        return context(AnalysisOptions.DEFAULT_MAX_BLOCK_VISITS, Collections.emptyMap());
    }

    public static FunctionRecovery recover(Function func) {
        return recover(context(), func);
    }

    public static FunctionRecovery recover(RecoveryContext ctx, Function func) {
        FunctionRecovery recovery = Passes.recoverAndUnify(ctx).run(func);
        LOGGER.fine(() -> func + "\n" + recovery.describe());
        return recovery;
    }

    public static <T> List<TypeConstraint<T>> constraintsOf(FunctionRecovery recovery, Relation<T> relation) {
        return recovery.getConstraints().stream()
                .map(relation::check)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(Collectors.toList());
    }
}
