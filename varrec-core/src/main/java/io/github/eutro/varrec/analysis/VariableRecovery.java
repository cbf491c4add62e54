package io.github.eutro.varrec.analysis;

import io.github.eutro.varrec.ir.BasicBlock;
import io.github.eutro.varrec.ir.Function;
import io.github.eutro.varrec.passes.ComputePreds;
import io.github.eutro.varrec.passes.IRPass;
import io.github.eutro.varrec.passes.InvalidGraphException;
import io.github.eutro.varrec.passes.VerifyIntegrity;
import io.github.eutro.varrec.util.GraphWalker;
import org.jetbrains.annotations.Nullable;

import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Forward dataflow over a function's blocks, recovering its SSA variables, bindings and type constraints.
 * <p>
 * Blocks are taken from a worklist ordered by reverse post-order, so a block is usually evaluated after
 * all of its forward predecessors. A block's entry state is the join of the exit states of its
 * already evaluated predecessors, and a block is only re-evaluated when that join changes.
 * <p>
 * Each block may be evaluated at most {@link RecoveryContext#maxBlockVisits} times; a block that would
 * exceed this stops the analysis, and the recovery is {@link AnalysisStatus#DEGRADED}. A function whose
 * block graph is invalid yields a {@link AnalysisStatus#FAILED} recovery rather than an exception.
 * <p>
 * The function is never modified, and this pass holds no per-function state, so it can be run on many
 * functions concurrently.
 */
public class VariableRecovery implements IRPass<Function, FunctionRecovery> {
    private static final Logger LOGGER = Logger.getLogger(VariableRecovery.class.getName());

    private final RecoveryContext ctx;

    public VariableRecovery(RecoveryContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public FunctionRecovery run(Function func) {
        FunctionRecovery recovery = new FunctionRecovery(func.name);
        Map<BasicBlock, List<BasicBlock>> preds;
        try {
            VerifyIntegrity.INSTANCE.run(func);
            preds = ComputePreds.INSTANCE.run(func);
        } catch (InvalidGraphException e) {
            LOGGER.log(Level.WARNING, "recovery of " + func.name + " failed", e);
            recovery.fail(e);
            return recovery;
        }
        new Solver(func, preds, recovery).solve();
        return recovery;
    }

    private class Solver {
        private final Function func;
        private final BasicBlock entry;
        private final Map<BasicBlock, List<BasicBlock>> preds;
        private final FunctionRecovery recovery;
        private final BlockEvaluator evaluator;
        private final AbstractState entryState;

        private final Map<BasicBlock, Integer> ordinals = new IdentityHashMap<>();
        private final Map<BasicBlock, Integer> priorities = new IdentityHashMap<>();
        private final Map<BasicBlock, Integer> visits = new IdentityHashMap<>();

        Solver(Function func, Map<BasicBlock, List<BasicBlock>> preds, FunctionRecovery recovery) {
            this.func = func;
            this.entry = func.getEntry();
            this.preds = preds;
            this.recovery = recovery;
            this.evaluator = new BlockEvaluator(ctx, recovery);
            this.entryState = AbstractState.entry(ctx.layout);

            for (int i = 0; i < func.blocks.size(); i++) {
                ordinals.put(func.blocks.get(i), i);
            }
            List<BasicBlock> rpo = GraphWalker.blockWalker(func).reversePostOrder();
            for (int i = 0; i < rpo.size(); i++) {
                priorities.put(rpo.get(i), i);
            }
        }

        void solve() {
            TreeSet<BasicBlock> worklist = new TreeSet<>(Comparator.comparingInt(priorities::get));
            worklist.add(entry);
            while (!worklist.isEmpty()) {
                BasicBlock block = worklist.pollFirst();
                AbstractState in = joinPreds(block);
                if (in.equals(recovery.inStates.get(block))) continue;

                int count = visits.merge(block, 1, Integer::sum);
                if (count > ctx.maxBlockVisits) {
                    LOGGER.warning(() -> String.format(
                            "%s: block %s exceeded %d visits, results are partial",
                            func.name,
                            block.toTargetString(),
                            ctx.maxBlockVisits));
                    recovery.degrade(block);
                    return;
                }

                LOGGER.fine(() -> String.format("%s: visit %d of %s", func.name, count, block.toTargetString()));
                recovery.inStates.put(block, in);
                AbstractState out = evaluator.evaluate(block, ordinals.get(block), in);
                AbstractState lastOut = recovery.outStates.put(block, out);
                if (out.equals(lastOut)) continue;

                for (BasicBlock succ : block.successors) {
                    if (!joinPreds(succ).equals(recovery.inStates.get(succ))) {
                        worklist.add(succ);
                    }
                }
            }
            LOGGER.fine(() -> String.format(
                    "%s: converged after %d visits, %d variables",
                    func.name,
                    visits.values().stream().mapToInt(Integer::intValue).sum(),
                    recovery.allocator.count()));
            recovery.converge();
        }

        private AbstractState joinPreds(BasicBlock block) {
            @Nullable AbstractState acc = block == entry ? entryState : null;
            for (BasicBlock pred : preds.get(block)) {
                AbstractState out = recovery.outStates.get(pred);
                if (out == null) continue;
                acc = acc == null ? out : acc.join(out);
            }
            return acc == null ? AbstractState.empty() : acc;
        }
    }
}
