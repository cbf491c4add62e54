package io.github.eutro.varrec.passes;

import io.github.eutro.varrec.ir.BasicBlock;
import io.github.eutro.varrec.ir.Function;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the predecessors of each block.
 * <p>
 * The result is a fresh map rather than an ext on the blocks, so the function is left untouched.
 */
public class ComputePreds implements IRPass<Function, Map<BasicBlock, List<BasicBlock>>> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public Map<BasicBlock, List<BasicBlock>> run(Function func) {
        Map<BasicBlock, List<BasicBlock>> preds = new IdentityHashMap<>();
        for (BasicBlock block : func.blocks) {
            preds.put(block, new ArrayList<>());
        }
        for (BasicBlock block : func.blocks) {
            for (BasicBlock target : block.successors) {
                List<BasicBlock> targetPreds = preds.get(target);
                if (targetPreds == null) {
                    throw new InvalidGraphException(String.format(
                            "successor %s of %s is not in function %s",
                            target.toTargetString(),
                            block.toTargetString(),
                            func.name));
                }
                if (!targetPreds.contains(block)) {
                    targetPreds.add(block);
                }
            }
        }
        return preds;
    }
}
