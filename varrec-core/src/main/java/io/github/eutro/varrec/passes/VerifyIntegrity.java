package io.github.eutro.varrec.passes;

import io.github.eutro.varrec.ext.CommonExts;
import io.github.eutro.varrec.ir.BasicBlock;
import io.github.eutro.varrec.ir.Function;
import io.github.eutro.varrec.ir.Stmt;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Checks that a function's block graph is well-formed, throwing {@link InvalidGraphException} if not.
 */
public class VerifyIntegrity implements IRPass<Function, Function> {
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public Function run(Function function) {
        if (function.blocks.isEmpty()) {
            throw new InvalidGraphException(String.format("function %s has no entry block", function.name));
        }

        Set<BasicBlock> blockSet = Collections.newSetFromMap(new IdentityHashMap<>());
        blockSet.addAll(function.blocks);
        if (blockSet.size() != function.blocks.size()) {
            throw new InvalidGraphException(String.format("function %s contains duplicate blocks", function.name));
        }

        for (BasicBlock block : function.blocks) {
            if (block.getNullable(CommonExts.OWNING_FUNCTION) != function) {
                throw new InvalidGraphException(String.format(
                        "block not owned by function\n  block: %s\n  function: %s",
                        block.toTargetString(),
                        function.name));
            }

            for (Stmt stmt : block.getStmts()) {
                if (stmt.getNullable(CommonExts.OWNING_BLOCK) != block) {
                    throw new InvalidGraphException(String.format(
                            "statement not owned by block\n  statement: %s\n  block: %s",
                            stmt,
                            block));
                }
            }

            for (BasicBlock target : block.successors) {
                if (!blockSet.contains(target)) {
                    throwInvalidReference(block, target);
                }
            }
        }
        return function;
    }

    private void throwInvalidReference(BasicBlock block, BasicBlock referenced) {
        throw new InvalidGraphException(String.format(
                "successor not in function;" +
                        "\n  referenced: %s" +
                        "\n  in block: %s",
                referenced.toTargetString(),
                block
        ));
    }
}
