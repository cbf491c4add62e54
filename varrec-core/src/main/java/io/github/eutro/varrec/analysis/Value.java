package io.github.eutro.varrec.analysis;

import io.github.eutro.varrec.constraints.Operation;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Set;

/**
 * What the evaluator knows about the value of an expression.
 */
final class Value {
    static final Value UNKNOWN = new Value(Collections.emptySet(), null, null, Collections.emptySet(), 0, 0, 0, null);

    /**
     * The variables a leaf read resolved to.
     */
    final Set<SSAVariable> vars;
    @Nullable
    final Long frameOffset;
    @Nullable
    final Long constant;

    // base + displacement (+ index * arrayScale), for pointer constraints
    final Set<SSAVariable> base;
    final long displacement;
    final int arrayScale;
    /**
     * Non-zero if this value is itself {@code index * indexScale}.
     */
    final int indexScale;

    @Nullable
    final Operation operation;

    Value(
            Set<SSAVariable> vars,
            @Nullable Long frameOffset,
            @Nullable Long constant,
            Set<SSAVariable> base,
            long displacement,
            int arrayScale,
            int indexScale,
            @Nullable Operation operation
    ) {
        this.vars = vars;
        this.frameOffset = frameOffset;
        this.constant = constant;
        this.base = base;
        this.displacement = displacement;
        this.arrayScale = arrayScale;
        this.indexScale = indexScale;
        this.operation = operation;
    }

    static Value constant(long value) {
        return new Value(Collections.emptySet(), null, value, Collections.emptySet(), 0, 0, 0, null);
    }

    static Value frame(@Nullable Long offset) {
        if (offset == null) return UNKNOWN;
        return new Value(Collections.emptySet(), offset, null, Collections.emptySet(), 0, 0, 0, null);
    }

    static Value read(Set<SSAVariable> vars, @Nullable Long frameOffset) {
        return new Value(vars, frameOffset, null, vars, 0, 0, 0, null);
    }

    static Value result(Operation operation) {
        return new Value(Collections.emptySet(), null, null, Collections.emptySet(), 0, 0, 0, operation);
    }
}
