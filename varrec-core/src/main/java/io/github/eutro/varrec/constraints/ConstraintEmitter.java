package io.github.eutro.varrec.constraints;

import io.github.eutro.varrec.analysis.SSAVariable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The append-only stream of type constraints recorded while evaluating one function.
 * <p>
 * Re-evaluating a block emits the same records again; a record already in the stream is not appended twice.
 */
public final class ConstraintEmitter {
    private final List<TypeConstraint<?>> constraints = new ArrayList<>();
    private final Set<TypeConstraint<?>> seen = new HashSet<>();

    public <T> void emit(SSAVariable subject, Relation<T> relation, T operand) {
        TypeConstraint<T> constraint = new TypeConstraint<>(subject, relation, operand);
        if (seen.add(constraint)) {
            constraints.add(constraint);
        }
    }

    public void equalsTypeOf(SSAVariable subject, SSAVariable other) {
        if (subject != other) {
            emit(subject, Relation.EQUALS_TYPE_OF, other);
        }
    }

    public void hasSize(SSAVariable subject, int size) {
        emit(subject, Relation.HAS_SIZE, size);
    }

    /**
     * Get the constraints, in the order they were first emitted.
     *
     * @return An unmodifiable view of the stream.
     */
    public List<TypeConstraint<?>> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }
}
