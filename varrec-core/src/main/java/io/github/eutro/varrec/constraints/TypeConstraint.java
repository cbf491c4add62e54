package io.github.eutro.varrec.constraints;

import io.github.eutro.varrec.analysis.SSAVariable;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A typing obligation on an SSA variable, for the solver to discharge.
 *
 * @param <T> The operand type of the relation.
 */
public final class TypeConstraint<T> {
    @NotNull
    public final SSAVariable subject;
    @NotNull
    public final Relation<T> relation;
    @NotNull
    public final T operand;

    public TypeConstraint(@NotNull SSAVariable subject, @NotNull Relation<T> relation, @NotNull T operand) {
        this.subject = Objects.requireNonNull(subject);
        this.relation = Objects.requireNonNull(relation);
        this.operand = relation.cast(Objects.requireNonNull(operand));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeConstraint)) return false;
        TypeConstraint<?> that = (TypeConstraint<?>) o;
        return subject == that.subject && relation == that.relation && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, relation, operand);
    }

    @Override
    public String toString() {
        return subject + " " + relation + " " + relation.print(operand);
    }
}
