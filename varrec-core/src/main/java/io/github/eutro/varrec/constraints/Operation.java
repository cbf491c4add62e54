package io.github.eutro.varrec.constraints;

import io.github.eutro.varrec.analysis.SSAVariable;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The operand of {@link Relation#RESULT_OF_OPERATION}: an operator, the variables it read,
 * and the constant operand if it had one.
 */
public final class Operation {
    public final String operator;
    public final List<SSAVariable> inputs;
    @Nullable
    public final Long constant;

    public Operation(String operator, List<SSAVariable> inputs, @Nullable Long constant) {
        this.operator = operator;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.constant = constant;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operation)) return false;
        Operation that = (Operation) o;
        return operator.equals(that.operator) && inputs.equals(that.inputs) && Objects.equals(constant, that.constant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, inputs, constant);
    }

    @Override
    public String toString() {
        return operator + inputs + (constant == null ? "" : " #" + constant);
    }
}
