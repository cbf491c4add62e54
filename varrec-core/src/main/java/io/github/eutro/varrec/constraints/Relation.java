package io.github.eutro.varrec.constraints;

import io.github.eutro.varrec.analysis.SSAVariable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The relation a {@link TypeConstraint} states between its subject and its operand.
 * <p>
 * The set of relations is fixed; each carries the type of its operand.
 *
 * @param <T> The operand type.
 */
public final class Relation<T> {
    /**
     * The subject has the same type as the operand variable.
     */
    public static final Relation<SSAVariable> EQUALS_TYPE_OF =
            new Relation<>("equals-type-of", SSAVariable.class, SSAVariable::toString);
    /**
     * The subject is the result of an operation.
     */
    public static final Relation<Operation> RESULT_OF_OPERATION =
            new Relation<>("result-of-operation", Operation.class, Objects::toString);
    /**
     * The subject is this many bytes wide.
     */
    public static final Relation<Integer> HAS_SIZE =
            new Relation<>("has-size", Integer.class, Objects::toString);
    /**
     * The subject is a pointer to something.
     */
    public static final Relation<Pointee> IS_POINTER_TO =
            new Relation<>("is-pointer-to", Pointee.class, Objects::toString);
    /**
     * The subject points to an array with elements of this many bytes.
     */
    public static final Relation<Integer> IS_ARRAY_OF =
            new Relation<>("is-array-of", Integer.class, size -> "[" + size + "]");
    /**
     * The subject is passed to, or returned from, a callee with a known signature.
     */
    public static final Relation<SignatureSlot> CALL_SIGNATURE =
            new Relation<>("call-signature", SignatureSlot.class, Objects::toString);

    public final String mnemonic;
    private final Class<T> operandType;
    private final Function<T, String> printer;

    private Relation(String mnemonic, Class<T> operandType, Function<T, String> printer) {
        this.mnemonic = mnemonic;
        this.operandType = operandType;
        this.printer = printer;
    }

    /**
     * Check whether {@code constraint} is of this relation, casting it if so.
     *
     * @param constraint The constraint.
     * @return The constraint, if it has this relation.
     */
    @SuppressWarnings("unchecked")
    public Optional<TypeConstraint<T>> check(TypeConstraint<?> constraint) {
        return constraint.relation == this
                ? Optional.of((TypeConstraint<T>) constraint)
                : Optional.empty();
    }

    T cast(Object operand) {
        return operandType.cast(operand);
    }

    String print(T operand) {
        return printer.apply(operand);
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
