package io.github.eutro.varrec.constraints;

import io.github.eutro.varrec.conf.FunctionSignature;

/**
 * The operand of {@link Relation#CALL_SIGNATURE}: a parameter, or the return value, of a known callee.
 */
public final class SignatureSlot {
    public static final int RETURN = -1;

    public final FunctionSignature signature;
    /**
     * The parameter index, or {@link #RETURN}.
     */
    public final int index;

    public SignatureSlot(FunctionSignature signature, int index) {
        this.signature = signature;
        this.index = index;
    }

    public int size() {
        return index == RETURN ? signature.returnSize : signature.parameterSizes.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignatureSlot)) return false;
        SignatureSlot that = (SignatureSlot) o;
        return index == that.index && signature == that.signature;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(signature) * 31 + index;
    }

    @Override
    public String toString() {
        return signature.name + (index == RETURN ? ".ret" : ".arg" + index);
    }
}
