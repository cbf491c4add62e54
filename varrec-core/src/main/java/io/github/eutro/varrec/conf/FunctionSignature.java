package io.github.eutro.varrec.conf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The known signature of a callee: the widths of its parameters and of its return value.
 */
public final class FunctionSignature {
    public final String name;
    public final List<Integer> parameterSizes;
    /**
     * The width of the return value in bytes, or 0 if the callee returns nothing.
     */
    public final int returnSize;

    public FunctionSignature(String name, List<Integer> parameterSizes, int returnSize) {
        this.name = name;
        this.parameterSizes = Collections.unmodifiableList(new ArrayList<>(parameterSizes));
        this.returnSize = returnSize;
    }

    public boolean returnsValue() {
        return returnSize > 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(returnsValue() ? "i" + returnSize * 8 : "void").append(' ').append(name).append('(');
        for (int i = 0; i < parameterSizes.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append('i').append(parameterSizes.get(i) * 8);
        }
        return sb.append(')').toString();
    }
}
