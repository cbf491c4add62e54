package io.github.eutro.varrec.analysis;

import org.jetbrains.annotations.NotNull;

/**
 * The identity of a statement or expression occurrence in a function.
 * <p>
 * {@code block} is the ordinal of the block in {@link io.github.eutro.varrec.ir.Function#blocks},
 * {@code stmt} the index of the statement in that block. {@code sub} is {@link #STMT} for the statement
 * itself, and numbers the expression nodes it evaluates from 1, in evaluation order.
 * <p>
 * Locations are ordered by block, then statement, then sub-position.
 */
public final class CodeLocation implements Comparable<CodeLocation> {
    public static final int STMT = 0;

    public final int block;
    public final int stmt;
    public final int sub;

    public CodeLocation(int block, int stmt, int sub) {
        this.block = block;
        this.stmt = stmt;
        this.sub = sub;
    }

    public static CodeLocation ofStmt(int block, int stmt) {
        return new CodeLocation(block, stmt, STMT);
    }

    public boolean isStmt() {
        return sub == STMT;
    }

    public CodeLocation withSub(int sub) {
        return new CodeLocation(block, stmt, sub);
    }

    @Override
    public int compareTo(@NotNull CodeLocation o) {
        int c = Integer.compare(block, o.block);
        if (c != 0) return c;
        c = Integer.compare(stmt, o.stmt);
        if (c != 0) return c;
        return Integer.compare(sub, o.sub);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodeLocation)) return false;
        CodeLocation that = (CodeLocation) o;
        return block == that.block && stmt == that.stmt && sub == that.sub;
    }

    @Override
    public int hashCode() {
        return (block * 31 + stmt) * 31 + sub;
    }

    @Override
    public String toString() {
        return block + "." + stmt + (sub == STMT ? "" : "." + sub);
    }
}
