package io.github.eutro.varrec.unify;

import io.github.eutro.varrec.analysis.StorageLocation;

/**
 * Two distinct stack windows that were unified because they overlap.
 */
public final class OverlapConflict {
    public enum Kind {
        /**
         * One window lies entirely within the other.
         */
        SIZE_MISMATCH,
        /**
         * Each window has bytes the other lacks.
         */
        PARTIAL_OVERLAP,
    }

    public final Kind kind;
    public final StorageLocation.Stack first;
    public final StorageLocation.Stack second;

    OverlapConflict(Kind kind, StorageLocation.Stack first, StorageLocation.Stack second) {
        this.kind = kind;
        this.first = first;
        this.second = second;
    }

    static OverlapConflict between(StorageLocation.Stack a, StorageLocation.Stack b) {
        boolean nested = a.window().encloses(b.window()) || b.window().encloses(a.window());
        return new OverlapConflict(nested ? Kind.SIZE_MISMATCH : Kind.PARTIAL_OVERLAP, a, b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OverlapConflict)) return false;
        OverlapConflict that = (OverlapConflict) o;
        return kind == that.kind && first.equals(that.first) && second.equals(that.second);
    }

    @Override
    public int hashCode() {
        return (kind.hashCode() * 31 + first.hashCode()) * 31 + second.hashCode();
    }

    @Override
    public String toString() {
        return kind + "(" + first + ", " + second + ")";
    }
}
