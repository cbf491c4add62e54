package io.github.eutro.varrec.ir;

import io.github.eutro.varrec.ext.CommonExts;
import io.github.eutro.varrec.ext.Ext;
import io.github.eutro.varrec.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A statement in a {@link BasicBlock}.
 * <p>
 * Like {@link Expr}, the set of statement kinds is closed.
 */
public abstract class Stmt extends ExtHolder {
    private Stmt() {
    }

    public abstract <R> R accept(Visitor<R> v);

    public interface Visitor<R> {
        R visitAssign(Assign stmt);

        R visitStore(Store stmt);

        R visitCall(Call stmt);

        R visitReturn(Return stmt);

        R visitBranch(Branch stmt);

        R visitOpaque(Opaque stmt);
    }

    public static Assign assign(Expr.Lvalue dst, Expr src) {
        return new Assign(dst, src);
    }

    public static Store store(Expr addr, Expr value) {
        return new Store(addr, value);
    }

    public static Call call(Expr target, @Nullable String callee) {
        return new Call(target, callee);
    }

    public static Return ret(@Nullable Expr value) {
        return new Return(value);
    }

    public static Branch branch(Expr cond) {
        return new Branch(cond);
    }

    public static Opaque opaque(String description) {
        return new Opaque(description);
    }

    /**
     * {@code dst = src}, where {@code dst} is a register or temporary.
     */
    public static final class Assign extends Stmt {
        public final Expr.Lvalue dst;
        public final Expr src;

        private Assign(Expr.Lvalue dst, Expr src) {
            this.dst = Objects.requireNonNull(dst);
            this.src = Objects.requireNonNull(src);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitAssign(this);
        }

        @Override
        public String toString() {
            return dst + " = " + src;
        }
    }

    /**
     * {@code [addr] = value}, writing {@code value.size} bytes.
     */
    public static final class Store extends Stmt {
        public final Expr addr;
        public final Expr value;

        private Store(Expr addr, Expr value) {
            this.addr = Objects.requireNonNull(addr);
            this.value = Objects.requireNonNull(value);
        }

        public int size() {
            return value.size;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitStore(this);
        }

        @Override
        public String toString() {
            return "[" + addr + "]:" + value.size + " = " + value;
        }
    }

    /**
     * A call. Arguments are not explicit, they are found through the calling convention.
     */
    public static final class Call extends Stmt {
        public final Expr target;
        /**
         * The symbol of the callee, if the lifter could name it.
         */
        @Nullable
        public final String callee;

        private Call(Expr target, @Nullable String callee) {
            this.target = Objects.requireNonNull(target);
            this.callee = callee;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitCall(this);
        }

        @Override
        public String toString() {
            return "call " + (callee == null ? target.toString() : callee);
        }
    }

    public static final class Return extends Stmt {
        @Nullable
        public final Expr value;

        private Return(@Nullable Expr value) {
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitReturn(this);
        }

        @Override
        public String toString() {
            return value == null ? "return" : "return " + value;
        }
    }

    /**
     * A conditional branch on {@code cond}. The targets are the successors of the owning block.
     */
    public static final class Branch extends Stmt {
        public final Expr cond;

        private Branch(Expr cond) {
            this.cond = Objects.requireNonNull(cond);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitBranch(this);
        }

        @Override
        public String toString() {
            return "if " + cond;
        }
    }

    /**
     * A statement the lifter could not model.
     */
    public static final class Opaque extends Stmt {
        public final String description;

        private Opaque(String description) {
            this.description = description;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitOpaque(this);
        }

        @Override
        public String toString() {
            return "opaque<" + description + ">";
        }
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
