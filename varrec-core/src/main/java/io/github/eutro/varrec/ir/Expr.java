package io.github.eutro.varrec.ir;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An expression in the lifted IR.
 * <p>
 * The set of expression kinds is closed: every kind has a method in {@link Visitor},
 * and the constructors are private to this file.
 */
public abstract class Expr {
    /**
     * The width of the value this expression produces, in bytes.
     */
    public final int size;

    private Expr(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive: " + size);
        }
        this.size = size;
    }

    public abstract <R> R accept(Visitor<R> v);

    public interface Visitor<R> {
        R visitConst(Const expr);

        R visitRegister(Register expr);

        R visitTemp(Temp expr);

        R visitLoad(Load expr);

        R visitBinary(Binary expr);

        R visitUnary(Unary expr);

        R visitConvert(Convert expr);

        R visitOpaque(Opaque expr);
    }

    public static Const constant(long value, int size) {
        return new Const(value, size);
    }

    public static Register reg(String name, int size) {
        return new Register(name, size);
    }

    public static Temp temp(int id, int size) {
        return new Temp(id, size);
    }

    public static Load load(Expr addr, int size) {
        return new Load(addr, size);
    }

    public static Binary binary(BinaryOp op, Expr lhs, Expr rhs) {
        return new Binary(op, lhs, rhs, op.isComparison() ? 1 : lhs.size);
    }

    public static Binary add(Expr lhs, Expr rhs) {
        return binary(BinaryOp.ADD, lhs, rhs);
    }

    public static Binary sub(Expr lhs, Expr rhs) {
        return binary(BinaryOp.SUB, lhs, rhs);
    }

    public static Unary unary(UnaryOp op, Expr operand) {
        return new Unary(op, operand, operand.size);
    }

    public static Convert convert(ConvertKind kind, Expr operand, int size) {
        return new Convert(kind, operand, size);
    }

    public static Opaque opaque(String description, int size) {
        return new Opaque(description, size);
    }

    public enum BinaryOp {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        AND("&"),
        OR("|"),
        XOR("^"),
        SHL("<<"),
        SHR(">>"),
        SAR(">>s"),
        CMP_EQ("=="),
        CMP_NE("!="),
        CMP_LT("<"),
        CMP_LE("<="),
        ;

        public final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public boolean isComparison() {
            return ordinal() >= CMP_EQ.ordinal();
        }
    }

    public enum UnaryOp {
        NEG,
        NOT,
    }

    public enum ConvertKind {
        ZERO_EXTEND("zext"),
        SIGN_EXTEND("sext"),
        TRUNCATE("trunc"),
        ;

        public final String mnemonic;

        ConvertKind(String mnemonic) {
            this.mnemonic = mnemonic;
        }
    }

    public static final class Const extends Expr {
        public final long value;

        private Const(long value, int size) {
            super(size);
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitConst(this);
        }

        @Override
        public String toString() {
            return value < 0 ? "-0x" + Long.toHexString(-value) : "0x" + Long.toHexString(value);
        }
    }

    /**
     * Something that can appear on the left-hand side of an {@link Stmt.Assign}.
     */
    public static abstract class Lvalue extends Expr {
        private Lvalue(int size) {
            super(size);
        }
    }

    public static final class Register extends Lvalue {
        @NotNull
        public final String name;

        private Register(@NotNull String name, int size) {
            super(size);
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitRegister(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A temporary. Temporaries are scoped to the block they appear in.
     */
    public static final class Temp extends Lvalue {
        public final int id;

        private Temp(int id, int size) {
            super(size);
            this.id = id;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitTemp(this);
        }

        @Override
        public String toString() {
            return "t" + id;
        }
    }

    public static final class Load extends Expr {
        public final Expr addr;

        private Load(Expr addr, int size) {
            super(size);
            this.addr = Objects.requireNonNull(addr);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitLoad(this);
        }

        @Override
        public String toString() {
            return "[" + addr + "]:" + size;
        }
    }

    public static final class Binary extends Expr {
        public final BinaryOp op;
        public final Expr lhs;
        public final Expr rhs;

        private Binary(BinaryOp op, Expr lhs, Expr rhs, int size) {
            super(size);
            this.op = op;
            this.lhs = Objects.requireNonNull(lhs);
            this.rhs = Objects.requireNonNull(rhs);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitBinary(this);
        }

        @Override
        public String toString() {
            return "(" + lhs + " " + op.symbol + " " + rhs + ")";
        }
    }

    public static final class Unary extends Expr {
        public final UnaryOp op;
        public final Expr operand;

        private Unary(UnaryOp op, Expr operand, int size) {
            super(size);
            this.op = op;
            this.operand = Objects.requireNonNull(operand);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitUnary(this);
        }

        @Override
        public String toString() {
            return op.name().toLowerCase() + " " + operand;
        }
    }

    public static final class Convert extends Expr {
        public final ConvertKind kind;
        public final Expr operand;

        private Convert(ConvertKind kind, Expr operand, int size) {
            super(size);
            this.kind = kind;
            this.operand = Objects.requireNonNull(operand);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitConvert(this);
        }

        @Override
        public String toString() {
            return kind.mnemonic + size * 8 + "(" + operand + ")";
        }
    }

    /**
     * An expression the lifter could not model.
     */
    public static final class Opaque extends Expr {
        public final String description;

        private Opaque(String description, int size) {
            super(size);
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
}
