package io.github.eutro.varrec.ir;

import io.github.eutro.varrec.ext.CommonExts;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * An IR builder, which encapsulates a position in a function
 * where statements are being inserted.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private BasicBlock bb;
    @Nullable
    private Long address;

    /**
     * Construct an IR builder, inserting into a specific block.
     *
     * @param func The function.
     * @param bb   One of the function's blocks.
     */
    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    public BasicBlock getBlock() {
        return bb;
    }

    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    /**
     * Set the instruction address attached to statements inserted from now on.
     *
     * @param address The address, or null to stop attaching one.
     * @return This builder.
     */
    public IRBuilder at(@Nullable Long address) {
        this.address = address;
        return this;
    }

    /**
     * Insert a statement at the end of the current block.
     *
     * @param stmt The statement.
     * @return The same statement.
     */
    public <S extends Stmt> S insert(S stmt) {
        if (address != null) {
            stmt.attachExt(CommonExts.INSN_ADDRESS, address);
        }
        bb.addStmt(stmt);
        return stmt;
    }

    public Stmt.Assign assign(Expr.Lvalue dst, Expr src) {
        return insert(Stmt.assign(dst, src));
    }

    public Stmt.Store store(Expr addr, Expr value) {
        return insert(Stmt.store(addr, value));
    }

    public Stmt.Call call(Expr target, @Nullable String callee) {
        return insert(Stmt.call(target, callee));
    }

    public Stmt.Return ret(@Nullable Expr value) {
        return insert(Stmt.ret(value));
    }

    public Stmt.Branch branch(Expr cond) {
        return insert(Stmt.branch(cond));
    }

    /**
     * Add jump targets to the current block.
     *
     * @param targets The successor blocks.
     */
    public void jumpsTo(BasicBlock... targets) {
        bb.successors.addAll(Arrays.asList(targets));
    }
}
