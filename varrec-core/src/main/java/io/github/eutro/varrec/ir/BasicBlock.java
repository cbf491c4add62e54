package io.github.eutro.varrec.ir;

import io.github.eutro.varrec.ext.CommonExts;
import io.github.eutro.varrec.ext.Ext;
import io.github.eutro.varrec.ext.ExtHolder;
import io.github.eutro.varrec.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

public final class BasicBlock extends ExtHolder {
    /**
     * The label of this block, as assigned by the lifter. Only used for display.
     */
    public final int id;

    private final List<Stmt> stmts = new TrackedList<Stmt>(new ArrayList<>()) {
        @Override
        protected void onAdded(Stmt elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Stmt elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };

    public final List<BasicBlock> successors = new ArrayList<>();

    public BasicBlock(int id) {
        this.id = id;
    }

    public List<Stmt> getStmts() {
        return stmts;
    }

    public void addStmt(Stmt stmt) {
        stmts.add(stmt);
    }

    public String toTargetString() {
        return "@" + id;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append("\n{\n");
        for (Stmt stmt : stmts) {
            sb.append(' ').append(stmt).append('\n');
        }
        if (!successors.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock succ : successors) {
                sb.append(' ').append(succ.toTargetString());
            }
            sb.append('\n');
        }
        sb.append('}');
        return sb.toString();
    }

    // exts
    private Function owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
