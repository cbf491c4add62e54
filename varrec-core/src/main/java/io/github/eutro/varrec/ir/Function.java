package io.github.eutro.varrec.ir;

import io.github.eutro.varrec.ext.CommonExts;
import io.github.eutro.varrec.ext.ExtHolder;
import io.github.eutro.varrec.ext.TrackedList;

import java.util.ArrayList;
import java.util.List;

public final class Function extends ExtHolder {
    public final String name;

    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_FUNCTION);
        }
    }; // [0] is entry

    public Function(String name) {
        this.name = name;
    }

    public BasicBlock getEntry() {
        return blocks.get(0);
    }

    public BasicBlock newBb(int id) {
        BasicBlock bb = new BasicBlock(id);
        blocks.add(bb);
        return bb;
    }

    public BasicBlock newBb() {
        return newBb(blocks.size());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name).append("() {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }
}
