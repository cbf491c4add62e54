package io.github.eutro.varrec.ext;

import io.github.eutro.varrec.ir.BasicBlock;
import io.github.eutro.varrec.ir.Function;

public class CommonExts {
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");

    /**
     * The address of the machine instruction a statement was lifted from, if the lifter recorded it.
     */
    public static final Ext<Long> INSN_ADDRESS = Ext.create(Long.class, "INSN_ADDRESS");
}
