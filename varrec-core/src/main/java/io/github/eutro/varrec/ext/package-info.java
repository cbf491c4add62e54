/**
 * Typed attachments on IR objects.
 * <p>
 * An {@link io.github.eutro.varrec.ext.Ext} is a typed key, and an
 * {@link io.github.eutro.varrec.ext.ExtContainer} holds at most one value per key:
 *
 * <pre>{@code
 * BasicBlock bb = func.newBb();
 * bb.getExtOrThrow(CommonExts.OWNING_FUNCTION); // => func
 *
 * Stmt stmt = ...;
 * stmt.attachExt(CommonExts.INSN_ADDRESS, 0x401000L);
 * }</pre>
 * <p>
 * Ownership exts are maintained by the lists that hold blocks and statements, and
 * {@link io.github.eutro.varrec.ir.BasicBlock} and {@link io.github.eutro.varrec.ir.Stmt}
 * store them directly in fields.
 */
package io.github.eutro.varrec.ext;
