/**
 * The lifted IR that variables are recovered from.
 * <p>
 * A {@link io.github.eutro.varrec.ir.Function} is a list of
 * {@link io.github.eutro.varrec.ir.BasicBlock}s, the first being the entry.
 * Blocks hold {@link io.github.eutro.varrec.ir.Stmt}s over side-effect free
 * {@link io.github.eutro.varrec.ir.Expr}s, and list their successors explicitly.
 * {@link io.github.eutro.varrec.ir.IRBuilder} is the usual way to build them.
 */
package io.github.eutro.varrec.ir;
