/**
 * The variable recovery dataflow analysis.
 * <p>
 * {@link io.github.eutro.varrec.analysis.VariableRecovery} walks a function to a fixpoint,
 * allocating an {@link io.github.eutro.varrec.analysis.SSAVariable} for each definition and for each
 * read of a location nothing defined, and recording in its
 * {@link io.github.eutro.varrec.analysis.FunctionRecovery} which variables each statement and
 * expression binds.
 */
package io.github.eutro.varrec.analysis;
