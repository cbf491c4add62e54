/**
 * Batch recovery over many functions.
 * <p>
 * The main entrypoint to this API is the {@link io.github.eutro.varrec.api.BatchRecovery},
 * to which lists of functions can be submitted. Its results are gathered into a
 * {@link io.github.eutro.varrec.api.RecoveryResults}, and progress can be observed through the
 * {@link io.github.eutro.varrec.api.events events API}.
 */
package io.github.eutro.varrec.api;
