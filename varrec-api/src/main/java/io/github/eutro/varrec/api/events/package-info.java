/**
 * Events fired while a batch of functions is recovered.
 * <p>
 * The API revolves around {@link io.github.eutro.varrec.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.varrec.api.events;
