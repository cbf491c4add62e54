package io.github.eutro.varrec.api.events;

import io.github.eutro.varrec.api.BatchRecovery;

/**
 * An event fired by a {@link BatchRecovery}.
 */
public interface RecoveryEvent {
}
