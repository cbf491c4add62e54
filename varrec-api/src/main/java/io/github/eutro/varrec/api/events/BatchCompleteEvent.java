package io.github.eutro.varrec.api.events;

import io.github.eutro.varrec.api.RecoveryResults;

/**
 * Fired when a batch has been aggregated, after every {@link FunctionRecoveredEvent}.
 */
public class BatchCompleteEvent implements RecoveryEvent {
    public final RecoveryResults results;

    public BatchCompleteEvent(RecoveryResults results) {
        this.results = results;
    }
}
