package io.github.eutro.varrec.api.events;

import io.github.eutro.varrec.analysis.FunctionRecovery;

/**
 * Fired once for each function in a batch, after every function has been analysed,
 * in the order the functions were submitted.
 */
public class FunctionRecoveredEvent implements RecoveryEvent {
    /**
     * The finished recovery, which may have any status but
     * {@link io.github.eutro.varrec.analysis.AnalysisStatus#RUNNING}.
     */
    public final FunctionRecovery recovery;

    public FunctionRecoveredEvent(FunctionRecovery recovery) {
        this.recovery = recovery;
    }
}
