package io.github.eutro.varrec.analysis;

/**
 * The state of one function's analysis.
 * <p>
 * {@code RUNNING} moves to exactly one of the other three. Only {@link #CONVERGED} and
 * {@link #DEGRADED} results carry usable states and are unified.
 */
public enum AnalysisStatus {
    RUNNING,
    /**
     * A fixpoint was reached.
     */
    CONVERGED,
    /**
     * A block hit the visit ceiling; the results are whatever was computed until then.
     */
    DEGRADED,
    /**
     * The block graph was structurally invalid; there are no results.
     */
    FAILED,
    ;

    public boolean hasResults() {
        return this == CONVERGED || this == DEGRADED;
    }
}
