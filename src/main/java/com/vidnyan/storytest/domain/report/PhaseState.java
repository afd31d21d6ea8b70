package com.vidnyan.storytest.domain.report;

/**
 * Terminal state of one phase within a run.
 */
public enum PhaseState {
    /** Every rule ran against every candidate. */
    COMPLETED,
    /** Ran to the end, but rules faulted or there was nothing to evaluate. */
    INCONCLUSIVE,
    /** Turned off in configuration. */
    DISABLED,
    /** Ended by stop-on-first-violation. */
    STOPPED,
    /** Ended by a cancellation request. */
    CANCELLED
}
