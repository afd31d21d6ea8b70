package com.vidnyan.storytest.application.service;

import com.vidnyan.storytest.domain.report.PhaseResult;

/**
 * Callbacks from a running validation. {@link #progress} fires every
 * {@code progressInterval} candidates and is the place for a host to yield to its event loop.
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() { };

    default void phaseStarted(String phase, int candidates) {
    }

    default void progress(String phase, int evaluated, int total) {
    }

    default void phaseCompleted(PhaseResult result) {
    }
}
