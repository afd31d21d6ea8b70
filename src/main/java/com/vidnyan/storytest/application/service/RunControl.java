package com.vidnyan.storytest.application.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, checked between types, members and candidates.
 */
public final class RunControl {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static RunControl create() {
        return new RunControl();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
