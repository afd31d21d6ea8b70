package com.vidnyan.storytest.application.benchmark;

/**
 * Timing of one actor's measured pass. Failed actors carry the error and no timing.
 */
public record ActorTiming(
    int actorId,
    int batch,
    long elapsedNanos,
    long operations,
    boolean failed,
    String error
) {

    public static ActorTiming success(int actorId, int batch, long elapsedNanos, long operations) {
        return new ActorTiming(actorId, batch, elapsedNanos, operations, false, null);
    }

    public static ActorTiming failure(int actorId, int batch, Throwable error) {
        return new ActorTiming(actorId, batch, 0, 0, true, String.valueOf(error));
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
