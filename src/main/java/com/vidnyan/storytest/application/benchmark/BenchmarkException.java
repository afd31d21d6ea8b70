package com.vidnyan.storytest.application.benchmark;

/**
 * The harness itself could not complete, as opposed to a single actor failing.
 */
public class BenchmarkException extends RuntimeException {

    public BenchmarkException(String message) {
        super(message);
    }

    public BenchmarkException(String message, Throwable cause) {
        super(message, cause);
    }
}
