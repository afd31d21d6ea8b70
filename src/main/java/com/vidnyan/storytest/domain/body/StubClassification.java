package com.vidnyan.storytest.domain.body;

/**
 * Outcome of the stub-throw detector.
 */
public enum StubClassification {
    /** No construct-then-throw sequence in the body. */
    NONE,
    /** Throws with little or no preceding logic. */
    STUB,
    /** Throws after enough loads, branches and calls to look like a guard clause. */
    ARGUMENT_VALIDATION;

    public boolean isStub() {
        return this == STUB;
    }
}
