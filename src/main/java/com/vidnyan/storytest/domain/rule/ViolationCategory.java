package com.vidnyan.storytest.domain.rule;

public enum ViolationCategory {
    INCOMPLETE_IMPLEMENTATION,
    PLACEHOLDER_CODE,
    DEBUGGING_CODE,
    UNUSED_CODE,
    PREMATURE_CELEBRATION,
    OTHER
}
