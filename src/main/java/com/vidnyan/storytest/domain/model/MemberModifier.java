package com.vidnyan.storytest.domain.model;

/**
 * Metadata modifiers the rules look at.
 * LITERAL marks compile-time constants, INIT_ONLY marks readonly fields.
 */
public enum MemberModifier {
    PUBLIC,
    PRIVATE,
    STATIC,
    ABSTRACT,
    VIRTUAL,
    SPECIAL_NAME,
    AUTO_PROPERTY,
    LITERAL,
    INIT_ONLY
}
