package com.vidnyan.storytest.domain.model;

public enum MemberKind {
    METHOD,
    PROPERTY,
    FIELD,
    ENUM_VALUE
}
