package com.vidnyan.storytest.domain.model;

public enum TypeFlag {
    ABSTRACT,
    INTERFACE,
    VALUE_TYPE,
    ENUM,
    SEALED
}
