package com.vidnyan.storytest.domain.model;

/**
 * Method parameter, in declaration order.
 */
public record ParameterDescriptor(
    String name,
    String typeName
) {

    public static ParameterDescriptor of(String name, String typeName) {
        return new ParameterDescriptor(name, typeName);
    }
}
