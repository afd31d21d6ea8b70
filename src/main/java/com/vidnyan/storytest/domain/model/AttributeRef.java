package com.vidnyan.storytest.domain.model;

import java.util.Map;

/**
 * Reference to a custom attribute applied to a type or member.
 */
public record AttributeRef(
    String simpleName,
    String fullyQualifiedName,
    Map<String, Object> arguments
) {

    private static final String SUFFIX = "Attribute";

    public AttributeRef {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
        if (fullyQualifiedName == null) {
            fullyQualifiedName = simpleName;
        }
    }

    public static AttributeRef of(String simpleName) {
        return new AttributeRef(simpleName, simpleName, Map.of());
    }

    public static AttributeRef of(String simpleName, Map<String, Object> arguments) {
        return new AttributeRef(simpleName, simpleName, arguments);
    }

    /**
     * Name without the conventional "Attribute" suffix.
     */
    public String shortName() {
        if (simpleName.endsWith(SUFFIX) && simpleName.length() > SUFFIX.length()) {
            return simpleName.substring(0, simpleName.length() - SUFFIX.length());
        }
        return simpleName;
    }

    /**
     * Case-insensitive name match, ignoring the "Attribute" suffix on either side.
     */
    public boolean matches(String name) {
        String wanted = name.endsWith(SUFFIX) && name.length() > SUFFIX.length()
                ? name.substring(0, name.length() - SUFFIX.length())
                : name;
        return shortName().equalsIgnoreCase(wanted);
    }
}
