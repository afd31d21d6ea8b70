package com.vidnyan.storytest.domain.model;

import java.util.List;

/**
 * Thrown by an {@link AssemblyHandle} when only part of its types could be loaded.
 * Carries the types that did load so analysis can continue with them.
 */
public class TypeLoadException extends Exception {

    private final transient List<TypeDescriptor> loadedTypes;
    private final List<String> failures;

    public TypeLoadException(String message, List<TypeDescriptor> loadedTypes, List<String> failures) {
        super(message);
        this.loadedTypes = loadedTypes == null ? List.of() : List.copyOf(loadedTypes);
        this.failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public List<TypeDescriptor> getLoadedTypes() {
        return loadedTypes;
    }

    public List<String> getFailures() {
        return failures;
    }
}
