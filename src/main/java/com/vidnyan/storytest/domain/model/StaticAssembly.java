package com.vidnyan.storytest.domain.model;

import java.util.List;

/**
 * In-memory assembly over an already built descriptor graph.
 */
public record StaticAssembly(
    String name,
    List<TypeDescriptor> types,
    List<String> loadFailures
) implements AssemblyHandle {

    public StaticAssembly {
        types = List.copyOf(types);
        loadFailures = loadFailures == null ? List.of() : List.copyOf(loadFailures);
    }

    public static StaticAssembly of(String name, TypeDescriptor... types) {
        return new StaticAssembly(name, List.of(types), List.of());
    }

    /**
     * Assembly whose load reports failures alongside the given types.
     */
    public static StaticAssembly partial(String name, List<TypeDescriptor> types, List<String> failures) {
        return new StaticAssembly(name, types, failures);
    }

    @Override
    public List<TypeDescriptor> loadTypes() throws TypeLoadException {
        if (!loadFailures.isEmpty()) {
            throw new TypeLoadException(
                    "Failed to load " + loadFailures.size() + " type(s) from " + name,
                    types, loadFailures);
        }
        return types;
    }
}
