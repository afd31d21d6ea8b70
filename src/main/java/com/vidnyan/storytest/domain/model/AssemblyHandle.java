package com.vidnyan.storytest.domain.model;

import java.util.List;

/**
 * A loaded compiled module. Implementations are supplied by the host's loader.
 */
public interface AssemblyHandle {

    String name();

    /**
     * Top-level types of the module. Nested types are reached through
     * {@link TypeDescriptor#nestedTypes()}.
     *
     * @throws TypeLoadException when some types failed to load; the exception
     *         carries the ones that did
     */
    List<TypeDescriptor> loadTypes() throws TypeLoadException;
}
