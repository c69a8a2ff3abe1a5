package com.logixtag.catalog;

import java.util.Optional;

/**
 * Supplies type definitions read from project metadata.
 */
@FunctionalInterface
public interface TypeDefinitionSource {
    /**
     * @return the definition named {@code typeName}, or empty when the project does not define it
     */
    Optional<TypeDefinition> readTypeDefinition(String typeName);
}
