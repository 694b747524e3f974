package com.baskettecase.dpmcp.catalog;

import java.util.Optional;

/**
 * One link in the ordered chain of definition loaders.
 */
public interface DefinitionSource {

    String name();

    /**
     * @return the definitions, or empty when the source is absent
     * @throws Exception when the source exists but cannot be read or parsed
     */
    Optional<CatalogSnapshot> load() throws Exception;
}
