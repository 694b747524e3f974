package com.baskettecase.dpmcp.gateway;

import java.util.Map;
import java.util.Optional;

/**
 * Supplies governance context for a principal. Used only to annotate responses.
 */
@FunctionalInterface
public interface PrincipalContextProvider {

    PrincipalContextProvider NONE = principalId -> Optional.empty();

    Optional<Map<String, Object>> findPrincipalContext(String principalId);
}
