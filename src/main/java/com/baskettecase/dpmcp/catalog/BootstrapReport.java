package com.baskettecase.dpmcp.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * What a bootstrap or reload did: which definition source won, which views were
 * created, and which required views had to be backed by fallback data.
 */
public record BootstrapReport(
    String source,
    Map<String, Boolean> viewResults,
    List<String> missingRequiredViews,
    Map<String, Boolean> fallbackResults
) {
    public BootstrapReport {
        viewResults = Collections.unmodifiableMap(new LinkedHashMap<>(viewResults));
        missingRequiredViews = List.copyOf(missingRequiredViews);
        fallbackResults = Collections.unmodifiableMap(new LinkedHashMap<>(fallbackResults));
    }

    public List<String> failedViews() {
        return viewResults.entrySet().stream()
                .filter(entry -> !entry.getValue())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public long createdCount() {
        return viewResults.values().stream().filter(Boolean::booleanValue).count();
    }
}
