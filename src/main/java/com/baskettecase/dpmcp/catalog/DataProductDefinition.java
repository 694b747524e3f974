package com.baskettecase.dpmcp.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A governed dataset callers may query, validated once when loaded.
 *
 * @param kpiDefinition optional KPI metadata, null when the product has none
 */
public record DataProductDefinition(
    String id,
    String primaryTableOrView,
    String description,
    String governanceLevel,
    Map<String, Object> kpiDefinition
) {
    public static final String DEFAULT_GOVERNANCE_LEVEL = "department";

    public DataProductDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Data product id is required");
        }
        if (primaryTableOrView == null || primaryTableOrView.isBlank()) {
            throw new IllegalArgumentException("Data product " + id + " has no primary table or view");
        }
        id = id.trim();
        primaryTableOrView = primaryTableOrView.trim();
        description = description == null ? "" : description;
        governanceLevel = governanceLevel == null || governanceLevel.isBlank() ? DEFAULT_GOVERNANCE_LEVEL : governanceLevel;
        kpiDefinition = kpiDefinition == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(kpiDefinition));
    }

    public static DataProductDefinition of(String id, String primaryTableOrView, String description) {
        return new DataProductDefinition(id, primaryTableOrView, description, DEFAULT_GOVERNANCE_LEVEL, null);
    }

    public boolean isView() {
        return primaryTableOrView.toLowerCase(Locale.ROOT).endsWith("_view");
    }
}
