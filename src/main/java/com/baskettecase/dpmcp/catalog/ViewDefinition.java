package com.baskettecase.dpmcp.catalog;

/**
 * A named view and the SQL backing it. Names are unique per connection; re-declaring
 * a name replaces the view.
 */
public record ViewDefinition(
    String name,
    String backingSql,
    String sourceDataProductId
) {
    public ViewDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("View name is required");
        }
        if (backingSql == null || backingSql.isBlank()) {
            throw new IllegalArgumentException("View " + name + " has no SQL");
        }
        name = name.trim();
        backingSql = backingSql.trim();
    }
}
