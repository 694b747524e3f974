package com.baskettecase.dpmcp.sql;

import java.util.List;

/**
 * Outcome of a read-only policy check, shared by the gateway validator and every backend.
 */
public record ValidationResult(
    boolean isValid,
    List<String> errors,
    List<String> warnings
) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult valid() {
        return new ValidationResult(true, List.of(), List.of());
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, List.of(error), List.of());
    }

    public String getErrorMessage() {
        return String.join("; ", errors);
    }

    public String getWarningMessage() {
        return String.join("; ", warnings);
    }
}
