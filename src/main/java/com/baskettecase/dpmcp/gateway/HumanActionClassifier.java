package com.baskettecase.dpmcp.gateway;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether an execution error needs a human rather than a retry.
 *
 * Patterns are checked in declaration order, so column-level matches win over the
 * generic "does not exist".
 */
@Component
public class HumanActionClassifier {

    @Getter
    @RequiredArgsConstructor
    public enum Category {
        PERMISSION_DENIED("access_review", List.of("permission denied", "access denied")),
        AMBIGUOUS_COLUMN("data_correction", List.of("ambiguous column name", "ambiguous reference", "is ambiguous")),
        TYPE_CONVERSION("data_correction", List.of("invalid input syntax", "could not convert", "conversion error")),
        MISSING_COLUMN("data_correction", List.of("no such column", "undefined column",
                "column \"?[\\w. ]+\"? does not exist", "referenced column .* not found", "unrecognized name")),
        MISSING_RELATION("data_correction", List.of("no such table", "does not exist", "not found: table"));

        private final String actionType;
        private final List<String> patterns;

        boolean matches(String message) {
            return patterns.stream()
                    .anyMatch(pattern -> Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(message).find());
        }
    }

    private static final List<Pattern> RELATION_NAME_PATTERNS = List.of(
        Pattern.compile("relation \"([^\"]+)\" does not exist", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(?:table|view) with name \"?([^\\s!\"]+)\"? does not exist", Pattern.CASE_INSENSITIVE),
        Pattern.compile("no such table: ([\\w.]+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("not found: table ([\\w.:-]+)", Pattern.CASE_INSENSITIVE)
    );

    public Optional<Category> classify(String errorMessage) {
        if (errorMessage == null || errorMessage.isBlank()) {
            return Optional.empty();
        }
        for (Category category : Category.values()) {
            if (category.matches(errorMessage)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Name of the missing table or view, if the message carries one.
     */
    public Optional<String> extractMissingRelation(String errorMessage) {
        if (errorMessage == null) {
            return Optional.empty();
        }
        for (Pattern pattern : RELATION_NAME_PATTERNS) {
            Matcher matcher = pattern.matcher(errorMessage);
            if (matcher.find()) {
                String name = matcher.group(1);
                int dot = name.lastIndexOf('.');
                return Optional.of(dot >= 0 ? name.substring(dot + 1) : name);
            }
        }
        return Optional.empty();
    }
}
