package com.baskettecase.dpmcp.sql;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword helpers for read-only checks.
 *
 * <p>Checks run on a masked copy of the SQL in which comments are blanked and quoted
 * text is emptied, produced by a single left-to-right scan so that a {@code --} inside a
 * literal or an apostrophe inside a quoted identifier cannot hide the code after it.
 * Engines disagree on lexing (backslash escapes, dollar quotes, triple quotes), so every
 * check runs against two masks and fails if either one fails:
 * <ul>
 *   <li>standard: {@code ''} escapes, {@code E'...'} backslash escapes, {@code $tag$} quotes</li>
 *   <li>escaped: backslash escapes in every quoted form, backtick and triple-quoted strings</li>
 * </ul>
 */
public final class ReadOnlySqlRules {

    private static final Pattern LEADING_KEYWORD = Pattern.compile("^\\s*\\(*\\s*([A-Za-z]+)");
    private static final Pattern TRAILING_TERMINATORS = Pattern.compile("[;\\s]*$");
    private static final Pattern DOLLAR_TAG = Pattern.compile("\\$(?:[A-Za-z_][A-Za-z0-9_]*)?\\$");

    private ReadOnlySqlRules() {
    }

    /**
     * The SQL as seen by each lexing mode, comments and quoted content removed.
     */
    public static List<String> maskedVariants(String sql) {
        if (sql == null) {
            return List.of("", "");
        }
        return List.of(mask(sql, false), mask(sql, true));
    }

    /**
     * True when any statement separator is followed by more code. Trailing semicolons are fine.
     */
    public static boolean hasMultipleStatements(String sql) {
        for (String masked : maskedVariants(sql)) {
            String body = TRAILING_TERMINATORS.matcher(masked).replaceFirst("");
            if (body.indexOf(';') >= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * First keyword of the statement in upper case, e.g. {@code SELECT} or {@code DELETE}.
     * When the lexing modes disagree, the non-read keyword is reported.
     */
    public static String leadingKeyword(String sql) {
        String first = null;
        for (String masked : maskedVariants(sql)) {
            Matcher matcher = LEADING_KEYWORD.matcher(masked);
            String keyword = matcher.find() ? matcher.group(1).toUpperCase(Locale.ROOT) : "";
            if (!isReadKeyword(keyword)) {
                return keyword;
            }
            if (first == null) {
                first = keyword;
            }
        }
        return first;
    }

    public static boolean startsWithReadKeyword(String sql) {
        return isReadKeyword(leadingKeyword(sql));
    }

    /**
     * First denied keyword or phrase found on word boundaries, case-insensitive.
     */
    public static Optional<String> findDeniedKeyword(String sql, Collection<String> deniedKeywords) {
        List<String> variants = maskedVariants(sql);
        for (String keyword : deniedKeywords) {
            String phrase = Pattern.quote(keyword.trim()).replace(" ", "\\E\\s+\\Q");
            Pattern pattern = Pattern.compile("\\b" + phrase + "\\b", Pattern.CASE_INSENSITIVE);
            for (String masked : variants) {
                if (pattern.matcher(masked).find()) {
                    return Optional.of(keyword.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isReadKeyword(String keyword) {
        return "SELECT".equals(keyword) || "WITH".equals(keyword);
    }

    /**
     * Comments become a single space; quoted regions keep their delimiters and lose their
     * content. An unterminated comment or quote runs to the end of the text.
     */
    static String mask(String sql, boolean backslashEscapes) {
        StringBuilder out = new StringBuilder(sql.length());
        int n = sql.length();
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            char next = i + 1 < n ? sql.charAt(i + 1) : '\0';
            if (c == '-' && next == '-') {
                int end = sql.indexOf('\n', i + 2);
                i = end < 0 ? n : end;
                out.append(' ');
            } else if (c == '/' && next == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
                out.append(' ');
            } else if (backslashEscapes && (c == '\'' || c == '"') && sql.startsWith(String.valueOf(c).repeat(3), i)) {
                String delimiter = String.valueOf(c).repeat(3);
                i = skipTripleQuoted(sql, i + 3, delimiter);
                out.append(c).append(c);
            } else if (c == '\'' || c == '"' || (backslashEscapes && c == '`')) {
                boolean escapes = backslashEscapes || (c == '\'' && hasEscapePrefix(sql, i));
                i = skipQuoted(sql, i, c, escapes);
                out.append(c).append(c);
            } else if (c == '$' && !backslashEscapes && !precededByIdentifier(sql, i)) {
                Matcher tag = DOLLAR_TAG.matcher(sql).region(i, n);
                if (tag.lookingAt()) {
                    int end = sql.indexOf(tag.group(), tag.end());
                    i = end < 0 ? n : end + tag.group().length();
                    out.append("''");
                } else {
                    out.append(c);
                    i++;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static int skipQuoted(String sql, int start, char quote, boolean backslashEscapes) {
        int n = sql.length();
        int j = start + 1;
        while (j < n) {
            char ch = sql.charAt(j);
            if (backslashEscapes && ch == '\\') {
                j += 2;
            } else if (ch == quote) {
                if (j + 1 < n && sql.charAt(j + 1) == quote) {
                    j += 2;
                } else {
                    return j + 1;
                }
            } else {
                j++;
            }
        }
        return n;
    }

    private static int skipTripleQuoted(String sql, int contentStart, String delimiter) {
        int n = sql.length();
        int j = contentStart;
        while (j < n) {
            if (sql.charAt(j) == '\\') {
                j += 2;
            } else if (sql.startsWith(delimiter, j)) {
                return j + delimiter.length();
            } else {
                j++;
            }
        }
        return n;
    }

    // E'...' / e'...' escape-string prefix, not the tail of an identifier
    private static boolean hasEscapePrefix(String sql, int quoteIndex) {
        if (quoteIndex == 0) {
            return false;
        }
        char prefix = sql.charAt(quoteIndex - 1);
        return (prefix == 'E' || prefix == 'e') && !precededByIdentifier(sql, quoteIndex - 1);
    }

    private static boolean precededByIdentifier(String sql, int index) {
        if (index == 0) {
            return false;
        }
        char before = sql.charAt(index - 1);
        return Character.isLetterOrDigit(before) || before == '_' || before == '$';
    }
}
