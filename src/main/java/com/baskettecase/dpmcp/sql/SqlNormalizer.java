package com.baskettecase.dpmcp.sql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans SQL text produced by an upstream generator before it is validated.
 *
 * Generated SQL regularly arrives wrapped in a JSON object, a markdown fence or
 * stray quotes, with escaped quoting still in place. Normalization never adds
 * SQL; it only removes packaging around it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SqlNormalizer {

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);
    private static final Pattern JSON_CONTINUATION = Pattern.compile("\"\\s*,\\s*\"[A-Za-z_][A-Za-z0-9_]*\"\\s*:.*$", Pattern.DOTALL);
    private static final Pattern SQL_KEY_PREFIX = Pattern.compile("^\\{?\\s*\"(?:sql|query)\"\\s*:\\s*\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_ARTIFACT = Pattern.compile("\"\\s*[,}]\\s*$");
    private static final Pattern TRAILING_SEMICOLON = Pattern.compile(";\\s*$");

    private final ObjectMapper objectMapper;

    public String normalize(String rawSql) {
        if (rawSql == null) {
            return "";
        }
        String sql = rawSql.trim();

        String fromJson = extractFromJson(sql);
        if (fromJson != null) {
            sql = fromJson.trim();
        }

        Matcher fence = CODE_FENCE.matcher(sql);
        if (fence.matches()) {
            sql = fence.group(1).trim();
        }

        // Broken JSON such as {"sql": "SELECT ...", "explanation": ... that Jackson rejected
        Matcher keyPrefix = SQL_KEY_PREFIX.matcher(sql);
        if (keyPrefix.find()) {
            sql = sql.substring(keyPrefix.end());
            sql = JSON_CONTINUATION.matcher(sql).replaceFirst("");
        }

        sql = stripTrailingArtifacts(sql);
        sql = stripWrapping(sql);

        sql = sql.replace("\\\"", "\"")
                 .replace("\\'", "'")
                 .replace("\\n", " ")
                 .replace("\\t", " ")
                 .trim();
        sql = stripWrapping(sql);

        sql = TRAILING_SEMICOLON.matcher(sql).replaceFirst("").trim();

        if (!sql.equals(rawSql)) {
            log.debug("🔧 Normalized SQL: [{}] -> [{}]", rawSql, sql);
        }
        return sql;
    }

    private String extractFromJson(String text) {
        if (!text.startsWith("{")) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            for (String key : new String[] {"sql", "query", "sql_query"}) {
                JsonNode value = node.get(key);
                if (value != null && value.isTextual()) {
                    return value.asText();
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("SQL payload looked like JSON but did not parse: {}", e.getOriginalMessage());
        }
        return null;
    }

    private static String stripTrailingArtifacts(String sql) {
        String previous;
        String current = sql.trim();
        do {
            previous = current;
            boolean danglingQuote = countUnescapedQuotes(current) % 2 == 1;
            Matcher artifact = TRAILING_ARTIFACT.matcher(current);
            // Only a dangling quote, never the closing quote of an identifier
            if (danglingQuote && artifact.find()) {
                current = current.substring(0, artifact.start()).trim();
            } else if (current.endsWith("}") && !current.contains("{")) {
                current = current.substring(0, current.length() - 1).trim();
            } else if (danglingQuote && current.endsWith("\"") && !current.startsWith("\"")) {
                current = current.substring(0, current.length() - 1).trim();
            }
        } while (!current.equals(previous));
        return current;
    }

    private static String stripWrapping(String sql) {
        String current = sql.trim();
        boolean changed = true;
        while (changed && current.length() >= 2) {
            changed = false;
            char first = current.charAt(0);
            char last = current.charAt(current.length() - 1);
            if ((first == '{' && last == '}') || (first == '`' && last == '`')
                    || (first == '\'' && last == '\'' && current.indexOf('\'', 1) == current.length() - 1)) {
                current = current.substring(1, current.length() - 1).trim();
                changed = true;
            } else if (first == '"' && last == '"' && isWrappedInQuotes(current)) {
                current = current.substring(1, current.length() - 1).trim();
                changed = true;
            } else if (first == '"' && countUnescapedQuotes(current) % 2 == 1) {
                current = current.substring(1).trim();
                changed = true;
            }
        }
        return current;
    }

    /**
     * A double-quoted string that is one literal rather than SQL starting and ending
     * with quoted identifiers, e.g. {@code "SELECT 1"} versus {@code "a" + "b"}.
     */
    private static boolean isWrappedInQuotes(String text) {
        String inner = text.substring(1, text.length() - 1);
        return inner.replace("\\\"", "").indexOf('"') < 0;
    }

    private static int countUnescapedQuotes(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '"' && (i == 0 || text.charAt(i - 1) != '\\')) {
                count++;
            }
        }
        return count;
    }
}
