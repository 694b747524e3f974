package com.baskettecase.dpmcp.sql;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * SQL Validator for Read-Only Enforcement
 *
 * Gateway-level policy applied before any backend sees the SQL. Only a single
 * SELECT (or WITH ... SELECT) statement passes. Statement boundaries and keywords are
 * checked on a comment- and quote-aware scan of the text, and the statement must also
 * parse with JSQLParser as exactly one SELECT; SQL the parser rejects is rejected here.
 *
 * @see <a href="https://github.com/JSQLParser/JSqlParser">JSQLParser Documentation</a>
 */
@Slf4j
@Component
public class SqlValidator {

    private static final String MULTI_STATEMENT_MESSAGE = "Multi-statement queries are not allowed";

    private static final Pattern TRAILING_SEMICOLON = Pattern.compile(";\\s*$");

    private static final Pattern SELECT_STAR = Pattern.compile("\\bselect\\s+(distinct\\s+)?\\*", Pattern.CASE_INSENSITIVE);

    private static final List<String> DENIED_KEYWORDS = List.of(
        "insert", "update", "delete", "merge", "create", "drop", "alter",
        "truncate", "grant", "revoke", "copy"
    );

    private static final List<String> DANGEROUS_FUNCTIONS = List.of(
        "pg_read_file", "pg_ls_dir", "lo_import", "lo_export",
        "read_csv", "read_csv_auto", "read_parquet", "read_json", "glob"
    );

    /**
     * Validate SQL against the read-only policy.
     */
    public ValidationResult validate(String sql) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (sql == null || sql.isBlank()) {
            errors.add("SQL statement is empty");
            return new ValidationResult(false, errors, warnings);
        }

        if (ReadOnlySqlRules.hasMultipleStatements(sql)) {
            errors.add(MULTI_STATEMENT_MESSAGE);
            return report(sql, new ValidationResult(false, errors, warnings));
        }

        String statementSql = stripTrailingSemicolon(sql.trim());
        String keyword = ReadOnlySqlRules.leadingKeyword(statementSql);
        if (!"SELECT".equals(keyword) && !"WITH".equals(keyword)) {
            errors.add(onlySelectMessage(keyword.isEmpty() ? "UNKNOWN" : keyword));
            return report(sql, new ValidationResult(false, errors, warnings));
        }

        try {
            List<Statement> statements = CCJSqlParserUtil.parseStatements(sql).getStatements();
            if (statements.size() != 1) {
                errors.add(MULTI_STATEMENT_MESSAGE);
            } else if (!(statements.get(0) instanceof Select)) {
                errors.add(onlySelectMessage(statements.get(0).getClass().getSimpleName().toUpperCase(Locale.ROOT)));
            }
        } catch (JSQLParserException e) {
            errors.add("Invalid SQL syntax: " + firstLine(e));
        }

        Optional<String> denied = ReadOnlySqlRules.findDeniedKeyword(statementSql, DENIED_KEYWORDS);
        denied.ifPresent(word -> errors.add("Data-modifying keyword detected: " + word));

        validateFunctions(statementSql, errors);

        if (SELECT_STAR.matcher(statementSql).find()) {
            warnings.add("SELECT * queries may expose sensitive columns");
        }

        return report(sql, new ValidationResult(errors.isEmpty(), errors, warnings));
    }

    /**
     * The statement the backend should receive: comments kept, one trailing semicolon dropped.
     */
    public String prepareForExecution(String sql) {
        return stripTrailingSemicolon(sql.trim());
    }

    static String onlySelectMessage(String statementType) {
        return "Invalid SQL statement: only SELECT statements are allowed (found " + statementType + ")";
    }

    private void validateFunctions(String sql, List<String> errors) {
        List<String> variants = ReadOnlySqlRules.maskedVariants(sql);
        for (String func : DANGEROUS_FUNCTIONS) {
            Pattern call = Pattern.compile("\\b" + func + "\\s*\\(", Pattern.CASE_INSENSITIVE);
            if (variants.stream().anyMatch(masked -> call.matcher(masked).find())) {
                errors.add("Dangerous function/statement detected: " + func);
            }
        }
    }

    private static String firstLine(JSQLParserException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage() != null ? cause.getMessage() : e.getClass().getSimpleName();
        int newline = message.indexOf('\n');
        return (newline < 0 ? message : message.substring(0, newline)).trim();
    }

    private static String stripTrailingSemicolon(String sql) {
        return TRAILING_SEMICOLON.matcher(sql).replaceFirst("").trim();
    }

    private ValidationResult report(String sql, ValidationResult result) {
        if (result.isValid()) {
            log.debug("✅ SQL validation passed: {}", sql);
        } else {
            log.warn("❌ SQL validation failed: {} - Errors: {}", sql, result.errors());
        }
        return result;
    }
}
