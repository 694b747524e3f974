package com.baskettecase.dpmcp.backend.duckdb;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Synthetic view bodies for the required analytic views.
 *
 * <p>Each view has 100 rows generated from {@code range(0, 100)}; every value is a pure
 * function of the row index, so recreating a view yields identical data.
 *
 * <table>
 *   <caption>Column schemas</caption>
 *   <tr><th>View</th><th>Columns</th></tr>
 *   <tr><td>fi_star_view</td><td>transactionid VARCHAR, fiscal_year INTEGER, fiscal_quarter INTEGER,
 *       fiscal_month INTEGER, customer_id VARCHAR, customer_type VARCHAR, account_id VARCHAR,
 *       amount DECIMAL(18,2), description VARCHAR</td></tr>
 *   <tr><td>fi_financial_transactions_view</td><td>transaction_id VARCHAR, transaction_date DATE,
 *       account_id VARCHAR, value DECIMAL(18,2), type VARCHAR</td></tr>
 *   <tr><td>fi_sales_by_customer_type_view</td><td>customertypeid VARCHAR, value DECIMAL(18,2),
 *       date DATE</td></tr>
 *   <tr><td>fi_customer_transactions_view</td><td>transaction_id VARCHAR, customer_id VARCHAR,
 *       transaction_date DATE, amount DECIMAL(18,2), customer_type VARCHAR</td></tr>
 * </table>
 */
public final class FallbackViewTemplates {

    public static final int ROW_COUNT = 100;

    private static final String CUSTOMER_TYPE =
        "CASE i % 3 WHEN 0 THEN 'Retail' WHEN 1 THEN 'Wholesale' ELSE 'Enterprise' END";

    private static final Map<String, String> TEMPLATES = new LinkedHashMap<>();

    static {
        TEMPLATES.put("fi_star_view", """
            SELECT
                'TX' || lpad(CAST(i AS VARCHAR), 5, '0') AS transactionid,
                CAST(2023 + i % 2 AS INTEGER) AS fiscal_year,
                CAST(i % 4 + 1 AS INTEGER) AS fiscal_quarter,
                CAST(i % 12 + 1 AS INTEGER) AS fiscal_month,
                'CUST' || CAST(i % 20 + 1 AS VARCHAR) AS customer_id,
                %s AS customer_type,
                'Account' || CAST(i % 10 + 1 AS VARCHAR) AS account_id,
                CAST(1000 + (i * 37) % 9000 AS DECIMAL(18,2)) AS amount,
                'Synthetic transaction ' || CAST(i AS VARCHAR) AS description
            FROM range(0, 100) t(i)
            """.replace("%s", CUSTOMER_TYPE));

        TEMPLATES.put("fi_financial_transactions_view", """
            SELECT
                'TX' || CAST(i AS VARCHAR) AS transaction_id,
                CAST(DATE '2024-01-01' + CAST(i % 365 AS INTEGER) AS DATE) AS transaction_date,
                'Account' || CAST(i % 10 + 1 AS VARCHAR) AS account_id,
                CAST(5000 + (i * 137) % 20000 AS DECIMAL(18,2)) AS "value",
                CASE WHEN i % 2 = 0 THEN 'Debit' ELSE 'Credit' END AS "type"
            FROM range(0, 100) t(i)
            """);

        TEMPLATES.put("fi_sales_by_customer_type_view", """
            SELECT
                'Type ' || CAST(i % 5 + 1 AS VARCHAR) AS customertypeid,
                CAST(((i * 7919) % 1000000) / 100.0 AS DECIMAL(18,2)) AS "value",
                CAST(DATE '2024-12-31' - CAST((i * 7) % 730 AS INTEGER) AS DATE) AS "date"
            FROM range(0, 100) t(i)
            """);

        TEMPLATES.put("fi_customer_transactions_view", """
            SELECT
                'TX' || CAST(i AS VARCHAR) AS transaction_id,
                'CUST' || CAST(i % 20 + 1 AS VARCHAR) AS customer_id,
                CAST(DATE '2024-01-01' + CAST((i * 3) % 365 AS INTEGER) AS DATE) AS transaction_date,
                CAST(1000 + (i * 53) % 10000 AS DECIMAL(18,2)) AS amount,
                %s AS customer_type
            FROM range(0, 100) t(i)
            """.replace("%s", CUSTOMER_TYPE));
    }

    private FallbackViewTemplates() {
    }

    public static Optional<String> sqlFor(String viewName) {
        if (viewName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TEMPLATES.get(viewName.toLowerCase(Locale.ROOT)));
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(TEMPLATES.keySet());
    }
}
