package com.baskettecase.dpmcp.backend;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed record access for backends that double as a metadata/config store.
 *
 * Writes are limited to upsert-by-key; there is no multi-statement transaction support.
 */
public interface RecordStore {

    /**
     * Insert the record or update the non-key columns of the row matching {@code keyFields}.
     * Map and collection values are stored as JSON.
     */
    boolean upsertRecord(String table, Map<String, Object> record, List<String> keyFields, String transactionId);

    Optional<Map<String, Object>> getRecord(String table, String keyField, Object keyValue);

    /**
     * Rows matching every equality filter, at most {@code limit} of them ({@code <= 0} for no limit).
     */
    List<Map<String, Object>> fetchRecords(String table, Map<String, Object> filters, int limit);
}
