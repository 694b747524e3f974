package com.baskettecase.dpmcp.backend;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connection state and configuration plumbing shared by the adapters.
 */
public abstract class AbstractBackendManager implements BackendManager {

    protected final Map<String, Object> config;

    private final AtomicBoolean connected = new AtomicBoolean(false);

    protected AbstractBackendManager(Map<String, Object> config) {
        this.config = config == null ? new HashMap<>() : new HashMap<>(config);
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    protected void markConnected(boolean value) {
        connected.set(value);
    }

    /**
     * Fail fast on use of a disconnected adapter; this is a programming error, not a query outcome.
     */
    protected void requireConnected(String operation) {
        if (!connected.get()) {
            throw new IllegalStateException(
                getBackendType() + " backend is not connected; " + operation + " requires connect() first");
        }
    }

    /**
     * Construction-time config overlaid with the parameters passed to {@code connect}.
     */
    protected Map<String, Object> mergeParams(Map<String, Object> params) {
        Map<String, Object> merged = new HashMap<>(config);
        if (params != null) {
            merged.putAll(params);
        }
        return merged;
    }

    protected static String stringParam(Map<String, Object> params, String key, String defaultValue) {
        Object value = params.get(key);
        if (value == null || value.toString().isBlank()) {
            return defaultValue;
        }
        return value.toString().trim();
    }

    protected static int intParam(Map<String, Object> params, String key, int defaultValue) {
        Object value = params.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value == null || value.toString().isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Connection parameter '" + key + "' must be an integer: " + value, e);
        }
    }

    /**
     * Double-quote an identifier, doubling embedded quotes.
     */
    protected static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    protected static Map<String, Boolean> allFalse(List<String> names) {
        Map<String, Boolean> results = new LinkedHashMap<>();
        if (names != null) {
            names.forEach(name -> results.put(name, false));
        }
        return results;
    }

    protected static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
