package com.baskettecase.dpmcp.backend;

import com.baskettecase.dpmcp.backend.bigquery.BigQueryBackendManager;
import com.baskettecase.dpmcp.backend.duckdb.DuckDbBackendManager;
import com.baskettecase.dpmcp.backend.postgres.PostgresBackendManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Backend Manager Factory
 *
 * Maps a backend type name (case-insensitive) to an adapter constructor.
 * New backends can be registered at runtime without touching this class.
 */
@Slf4j
@Component
public class BackendManagerFactory {

    /**
     * Creates an unconnected adapter from its configuration.
     */
    @FunctionalInterface
    public interface BackendConstructor {
        BackendManager create(Map<String, Object> config);
    }

    private final Map<String, BackendConstructor> constructors = new ConcurrentHashMap<>();

    public BackendManagerFactory() {
        registerBackend("duckdb", DuckDbBackendManager::new);
        registerBackend("bigquery", BigQueryBackendManager::new);
        registerBackend("postgres", PostgresBackendManager::new);
        registerBackend("postgresql", PostgresBackendManager::new);
        registerBackend("supabase", PostgresBackendManager::new);
    }

    /**
     * Create an adapter for the given type.
     *
     * @throws IllegalArgumentException if the type is unknown; the message lists supported types
     */
    public BackendManager createManager(String backendType, Map<String, Object> config) {
        String key = normalize(backendType);
        BackendConstructor constructor = key.isEmpty() ? null : constructors.get(key);
        if (constructor == null) {
            throw new IllegalArgumentException(String.format(
                "Unsupported backend type: %s. Supported types: %s",
                backendType, String.join(", ", getSupportedTypes())));
        }
        log.info("🔧 Creating {} backend manager", key);
        return constructor.create(config == null ? Map.of() : config);
    }

    /**
     * Register or replace the constructor for a backend type.
     */
    public void registerBackend(String backendType, BackendConstructor constructor) {
        String key = normalize(backendType);
        if (key.isEmpty() || constructor == null) {
            throw new IllegalArgumentException("Backend type and constructor are required");
        }
        BackendConstructor previous = constructors.put(key, constructor);
        if (previous != null) {
            log.debug("Replaced backend constructor for type '{}'", key);
        }
    }

    public List<String> getSupportedTypes() {
        return constructors.keySet().stream().sorted().collect(Collectors.toList());
    }

    private static String normalize(String backendType) {
        return backendType == null ? "" : backendType.trim().toLowerCase(Locale.ROOT);
    }
}
