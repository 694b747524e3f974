package com.baskettecase.dpmcp.catalog;

import com.baskettecase.dpmcp.backend.BackendManager;
import com.baskettecase.dpmcp.backend.DataSourceInfo;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * View Bootstrapper
 *
 * Resolves data product and view definitions from an ordered chain of sources and
 * materializes them through a backend. The first source yielding a non-empty snapshot
 * wins; sources that are missing or fail to parse are skipped, and the built-in
 * defaults always apply last.
 */
@Slf4j
public class ViewBootstrapper {

    private final List<DefinitionSource> sources;

    public ViewBootstrapper(List<DefinitionSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public CatalogSnapshot resolve() {
        for (DefinitionSource source : sources) {
            try {
                Optional<CatalogSnapshot> snapshot = source.load();
                if (snapshot.isPresent() && !snapshot.get().isEmpty()) {
                    log.info("✅ Using definitions from {}", source.name());
                    return snapshot.get();
                }
                log.info("📄 No definitions from {}, trying next source", source.name());
            } catch (Exception e) {
                log.warn("⚠️ Could not load definitions from {}: {}", source.name(), e.getMessage());
            }
        }
        log.warn("⚠️ No definition source produced data, using built-in defaults");
        return DefaultDefinitionSource.snapshot();
    }

    /**
     * Register every CSV file in {@code directory} as a table. Returns the number registered.
     */
    public int registerDataDirectory(BackendManager backend, Path directory, String schema, String transactionId) {
        if (directory == null || !Files.isDirectory(directory)) {
            log.info("[TXN:{}] 📁 No data directory to register", transactionId);
            return 0;
        }
        List<Path> csvFiles;
        try (Stream<Path> files = Files.list(directory)) {
            csvFiles = files
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("[TXN:{}] ⚠️ Could not list data directory {}: {}", transactionId, directory, e.getMessage());
            return 0;
        }

        int registered = 0;
        for (Path csv : csvFiles) {
            if (backend.registerDataSource(DataSourceInfo.csv(csv.toString(), schema, null), transactionId)) {
                registered++;
            }
        }
        log.info("[TXN:{}] 📁 Registered {}/{} CSV files from {}", transactionId, registered, csvFiles.size(), directory);
        return registered;
    }

    /**
     * Create every declared view, then back any missing required view with fallback data.
     * A failing view is logged and does not stop the rest.
     */
    public BootstrapReport materialize(BackendManager backend, CatalogSnapshot snapshot,
                                       List<String> requiredViews, String transactionId) {
        Map<String, ViewDefinition> byName = new LinkedHashMap<>();
        for (ViewDefinition view : snapshot.views()) {
            // Last declaration of a name wins
            byName.remove(view.name().toLowerCase(Locale.ROOT));
            byName.put(view.name().toLowerCase(Locale.ROOT), view);
        }

        Map<String, Boolean> viewResults = new LinkedHashMap<>();
        for (ViewDefinition view : byName.values()) {
            boolean created;
            try {
                created = backend.createView(view.name(), view.backingSql(), true, transactionId);
            } catch (RuntimeException e) {
                log.error("[TXN:{}] ❌ Creating view {} failed: {}", transactionId, view.name(), e.getMessage());
                created = false;
            }
            viewResults.put(view.name(), created);
        }

        List<String> missing = new ArrayList<>();
        for (String required : requiredViews == null ? List.<String>of() : requiredViews) {
            if (!backend.checkViewExists(required)) {
                missing.add(required);
            }
        }

        Map<String, Boolean> fallbackResults = Map.of();
        if (!missing.isEmpty()) {
            log.warn("[TXN:{}] ⚠️ Required views missing, creating fallbacks: {}", transactionId, missing);
            fallbackResults = backend.createFallbackViews(missing, transactionId);
        }

        BootstrapReport report = new BootstrapReport(snapshot.source(), viewResults, missing, fallbackResults);
        log.info("[TXN:{}] ✅ View bootstrap from {}: {}/{} views created, {} fallback views",
                transactionId, snapshot.source(), report.createdCount(), viewResults.size(),
                fallbackResults.values().stream().filter(Boolean::booleanValue).count());
        if (!report.failedViews().isEmpty()) {
            log.warn("[TXN:{}] ⚠️ Views that could not be created: {}", transactionId, report.failedViews());
        }
        return report;
    }
}
