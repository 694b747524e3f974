package com.baskettecase.dpmcp.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Minimal built-in data products so the gateway is usable without any registry.
 */
public class DefaultDefinitionSource implements DefinitionSource {

    public static final String NAME = "defaults";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<CatalogSnapshot> load() {
        return Optional.of(snapshot());
    }

    public static CatalogSnapshot snapshot() {
        return new CatalogSnapshot(NAME, List.of(
            DataProductDefinition.of("financial_transactions_data", "FinancialTransactions",
                "Financial transactions data product"),
            DataProductDefinition.of("accounting_documents_data", "AccountingDocuments",
                "Accounting documents data product")
        ), List.of());
    }
}
