package com.baskettecase.dpmcp.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Immutable set of definitions from one source. Reloads replace the whole snapshot.
 */
public record CatalogSnapshot(
    String source,
    List<DataProductDefinition> dataProducts,
    List<ViewDefinition> views
) {
    public CatalogSnapshot {
        dataProducts = dataProducts == null ? List.of() : List.copyOf(dataProducts);
        views = views == null ? List.of() : List.copyOf(views);
    }

    public static CatalogSnapshot empty(String source) {
        return new CatalogSnapshot(source, List.of(), List.of());
    }

    public boolean isEmpty() {
        return dataProducts.isEmpty() && views.isEmpty();
    }

    public Optional<DataProductDefinition> findDataProduct(String productId) {
        if (productId == null) {
            return Optional.empty();
        }
        return dataProducts.stream()
                .filter(product -> product.id().equalsIgnoreCase(productId.trim()))
                .findFirst();
    }
}
