package com.catalog.reconciliation.rewrite;

import com.catalog.reconciliation.core.model.CatalogRecord;

import java.util.List;

/**
 * Result of rewriting one foreign-key field across one collection.
 *
 * @param records        the collection after rewriting, same order as the input
 * @param rewrittenCount number of references replaced with a different identifier
 * @param unresolved     references left untouched and flagged
 */
public record RewriteResult(
        List<CatalogRecord> records,
        int rewrittenCount,
        List<UnresolvedReference> unresolved
) {
    public RewriteResult {
        records = records != null ? List.copyOf(records) : List.of();
        unresolved = unresolved != null ? List.copyOf(unresolved) : List.of();
    }

    public boolean hasWarnings() {
        return !unresolved.isEmpty();
    }
}
