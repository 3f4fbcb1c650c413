package com.catalog.reconciliation.rewrite;

import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.core.model.CollectionType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of applying a whole {@link ReferenceTable} to a set of collections.
 *
 * @param collections   every input collection, rewritten where a mapping was available
 * @param rewrittenByKey references replaced per applied foreign key, in table order
 * @param unresolved    flagged references across all collections
 * @param skipped       foreign keys not applied because their target had no mapping
 */
public record CascadeResult(
        Map<CollectionType, List<CatalogRecord>> collections,
        Map<ForeignKey, Integer> rewrittenByKey,
        List<UnresolvedReference> unresolved,
        List<ForeignKey> skipped
) {
    public CascadeResult {
        collections = collections != null && !collections.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(collections))
                : Map.of();
        rewrittenByKey = rewrittenByKey != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(rewrittenByKey))
                : Map.of();
        unresolved = unresolved != null ? List.copyOf(unresolved) : List.of();
        skipped = skipped != null ? List.copyOf(skipped) : List.of();
    }

    /**
     * Total references replaced across all applied foreign keys.
     */
    public int rewrittenCount() {
        return rewrittenByKey.values().stream().mapToInt(Integer::intValue).sum();
    }
}
