package com.catalog.reconciliation.api;

import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.core.model.CollectionType;
import com.catalog.reconciliation.core.model.IdentityMapping;
import com.catalog.reconciliation.core.model.MatchResult;
import com.catalog.reconciliation.identity.ConflictResolution;
import com.catalog.reconciliation.ledger.RecordError;
import com.catalog.reconciliation.merge.MergeResult;
import com.catalog.reconciliation.rewrite.ForeignKey;
import com.catalog.reconciliation.rewrite.UnresolvedReference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of reconciling one entity collection.
 *
 * @param type         the collection
 * @param records      final records, every one with a unique identifier
 * @param mapping      local identifier (after conflict resolution) to final identifier
 * @param conflicts    identifier conflict resolution applied to the local records
 * @param matches      per-record match results; empty when no canonical data was supplied
 * @param merges       merge results for matched records, in match order
 * @param errors       raw records skipped as malformed
 * @param references   references translated into final identifiers, per foreign key of this collection
 * @param unresolved   references of this collection left untouched and flagged
 */
public record ReconciledCollection(
        CollectionType type,
        List<CatalogRecord> records,
        IdentityMapping mapping,
        ConflictResolution conflicts,
        List<MatchResult> matches,
        List<MergeResult> merges,
        List<RecordError> errors,
        Map<ForeignKey, Integer> references,
        List<UnresolvedReference> unresolved
) {
    public ReconciledCollection {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(mapping, "mapping is required");
        Objects.requireNonNull(conflicts, "conflicts is required");
        records = records != null ? List.copyOf(records) : List.of();
        matches = matches != null ? List.copyOf(matches) : List.of();
        merges = merges != null ? List.copyOf(merges) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        references = references != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(references))
                : Map.of();
        unresolved = unresolved != null ? List.copyOf(unresolved) : List.of();
    }

    /**
     * True if the collection was synchronized against canonical data.
     */
    public boolean isSynchronized() {
        return !matches.isEmpty();
    }

    public long matchedCount() {
        return matches.stream().filter(MatchResult::isMatched).count();
    }

    public long newCount() {
        return matches.size() - matchedCount();
    }
}
