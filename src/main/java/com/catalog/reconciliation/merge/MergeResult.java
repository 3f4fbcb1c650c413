package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.core.model.FieldDecision;
import com.catalog.reconciliation.core.model.MergeDecision;

import java.util.List;
import java.util.Objects;

/**
 * Result of merging a canonical record into a local record.
 *
 * @param record    the merged record
 * @param decisions one decision per canonical field, in canonical field order
 */
public record MergeResult(CatalogRecord record, List<FieldDecision> decisions) {

    public MergeResult {
        Objects.requireNonNull(record, "record is required");
        decisions = decisions != null ? List.copyOf(decisions) : List.of();
    }

    public boolean hasChanges() {
        return decisions.stream().anyMatch(d -> d.decision() == MergeDecision.ADOPTED_CANONICAL);
    }

    public List<String> adoptedFields() {
        return fieldsWith(MergeDecision.ADOPTED_CANONICAL);
    }

    public List<String> keptFields() {
        return fieldsWith(MergeDecision.KEPT_LOCAL);
    }

    private List<String> fieldsWith(MergeDecision decision) {
        return decisions.stream()
                .filter(d -> d.decision() == decision)
                .map(FieldDecision::field)
                .toList();
    }
}
