package com.catalog.reconciliation.matching;

import com.catalog.reconciliation.core.model.IdentityMapping;
import com.catalog.reconciliation.core.model.MatchResult;

import java.util.List;

/**
 * Output of matching one local collection against a canonical index.
 *
 * @param results          one result per local record, in input order
 * @param mapping          local identifier to final identifier for every local record
 * @param duplicateMatches local records whose canonical counterpart was already claimed
 */
public record MatchOutcome(
        List<MatchResult> results,
        IdentityMapping mapping,
        List<DuplicateMatch> duplicateMatches
) {
    public MatchOutcome {
        results = results != null ? List.copyOf(results) : List.of();
        duplicateMatches = duplicateMatches != null ? List.copyOf(duplicateMatches) : List.of();
    }

    public long matchedCount() {
        return results.stream().filter(MatchResult::isMatched).count();
    }

    public long newCount() {
        return results.size() - matchedCount();
    }

    /**
     * A local record routed to NEW because an earlier local record claimed the same canonical record.
     *
     * @param localId     identifier of the local record
     * @param canonicalId identifier of the contested canonical record
     * @param claimedBy   identifier of the local record that claimed it first
     * @param allocatedId identifier given to the later record instead
     */
    public record DuplicateMatch(int localId, int canonicalId, int claimedBy, int allocatedId) {}
}
