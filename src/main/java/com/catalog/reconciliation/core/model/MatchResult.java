package com.catalog.reconciliation.core.model;

import java.util.Objects;

/**
 * Result of matching a single local record against the canonical index.
 * Exactly one status per local record.
 *
 * @param localRecord     the local record after conflict resolution
 * @param status          matched or new
 * @param canonicalId     identifier of the matched canonical record (null when new)
 * @param canonicalRecord the matched canonical record (null when new)
 * @param finalId         identifier the record ends up with
 * @param normalizedName  the comparison key used for matching
 */
public record MatchResult(
        CatalogRecord localRecord,
        MatchStatus status,
        Integer canonicalId,
        CatalogRecord canonicalRecord,
        int finalId,
        String normalizedName
) {
    public MatchResult {
        Objects.requireNonNull(localRecord, "localRecord is required");
        Objects.requireNonNull(status, "status is required");
        if (status == MatchStatus.MATCHED) {
            Objects.requireNonNull(canonicalRecord, "canonicalRecord is required for a match");
            Objects.requireNonNull(canonicalId, "canonicalId is required for a match");
        }
    }

    public static MatchResult matched(CatalogRecord local, CatalogRecord canonical, String normalizedName) {
        return new MatchResult(local, MatchStatus.MATCHED, canonical.getId(), canonical,
                canonical.getId(), normalizedName);
    }

    public static MatchResult newRecord(CatalogRecord local, int allocatedId, String normalizedName) {
        return new MatchResult(local, MatchStatus.NEW, null, null, allocatedId, normalizedName);
    }

    public boolean isMatched() {
        return status == MatchStatus.MATCHED;
    }

    /**
     * True if the matched canonical record is archived at the source.
     */
    public boolean isCanonicalArchived() {
        return canonicalRecord != null && canonicalRecord.isArchived();
    }
}
