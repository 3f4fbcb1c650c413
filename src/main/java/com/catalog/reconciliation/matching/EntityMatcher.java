package com.catalog.reconciliation.matching;

import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.core.model.IdentityMapping;
import com.catalog.reconciliation.core.model.MatchResult;
import com.catalog.reconciliation.identity.IdentifierAllocator;
import com.catalog.reconciliation.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pairs local records with canonical records by normalized name.
 *
 * <p>A hit gives the local record the canonical identifier. A miss, or an empty name,
 * makes the record new; new identifiers are allocated strictly above the largest canonical
 * identifier so they cannot collide with canonical records missing from a partial fetch.
 * A canonical record is claimed by at most one local record; later claimants become new.</p>
 *
 * <p>Local identifiers must already be unique (see
 * {@link com.catalog.reconciliation.identity.ConflictResolver}).</p>
 */
public class EntityMatcher {
    private static final Logger log = LoggerFactory.getLogger(EntityMatcher.class);

    private final NameNormalizer normalizer;

    public EntityMatcher(NameNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public MatchOutcome match(List<CatalogRecord> locals, CanonicalIndex index) {
        IdentifierAllocator allocator = new IdentifierAllocator(index.ids(), (long) index.maxId() + 1);
        Map<Integer, Integer> claimedBy = new HashMap<>();
        List<MatchResult> results = new ArrayList<>(locals.size());
        List<MatchOutcome.DuplicateMatch> duplicates = new ArrayList<>();
        IdentityMapping.Builder mapping = IdentityMapping.builder();

        for (CatalogRecord local : locals) {
            if (!local.hasId()) {
                throw new IllegalArgumentException("Local record without identifier: " + local);
            }
            String key = normalizer.normalize(local.getDisplayName());
            Optional<CatalogRecord> candidate = index.find(key);

            MatchResult result;
            if (candidate.isPresent() && !claimedBy.containsKey(candidate.get().getId())) {
                CatalogRecord canonical = candidate.get();
                claimedBy.put(canonical.getId(), local.getId());
                result = MatchResult.matched(local, canonical, key);
                log.debug("match.matched localId={} canonicalId={} name='{}'",
                        local.getId(), canonical.getId(), key);
            } else {
                int newId = allocator.next();
                result = MatchResult.newRecord(local, newId, key);
                if (candidate.isPresent()) {
                    int canonicalId = candidate.get().getId();
                    duplicates.add(new MatchOutcome.DuplicateMatch(
                            local.getId(), canonicalId, claimedBy.get(canonicalId), newId));
                    log.warn("match.duplicate localId={} canonicalId={} claimedBy={} allocatedId={}",
                            local.getId(), canonicalId, claimedBy.get(canonicalId), newId);
                } else {
                    log.debug("match.new localId={} newId={} name='{}'", local.getId(), newId, key);
                }
            }
            results.add(result);
            mapping.put(local.getId(), result.finalId());
        }

        MatchOutcome outcome = new MatchOutcome(results, mapping.build(), duplicates);
        log.info("match.completed locals={} canonical={} matched={} new={}",
                locals.size(), index.size(), outcome.matchedCount(), outcome.newCount());
        return outcome;
    }
}
