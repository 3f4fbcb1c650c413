package com.catalog.reconciliation.identity;

import com.catalog.reconciliation.core.model.CatalogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Makes identifiers within one collection unique.
 *
 * <p>Records sharing an identifier form a conflict group. The first record of each group
 * (in input order) keeps the identifier; the others, together with records lacking an
 * identifier, get a fresh one from an {@link IdentifierAllocator} seeded with every
 * identifier already present, conflicting ones included.</p>
 *
 * <p>Resolution is idempotent: a second pass over its own output finds no conflicts and
 * changes nothing.</p>
 */
public class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    public static final int DEFAULT_START_ID = 1;

    private final int startId;

    public ConflictResolver() {
        this(DEFAULT_START_ID);
    }

    public ConflictResolver(int startId) {
        this.startId = startId;
    }

    public ConflictResolution resolve(List<CatalogRecord> records) {
        Map<Integer, List<Integer>> positionsById = new LinkedHashMap<>();
        List<Integer> needsId = new ArrayList<>();

        for (int i = 0; i < records.size(); i++) {
            CatalogRecord record = records.get(i);
            if (record.hasId()) {
                positionsById.computeIfAbsent(record.getId(), k -> new ArrayList<>()).add(i);
            } else {
                needsId.add(i);
            }
        }

        int conflictsFound = 0;
        for (Map.Entry<Integer, List<Integer>> entry : positionsById.entrySet()) {
            List<Integer> positions = entry.getValue();
            if (positions.size() > 1) {
                conflictsFound++;
                log.warn("identity.conflict id={} occurrences={} positions={}",
                        entry.getKey(), positions.size(), positions);
                needsId.addAll(positions.subList(1, positions.size()));
            }
        }
        needsId.sort(null);

        IdentifierAllocator allocator = new IdentifierAllocator(positionsById.keySet(), startId);
        List<CatalogRecord> resolved = new ArrayList<>(records);
        List<IdReassignment> changes = new ArrayList<>();

        for (int position : needsId) {
            CatalogRecord record = records.get(position);
            int newId = allocator.next();
            resolved.set(position, record.withId(newId));
            IdReassignment change = new IdReassignment(position, record.getId(), newId, record.getDisplayName());
            changes.add(change);
            if (change.isConflict()) {
                log.info("identity.reassigned oldId={} newId={} name='{}'",
                        change.oldId(), newId, change.displayName());
            } else {
                log.debug("identity.assigned newId={} name='{}'", newId, change.displayName());
            }
        }

        verifyUnique(resolved);
        ConflictResolution resolution = new ConflictResolution(resolved, changes, conflictsFound);
        if (resolution.hasChanges()) {
            log.info("identity.resolved {}", resolution);
        }
        return resolution;
    }

    /**
     * Checks that every record has an identifier and no two share one.
     *
     * @throws IllegalStateException if the invariant does not hold
     */
    public static void verifyUnique(List<CatalogRecord> records) {
        Set<Integer> seen = new HashSet<>();
        for (CatalogRecord record : records) {
            if (!record.hasId()) {
                throw new IllegalStateException("Record without identifier: " + record);
            }
            if (!seen.add(record.getId())) {
                throw new IllegalStateException("Duplicate identifier " + record.getId());
            }
        }
    }
}
