package com.catalog.reconciliation.matching;

import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup from normalized name to canonical record, built once per reconciliation pass.
 *
 * <p>When several canonical records normalize to the same name, the last one in iteration
 * order wins and each displaced record is reported as an {@link AmbiguousName}.
 * Records whose name normalizes to the empty string are not indexed, but their identifiers
 * still count towards {@link #maxId()} and {@link #ids()}.</p>
 */
public final class CanonicalIndex {
    private static final Logger log = LoggerFactory.getLogger(CanonicalIndex.class);

    private final Map<String, CatalogRecord> byName;
    private final Set<Integer> ids;
    private final List<AmbiguousName> ambiguousNames;
    private final int maxId;
    private final int size;

    private CanonicalIndex(Map<String, CatalogRecord> byName, Set<Integer> ids,
                           List<AmbiguousName> ambiguousNames, int maxId, int size) {
        this.byName = Collections.unmodifiableMap(byName);
        this.ids = Collections.unmodifiableSet(ids);
        this.ambiguousNames = List.copyOf(ambiguousNames);
        this.maxId = maxId;
        this.size = size;
    }

    /**
     * Builds the index.
     *
     * @param canonical  canonical records; every record must carry an identifier
     * @param normalizer the normalizer used for both sides of matching
     */
    public static CanonicalIndex build(List<CatalogRecord> canonical, NameNormalizer normalizer) {
        Map<String, CatalogRecord> byName = new LinkedHashMap<>();
        Set<Integer> ids = new LinkedHashSet<>();
        List<AmbiguousName> ambiguous = new ArrayList<>();
        int maxId = 0;

        for (CatalogRecord record : canonical) {
            Integer id = Objects.requireNonNull(record.getId(), "canonical record without identifier");
            ids.add(id);
            maxId = Math.max(maxId, id);

            String key = normalizer.normalize(record.getDisplayName());
            if (key.isEmpty()) {
                continue;
            }
            CatalogRecord displaced = byName.put(key, record);
            if (displaced != null) {
                ambiguous.add(new AmbiguousName(key, displaced.getId(), id));
                log.warn("canonical.ambiguous name='{}' displacedId={} winningId={}",
                        key, displaced.getId(), id);
            }
        }

        return new CanonicalIndex(byName, ids, ambiguous, maxId, canonical.size());
    }

    public static CanonicalIndex empty() {
        return new CanonicalIndex(new LinkedHashMap<>(), new LinkedHashSet<>(), List.of(), 0, 0);
    }

    /**
     * Looks up a canonical record by normalized name. The empty key never matches.
     */
    public Optional<CatalogRecord> find(String normalizedName) {
        if (normalizedName == null || normalizedName.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(normalizedName));
    }

    /**
     * Largest canonical identifier observed, or 0 when there are none.
     */
    public int maxId() {
        return maxId;
    }

    public Set<Integer> ids() {
        return ids;
    }

    public List<AmbiguousName> ambiguousNames() {
        return ambiguousNames;
    }

    /**
     * Number of canonical records the index was built from.
     */
    public int size() {
        return size;
    }

    public int indexedNames() {
        return byName.size();
    }

    /**
     * Two or more canonical records sharing a normalized name.
     *
     * @param normalizedName the shared comparison key
     * @param displacedId    identifier of the record that lost the tie-break
     * @param winningId      identifier of the record now indexed under the name
     */
    public record AmbiguousName(String normalizedName, int displacedId, int winningId) {}
}
