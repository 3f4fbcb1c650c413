package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.core.model.FieldDecision;
import com.catalog.reconciliation.core.model.MergeDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges a canonical record into its matched local record, field by field.
 *
 * <p>For every field the canonical record carries: a protected local field keeps its local
 * value; otherwise a differing canonical value is adopted. Fields the canonical record does
 * not carry are left alone, protected or not. The merger never removes a local field and
 * never changes the protection list. The identifier is not merged here; the caller assigns
 * the final identifier.</p>
 */
public class OverrideAwareMerger {
    private static final Logger log = LoggerFactory.getLogger(OverrideAwareMerger.class);

    private static final Set<String> NON_MERGEABLE = Set.of(
            CatalogRecord.ID_FIELD,
            CatalogRecord.PROTECTED_FIELDS,
            CatalogRecord.LEGACY_PROTECTED_FIELDS
    );

    public MergeResult merge(CatalogRecord local, CatalogRecord canonical) {
        Objects.requireNonNull(local, "local record is required");
        Objects.requireNonNull(canonical, "canonical record is required");

        CatalogRecord.Builder merged = CatalogRecord.builder(local);
        List<FieldDecision> decisions = new ArrayList<>();

        for (Map.Entry<String, Object> entry : canonical.getFields().entrySet()) {
            String field = entry.getKey();
            if (NON_MERGEABLE.contains(field)) {
                continue;
            }
            Object canonicalValue = entry.getValue();
            Object localValue = local.get(field);

            MergeDecision decision;
            if (local.isFieldProtected(field)) {
                decision = MergeDecision.KEPT_LOCAL;
            } else if (valuesEqual(localValue, canonicalValue)) {
                decision = MergeDecision.UNCHANGED;
            } else {
                merged.field(field, canonicalValue);
                decision = MergeDecision.ADOPTED_CANONICAL;
            }
            decisions.add(new FieldDecision(field, decision, localValue, canonicalValue));
        }

        MergeResult result = new MergeResult(merged.build(), decisions);
        if (log.isDebugEnabled()) {
            log.debug("merge.completed localId={} canonicalId={} adopted={} kept={}",
                    local.getId(), canonical.getId(), result.adoptedFields(), result.keptFields());
        }
        return result;
    }

    /**
     * Value equality tolerant of numeric representation ({@code 100} equals {@code 100.0}),
     * applied recursively through maps and lists.
     */
    static boolean valuesEqual(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Number na && b instanceof Number nb) {
            BigDecimal da = toDecimal(na);
            BigDecimal db = toDecimal(nb);
            return da != null && db != null ? da.compareTo(db) == 0 : a.equals(b);
        }
        if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
            if (ma.size() != mb.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : ma.entrySet()) {
                if (!mb.containsKey(entry.getKey()) || !valuesEqual(entry.getValue(), mb.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            if (la.size() != lb.size()) {
                return false;
            }
            Iterator<?> ia = la.iterator();
            Iterator<?> ib = lb.iterator();
            while (ia.hasNext()) {
                if (!valuesEqual(ia.next(), ib.next())) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }

    private static BigDecimal toDecimal(Number number) {
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
