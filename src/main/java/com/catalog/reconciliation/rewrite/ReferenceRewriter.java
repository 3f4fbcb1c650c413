package com.catalog.reconciliation.rewrite;

import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.core.model.CollectionType;
import com.catalog.reconciliation.core.model.IdentityMapping;
import com.catalog.reconciliation.core.model.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Propagates identifier remappings to records that reference the remapped collection.
 *
 * <p>A reference found among the mapping's keys is replaced by its mapped value. Any other
 * reference is left untouched; when it is not one of the mapping's final identifiers either,
 * it is flagged as {@link UnresolvedReference.Reason#UNKNOWN_ENTITY}. Null references are
 * skipped. Every record is processed before the result is returned.</p>
 */
public class ReferenceRewriter {
    private static final Logger log = LoggerFactory.getLogger(ReferenceRewriter.class);

    /**
     * Rewrites one foreign-key field across one collection.
     */
    public RewriteResult rewrite(ForeignKey foreignKey, List<CatalogRecord> records, IdentityMapping mapping) {
        List<CatalogRecord> output = new ArrayList<>(records.size());
        List<UnresolvedReference> unresolved = new ArrayList<>();
        int rewritten = 0;

        for (int i = 0; i < records.size(); i++) {
            CatalogRecord record = records.get(i);
            Object raw = record.get(foreignKey.field());
            if (raw == null) {
                output.add(record);
                continue;
            }

            Integer reference = Identifiers.toIdentifier(raw);
            if (reference == null) {
                unresolved.add(new UnresolvedReference(foreignKey, i, record.getId(), raw,
                        UnresolvedReference.Reason.NOT_AN_IDENTIFIER));
                log.warn("rewrite.invalid fk='{}' position={} value={}", foreignKey, i, raw);
                output.add(record);
            } else if (mapping.contains(reference)) {
                Integer target = mapping.apply(reference);
                if (!target.equals(reference)) {
                    rewritten++;
                    log.debug("rewrite.replaced fk='{}' position={} {} -> {}", foreignKey, i, reference, target);
                }
                output.add(record.withField(foreignKey.field(), target));
            } else {
                if (!mapping.containsTarget(reference)) {
                    unresolved.add(new UnresolvedReference(foreignKey, i, record.getId(), reference,
                            UnresolvedReference.Reason.UNKNOWN_ENTITY));
                    log.warn("rewrite.unknown fk='{}' position={} value={}", foreignKey, i, reference);
                }
                output.add(record);
            }
        }

        return new RewriteResult(output, rewritten, unresolved);
    }

    /**
     * Applies every foreign key of the table whose source collection is present and whose
     * target collection has a mapping. Foreign keys on the same collection are applied in
     * table order, each against the original local identifier space of its target.
     *
     * @param collections collections to rewrite, keyed by type
     * @param mappings    finalized mappings of the reconciled collections
     * @param table       which fields reference which collections
     */
    public CascadeResult rewriteAll(Map<CollectionType, List<CatalogRecord>> collections,
                                    Map<CollectionType, IdentityMapping> mappings,
                                    ReferenceTable table) {
        Map<CollectionType, List<CatalogRecord>> output = new EnumMap<>(CollectionType.class);
        output.putAll(collections);
        List<UnresolvedReference> unresolved = new ArrayList<>();
        List<ForeignKey> skipped = new ArrayList<>();
        Map<ForeignKey, Integer> rewritten = new LinkedHashMap<>();

        for (ForeignKey foreignKey : table.getForeignKeys()) {
            List<CatalogRecord> records = output.get(foreignKey.source());
            if (records == null) {
                continue;
            }
            IdentityMapping mapping = mappings.get(foreignKey.target());
            if (mapping == null) {
                skipped.add(foreignKey);
                continue;
            }
            RewriteResult result = rewrite(foreignKey, records, mapping);
            output.put(foreignKey.source(), result.records());
            unresolved.addAll(result.unresolved());
            rewritten.merge(foreignKey, result.rewrittenCount(), Integer::sum);
            log.info("rewrite.completed fk='{}' records={} rewritten={} unresolved={}",
                    foreignKey, records.size(), result.rewrittenCount(), result.unresolved().size());
        }

        return new CascadeResult(output, rewritten, unresolved, skipped);
    }
}
