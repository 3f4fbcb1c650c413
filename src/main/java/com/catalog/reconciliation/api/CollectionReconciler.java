package com.catalog.reconciliation.api;

import com.catalog.reconciliation.audit.AuditAction;
import com.catalog.reconciliation.audit.AuditEntry;
import com.catalog.reconciliation.audit.AuditService;
import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.core.model.CollectionType;
import com.catalog.reconciliation.core.model.FieldDecision;
import com.catalog.reconciliation.core.model.IdentityMapping;
import com.catalog.reconciliation.core.model.MalformedRecordException;
import com.catalog.reconciliation.core.model.MatchResult;
import com.catalog.reconciliation.core.model.MergeDecision;
import com.catalog.reconciliation.identity.ConflictResolution;
import com.catalog.reconciliation.identity.ConflictResolver;
import com.catalog.reconciliation.identity.IdReassignment;
import com.catalog.reconciliation.ledger.RecordError;
import com.catalog.reconciliation.ledger.RunLedger;
import com.catalog.reconciliation.logging.LogContext;
import com.catalog.reconciliation.matching.CanonicalIndex;
import com.catalog.reconciliation.matching.EntityMatcher;
import com.catalog.reconciliation.matching.MatchOutcome;
import com.catalog.reconciliation.merge.MergeResult;
import com.catalog.reconciliation.merge.OverrideAwareMerger;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.rewrite.ForeignKey;
import com.catalog.reconciliation.rewrite.ReferenceRewriter;
import com.catalog.reconciliation.rewrite.RewriteResult;
import com.catalog.reconciliation.rewrite.UnresolvedReference;
import com.catalog.reconciliation.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles one entity collection in a single pass.
 *
 * <p>Parse, resolve identifier conflicts, then, when canonical records are supplied, index
 * them, match the local records and merge each match. The pass is all-or-nothing: ledger
 * counters, audit entries and metrics are committed only once every record has a final,
 * unique identifier. If any step throws, nothing is committed and the exception propagates
 * to the caller, which marks the collection failed.</p>
 *
 * <p>Ledger counting per reconciled record: matched to an archived canonical record counts
 * as archived, other matches as updated, new records as created. Without canonical data,
 * records that received an identifier count as created and the others as updated.
 * Malformed raw records only count as errors.</p>
 *
 * <p>Foreign keys of the collection are translated into final identifiers before any record
 * is merged, so local and canonical values are compared in the same identifier space and
 * values adopted from canonical records are never remapped afterwards. Keys referencing
 * another collection use that collection's finished mapping; keys referencing the collection
 * itself use the mapping of the current pass.</p>
 */
public class CollectionReconciler {
    private static final Logger log = LoggerFactory.getLogger(CollectionReconciler.class);

    private final NameNormalizer normalizer;
    private final EntityMatcher matcher;
    private final OverrideAwareMerger merger;
    private final ConflictResolver conflictResolver;
    private final ReferenceRewriter referenceRewriter;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final ReconciliationOptions options;

    public CollectionReconciler(NameNormalizer normalizer, AuditService auditService,
                                MetricsService metricsService, ReconciliationOptions options) {
        this.normalizer = normalizer;
        this.matcher = new EntityMatcher(normalizer);
        this.merger = new OverrideAwareMerger();
        this.conflictResolver = new ConflictResolver(options.getStartId());
        this.referenceRewriter = new ReferenceRewriter();
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.options = options;
    }

    public ReconciledCollection reconcile(CollectionType type, List<Map<String, Object>> localRaw,
                                          List<Map<String, Object>> canonicalRaw, RunLedger ledger) {
        return reconcile(type, localRaw, canonicalRaw, ledger, Map.of());
    }

    /**
     * @param type           entity collection being reconciled
     * @param localRaw       raw local records
     * @param canonicalRaw   raw canonical records, or null to only resolve identifier conflicts
     * @param ledger         run ledger receiving the committed counters
     * @param targetMappings finished mappings of other collections this one references
     */
    public ReconciledCollection reconcile(CollectionType type, List<Map<String, Object>> localRaw,
                                          List<Map<String, Object>> canonicalRaw, RunLedger ledger,
                                          Map<CollectionType, IdentityMapping> targetMappings) {
        try (LogContext ignored = LogContext.forCollection(ledger.getRunId(), type.getKey())) {
            log.info("reconcile.collection.starting locals={} canonical={}",
                    localRaw.size(), canonicalRaw != null ? canonicalRaw.size() : "none");
            Pending pending = new Pending(ledger.getRunId(), type);

            List<CatalogRecord> locals = parseLocals(localRaw, pending);
            ConflictResolution resolution = conflictResolver.resolve(locals);
            auditConflicts(resolution, pending);
            List<CatalogRecord> resolved = rewriteReferences(type, resolution.records(), targetMappings, pending);

            ReconciledCollection result = canonicalRaw == null
                    ? resolveOnly(type, resolution, resolved, pending)
                    : synchronize(type, resolution, resolved, parseCanonical(canonicalRaw, pending), pending);

            commit(pending, ledger);
            log.info("reconcile.collection.completed records={} created={} updated={} archived={} errors={}",
                    result.records().size(), pending.created, pending.updated, pending.archived,
                    pending.errors.size());
            return result;
        }
    }

    private ReconciledCollection resolveOnly(CollectionType type, ConflictResolution resolution,
                                             List<CatalogRecord> resolved, Pending pending) {
        Set<Integer> positionsChanged = new HashSet<>();
        for (IdReassignment change : resolution.changes()) {
            positionsChanged.add(change.position());
        }
        IdentityMapping.Builder mapping = IdentityMapping.builder();
        for (int i = 0; i < resolved.size(); i++) {
            Integer id = resolved.get(i).getId();
            mapping.put(id, id);
            if (positionsChanged.contains(i)) {
                pending.created++;
            } else {
                pending.updated++;
            }
        }
        IdentityMapping identity = mapping.build();
        List<CatalogRecord> records = rewriteSelfReferences(type, resolved, identity, pending);
        List<CatalogRecord> output = finish(type, records);
        return new ReconciledCollection(type, output, identity, resolution,
                List.of(), List.of(), pending.errors, pending.rewritten, pending.unresolved);
    }

    private ReconciledCollection synchronize(CollectionType type, ConflictResolution resolution,
                                             List<CatalogRecord> resolved, List<CatalogRecord> canonical,
                                             Pending pending) {
        CanonicalIndex index = CanonicalIndex.build(canonical, normalizer);
        for (CanonicalIndex.AmbiguousName ambiguous : index.ambiguousNames()) {
            pending.audit(AuditAction.AMBIGUOUS_CANONICAL_NAME, ambiguous.winningId(), details(
                    "normalizedName", ambiguous.normalizedName(),
                    "displacedId", ambiguous.displacedId()));
            pending.issues.add(type.getKey() + ": canonical records " + ambiguous.displacedId() + " and "
                    + ambiguous.winningId() + " share the name '" + ambiguous.normalizedName()
                    + "'; matching uses " + ambiguous.winningId());
        }

        MatchOutcome outcome = matcher.match(resolved, index);
        List<CatalogRecord> translated = rewriteSelfReferences(type, resolved, outcome.mapping(), pending);
        for (MatchOutcome.DuplicateMatch duplicate : outcome.duplicateMatches()) {
            pending.audit(AuditAction.DUPLICATE_LOCAL_MATCH, duplicate.allocatedId(), details(
                    "localId", duplicate.localId(),
                    "canonicalId", duplicate.canonicalId(),
                    "claimedBy", duplicate.claimedBy()));
            pending.issues.add(type.getKey() + ": local record " + duplicate.localId()
                    + " has the same name as local record " + duplicate.claimedBy()
                    + "; created as " + duplicate.allocatedId());
        }

        List<CatalogRecord> records = new ArrayList<>(outcome.results().size());
        List<MergeResult> merges = new ArrayList<>();
        for (int i = 0; i < outcome.results().size(); i++) {
            MatchResult match = outcome.results().get(i);
            CatalogRecord local = translated.get(i);
            if (match.isMatched()) {
                MergeResult merge = merger.merge(local, match.canonicalRecord());
                merges.add(merge);
                records.add(merge.record().withId(match.finalId()));
                pending.audit(AuditAction.RECORD_MATCHED, match.finalId(), details(
                        "localId", local.getId(), "name", match.normalizedName()));
                for (FieldDecision decision : merge.decisions()) {
                    pending.decisions.add(decision.decision());
                    auditFieldDecision(decision, match.finalId(), pending);
                }
                if (match.isCanonicalArchived()) {
                    pending.archived++;
                } else {
                    pending.updated++;
                }
            } else {
                records.add(local.withId(match.finalId()));
                pending.audit(AuditAction.RECORD_CREATED, match.finalId(), details(
                        "localId", local.getId(), "name", match.normalizedName()));
                pending.created++;
            }
        }

        List<CatalogRecord> output = finish(type, records);
        return new ReconciledCollection(type, output, outcome.mapping(), resolution,
                outcome.results(), merges, pending.errors, pending.rewritten, pending.unresolved);
    }

    /**
     * Translates references to other collections through their finished mappings.
     * References to collections without a mapping are left for the caller to report.
     */
    private List<CatalogRecord> rewriteReferences(CollectionType type, List<CatalogRecord> records,
                                                  Map<CollectionType, IdentityMapping> targetMappings,
                                                  Pending pending) {
        List<CatalogRecord> current = records;
        for (ForeignKey foreignKey : options.getReferenceTable().referencesFrom(type)) {
            IdentityMapping mapping = targetMappings.get(foreignKey.target());
            if (foreignKey.target() == type || mapping == null) {
                continue;
            }
            current = applyReference(foreignKey, current, mapping, pending);
        }
        return current;
    }

    private List<CatalogRecord> rewriteSelfReferences(CollectionType type, List<CatalogRecord> records,
                                                      IdentityMapping mapping, Pending pending) {
        List<CatalogRecord> current = records;
        for (ForeignKey foreignKey : options.getReferenceTable().referencesFrom(type)) {
            if (foreignKey.target() == type) {
                current = applyReference(foreignKey, current, mapping, pending);
            }
        }
        return current;
    }

    private List<CatalogRecord> applyReference(ForeignKey foreignKey, List<CatalogRecord> records,
                                               IdentityMapping mapping, Pending pending) {
        RewriteResult result = referenceRewriter.rewrite(foreignKey, records, mapping);
        pending.rewritten.merge(foreignKey, result.rewrittenCount(), Integer::sum);
        pending.unresolved.addAll(result.unresolved());
        log.debug("reconcile.references fk='{}' rewritten={} unresolved={}",
                foreignKey, result.rewrittenCount(), result.unresolved().size());
        return result.records();
    }

    private void auditFieldDecision(FieldDecision decision, int recordId, Pending pending) {
        if (decision.decision() == MergeDecision.ADOPTED_CANONICAL) {
            pending.audit(AuditAction.FIELD_ADOPTED, recordId, details(
                    "field", decision.field(),
                    "localValue", decision.localValue(),
                    "canonicalValue", decision.canonicalValue()));
        } else if (decision.decision() == MergeDecision.KEPT_LOCAL) {
            pending.audit(AuditAction.FIELD_KEPT_LOCAL, recordId, details(
                    "field", decision.field(),
                    "localValue", decision.localValue(),
                    "canonicalValue", decision.canonicalValue()));
        }
    }

    /**
     * Optional sort-and-renumber, then the uniqueness check every output must pass.
     */
    private List<CatalogRecord> finish(CollectionType type, List<CatalogRecord> records) {
        List<CatalogRecord> output = records;
        if (options.isRenumberSortOrder(type)) {
            output = renumberSortOrder(records, options.getSortOrderField());
        }
        ConflictResolver.verifyUnique(output);
        return output;
    }

    static List<CatalogRecord> renumberSortOrder(List<CatalogRecord> records, String field) {
        List<CatalogRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(CatalogRecord::getId));
        for (int i = 0; i < sorted.size(); i++) {
            CatalogRecord record = sorted.get(i);
            if (!record.isFieldProtected(field)) {
                sorted.set(i, record.withField(field, i + 1));
            }
        }
        return sorted;
    }

    private List<CatalogRecord> parseLocals(List<Map<String, Object>> raw, Pending pending) {
        List<CatalogRecord> records = new ArrayList<>(raw.size());
        for (Map<String, Object> item : raw) {
            try {
                records.add(CatalogRecord.fromMap(item));
            } catch (MalformedRecordException e) {
                pending.reject(e.getRawRecord(), e.getMessage());
            }
        }
        return records;
    }

    private List<CatalogRecord> parseCanonical(List<Map<String, Object>> raw, Pending pending) {
        List<CatalogRecord> records = new ArrayList<>(raw.size());
        Set<Integer> seen = new HashSet<>();
        for (Map<String, Object> item : raw) {
            try {
                CatalogRecord record = CatalogRecord.fromMap(item);
                if (!record.hasId()) {
                    throw new MalformedRecordException("Canonical record without identifier", item);
                }
                if (!seen.add(record.getId())) {
                    throw new MalformedRecordException("Duplicate canonical identifier " + record.getId(), item);
                }
                records.add(record);
            } catch (MalformedRecordException e) {
                pending.reject(e.getRawRecord(), "canonical: " + e.getMessage());
            }
        }
        return records;
    }

    private void auditConflicts(ConflictResolution resolution, Pending pending) {
        for (IdReassignment change : resolution.changes()) {
            if (change.isConflict()) {
                pending.reassigned++;
                pending.audit(AuditAction.ID_REASSIGNED, change.newId(), details(
                        "oldId", change.oldId(), "position", change.position(), "name", change.displayName()));
            } else {
                pending.audit(AuditAction.ID_ASSIGNED, change.newId(), details(
                        "position", change.position(), "name", change.displayName()));
            }
        }
    }

    private void commit(Pending pending, RunLedger ledger) {
        CollectionType type = pending.type;
        for (RecordError error : pending.errors) {
            ledger.recordError(type, error.record(), error.reason());
            metricsService.incrementErrors(type);
        }
        for (int i = 0; i < pending.created; i++) {
            ledger.recordCreated(type);
            metricsService.incrementCreated(type);
        }
        for (int i = 0; i < pending.updated; i++) {
            ledger.recordUpdated(type);
            metricsService.incrementUpdated(type);
        }
        for (int i = 0; i < pending.archived; i++) {
            ledger.recordArchived(type);
            metricsService.incrementArchived(type);
        }
        for (int i = 0; i < pending.reassigned; i++) {
            metricsService.incrementIdReassigned(type);
        }
        for (MergeDecision decision : pending.decisions) {
            metricsService.recordFieldDecision(type, decision);
        }
        pending.issues.forEach(ledger::addIssue);
        pending.auditEntries.forEach(auditService::record);
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put((String) keyValues[i], keyValues[i + 1]);
        }
        return details;
    }

    /**
     * Outcome of the pass held back until every record has its final identifier.
     */
    private static final class Pending {
        private final String runId;
        private final CollectionType type;
        private final List<RecordError> errors = new ArrayList<>();
        private final List<AuditEntry> auditEntries = new ArrayList<>();
        private final List<MergeDecision> decisions = new ArrayList<>();
        private final List<String> issues = new ArrayList<>();
        private final Map<ForeignKey, Integer> rewritten = new LinkedHashMap<>();
        private final List<UnresolvedReference> unresolved = new ArrayList<>();
        private int created;
        private int updated;
        private int archived;
        private int reassigned;

        private Pending(String runId, CollectionType type) {
            this.runId = runId;
            this.type = type;
        }

        private void reject(Object raw, String reason) {
            errors.add(new RecordError(raw, reason));
            audit(AuditAction.RECORD_SKIPPED, null, details("reason", reason));
            log.warn("reconcile.record.skipped reason={}", reason);
        }

        private void audit(AuditAction action, Integer recordId, Map<String, Object> details) {
            auditEntries.add(AuditEntry.builder()
                    .runId(runId)
                    .action(action)
                    .collection(type)
                    .recordId(recordId)
                    .details(details)
                    .build());
        }
    }
}
