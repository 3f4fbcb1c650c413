package com.catalog.reconciliation.api;

import com.catalog.reconciliation.audit.AuditEntry;
import com.catalog.reconciliation.core.model.CatalogRecord;
import com.catalog.reconciliation.core.model.CollectionType;
import com.catalog.reconciliation.core.model.IdentityMapping;
import com.catalog.reconciliation.ledger.RunReport;
import com.catalog.reconciliation.ledger.RunStatus;
import com.catalog.reconciliation.rewrite.UnresolvedReference;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a reconciliation run.
 * Failed collections have no records, no mapping and no reconciled entry; see the report.
 */
public class ReconciliationResult {

    private final RunReport report;
    private final Map<CollectionType, ReconciledCollection> reconciled;
    private final Map<CollectionType, List<CatalogRecord>> records;
    private final Map<CollectionType, IdentityMapping> mappings;
    private final List<UnresolvedReference> unresolved;
    private final List<AuditEntry> auditTrail;

    public ReconciliationResult(RunReport report,
                                Map<CollectionType, ReconciledCollection> reconciled,
                                Map<CollectionType, List<CatalogRecord>> records,
                                Map<CollectionType, IdentityMapping> mappings,
                                List<UnresolvedReference> unresolved,
                                List<AuditEntry> auditTrail) {
        this.report = report;
        this.reconciled = immutable(reconciled);
        this.records = immutable(records);
        this.mappings = immutable(mappings);
        this.unresolved = List.copyOf(unresolved);
        this.auditTrail = List.copyOf(auditTrail);
    }

    public RunReport getReport() {
        return report;
    }

    public RunStatus getStatus() {
        return report.status();
    }

    public String getRunId() {
        return report.runId();
    }

    /**
     * Per-collection details for every collection that reconciled successfully.
     */
    public Map<CollectionType, ReconciledCollection> getReconciled() {
        return reconciled;
    }

    public Optional<ReconciledCollection> getReconciled(CollectionType type) {
        return Optional.ofNullable(reconciled.get(type));
    }

    /**
     * Final records of reconciled and dependent collections, after reference rewriting.
     */
    public Map<CollectionType, List<CatalogRecord>> getRecords() {
        return records;
    }

    public List<CatalogRecord> getRecords(CollectionType type) {
        return records.getOrDefault(type, List.of());
    }

    public Map<CollectionType, IdentityMapping> getMappings() {
        return mappings;
    }

    public Optional<IdentityMapping> getMapping(CollectionType type) {
        return Optional.ofNullable(mappings.get(type));
    }

    public List<UnresolvedReference> getUnresolved() {
        return unresolved;
    }

    public List<AuditEntry> getAuditTrail() {
        return auditTrail;
    }

    private static <V> Map<CollectionType, V> immutable(Map<CollectionType, V> map) {
        return map == null || map.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(map));
    }

    @Override
    public String toString() {
        return "ReconciliationResult{" +
                "report=" + report +
                ", collections=" + records.keySet() +
                ", unresolved=" + unresolved.size() +
                '}';
    }
}
