package com.catalog.reconciliation.audit;

import com.catalog.reconciliation.core.model.CollectionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only audit trail of one or more reconciliation runs.
 * Thread-safe via CopyOnWriteArrayList.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries;

    public AuditService() {
        this.entries = new CopyOnWriteArrayList<>();
    }

    /**
     * Records an audit entry.
     */
    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("Audit entry recorded: {} for {} record {}",
                entry.action(), entry.collection(), entry.recordId());
        return entry;
    }

    public AuditEntry record(AuditAction action, CollectionType collection, Integer recordId,
                             Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .collection(collection)
                .recordId(recordId)
                .details(details)
                .build());
    }

    public AuditEntry record(AuditAction action, CollectionType collection, Integer recordId) {
        return record(action, collection, recordId, null);
    }

    /**
     * Gets all audit entries (immutable view).
     */
    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForRun(String runId) {
        return entries.stream()
                .filter(e -> runId.equals(e.runId()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesForCollection(CollectionType collection) {
        return entries.stream()
                .filter(e -> e.collection() == collection)
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    /**
     * Gets entries for one record of one collection.
     */
    public List<AuditEntry> getEntriesForRecord(CollectionType collection, Integer recordId) {
        return entries.stream()
                .filter(e -> e.collection() == collection && recordId != null && recordId.equals(e.recordId()))
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }
}
