package com.catalog.reconciliation.identity;

import com.catalog.reconciliation.core.model.CatalogRecord;

import java.util.List;

/**
 * Result of resolving identifier conflicts in one collection.
 *
 * @param records        resolved records, in input order, all with distinct identifiers
 * @param changes        every identifier assigned, conflicts and fills alike, in assignment order
 * @param conflictsFound number of identifiers that were shared by more than one record
 */
public record ConflictResolution(
        List<CatalogRecord> records,
        List<IdReassignment> changes,
        int conflictsFound
) {
    public ConflictResolution {
        records = records != null ? List.copyOf(records) : List.of();
        changes = changes != null ? List.copyOf(changes) : List.of();
    }

    /**
     * Audit entries for records whose conflicting identifier was replaced.
     */
    public List<IdReassignment> reassignments() {
        return changes.stream().filter(IdReassignment::isConflict).toList();
    }

    /**
     * Audit entries for records that had no identifier.
     */
    public List<IdReassignment> assignments() {
        return changes.stream().filter(c -> !c.isConflict()).toList();
    }

    public int totalItems() {
        return records.size();
    }

    public int hadId() {
        return totalItems() - assignedNew();
    }

    public int assignedNew() {
        return (int) changes.stream().filter(c -> !c.isConflict()).count();
    }

    public int reassignedConflicts() {
        return (int) changes.stream().filter(IdReassignment::isConflict).count();
    }

    /**
     * Largest identifier in the resolved collection, or 0 when empty.
     */
    public int maxId() {
        return records.stream().mapToInt(CatalogRecord::getId).max().orElse(0);
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }

    @Override
    public String toString() {
        return "ConflictResolution{total=" + totalItems() +
                ", hadId=" + hadId() +
                ", assignedNew=" + assignedNew() +
                ", reassigned=" + reassignedConflicts() +
                ", conflicts=" + conflictsFound +
                ", maxId=" + maxId() + '}';
    }
}
