package com.catalog.reconciliation.ledger;

import java.util.List;

/**
 * Per-collection counters of a run.
 *
 * @param created  records that received a new identifier
 * @param updated  records matched to an active canonical record
 * @param archived records matched to an archived canonical record
 * @param errors   records skipped, or the collection failure
 * @param failed   true if the collection step as a whole failed
 */
public record CollectionTally(
        int created,
        int updated,
        int archived,
        List<RecordError> errors,
        boolean failed
) {
    public CollectionTally {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static CollectionTally empty() {
        return new CollectionTally(0, 0, 0, List.of(), false);
    }

    public int processed() {
        return created + updated + archived;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
