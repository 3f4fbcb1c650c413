package com.catalog.reconciliation.ledger;

import java.util.Objects;

/**
 * A record, or a whole collection step, that could not be processed.
 *
 * @param record the offending raw record; null when the whole collection step failed
 * @param reason human-readable cause
 */
public record RecordError(Object record, String reason) {

    public RecordError {
        Objects.requireNonNull(reason, "reason is required");
    }
}
